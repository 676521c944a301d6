package com.ccproxy.gateway.tool;

import com.ccproxy.gateway.converter.model.Tool;
import com.ccproxy.gateway.exception.SchemaValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 工具定义 input_schema 的结构校验
 * <p>
 * 递归遍历 properties / items / additionalProperties，深度通过参数显式传递：
 * 顶层属性为第 1 层，每嵌套一层加 1，超过 {@link #MAX_DEPTH} 直接失败。
 * 属性缺少 type、string 使用未知 format 只记录告警。
 */
public class ToolSchemaValidator {

    private static final Logger log = LoggerFactory.getLogger(ToolSchemaValidator.class);

    public static final int MAX_DEPTH = 10;

    private static final Set<String> VALID_TYPES = Set.of(
            "string", "number", "integer", "boolean", "array", "object", "null");

    private static final Set<String> KNOWN_FORMATS = Set.of(
            "date-time", "date", "time", "email", "hostname", "ipv4", "ipv6", "uri", "uuid");

    /**
     * 校验工具定义
     *
     * @throws SchemaValidationException 结构不合法，携带出错字段路径
     */
    public void validate(Tool tool, ToolConversionContext ctx) {
        String toolName = tool.name();
        if (toolName == null || toolName.isEmpty()) {
            throw new SchemaValidationException(null, "name", "tool name cannot be empty");
        }
        Map<String, Object> schema = tool.inputSchema();
        if (schema == null) {
            throw new SchemaValidationException(toolName, "input_schema", "tool input_schema cannot be nil");
        }
        if (!"object".equals(schema.get("type"))) {
            throw new SchemaValidationException(toolName, "input_schema.type", "schema must have type 'object'");
        }

        Walker walker = new Walker(toolName, ctx);
        Object properties = schema.get("properties");
        if (properties != null) {
            if (!(properties instanceof Map<?, ?> props)) {
                throw walker.fail("input_schema.properties", "properties must be an object");
            }
            for (Map.Entry<?, ?> e : props.entrySet()) {
                walker.property(String.valueOf(e.getKey()), e.getValue(), 1);
            }
        }
        walker.required("input_schema.required", schema.get("required"));
    }

    /**
     * 一次校验的遍历状态（工具名与上下文）
     */
    private static final class Walker {

        private final String toolName;
        private final ToolConversionContext ctx;

        Walker(String toolName, ToolConversionContext ctx) {
            this.toolName = toolName;
            this.ctx = ctx;
        }

        void property(String path, Object definition, int depth) {
            if (depth > MAX_DEPTH) {
                throw fail(path, "schema nesting too deep (max " + MAX_DEPTH + " levels)");
            }
            if (!(definition instanceof Map<?, ?> def)) {
                throw fail(path, "property definition must be an object");
            }

            Object type = def.get("type");
            if (type == null) {
                log.warn("[{}] 工具 {} 的属性 {} 缺少 type 定义 (depth={})", requestId(), toolName, path, depth);
                return;
            }
            if (!(type instanceof String typeStr)) {
                throw fail(path + ".type", "type must be a string");
            }
            if (!VALID_TYPES.contains(typeStr)) {
                throw fail(path + ".type", "invalid type: " + typeStr
                        + " (allowed: [string number integer boolean array object null])");
            }

            switch (typeStr) {
                case "array" -> array(path, def, depth);
                case "object" -> object(path, def, depth);
                case "string" -> string(path, def);
                case "number", "integer" -> number(path, def);
                default -> {
                }
            }
        }

        private void array(String path, Map<?, ?> def, int depth) {
            if (def.containsKey("items")) {
                property(path + "[items]", def.get("items"), depth + 1);
            }
            nonNegative(path, def, "minItems");
            nonNegative(path, def, "maxItems");
        }

        private void object(String path, Map<?, ?> def, int depth) {
            Object properties = def.get("properties");
            if (properties != null) {
                if (!(properties instanceof Map<?, ?> props)) {
                    throw fail(path + ".properties", "properties must be an object");
                }
                for (Map.Entry<?, ?> e : props.entrySet()) {
                    property(path + "." + e.getKey(), e.getValue(), depth + 1);
                }
            }
            required(path + ".required", def.get("required"));

            if (def.containsKey("additionalProperties")) {
                Object additional = def.get("additionalProperties");
                if (additional instanceof Map<?, ?>) {
                    property(path + "[additionalProperties]", additional, depth + 1);
                } else if (!(additional instanceof Boolean)) {
                    throw fail(path + ".additionalProperties", "additionalProperties must be boolean or schema object");
                }
            }
        }

        private void string(String path, Map<?, ?> def) {
            nonNegative(path, def, "minLength");
            nonNegative(path, def, "maxLength");

            if (def.containsKey("format")) {
                if (!(def.get("format") instanceof String format)) {
                    throw fail(path + ".format", "format must be a string");
                }
                if (!KNOWN_FORMATS.contains(format)) {
                    log.warn("[{}] 工具 {} 的属性 {} 使用了未知的 format: {}", requestId(), toolName, path, format);
                }
            }

            if (def.containsKey("enum")) {
                if (!(def.get("enum") instanceof List<?> values)) {
                    throw fail(path + ".enum", "enum must be an array");
                }
                if (values.isEmpty()) {
                    throw fail(path + ".enum", "enum array cannot be empty");
                }
                for (int i = 0; i < values.size(); i++) {
                    if (!(values.get(i) instanceof String)) {
                        throw fail(path + ".enum[" + i + "]", "enum[" + i + "] must be a string for string type");
                    }
                }
            }
        }

        private void number(String path, Map<?, ?> def) {
            for (String key : List.of("minimum", "maximum", "exclusiveMinimum", "exclusiveMaximum")) {
                if (def.containsKey(key) && !(def.get(key) instanceof Number)) {
                    throw fail(path + "." + key, key + " must be a number");
                }
            }
            if (def.containsKey("multipleOf")) {
                if (!(def.get("multipleOf") instanceof Number multipleOf)) {
                    throw fail(path + ".multipleOf", "multipleOf must be a number");
                }
                if (toBigDecimal(multipleOf).signum() <= 0) {
                    throw fail(path + ".multipleOf", "multipleOf must be greater than 0");
                }
            }
        }

        void required(String path, Object required) {
            if (required == null) return;
            if (!(required instanceof List<?> list)) {
                throw fail(path, "required must be an array");
            }
            for (int i = 0; i < list.size(); i++) {
                if (!(list.get(i) instanceof String)) {
                    throw fail(path + "[" + i + "]", "required[" + i + "] must be a string");
                }
            }
        }

        private void nonNegative(String path, Map<?, ?> def, String key) {
            if (!def.containsKey(key)) return;
            if (!(def.get(key) instanceof Number n)) {
                throw fail(path + "." + key, key + " must be a number");
            }
            if (toBigDecimal(n).signum() < 0) {
                throw fail(path + "." + key, key + " cannot be negative");
            }
        }

        SchemaValidationException fail(String path, String reason) {
            return new SchemaValidationException(toolName, path, reason);
        }

        private String requestId() {
            return ctx != null ? ctx.requestId() : "-";
        }
    }

    static BigDecimal toBigDecimal(Number n) {
        if (n instanceof BigDecimal bd) return bd;
        if (n instanceof BigInteger bi) return new BigDecimal(bi);
        if (n instanceof Double || n instanceof Float) return BigDecimal.valueOf(n.doubleValue());
        return BigDecimal.valueOf(n.longValue());
    }
}
