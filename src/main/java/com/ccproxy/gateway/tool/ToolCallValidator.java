package com.ccproxy.gateway.tool;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.ccproxy.gateway.converter.model.Tool;
import com.ccproxy.gateway.converter.model.ToolCall;
import com.ccproxy.gateway.exception.ToolCallValidationException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * 校验一次具体的工具调用参数是否满足工具的 input_schema
 * <p>
 * 只检查 required 与各属性的类型；未声明的参数仅在 additionalProperties 显式为 false 时拒绝
 */
public class ToolCallValidator {

    /**
     * @throws ToolCallValidationException 参数不满足 schema
     */
    public void validate(ToolCall call, Tool tool) {
        Map<String, Object> schema = tool.inputSchema() != null ? tool.inputSchema() : new JSONObject();
        String arguments = call.arguments();

        if (arguments.isEmpty()) {
            if (schema.get("required") instanceof List<?> required && !required.isEmpty()) {
                throw new ToolCallValidationException(ToolCallValidationException.VALIDATION_ERROR,
                        "tool call has empty arguments but tool requires parameters")
                        .withTool(call.name(), call.id())
                        .withField("required_parameters", required)
                        .withSuggestions("Provide the required parameters in the function arguments");
            }
            return;
        }

        JSONObject args;
        try {
            args = JSON.parseObject(arguments);
        } catch (JSONException e) {
            throw new ToolCallValidationException(ToolCallValidationException.JSON_ERROR,
                    "invalid JSON in tool call arguments")
                    .withTool(call.name(), call.id())
                    .withField("arguments", arguments)
                    .withContext("parse_error", e.getMessage())
                    .withSuggestions("Ensure the arguments are valid JSON", "Check for missing quotes or commas");
        }
        if (args == null) {
            args = new JSONObject();
        }
        validateArguments(call, args, schema);
    }

    private void validateArguments(ToolCall call, JSONObject args, Map<String, Object> schema) {
        if (schema.get("required") instanceof List<?> required) {
            for (Object field : required) {
                if (field instanceof String name && !args.containsKey(name)) {
                    throw new ToolCallValidationException(ToolCallValidationException.VALIDATION_ERROR,
                            "missing required parameter '" + name + "'")
                            .withTool(call.name(), call.id())
                            .withField("missing_parameter", name)
                            .withSuggestions("Add the '" + name + "' parameter to the tool call");
                }
            }
        }

        if (!(schema.get("properties") instanceof Map<?, ?> properties)) {
            return;
        }
        boolean rejectUnknown = Boolean.FALSE.equals(schema.get("additionalProperties"));
        for (Map.Entry<String, Object> arg : args.entrySet()) {
            Object propSchema = properties.get(arg.getKey());
            if (propSchema != null) {
                checkType(call, arg.getKey(), arg.getValue(), propSchema);
            } else if (!properties.containsKey(arg.getKey()) && rejectUnknown) {
                throw new ToolCallValidationException(ToolCallValidationException.VALIDATION_ERROR,
                        "unexpected parameter '" + arg.getKey() + "'")
                        .withTool(call.name(), call.id())
                        .withField("unexpected_parameter", arg.getKey())
                        .withSuggestions("Remove the unexpected parameter", "Check the tool schema for allowed parameters");
            }
        }
    }

    private void checkType(ToolCall call, String name, Object value, Object propSchema) {
        if (!(propSchema instanceof Map<?, ?> def) || !(def.get("type") instanceof String expected)) {
            return;
        }
        String article = "a";
        String suggestion;
        boolean ok;
        switch (expected) {
            case "string" -> {
                ok = value instanceof String;
                suggestion = "Ensure the parameter value is a string";
            }
            case "number" -> {
                ok = value instanceof Number;
                suggestion = "Ensure the parameter value is a number";
            }
            case "integer" -> {
                ok = isInteger(value);
                article = "an";
                suggestion = "Ensure the parameter value is a whole number";
            }
            case "boolean" -> {
                ok = value instanceof Boolean;
                suggestion = "Ensure the parameter value is true or false";
            }
            case "array" -> {
                ok = value instanceof List<?>;
                article = "an";
                suggestion = "Ensure the parameter value is an array";
            }
            case "object" -> {
                ok = value instanceof Map<?, ?>;
                article = "an";
                suggestion = "Ensure the parameter value is an object";
            }
            default -> {
                return;
            }
        }
        if (!ok) {
            throw new ToolCallValidationException(ToolCallValidationException.TYPE_ERROR,
                    "parameter '" + name + "' must be " + article + " " + expected)
                    .withTool(call.name(), call.id())
                    .withField(name, value)
                    .withContext("expected_type", expected)
                    .withSuggestions(suggestion);
        }
    }

    /**
     * 整数：整型数值，或小数部分为 0 的浮点数值
     */
    static boolean isInteger(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger) {
            return true;
        }
        if (value instanceof BigDecimal bd) {
            return bd.stripTrailingZeros().scale() <= 0;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return !Double.isInfinite(d) && d == Math.rint(d);
        }
        return false;
    }
}
