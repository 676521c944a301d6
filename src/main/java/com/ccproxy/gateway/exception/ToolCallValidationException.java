package com.ccproxy.gateway.exception;

import com.alibaba.fastjson2.JSONObject;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 工具调用参数校验失败（结构化错误）
 * <p>
 * 调用方可以直接渲染各字段或据此确定性重试
 */
@Getter
public class ToolCallValidationException extends ConversionException {

    public static final String VALIDATION_ERROR = "validation_error";
    public static final String JSON_ERROR = "json_error";
    public static final String TYPE_ERROR = "type_error";

    private final String type;
    private final String detail;
    private String toolName;
    private String toolId;
    private String field;
    private Object value;
    private final Map<String, Object> context = new LinkedHashMap<>();
    private final List<String> suggestions = new ArrayList<>();

    public ToolCallValidationException(String type, String detail) {
        super(detail);
        this.type = type;
        this.detail = detail;
    }

    public ToolCallValidationException withTool(String name, String id) {
        this.toolName = name;
        this.toolId = id;
        return this;
    }

    public ToolCallValidationException withField(String field, Object value) {
        this.field = field;
        this.value = value;
        return this;
    }

    public ToolCallValidationException withContext(String key, Object value) {
        this.context.put(key, value);
        return this;
    }

    public ToolCallValidationException withSuggestions(String... suggestions) {
        this.suggestions.addAll(Arrays.asList(suggestions));
        return this;
    }

    @Override
    public String getMessage() {
        if (toolName != null && !toolName.isEmpty()) {
            return "tool conversion error for '" + toolName + "': " + detail;
        }
        return "tool conversion error: " + detail;
    }

    @Override
    public String getErrorType() {
        return "tool_call_validation_error";
    }

    /**
     * 结构化输出，供 HTTP 层直接返回
     */
    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put("type", type);
        json.put("message", detail);
        json.put("tool_name", toolName);
        json.put("tool_id", toolId);
        json.put("field", field);
        json.put("value", value);
        if (!context.isEmpty()) {
            json.put("context", new JSONObject(context));
        }
        if (!suggestions.isEmpty()) {
            json.put("suggestions", suggestions);
        }
        return json;
    }
}
