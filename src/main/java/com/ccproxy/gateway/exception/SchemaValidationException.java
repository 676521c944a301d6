package com.ccproxy.gateway.exception;

import lombok.Getter;

/**
 * 工具定义的 input_schema 结构不合法
 */
@Getter
public class SchemaValidationException extends ConversionException {

    private final String toolName;
    private final String fieldPath;
    private final String reason;

    public SchemaValidationException(String toolName, String fieldPath, String reason) {
        super(buildMessage(toolName, fieldPath, reason));
        this.toolName = toolName;
        this.fieldPath = fieldPath;
        this.reason = reason;
    }

    private static String buildMessage(String toolName, String fieldPath, String reason) {
        StringBuilder sb = new StringBuilder("schema validation failed");
        if (toolName != null && !toolName.isEmpty()) {
            sb.append(" for tool '").append(toolName).append("'");
        }
        if (fieldPath != null && !fieldPath.isEmpty()) {
            sb.append(" at ").append(fieldPath);
        }
        return sb.append(": ").append(reason).toString();
    }

    @Override
    public String getErrorType() {
        return "schema_validation_error";
    }
}
