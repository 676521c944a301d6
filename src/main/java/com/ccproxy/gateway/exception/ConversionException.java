package com.ccproxy.gateway.exception;

/**
 * 格式转换异常基类（均映射为 4xx）
 */
public class ConversionException extends GatewayException {

    public ConversionException(String message) {
        super(message, 400);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, 400, cause);
    }

    @Override
    public String getErrorType() {
        return "invalid_request_error";
    }
}
