package com.ccproxy.gateway.exception;

import lombok.Getter;

/**
 * 网关异常基类
 */
@Getter
public class GatewayException extends RuntimeException {

    private final int statusCode;

    public GatewayException(String message) {
        super(message);
        this.statusCode = 500;
    }

    public GatewayException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public GatewayException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 500;
    }

    public GatewayException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * 返回给客户端的错误类型
     */
    public String getErrorType() {
        return "gateway_error";
    }
}
