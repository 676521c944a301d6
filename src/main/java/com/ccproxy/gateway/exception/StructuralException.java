package com.ccproxy.gateway.exception;

/**
 * 缺少必需结构（如响应中没有 choices / candidates）
 */
public class StructuralException extends ConversionException {

    public StructuralException(String message) {
        super(message);
    }
}
