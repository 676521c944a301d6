package com.ccproxy.gateway.exception;

/**
 * 内容形态不被目标格式接受
 */
public class ContentParseException extends ConversionException {

    public ContentParseException(String message) {
        super(message);
    }

    public ContentParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
