package com.ccproxy.gateway.exception;

import lombok.Getter;

/**
 * 源或目标格式没有注册编解码器
 */
@Getter
public class UnsupportedFormatException extends ConversionException {

    private final String side;
    private final String format;

    public UnsupportedFormatException(String side, String format) {
        super("unsupported " + side + " format: " + format);
        this.side = side;
        this.format = format;
    }

    public static UnsupportedFormatException source(String format) {
        return new UnsupportedFormatException("source", format);
    }

    public static UnsupportedFormatException target(String format) {
        return new UnsupportedFormatException("target", format);
    }
}
