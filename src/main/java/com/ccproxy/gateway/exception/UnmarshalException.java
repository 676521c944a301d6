package com.ccproxy.gateway.exception;

import lombok.Getter;

/**
 * 输入 JSON 无法解析
 * <p>
 * 消息中带上提供方与方向，例如 "failed to unmarshal OpenAI request"
 */
@Getter
public class UnmarshalException extends ConversionException {

    private final String provider;
    private final String direction;

    public UnmarshalException(String provider, String direction, Throwable cause) {
        super("failed to unmarshal " + provider + " " + direction + ": " + cause.getMessage(), cause);
        this.provider = provider;
        this.direction = direction;
    }
}
