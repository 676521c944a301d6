package com.ccproxy.gateway.converter.model;

/**
 * 消息格式标识
 * <p>
 * 决定使用哪个编解码器；{@link #GENERIC} 本身就是中间格式，没有对应的编解码器
 */
public enum MessageFormat {

    ANTHROPIC("anthropic"),
    OPENAI("openai"),
    GOOGLE("google"),
    AWS("aws"),
    GENERIC("generic");

    private final String value;

    MessageFormat(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * 按名称查找格式（忽略大小写），未知名称返回 null
     */
    public static MessageFormat fromValue(String value) {
        if (value == null) return null;
        for (MessageFormat format : values()) {
            if (format.value.equalsIgnoreCase(value.trim())) {
                return format;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return value;
    }
}
