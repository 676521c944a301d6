package com.ccproxy.gateway.converter.model;

/**
 * 通用消息
 *
 * @param role    user / assistant / system
 * @param content 消息内容，永不为 null
 * @param name    可选的发送者名称
 */
public record Message(String role, MessageContent content, String name) {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_SYSTEM = "system";

    public Message {
        content = content != null ? content : MessageContent.EMPTY;
    }

    public Message(String role, MessageContent content) {
        this(role, content, null);
    }

    public static Message user(String text) {
        return new Message(ROLE_USER, MessageContent.text(text));
    }

    public static Message assistant(String text) {
        return new Message(ROLE_ASSISTANT, MessageContent.text(text));
    }
}
