package com.ccproxy.gateway.converter;

/**
 * 编解码器能力声明
 *
 * @param supportsTools     目标协议是否有原生工具调用结构
 * @param supportsStreaming 是否支持流式
 * @param maxTokens         最大输出 token
 * @param maxMessageSize    单条消息最大字节数
 * @param maxMessages       单次请求最大消息数
 * @param maxToolCalls      单次请求最大工具数
 */
public record ConverterFeatures(boolean supportsTools, boolean supportsStreaming,
                                int maxTokens, int maxMessageSize,
                                int maxMessages, int maxToolCalls) {

    public static final int DEFAULT_MAX_TOKENS = 200_000;
    public static final int DEFAULT_MAX_MESSAGE_SIZE = 1024 * 1024;

    public static ConverterFeatures of(boolean supportsTools, int maxMessages, int maxToolCalls) {
        return new ConverterFeatures(supportsTools, true, DEFAULT_MAX_TOKENS, DEFAULT_MAX_MESSAGE_SIZE,
                maxMessages, maxToolCalls);
    }
}
