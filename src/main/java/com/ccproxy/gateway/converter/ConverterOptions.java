package com.ccproxy.gateway.converter;

/**
 * 调度器选项
 *
 * @param validateSchemas       解码后校验工具定义的 input_schema
 * @param validateToolArguments 校验 tool_use 入参是否满足对应工具的 schema
 * @param strictMode            启用完整的请求校验（模型、消息数、角色、内容块结构、大小）
 * @param maxRequestSize        严格模式下请求消息总字节上限
 * @param maxMessages           严格模式下消息数上限
 * @param maxToolCalls          严格模式下工具数上限
 */
public record ConverterOptions(boolean validateSchemas, boolean validateToolArguments, boolean strictMode,
                               long maxRequestSize, int maxMessages, int maxToolCalls) {

    public static final long DEFAULT_MAX_REQUEST_SIZE = 10L * 1024 * 1024;
    public static final int DEFAULT_MAX_MESSAGES = 100;
    public static final int DEFAULT_MAX_TOOL_CALLS = 50;

    public static ConverterOptions defaults() {
        return new ConverterOptions(true, true, false,
                DEFAULT_MAX_REQUEST_SIZE, DEFAULT_MAX_MESSAGES, DEFAULT_MAX_TOOL_CALLS);
    }

    public ConverterOptions withStrictMode(boolean strict) {
        return new ConverterOptions(validateSchemas, validateToolArguments, strict,
                maxRequestSize, maxMessages, maxToolCalls);
    }
}
