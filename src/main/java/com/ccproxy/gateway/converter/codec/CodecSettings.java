package com.ccproxy.gateway.converter.codec;

/**
 * 编解码器配置
 * <p>
 * 各协议的默认值以具名常量给出，通过该配置显式传入编解码器，测试可以覆盖
 *
 * @param awsAnthropicVersion Bedrock 请求必填的 anthropic_version
 * @param awsDefaultMaxTokens Bedrock 请求 max_tokens 未设置（≤0）时的默认值
 * @param openAiTextSeparator 多个 text 块展平为 OpenAI 字符串时的分隔符
 * @param googleTextSeparator 多个 part 合并为一段文本时的分隔符
 */
public record CodecSettings(String awsAnthropicVersion, int awsDefaultMaxTokens,
                            String openAiTextSeparator, String googleTextSeparator) {

    public static final String DEFAULT_AWS_ANTHROPIC_VERSION = "bedrock-2023-05-31";
    public static final int DEFAULT_AWS_MAX_TOKENS = 4096;
    public static final String DEFAULT_OPENAI_TEXT_SEPARATOR = " ";
    public static final String DEFAULT_GOOGLE_TEXT_SEPARATOR = "";

    public CodecSettings {
        awsAnthropicVersion = awsAnthropicVersion != null ? awsAnthropicVersion : DEFAULT_AWS_ANTHROPIC_VERSION;
        awsDefaultMaxTokens = awsDefaultMaxTokens > 0 ? awsDefaultMaxTokens : DEFAULT_AWS_MAX_TOKENS;
        openAiTextSeparator = openAiTextSeparator != null ? openAiTextSeparator : DEFAULT_OPENAI_TEXT_SEPARATOR;
        googleTextSeparator = googleTextSeparator != null ? googleTextSeparator : DEFAULT_GOOGLE_TEXT_SEPARATOR;
    }

    public static CodecSettings defaults() {
        return new CodecSettings(DEFAULT_AWS_ANTHROPIC_VERSION, DEFAULT_AWS_MAX_TOKENS,
                DEFAULT_OPENAI_TEXT_SEPARATOR, DEFAULT_GOOGLE_TEXT_SEPARATOR);
    }
}
