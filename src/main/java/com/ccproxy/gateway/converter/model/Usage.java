package com.ccproxy.gateway.converter.model;

/**
 * Token 用量
 */
public record Usage(long inputTokens, long outputTokens, long totalTokens) {

    /**
     * 上游未提供 total 时按 input + output 计算
     */
    public static Usage of(long inputTokens, long outputTokens) {
        return new Usage(inputTokens, outputTokens, inputTokens + outputTokens);
    }
}
