package com.ccproxy.gateway.exception;

/**
 * 转换阶段：源格式解码 / 目标格式编码
 */
public enum ConversionPhase {

    SOURCE_DECODE("failed to convert to generic format"),
    TARGET_ENCODE("failed to convert from generic format");

    private final String description;

    ConversionPhase(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
