package com.ccproxy.gateway.exception;

import lombok.Getter;

/**
 * 调度器包装的转换失败，标明失败发生在哪一侧
 * <p>
 * 调用方通过 {@link #getPhase()} 区分源解码还是目标编码失败，无需解析消息文本
 */
@Getter
public class ConversionFailedException extends ConversionException {

    private final ConversionPhase phase;

    public ConversionFailedException(ConversionPhase phase, Throwable cause) {
        super(phase.description() + ": " + cause.getMessage(), cause);
        this.phase = phase;
    }
}
