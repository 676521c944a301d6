package com.ccproxy.gateway.tool;

import com.ccproxy.gateway.converter.ConverterFeatures;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * 单次转换上下文
 * <p>
 * 每次调度调用新建一个，只在该次调用内使用，不跨线程共享
 */
public class ToolConversionContext {

    private final String requestId;
    private final String providerName;
    private final ConverterFeatures capabilities;
    private final Instant startTime;
    private final Map<String, Object> metadata = new LinkedHashMap<>();

    private ToolConversionContext(String requestId, String providerName, ConverterFeatures capabilities) {
        this.requestId = requestId;
        this.providerName = providerName;
        this.capabilities = capabilities;
        this.startTime = Instant.now();
    }

    /**
     * 创建新的上下文，requestId 随机生成
     */
    public static ToolConversionContext create(String providerName, ConverterFeatures capabilities) {
        return new ToolConversionContext(UUID.randomUUID().toString().replace("-", "").substring(0, 16),
                providerName, capabilities);
    }

    /**
     * 使用指定 requestId 创建
     */
    public static ToolConversionContext create(String requestId, String providerName, ConverterFeatures capabilities) {
        return new ToolConversionContext(requestId, providerName, capabilities);
    }

    public void putMetadata(String key, Object value) {
        metadata.put(key, value);
    }

    public long elapsedMs() {
        return Duration.between(startTime, Instant.now()).toMillis();
    }

    public String requestId() { return requestId; }
    public String providerName() { return providerName; }
    public ConverterFeatures capabilities() { return capabilities; }
    public Instant startTime() { return startTime; }
    public Map<String, Object> metadata() { return metadata; }
}
