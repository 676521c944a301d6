package com.ccproxy.gateway.converter.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 通用请求（所有编解码器读写的中间格式）
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Request {

    private String model;
    @Builder.Default
    private List<Message> messages = new ArrayList<>();
    private String system;
    private int maxTokens;
    private double temperature;
    private boolean stream;
    private Object metadata;

    // 工具相关
    @Builder.Default
    private List<Tool> tools = new ArrayList<>();
    private Object toolChoice;

    // 采样参数
    private Double topP;
    private Integer topK;
    @Builder.Default
    private List<String> stopSequences = new ArrayList<>();

    public boolean hasSystem() {
        return system != null && !system.isEmpty();
    }

    public boolean hasTools() {
        return tools != null && !tools.isEmpty();
    }
}
