package com.ccproxy.gateway.converter.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 通用响应
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Response {

    private String id;
    private String type;
    private String role;
    @Builder.Default
    private MessageContent content = MessageContent.EMPTY;
    private String model;
    private Usage usage;
    private String stopReason;
    private String stopSequence;
}
