package com.ccproxy.gateway.converter.model;

/**
 * SSE 事件记录（事件名 + data 载荷），由传输层拆帧后交给转换钩子
 */
public record StreamEvent(String event, String data) {
}
