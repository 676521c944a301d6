package com.ccproxy.gateway.controller;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.ccproxy.gateway.converter.ConverterFeatures;
import com.ccproxy.gateway.converter.MessageConverter;
import com.ccproxy.gateway.converter.model.MessageFormat;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * 健康检查端点
 */
@RestController
public class HealthController {

    private final MessageConverter converter;

    public HealthController(MessageConverter converter) {
        this.converter = converter;
    }

    @GetMapping(value = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<String> health() {
        JSONArray formats = new JSONArray();
        for (MessageFormat format : converter.supportedFormats()) {
            ConverterFeatures features = converter.codec(format).features();
            formats.add(JSONObject.of(
                    "format", format.value(), //
                    "supportsTools", features.supportsTools(), //
                    "maxMessages", features.maxMessages() //
            ));
        }
        JSONObject result = new JSONObject();
        result.put("status", "ok");
        result.put("version", "1.0.0");
        result.put("formats", formats);
        result.put("strictMode", converter.options().strictMode());
        return Mono.just(result.toJSONString());
    }
}
