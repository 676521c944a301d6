package com.ccproxy.gateway.controller;

import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.ccproxy.gateway.converter.MessageConverter;
import com.ccproxy.gateway.converter.model.Tool;
import com.ccproxy.gateway.converter.model.ToolCall;
import com.ccproxy.gateway.exception.ConversionException;
import com.ccproxy.gateway.tool.ToolCallValidator;
import com.ccproxy.gateway.tool.ToolConversionContext;
import com.ccproxy.gateway.tool.ToolSchemaValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;

/**
 * 格式转换端点
 * <p>
 * POST /v1/convert/request、/v1/convert/response — 请求体原样交给调度器
 * <br>
 * POST /v1/tools/validate — 单独校验工具定义（以及可选的一次工具调用）
 */
@RestController
@RequestMapping("/v1")
public class ConvertController {

    private static final Logger log = LoggerFactory.getLogger(ConvertController.class);

    private final MessageConverter converter;
    private final ToolSchemaValidator schemaValidator;
    private final ToolCallValidator toolCallValidator;

    public ConvertController(MessageConverter converter, ToolSchemaValidator schemaValidator,
                             ToolCallValidator toolCallValidator) {
        this.converter = converter;
        this.schemaValidator = schemaValidator;
        this.toolCallValidator = toolCallValidator;
    }

    @PostMapping(value = "/convert/request", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<String> convertRequest(@RequestParam("from") String from, @RequestParam("to") String to,
                                       @RequestBody(required = false) String body) {
        byte[] result = converter.convertRequest(bytes(body), from, to);
        return Mono.just(new String(result, StandardCharsets.UTF_8));
    }

    @PostMapping(value = "/convert/response", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<String> convertResponse(@RequestParam("from") String from, @RequestParam("to") String to,
                                        @RequestBody(required = false) String body) {
        byte[] result = converter.convertResponse(bytes(body), from, to);
        return Mono.just(new String(result, StandardCharsets.UTF_8));
    }

    /**
     * 请求体：{"tool": {name, description, input_schema}, "tool_call": {id, type, function}}
     */
    @PostMapping(value = "/tools/validate", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<String> validateTool(@RequestBody String body) {
        JSONObject request;
        try {
            request = JSONObject.parseObject(body);
        } catch (JSONException e) {
            throw new ConversionException("invalid JSON body: " + e.getMessage(), e);
        }
        JSONObject toolJson = request != null ? request.getJSONObject("tool") : null;
        if (toolJson == null) {
            throw new ConversionException("missing 'tool' in request body");
        }

        Tool tool = Tool.fromJson(toolJson);
        ToolConversionContext ctx = ToolConversionContext.create("validate", null);
        schemaValidator.validate(tool, ctx);

        JSONObject callJson = request.getJSONObject("tool_call");
        if (callJson != null) {
            toolCallValidator.validate(ToolCall.fromJson(callJson), tool);
        }
        log.debug("[{}] 工具 {} 校验通过", ctx.requestId(), tool.name());

        JSONObject result = new JSONObject();
        result.put("valid", true);
        result.put("tool", tool.name());
        result.put("tool_call_checked", callJson != null);
        return Mono.just(result.toJSONString());
    }

    private static byte[] bytes(String body) {
        return body != null ? body.getBytes(StandardCharsets.UTF_8) : new byte[0];
    }
}
