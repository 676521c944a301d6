package com.ccproxy.gateway.converter.codec;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;
import com.ccproxy.gateway.converter.model.ContentBlock;
import com.ccproxy.gateway.converter.model.Message;
import com.ccproxy.gateway.converter.model.MessageContent;
import com.ccproxy.gateway.converter.model.Request;
import com.ccproxy.gateway.converter.model.Response;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AwsCodecTest {

    private final AwsCodec codec = new AwsCodec(CodecSettings.defaults());

    @Test
    void shouldApplyDefaultsToRequest() {
        Request request = Request.builder()
                .messages(List.of(Message.user("Hi")))
                .build();

        JSONObject json = json(codec.encodeRequest(request));

        assertEquals("bedrock-2023-05-31", json.getString("anthropic_version"));
        assertEquals(4096, json.getIntValue("max_tokens"));
        assertEquals("Hi", json.getJSONArray("messages").getJSONObject(0).getString("content"));
    }

    @Test
    void shouldUseConfiguredDefaults() {
        AwsCodec custom = new AwsCodec(new CodecSettings("bedrock-2024-01-01", 2048, null, null));

        JSONObject json = json(custom.encodeRequest(Request.builder().messages(List.of(Message.user("Hi"))).build()));

        assertEquals("bedrock-2024-01-01", json.getString("anthropic_version"));
        assertEquals(2048, json.getIntValue("max_tokens"));
    }

    @Test
    void shouldKeepExplicitMaxTokens() {
        Request request = Request.builder().maxTokens(300).messages(List.of(Message.user("Hi"))).build();
        assertEquals(300, json(codec.encodeRequest(request)).getIntValue("max_tokens"));
    }

    @Test
    void shouldPassBlockContentThrough() {
        JSONObject image = JSONObject.of("type", "image", "source",
                JSONObject.of("type", "base64", "media_type", "image/png", "data", "AAAA"));
        Request request = Request.builder()
                .messages(List.of(new Message("user", MessageContent.blocks(List.of(ContentBlock.of(image))))))
                .build();

        JSONObject block = json(codec.encodeRequest(request))
                .getJSONArray("messages").getJSONObject(0).getJSONArray("content").getJSONObject(0);

        assertEquals(image, block);
    }

    @Test
    void shouldDefaultStopReasonOnEncode() {
        Response response = Response.builder()
                .id("msg_1")
                .role("assistant")
                .content(MessageContent.text("Hi"))
                .build();

        assertEquals("stop_sequence", json(codec.encodeResponse(response)).getString("stop_reason"));
    }

    @Test
    void shouldDefaultStopReasonAndTotalOnDecode() {
        Response response = codec.decodeResponse(bytes("""
                {"id":"msg_1","type":"message","role":"assistant","content":[{"type":"text","text":"Hi"}],
                 "usage":{"input_tokens":25,"output_tokens":15}}
                """));

        assertEquals("stop_sequence", response.getStopReason());
        assertEquals(40, response.getUsage().totalTokens());
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static JSONObject json(byte[] data) {
        return JSON.parseObject(new String(data, StandardCharsets.UTF_8));
    }
}
