package com.ccproxy.gateway.converter.codec;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.ccproxy.gateway.converter.model.Message;
import com.ccproxy.gateway.converter.model.MessageContent;
import com.ccproxy.gateway.converter.model.Request;
import com.ccproxy.gateway.converter.model.Response;
import com.ccproxy.gateway.exception.ContentParseException;
import com.ccproxy.gateway.exception.UnmarshalException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AnthropicCodecTest {

    private final AnthropicCodec codec = new AnthropicCodec(CodecSettings.defaults());

    @Test
    void shouldReadSystemFromTextBlockArray() {
        Request request = codec.decodeRequest(bytes("""
                {"model":"claude-3","system":[{"type":"text","text":"Line one"},{"type":"text","text":"Line two"}],
                 "messages":[{"role":"user","content":"Hi"}],"max_tokens":256}
                """));

        assertEquals("Line one\nLine two", request.getSystem());
        assertEquals(256, request.getMaxTokens());
        assertEquals(1, request.getMessages().size());
        assertEquals(MessageContent.text("Hi"), request.getMessages().get(0).content());
    }

    @Test
    void shouldWrapTextContentIntoSingleBlock() {
        Request request = Request.builder()
                .model("claude-3")
                .messages(List.of(Message.user("Hi")))
                .build();

        JSONObject json = json(codec.encodeRequest(request));
        JSONArray content = json.getJSONArray("messages").getJSONObject(0).getJSONArray("content");

        assertEquals(1, content.size());
        assertEquals("text", content.getJSONObject(0).getString("type"));
        assertEquals("Hi", content.getJSONObject(0).getString("text"));
        assertFalse(json.containsKey("system"));
        assertFalse(json.containsKey("max_tokens"));
        assertFalse(json.containsKey("temperature"));
    }

    @Test
    void shouldFoldSystemRoleMessagesIntoSystemField() {
        Request request = Request.builder()
                .model("claude-3")
                .system("Base")
                .messages(List.of(new Message("system", MessageContent.text("Extra")), Message.user("Hi")))
                .build();

        JSONObject json = json(codec.encodeRequest(request));

        assertEquals("Base\nExtra", json.getString("system"));
        assertEquals(1, json.getJSONArray("messages").size());
        assertEquals("user", json.getJSONArray("messages").getJSONObject(0).getString("role"));
    }

    @Test
    void shouldRejectOpaqueContent() {
        Request request = Request.builder()
                .model("claude-3")
                .messages(List.of(new Message("user", new MessageContent.Opaque(JSONObject.of("foo", "bar")))))
                .build();

        assertThrows(ContentParseException.class, () -> codec.encodeRequest(request));
    }

    @Test
    void shouldComputeTotalTokens() {
        Response response = codec.decodeResponse(bytes("""
                {"id":"msg_1","type":"message","role":"assistant","model":"claude-3",
                 "content":[{"type":"text","text":"Hello"}],"stop_reason":"end_turn",
                 "usage":{"input_tokens":25,"output_tokens":15}}
                """));

        assertEquals(40, response.getUsage().totalTokens());
        assertEquals("end_turn", response.getStopReason());
    }

    @Test
    void shouldPreserveUnknownBlockFields() {
        Request request = codec.decodeRequest(bytes("""
                {"model":"claude-3","messages":[{"role":"user","content":[
                  {"type":"text","text":"Hi","cache_control":{"type":"ephemeral"}}]}]}
                """));

        JSONObject block = json(codec.encodeRequest(request))
                .getJSONArray("messages").getJSONObject(0).getJSONArray("content").getJSONObject(0);
        assertEquals("ephemeral", block.getJSONObject("cache_control").getString("type"));
    }

    @Test
    void shouldNameProviderOnMalformedJson() {
        UnmarshalException e = assertThrows(UnmarshalException.class, () -> codec.decodeRequest(bytes("{not json")));
        assertTrue(e.getMessage().startsWith("failed to unmarshal Anthropic request"));
    }

    @Test
    void shouldOmitEmptyFieldsInGenericForm() {
        byte[] generic = codec.toGeneric(bytes("""
                {"model":"claude-3","messages":[{"role":"user","content":"Hi"}]}
                """), true);
        JSONObject json = json(generic);

        assertEquals("claude-3", json.getString("model"));
        assertFalse(json.containsKey("system"));
        assertFalse(json.containsKey("max_tokens"));
        assertFalse(json.containsKey("stream"));
        assertEquals("Hi", json.getJSONArray("messages").getJSONObject(0).getString("content"));
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static JSONObject json(byte[] data) {
        return JSON.parseObject(new String(data, StandardCharsets.UTF_8));
    }
}
