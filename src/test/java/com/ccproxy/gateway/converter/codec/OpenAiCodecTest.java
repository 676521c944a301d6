package com.ccproxy.gateway.converter.codec;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.ccproxy.gateway.converter.model.ContentBlock;
import com.ccproxy.gateway.converter.model.Message;
import com.ccproxy.gateway.converter.model.MessageContent;
import com.ccproxy.gateway.converter.model.Request;
import com.ccproxy.gateway.converter.model.Response;
import com.ccproxy.gateway.converter.model.Usage;
import com.ccproxy.gateway.exception.StructuralException;
import com.ccproxy.gateway.exception.ToolCallValidationException;
import com.ccproxy.gateway.exception.UnmarshalException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OpenAiCodecTest {

    private final OpenAiCodec codec = new OpenAiCodec(CodecSettings.defaults());

    @Test
    void shouldKeepLastSystemMessage() {
        Request request = codec.decodeRequest(bytes("""
                {"model":"gpt-4","messages":[
                  {"role":"system","content":"First system message"},
                  {"role":"system","content":"Second system message"},
                  {"role":"user","content":"Hello"}]}
                """));

        assertEquals("Second system message", request.getSystem());
        assertEquals(1, request.getMessages().size());
        assertEquals("user", request.getMessages().get(0).role());
    }

    @Test
    void shouldTreatDeveloperRoleAsSystem() {
        Request request = codec.decodeRequest(bytes("""
                {"model":"gpt-4o","messages":[{"role":"developer","content":"Be terse"},{"role":"user","content":"Hi"}]}
                """));

        assertEquals("Be terse", request.getSystem());
        assertEquals(1, request.getMessages().size());
    }

    @Test
    void shouldEmitSystemAsLeadingMessage() {
        Request request = Request.builder()
                .model("gpt-4")
                .system("You are helpful")
                .messages(List.of(Message.user("Hi")))
                .build();

        JSONArray messages = json(codec.encodeRequest(request)).getJSONArray("messages");

        assertEquals(2, messages.size());
        assertEquals("system", messages.getJSONObject(0).getString("role"));
        assertEquals("You are helpful", messages.getJSONObject(0).getString("content"));
        assertEquals("user", messages.getJSONObject(1).getString("role"));
    }

    @Test
    void shouldFlattenTextBlocksWithSpace() {
        Request request = Request.builder()
                .model("gpt-4")
                .messages(List.of(new Message("user", MessageContent.blocks(List.of(
                        ContentBlock.text("Hello"), ContentBlock.text("world"))))))
                .build();

        JSONObject message = json(codec.encodeRequest(request)).getJSONArray("messages").getJSONObject(0);
        assertEquals("Hello world", message.getString("content"));
    }

    @Test
    void shouldDecodeToolCallsAndToolMessages() {
        Request request = codec.decodeRequest(bytes("""
                {"model":"gpt-4","messages":[
                  {"role":"user","content":"Weather in Paris?"},
                  {"role":"assistant","content":null,"tool_calls":[
                    {"id":"call_1","type":"function","function":{"name":"get_weather","arguments":"{\\"city\\":\\"Paris\\"}"}}]},
                  {"role":"tool","tool_call_id":"call_1","content":"Sunny"}]}
                """));

        assertEquals(3, request.getMessages().size());

        MessageContent.Blocks assistant = assertInstanceOf(MessageContent.Blocks.class, request.getMessages().get(1).content());
        ContentBlock toolUse = assistant.blocks().get(0);
        assertTrue(toolUse.isToolUse());
        assertEquals("call_1", toolUse.id());
        assertEquals("get_weather", toolUse.name());
        assertEquals("Paris", toolUse.input().getString("city"));

        Message toolMessage = request.getMessages().get(2);
        assertEquals("user", toolMessage.role());
        ContentBlock result = ((MessageContent.Blocks) toolMessage.content()).blocks().get(0);
        assertTrue(result.isToolResult());
        assertEquals("call_1", result.toolUseId());
        assertEquals("Sunny", result.resultContent());
    }

    @Test
    void shouldMergeConsecutiveToolMessages() {
        Request request = codec.decodeRequest(bytes("""
                {"model":"gpt-4","messages":[
                  {"role":"tool","tool_call_id":"call_1","content":"a"},
                  {"role":"tool","tool_call_id":"call_2","content":"b"}]}
                """));

        assertEquals(1, request.getMessages().size());
        assertEquals(2, ((MessageContent.Blocks) request.getMessages().get(0).content()).blocks().size());
    }

    @Test
    void shouldEncodeToolBlocksAsNativeStructures() {
        Request request = Request.builder()
                .model("gpt-4")
                .messages(List.of(
                        new Message("assistant", MessageContent.blocks(List.of(
                                ContentBlock.text("Checking"),
                                ContentBlock.toolUse("call_1", "get_weather", JSONObject.of("city", "Paris"))))),
                        new Message("user", MessageContent.blocks(List.of(
                                ContentBlock.toolResult("call_1", "Sunny", null))))))
                .build();

        JSONArray messages = json(codec.encodeRequest(request)).getJSONArray("messages");

        assertEquals(2, messages.size());
        JSONObject assistant = messages.getJSONObject(0);
        assertEquals("Checking", assistant.getString("content"));
        JSONObject call = assistant.getJSONArray("tool_calls").getJSONObject(0);
        assertEquals("call_1", call.getString("id"));
        assertEquals("function", call.getString("type"));
        assertEquals("get_weather", call.getJSONObject("function").getString("name"));
        assertEquals("Paris", JSON.parseObject(call.getJSONObject("function").getString("arguments")).getString("city"));

        JSONObject tool = messages.getJSONObject(1);
        assertEquals("tool", tool.getString("role"));
        assertEquals("call_1", tool.getString("tool_call_id"));
        assertEquals("Sunny", tool.getString("content"));
    }

    @Test
    void shouldMapToolChoiceBothWays() {
        Request request = codec.decodeRequest(bytes("""
                {"model":"gpt-4","messages":[],"tool_choice":{"type":"function","function":{"name":"lookup"}}}
                """));
        assertEquals(JSONObject.of("type", "tool", "name", "lookup"), request.getToolChoice());

        Request required = request.toBuilder().toolChoice(JSONObject.of("type", "any")).build();
        assertEquals("required", json(codec.encodeRequest(required)).getString("tool_choice"));
    }

    @Test
    void shouldAcceptMaxCompletionTokensAndStringStop() {
        Request request = codec.decodeRequest(bytes("""
                {"model":"o1","messages":[],"max_completion_tokens":512,"stop":"END"}
                """));

        assertEquals(512, request.getMaxTokens());
        assertEquals(List.of("END"), request.getStopSequences());
    }

    @Test
    void shouldRejectToolCallWithoutId() {
        byte[] data = bytes("""
                {"model":"gpt-4","messages":[{"role":"assistant","tool_calls":[
                  {"id":"","type":"function","function":{"name":"get_weather","arguments":"{}"}}]}]}
                """);

        ToolCallValidationException e = assertThrows(ToolCallValidationException.class, () -> codec.decodeRequest(data));
        assertEquals(ToolCallValidationException.VALIDATION_ERROR, e.getType());
    }

    @Test
    void shouldReadResponseUsageAndFinishReason() {
        Response response = codec.decodeResponse(bytes("""
                {"id":"chatcmpl-1","object":"chat.completion","model":"gpt-4",
                 "choices":[{"index":0,"message":{"role":"assistant","content":"Hi there"},"finish_reason":"length"}],
                 "usage":{"prompt_tokens":10,"completion_tokens":5,"total_tokens":15}}
                """));

        assertEquals("chatcmpl-1", response.getId());
        assertEquals("message", response.getType());
        assertEquals("assistant", response.getRole());
        assertEquals("max_tokens", response.getStopReason());
        assertEquals(new Usage(10, 5, 15), response.getUsage());
        assertEquals(MessageContent.blocks(List.of(ContentBlock.text("Hi there"))), response.getContent());
    }

    @Test
    void shouldRejectResponseWithoutChoices() {
        StructuralException e = assertThrows(StructuralException.class,
                () -> codec.decodeResponse(bytes("{\"id\":\"x\",\"choices\":[]}")));
        assertEquals("no choices in OpenAI response", e.getMessage());
    }

    @Test
    void shouldRejectNullFirstChoice() {
        StructuralException e = assertThrows(StructuralException.class,
                () -> codec.decodeResponse(bytes("{\"choices\":[null]}")));
        assertEquals("no choices in OpenAI response", e.getMessage());
    }

    @Test
    void shouldRejectNullToolCallElement() {
        byte[] request = bytes("""
                {"model":"gpt-4","messages":[{"role":"assistant","content":null,"tool_calls":[null]}]}
                """);
        byte[] response = bytes("""
                {"choices":[{"message":{"role":"assistant","tool_calls":[null]},"finish_reason":"tool_calls"}]}
                """);

        ToolCallValidationException onRequest = assertThrows(ToolCallValidationException.class,
                () -> codec.decodeRequest(request));
        assertEquals(ToolCallValidationException.VALIDATION_ERROR, onRequest.getType());
        assertEquals("tool_calls[0]", onRequest.getField());
        assertThrows(ToolCallValidationException.class, () -> codec.decodeResponse(response));
    }

    @Test
    void shouldKeepTokenCountsBeyondIntRange() {
        Response response = codec.decodeResponse(bytes("""
                {"choices":[{"message":{"content":"ok"},"finish_reason":"stop"}],
                 "usage":{"prompt_tokens":3000000000,"completion_tokens":2000000000}}
                """));

        assertEquals(3_000_000_000L, response.getUsage().inputTokens());
        assertEquals(5_000_000_000L, response.getUsage().totalTokens());

        JSONObject usage = json(codec.encodeResponse(response)).getJSONObject("usage");
        assertEquals(3_000_000_000L, usage.getLongValue("prompt_tokens"));
        assertEquals(5_000_000_000L, usage.getLongValue("total_tokens"));
    }

    @Test
    void shouldWriteChatCompletionResponse() {
        Response response = Response.builder()
                .id("msg_1")
                .role("assistant")
                .model("claude-3")
                .content(MessageContent.blocks(List.of(ContentBlock.text("Done"))))
                .stopReason("end_turn")
                .usage(Usage.of(3, 4))
                .build();

        JSONObject json = json(codec.encodeResponse(response));
        JSONObject choice = json.getJSONArray("choices").getJSONObject(0);

        assertEquals("chat.completion", json.getString("object"));
        assertEquals("Done", choice.getJSONObject("message").getString("content"));
        assertEquals("stop", choice.getString("finish_reason"));
        assertEquals(7, json.getJSONObject("usage").getIntValue("total_tokens"));
    }

    @Test
    void shouldNameProviderOnMalformedResponse() {
        UnmarshalException e = assertThrows(UnmarshalException.class, () -> codec.decodeResponse(bytes("{\"choices\":")));
        assertTrue(e.getMessage().startsWith("failed to unmarshal OpenAI response"));
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static JSONObject json(byte[] data) {
        return JSON.parseObject(new String(data, StandardCharsets.UTF_8));
    }
}
