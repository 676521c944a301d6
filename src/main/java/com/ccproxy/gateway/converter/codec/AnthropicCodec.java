package com.ccproxy.gateway.converter.codec;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.ccproxy.gateway.converter.model.ContentBlock;
import com.ccproxy.gateway.converter.model.Message;
import com.ccproxy.gateway.converter.model.MessageFormat;
import com.ccproxy.gateway.converter.model.Request;
import com.ccproxy.gateway.converter.model.Response;
import com.ccproxy.gateway.converter.model.Usage;

import java.util.ArrayList;
import java.util.List;

/**
 * Anthropic Messages API ↔ 通用格式
 * <p>
 * system 为独立字段，内容为类型化块数组；上游不提供 total_tokens，按 input + output 计算
 */
public class AnthropicCodec extends AbstractProviderCodec {

    private static final String PROVIDER = "Anthropic";

    public AnthropicCodec(CodecSettings settings) {
        super(settings);
    }

    @Override
    public MessageFormat format() {
        return MessageFormat.ANTHROPIC;
    }

    @Override
    public String providerName() {
        return PROVIDER;
    }

    @Override
    protected Request readRequest(JSONObject json) {
        List<Message> messages = new ArrayList<>();
        JSONArray arr = WireJson.objects(json, "messages");
        for (int i = 0; i < arr.size(); i++) {
            JSONObject msg = arr.getJSONObject(i);
            if (msg == null) continue;
            messages.add(new Message(msg.getString("role"), ContentNormalizer.decode(msg.get("content"))));
        }

        return Request.builder()
                .model(json.getString("model"))
                .messages(messages)
                .system(readSystem(json.get("system")))
                .maxTokens(json.getIntValue("max_tokens"))
                .temperature(json.getDoubleValue("temperature"))
                .stream(json.getBooleanValue("stream"))
                .metadata(json.get("metadata"))
                .tools(readTools(WireJson.objects(json, "tools")))
                .toolChoice(json.get("tool_choice"))
                .topP(json.getDouble("top_p"))
                .topK(json.getInteger("top_k"))
                .stopSequences(WireJson.stringList(json.get("stop_sequences")))
                .build();
    }

    @Override
    protected JSONObject writeRequest(Request request) {
        List<Message> messages = new ArrayList<>();
        String system = foldSystemMessages(request, messages);

        JSONArray msgArr = new JSONArray();
        for (Message msg : messages) {
            msgArr.add(JSONObject.of(
                    "role", WireJson.stringOrEmpty(msg.role()), //
                    "content", blocksToJson(ContentNormalizer.toBlocks(msg.content(), PROVIDER)) //
            ));
        }

        JSONObject json = new JSONObject();
        json.put("model", WireJson.stringOrEmpty(request.getModel()));
        json.put("messages", msgArr);
        if (!system.isEmpty()) json.put("system", system);
        if (request.getMaxTokens() != 0) json.put("max_tokens", request.getMaxTokens());
        if (request.isStream()) json.put("stream", true);
        if (request.getMetadata() instanceof JSONObject metadata) json.put("metadata", metadata);
        putSamplingFields(json, request);
        return json;
    }

    @Override
    protected Response readResponse(JSONObject json) {
        JSONObject usage = json.getJSONObject("usage");
        return Response.builder()
                .id(json.getString("id"))
                .type(json.getString("type"))
                .role(json.getString("role"))
                .content(ContentNormalizer.decode(json.get("content")))
                .model(json.getString("model"))
                .stopReason(json.getString("stop_reason"))
                .stopSequence(json.getString("stop_sequence"))
                .usage(usage == null ? null : Usage.of(usage.getLongValue("input_tokens"), usage.getLongValue("output_tokens")))
                .build();
    }

    @Override
    protected JSONObject writeResponse(Response response) {
        JSONObject json = new JSONObject();
        json.put("id", WireJson.stringOrEmpty(response.getId()));
        json.put("type", WireJson.stringOrEmpty(response.getType()));
        json.put("role", WireJson.stringOrEmpty(response.getRole()));
        json.put("content", blocksToJson(ContentNormalizer.toBlocks(response.getContent(), PROVIDER)));
        json.put("model", WireJson.stringOrEmpty(response.getModel()));
        if (response.getStopReason() != null) json.put("stop_reason", response.getStopReason());
        if (response.getStopSequence() != null) json.put("stop_sequence", response.getStopSequence());
        if (response.getUsage() != null) {
            json.put("usage", JSONObject.of(
                    "input_tokens", response.getUsage().inputTokens(), //
                    "output_tokens", response.getUsage().outputTokens() //
            ));
        }
        return json;
    }

    private static JSONArray blocksToJson(List<ContentBlock> blocks) {
        JSONArray arr = new JSONArray();
        for (ContentBlock block : blocks) {
            arr.add(block.toJson());
        }
        return arr;
    }
}
