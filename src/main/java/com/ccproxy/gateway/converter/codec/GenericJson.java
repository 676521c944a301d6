package com.ccproxy.gateway.converter.codec;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.ccproxy.gateway.converter.model.Message;
import com.ccproxy.gateway.converter.model.Request;
import com.ccproxy.gateway.converter.model.Response;
import com.ccproxy.gateway.converter.model.Usage;

import java.util.ArrayList;
import java.util.List;

/**
 * 通用中间格式的 JSON 读写
 * <p>
 * 字段使用 snake_case；空字符串、0、false 的可选字段不输出
 */
public final class GenericJson {

    private static final String PROVIDER = "generic";

    private GenericJson() {
    }

    public static Request readRequest(byte[] data) {
        return WireJson.read(data, PROVIDER, "request", GenericJson::requestFromJson);
    }

    public static Response readResponse(byte[] data) {
        return WireJson.read(data, PROVIDER, "response", GenericJson::responseFromJson);
    }

    public static byte[] writeRequest(Request request) {
        return WireJson.toBytes(requestToJson(request));
    }

    public static byte[] writeResponse(Response response) {
        return WireJson.toBytes(responseToJson(response));
    }

    static Request requestFromJson(JSONObject json) {
        List<Message> messages = new ArrayList<>();
        JSONArray arr = WireJson.objects(json, "messages");
        for (int i = 0; i < arr.size(); i++) {
            JSONObject msg = arr.getJSONObject(i);
            if (msg == null) continue;
            messages.add(new Message(msg.getString("role"),
                    ContentNormalizer.decode(msg.get("content")),
                    msg.getString("name")));
        }

        return Request.builder()
                .model(json.getString("model"))
                .messages(messages)
                .system(json.getString("system"))
                .maxTokens(json.getIntValue("max_tokens"))
                .temperature(json.getDoubleValue("temperature"))
                .stream(json.getBooleanValue("stream"))
                .metadata(json.get("metadata"))
                .tools(AbstractProviderCodec.readTools(WireJson.objects(json, "tools")))
                .toolChoice(json.get("tool_choice"))
                .topP(json.getDouble("top_p"))
                .topK(json.getInteger("top_k"))
                .stopSequences(WireJson.stringList(json.get("stop_sequences")))
                .build();
    }

    static JSONObject requestToJson(Request request) {
        JSONObject json = new JSONObject();
        json.put("model", WireJson.stringOrEmpty(request.getModel()));

        JSONArray messages = new JSONArray();
        for (Message msg : request.getMessages()) {
            JSONObject m = new JSONObject();
            m.put("role", WireJson.stringOrEmpty(msg.role()));
            m.put("content", msg.content().toRaw());
            if (msg.name() != null && !msg.name().isEmpty()) {
                m.put("name", msg.name());
            }
            messages.add(m);
        }
        json.put("messages", messages);

        if (request.hasSystem()) json.put("system", request.getSystem());
        if (request.getMaxTokens() != 0) json.put("max_tokens", request.getMaxTokens());
        if (request.getTemperature() != 0) json.put("temperature", request.getTemperature());
        if (request.isStream()) json.put("stream", true);
        if (request.getMetadata() != null) json.put("metadata", request.getMetadata());
        if (request.hasTools()) json.put("tools", AbstractProviderCodec.writeTools(request.getTools()));
        if (request.getToolChoice() != null) json.put("tool_choice", request.getToolChoice());
        if (request.getTopP() != null) json.put("top_p", request.getTopP());
        if (request.getTopK() != null) json.put("top_k", request.getTopK());
        if (request.getStopSequences() != null && !request.getStopSequences().isEmpty()) {
            json.put("stop_sequences", request.getStopSequences());
        }
        return json;
    }

    static Response responseFromJson(JSONObject json) {
        return Response.builder()
                .id(json.getString("id"))
                .type(json.getString("type"))
                .role(json.getString("role"))
                .content(ContentNormalizer.decode(json.get("content")))
                .model(json.getString("model"))
                .usage(usageFromJson(json.getJSONObject("usage")))
                .stopReason(json.getString("stop_reason"))
                .stopSequence(json.getString("stop_sequence"))
                .build();
    }

    static JSONObject responseToJson(Response response) {
        JSONObject json = new JSONObject();
        json.put("id", WireJson.stringOrEmpty(response.getId()));
        json.put("type", WireJson.stringOrEmpty(response.getType()));
        json.put("role", WireJson.stringOrEmpty(response.getRole()));
        json.put("content", response.getContent().toRaw());
        json.put("model", WireJson.stringOrEmpty(response.getModel()));
        if (response.getUsage() != null) {
            Usage usage = response.getUsage();
            json.put("usage", JSONObject.of(
                    "input_tokens", usage.inputTokens(), //
                    "output_tokens", usage.outputTokens(), //
                    "total_tokens", usage.totalTokens() //
            ));
        }
        if (response.getStopReason() != null && !response.getStopReason().isEmpty()) {
            json.put("stop_reason", response.getStopReason());
        }
        if (response.getStopSequence() != null && !response.getStopSequence().isEmpty()) {
            json.put("stop_sequence", response.getStopSequence());
        }
        return json;
    }

    private static Usage usageFromJson(JSONObject usage) {
        if (usage == null) return null;
        long input = usage.getLongValue("input_tokens");
        long output = usage.getLongValue("output_tokens");
        return usage.containsKey("total_tokens")
                ? new Usage(input, output, usage.getLongValue("total_tokens"))
                : Usage.of(input, output);
    }
}
