package com.ccproxy.gateway.converter.codec;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.ccproxy.gateway.converter.model.Message;
import com.ccproxy.gateway.converter.model.MessageFormat;
import com.ccproxy.gateway.converter.model.Request;
import com.ccproxy.gateway.converter.model.Response;
import com.ccproxy.gateway.converter.model.Usage;

import java.util.ArrayList;
import java.util.List;

/**
 * AWS Bedrock（Anthropic 模型）↔ 通用格式
 * <p>
 * 请求必带 anthropic_version，max_tokens 未设置时取默认值；
 * 内容块基本原样透传；响应缺少 stop_reason 时补为 stop_sequence
 */
public class AwsCodec extends AbstractProviderCodec {

    private static final String PROVIDER = "AWS";
    static final String DEFAULT_STOP_REASON = StopReasons.STOP_SEQUENCE;

    public AwsCodec(CodecSettings settings) {
        super(settings);
    }

    @Override
    public MessageFormat format() {
        return MessageFormat.AWS;
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

        // Bedrock 请求体不带 model / stream，模型在调用 URL 上
        return Request.builder()
                .messages(messages)
                .system(readSystem(json.get("system")))
                .maxTokens(json.getIntValue("max_tokens"))
                .temperature(json.getDoubleValue("temperature"))
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
                    "content", msg.content().toRaw() //
            ));
        }

        JSONObject json = new JSONObject();
        json.put("anthropic_version", settings.awsAnthropicVersion());
        json.put("messages", msgArr);
        if (!system.isEmpty()) json.put("system", system);
        json.put("max_tokens", request.getMaxTokens() > 0 ? request.getMaxTokens() : settings.awsDefaultMaxTokens());
        putSamplingFields(json, request);
        return json;
    }

    @Override
    protected Response readResponse(JSONObject json) {
        JSONObject usage = json.getJSONObject("usage");
        String stopReason = json.getString("stop_reason");
        return Response.builder()
                .id(json.getString("id"))
                .type(json.getString("type"))
                .role(json.getString("role"))
                .content(ContentNormalizer.decode(json.get("content")))
                .model(json.getString("model"))
                .stopReason(stopReason == null || stopReason.isEmpty() ? DEFAULT_STOP_REASON : stopReason)
                .stopSequence(json.getString("stop_sequence"))
                .usage(usage == null ? null : Usage.of(usage.getLongValue("input_tokens"), usage.getLongValue("output_tokens")))
                .build();
    }

    @Override
    protected JSONObject writeResponse(Response response) {
        String stopReason = response.getStopReason();
        JSONObject json = new JSONObject();
        json.put("id", WireJson.stringOrEmpty(response.getId()));
        json.put("model", WireJson.stringOrEmpty(response.getModel()));
        json.put("type", WireJson.stringOrEmpty(response.getType()));
        json.put("role", WireJson.stringOrEmpty(response.getRole()));
        json.put("content", response.getContent().toRaw());
        json.put("stop_reason", stopReason == null || stopReason.isEmpty() ? DEFAULT_STOP_REASON : stopReason);
        if (response.getStopSequence() != null && !response.getStopSequence().isEmpty()) {
            json.put("stop_sequence", response.getStopSequence());
        }
        if (response.getUsage() != null) {
            json.put("usage", JSONObject.of(
                    "input_tokens", response.getUsage().inputTokens(), //
                    "output_tokens", response.getUsage().outputTokens() //
            ));
        }
        return json;
    }
}
