package com.ccproxy.gateway.converter.codec;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.ccproxy.gateway.converter.ConverterFeatures;
import com.ccproxy.gateway.converter.model.ContentBlock;
import com.ccproxy.gateway.converter.model.Message;
import com.ccproxy.gateway.converter.model.MessageContent;
import com.ccproxy.gateway.converter.model.MessageFormat;
import com.ccproxy.gateway.converter.model.Request;
import com.ccproxy.gateway.converter.model.Response;
import com.ccproxy.gateway.converter.model.Usage;
import com.ccproxy.gateway.exception.StructuralException;
import com.ccproxy.gateway.tool.ToolFallback;

import java.util.ArrayList;
import java.util.List;

/**
 * Google Gemini ↔ 通用格式
 * <p>
 * 角色 model ⇄ assistant；没有 system 字段，system 文本作为首个 user 轮次插入；
 * parts 只承载文本，工具块以哨兵标记写入文本，解码时再还原。
 * 非文本的其他块（如 image）按 JSON 文本写出，属于有损转换。
 */
public class GoogleCodec extends AbstractProviderCodec {

    private static final String PROVIDER = "Google";
    private static final String ROLE_MODEL = "model";

    public GoogleCodec(CodecSettings settings) {
        super(settings);
    }

    @Override
    public MessageFormat format() {
        return MessageFormat.GOOGLE;
    }

    @Override
    public String providerName() {
        return PROVIDER;
    }

    @Override
    public ConverterFeatures features() {
        // 工具声明只能降级为 system 文本
        return ConverterFeatures.of(false, 100, 50);
    }

    // ==================== 请求 ====================

    @Override
    protected Request readRequest(JSONObject json) {
        List<Message> messages = new ArrayList<>();
        JSONArray contents = WireJson.objects(json, "contents");
        for (int i = 0; i < contents.size(); i++) {
            JSONObject content = contents.getJSONObject(i);
            if (content == null) continue;
            messages.add(new Message(toGenericRole(content.getString("role")),
                    ContentNormalizer.fromText(joinParts(content))));
        }

        Request.RequestBuilder builder = Request.builder().messages(messages);

        JSONObject systemInstruction = json.getJSONObject("systemInstruction");
        if (systemInstruction != null) {
            builder.system(joinParts(systemInstruction));
        }

        JSONObject config = json.getJSONObject("generationConfig");
        if (config != null) {
            builder.maxTokens(config.getIntValue("maxOutputTokens"))
                    .temperature(config.getDoubleValue("temperature"))
                    .topP(config.getDouble("topP"))
                    .topK(config.getInteger("topK"))
                    .stopSequences(WireJson.stringList(config.get("stopSequences")));
        }
        return builder.build();
    }

    @Override
    protected JSONObject writeRequest(Request request) {
        List<Message> messages = new ArrayList<>();
        String system = ToolFallback.appendToSystem(foldSystemMessages(request, messages), request.getTools());

        JSONArray contents = new JSONArray();
        if (!system.isEmpty()) {
            contents.add(content(Message.ROLE_USER, JSONArray.of(part(system))));
        }
        for (Message msg : messages) {
            contents.add(content(toGoogleRole(msg.role()), parts(msg.content())));
        }

        JSONObject json = new JSONObject();
        json.put("contents", contents);
        JSONObject config = generationConfig(request);
        if (!config.isEmpty()) {
            json.put("generationConfig", config);
        }
        return json;
    }

    // ==================== 响应 ====================

    @Override
    protected Response readResponse(JSONObject json) {
        JSONArray candidates = json.getJSONArray("candidates");
        if (candidates == null || candidates.isEmpty()) {
            throw new StructuralException("no candidates in Google response");
        }

        JSONObject candidate = candidates.getJSONObject(0);
        if (candidate == null) {
            throw new StructuralException("no candidates in Google response");
        }
        JSONObject content = candidate.getJSONObject("content");
        if (content == null) content = new JSONObject();

        String role = toGenericRole(content.getString("role"));
        return Response.builder()
                .id(json.getString("responseId"))
                .type("message")
                .role(role != null && !role.isEmpty() ? role : Message.ROLE_ASSISTANT)
                .content(ContentNormalizer.fromText(joinParts(content)))
                .model(json.getString("modelVersion"))
                .stopReason(StopReasons.fromGoogle(candidate.getString("finishReason")))
                .usage(readUsage(json.getJSONObject("usageMetadata")))
                .build();
    }

    @Override
    protected JSONObject writeResponse(Response response) {
        JSONObject candidate = new JSONObject();
        candidate.put("content", content(toGoogleRole(response.getRole()), parts(response.getContent())));
        candidate.put("finishReason", StopReasons.toGoogle(response.getStopReason()));

        JSONObject json = new JSONObject();
        json.put("candidates", JSONArray.of(candidate));
        if (response.getUsage() != null) {
            json.put("usageMetadata", JSONObject.of(
                    "promptTokenCount", response.getUsage().inputTokens(), //
                    "candidatesTokenCount", response.getUsage().outputTokens(), //
                    "totalTokenCount", response.getUsage().totalTokens() //
            ));
        }
        if (response.getId() != null && !response.getId().isEmpty()) json.put("responseId", response.getId());
        if (response.getModel() != null && !response.getModel().isEmpty()) json.put("modelVersion", response.getModel());
        return json;
    }

    // ==================== 辅助方法 ====================

    static String toGenericRole(String role) {
        return ROLE_MODEL.equals(role) ? Message.ROLE_ASSISTANT : role;
    }

    static String toGoogleRole(String role) {
        return Message.ROLE_ASSISTANT.equals(role) ? ROLE_MODEL : WireJson.stringOrEmpty(role);
    }

    /**
     * 按顺序拼接所有 part 的 text（分隔符可配置，默认不插入）
     */
    private String joinParts(JSONObject content) {
        JSONArray parts = WireJson.objects(content, "parts");
        List<String> texts = new ArrayList<>(parts.size());
        for (int i = 0; i < parts.size(); i++) {
            JSONObject part = parts.getJSONObject(i);
            if (part != null && part.getString("text") != null) {
                texts.add(part.getString("text"));
            }
        }
        return String.join(settings.googleTextSeparator(), texts);
    }

    /**
     * 每个内容块一个 part
     */
    private static JSONArray parts(MessageContent content) {
        JSONArray parts = new JSONArray();
        if (content instanceof MessageContent.Blocks blocks) {
            for (ContentBlock block : blocks.blocks()) {
                if (block.isText()) {
                    parts.add(part(WireJson.stringOrEmpty(block.text())));
                } else if (block.isToolUse() || block.isToolResult()) {
                    parts.add(part(ContentNormalizer.toMarkerText(block)));
                } else {
                    parts.add(part(ContentNormalizer.stringify(block.toJson())));
                }
            }
        }
        if (parts.isEmpty()) {
            parts.add(part(content instanceof MessageContent.Blocks ? "" : ContentNormalizer.flatten(content, "")));
        }
        return parts;
    }

    private static JSONObject part(String text) {
        return JSONObject.of("text", text);
    }

    private static JSONObject content(String role, JSONArray parts) {
        return JSONObject.of("role", role, "parts", parts);
    }

    private static JSONObject generationConfig(Request request) {
        JSONObject config = new JSONObject();
        if (request.getTemperature() > 0) config.put("temperature", request.getTemperature());
        if (request.getMaxTokens() > 0) config.put("maxOutputTokens", request.getMaxTokens());
        if (request.getTopP() != null) config.put("topP", request.getTopP());
        if (request.getTopK() != null) config.put("topK", request.getTopK());
        if (request.getStopSequences() != null && !request.getStopSequences().isEmpty()) {
            config.put("stopSequences", request.getStopSequences());
        }
        return config;
    }

    private static Usage readUsage(JSONObject usage) {
        if (usage == null) return null;
        long input = usage.getLongValue("promptTokenCount");
        long output = usage.getLongValue("candidatesTokenCount");
        return usage.containsKey("totalTokenCount")
                ? new Usage(input, output, usage.getLongValue("totalTokenCount"))
                : Usage.of(input, output);
    }
}
