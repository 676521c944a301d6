package com.ccproxy.gateway.converter.codec;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.ccproxy.gateway.converter.ConverterFeatures;
import com.ccproxy.gateway.converter.model.Message;
import com.ccproxy.gateway.converter.model.Request;
import com.ccproxy.gateway.converter.model.Response;
import com.ccproxy.gateway.converter.model.Tool;

import java.util.ArrayList;
import java.util.List;

/**
 * 编解码器公共骨架
 * <p>
 * 负责 JSON 解析与错误包装，子类只处理各自协议的字段映射
 */
public abstract class AbstractProviderCodec implements ProviderCodec {

    protected final CodecSettings settings;

    protected AbstractProviderCodec(CodecSettings settings) {
        this.settings = settings != null ? settings : CodecSettings.defaults();
    }

    @Override
    public ConverterFeatures features() {
        return ConverterFeatures.of(true, 100, 50);
    }

    @Override
    public final Request decodeRequest(byte[] data) {
        return WireJson.read(data, providerName(), "request", this::readRequest);
    }

    @Override
    public final Response decodeResponse(byte[] data) {
        return WireJson.read(data, providerName(), "response", this::readResponse);
    }

    @Override
    public final byte[] encodeRequest(Request request) {
        return WireJson.toBytes(writeRequest(request));
    }

    @Override
    public final byte[] encodeResponse(Response response) {
        return WireJson.toBytes(writeResponse(response));
    }

    protected abstract Request readRequest(JSONObject json);

    protected abstract Response readResponse(JSONObject json);

    protected abstract JSONObject writeRequest(Request request);

    protected abstract JSONObject writeResponse(Response response);

    // ==================== 辅助方法 ====================

    /**
     * system 可以是字符串，也可以是 text 块数组（以换行拼接）
     */
    protected static String readSystem(Object system) {
        if (system == null) return null;
        if (system instanceof String s) return s;
        if (system instanceof JSONArray arr) {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < arr.size(); i++) {
                JSONObject item = arr.getJSONObject(i);
                if (item != null && item.containsKey("text")) {
                    if (!sb.isEmpty()) sb.append("\n");
                    sb.append(item.getString("text"));
                }
            }
            return sb.toString();
        }
        throw new JSONException("system must be a string or an array of text blocks");
    }

    /**
     * 把消息列表中的 system 角色消息并入 system 字段（用于只有独立 system 字段的协议）
     *
     * @param remaining 非 system 消息按原顺序追加到这里
     * @return 合并后的 system 文本
     */
    protected static String foldSystemMessages(Request request, List<Message> remaining) {
        List<String> parts = new ArrayList<>();
        if (request.hasSystem()) {
            parts.add(request.getSystem());
        }
        for (Message msg : request.getMessages()) {
            if (Message.ROLE_SYSTEM.equals(msg.role())) {
                String text = ContentNormalizer.flatten(msg.content(), "\n");
                if (!text.isEmpty()) parts.add(text);
            } else {
                remaining.add(msg);
            }
        }
        return String.join("\n", parts);
    }

    protected static List<Tool> readTools(JSONArray tools) {
        List<Tool> result = new ArrayList<>();
        for (int i = 0; i < tools.size(); i++) {
            JSONObject tool = tools.getJSONObject(i);
            if (tool != null) {
                result.add(Tool.fromJson(tool));
            }
        }
        return result;
    }

    protected static JSONArray writeTools(List<Tool> tools) {
        JSONArray arr = new JSONArray();
        for (Tool tool : tools) {
            arr.add(tool.toJson());
        }
        return arr;
    }

    /**
     * 写入 Anthropic 风格请求共有的可选字段
     */
    protected static void putSamplingFields(JSONObject json, Request request) {
        if (request.getTemperature() != 0) json.put("temperature", request.getTemperature());
        if (request.getTopP() != null) json.put("top_p", request.getTopP());
        if (request.getTopK() != null) json.put("top_k", request.getTopK());
        if (request.getStopSequences() != null && !request.getStopSequences().isEmpty()) {
            json.put("stop_sequences", request.getStopSequences());
        }
        if (request.hasTools()) json.put("tools", writeTools(request.getTools()));
        if (request.getToolChoice() != null) json.put("tool_choice", request.getToolChoice());
    }
}
