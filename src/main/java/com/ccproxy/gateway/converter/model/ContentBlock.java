package com.ccproxy.gateway.converter.model;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.ccproxy.gateway.exception.ContentParseException;

import java.util.Objects;

/**
 * 类型化内容块
 * <p>
 * 覆盖 text / tool_use / tool_result 三种块，其余块（如 image）原样保留，
 * 未识别的字段（cache_control 等）在 Anthropic / AWS 之间透传时不丢失
 */
public final class ContentBlock {

    public static final String TYPE_TEXT = "text";
    public static final String TYPE_TOOL_USE = "tool_use";
    public static final String TYPE_TOOL_RESULT = "tool_result";

    private final JSONObject raw;

    private ContentBlock(JSONObject raw) {
        this.raw = raw;
    }

    /**
     * 从原始 JSON 块构建（浅拷贝，调用方后续修改不影响本对象）
     */
    public static ContentBlock of(JSONObject raw) {
        Objects.requireNonNull(raw, "raw");
        return new ContentBlock(new JSONObject(raw));
    }

    public static ContentBlock text(String text) {
        return new ContentBlock(JSONObject.of("type", TYPE_TEXT, "text", text != null ? text : ""));
    }

    public static ContentBlock toolUse(String id, String name, Object input) {
        JSONObject block = new JSONObject();
        block.put("type", TYPE_TOOL_USE);
        block.put("id", id);
        block.put("name", name);
        block.put("input", input != null ? input : new JSONObject());
        return new ContentBlock(block);
    }

    public static ContentBlock toolResult(String toolUseId, Object content, Boolean isError) {
        JSONObject block = new JSONObject();
        block.put("type", TYPE_TOOL_RESULT);
        block.put("tool_use_id", toolUseId);
        block.put("content", content != null ? content : "");
        if (isError != null) {
            block.put("is_error", isError);
        }
        return new ContentBlock(block);
    }

    public String type() {
        return raw.getString("type");
    }

    public boolean isText() {
        return TYPE_TEXT.equals(type());
    }

    public boolean isToolUse() {
        return TYPE_TOOL_USE.equals(type());
    }

    public boolean isToolResult() {
        return TYPE_TOOL_RESULT.equals(type());
    }

    public String text() {
        return raw.getString("text");
    }

    public String id() {
        return raw.getString("id");
    }

    public String name() {
        return raw.getString("name");
    }

    /**
     * tool_use 的入参；字符串形式的 JSON 会被解析，缺失时返回空对象
     *
     * @throws ContentParseException 入参既不是对象也不是合法的 JSON 对象字符串
     */
    public JSONObject input() {
        Object input = raw.get("input");
        if (input == null) return new JSONObject();
        if (input instanceof JSONObject jo) return jo;
        if (input instanceof String s) {
            if (s.isBlank()) return new JSONObject();
            try {
                JSONObject parsed = JSON.parseObject(s);
                return parsed != null ? parsed : new JSONObject();
            } catch (JSONException e) {
                throw new ContentParseException("tool_use '" + id() + "' input is not valid JSON: " + e.getMessage(), e);
            }
        }
        throw new ContentParseException("tool_use '" + id() + "' input must be an object");
    }

    public String toolUseId() {
        return raw.getString("tool_use_id");
    }

    /**
     * tool_result 的内容，可能是字符串或内容块数组
     */
    public Object resultContent() {
        return raw.get("content");
    }

    public Boolean isError() {
        return raw.getBoolean("is_error");
    }

    /**
     * 输出 JSON 形式（拷贝）
     */
    public JSONObject toJson() {
        return new JSONObject(raw);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ContentBlock that)) return false;
        return raw.equals(that.raw);
    }

    @Override
    public int hashCode() {
        return raw.hashCode();
    }

    @Override
    public String toString() {
        return raw.toJSONString();
    }
}
