package com.ccproxy.gateway.converter.codec;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.ccproxy.gateway.converter.model.ContentBlock;
import com.ccproxy.gateway.converter.model.MessageContent;
import com.ccproxy.gateway.exception.ContentParseException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 内容归一化
 * <p>
 * 在原始 JSON 内容、纯字符串、类型化内容块之间转换。
 * 目标格式没有工具内容块时，tool_use / tool_result 以 JSON 形式包在哨兵标记里嵌入文本，
 * 认识该约定的下游可以还原结构，不认识的只会看到普通文本。
 */
public final class ContentNormalizer {

    public static final String TOOL_USE_START = "__TOOL_USE_START__";
    public static final String TOOL_USE_END = "__TOOL_USE_END__";
    public static final String TOOL_RESULT_START = "__TOOL_RESULT_START__";
    public static final String TOOL_RESULT_END = "__TOOL_RESULT_END__";

    private static final Pattern MARKER = Pattern.compile(
            "__TOOL_(USE|RESULT)_START__(.*?)__TOOL_\\1_END__", Pattern.DOTALL);

    private ContentNormalizer() {
    }

    /**
     * 解码原始内容：先按字符串，再按内容块数组，都不符合时作为 Opaque 保留
     * <p>
     * null 解码为空字符串；空数组解码为空的块序列
     */
    public static MessageContent decode(Object raw) {
        if (raw == null) return MessageContent.EMPTY;
        if (raw instanceof String s) return MessageContent.text(s);
        if (raw instanceof List<?> list) {
            List<ContentBlock> blocks = new ArrayList<>(list.size());
            for (Object item : list) {
                if (!(item instanceof Map<?, ?> map) || !(map.get("type") instanceof String)) {
                    return new MessageContent.Opaque(raw);
                }
                blocks.add(ContentBlock.of(toJsonObject(map)));
            }
            return MessageContent.blocks(blocks);
        }
        return new MessageContent.Opaque(raw);
    }

    /**
     * 从纯文本解码：包含工具标记时还原为内容块，否则保持字符串
     */
    public static MessageContent fromText(String text) {
        if (text == null) return MessageContent.EMPTY;
        if (!containsMarkers(text)) return MessageContent.text(text);
        return MessageContent.blocks(recoverMarkers(text));
    }

    /**
     * 展平为纯文本，只拼接 text 块（按原顺序，使用指定分隔符）
     * <p>
     * Opaque 内容按 JSON 文本输出，这是有损的兜底路径
     */
    public static String flatten(MessageContent content, String separator) {
        if (content instanceof MessageContent.Text text) {
            return text.value();
        }
        if (content instanceof MessageContent.Blocks blocks) {
            List<String> texts = new ArrayList<>();
            for (ContentBlock block : blocks.blocks()) {
                if (block.isText() && block.text() != null) {
                    texts.add(block.text());
                }
            }
            return String.join(separator, texts);
        }
        return stringify(((MessageContent.Opaque) content).value());
    }

    /**
     * 转为内容块序列；Opaque 内容不被接受
     *
     * @param target 目标格式名，用于错误消息
     */
    public static List<ContentBlock> toBlocks(MessageContent content, String target) {
        if (content instanceof MessageContent.Text text) {
            return List.of(ContentBlock.text(text.value()));
        }
        if (content instanceof MessageContent.Blocks blocks) {
            return blocks.blocks();
        }
        throw new ContentParseException("failed to parse content for " + target
                + ": expected string or content block array, got " + describe(((MessageContent.Opaque) content).value()));
    }

    /**
     * 将工具块编码为带哨兵标记的文本
     */
    public static String toMarkerText(ContentBlock block) {
        if (block.isToolUse()) {
            JSONObject payload = new JSONObject();
            payload.put("type", ContentBlock.TYPE_TOOL_USE);
            payload.put("id", block.id());
            payload.put("name", block.name());
            payload.put("input", block.input());
            return TOOL_USE_START + stringify(payload) + TOOL_USE_END;
        }
        if (block.isToolResult()) {
            JSONObject payload = new JSONObject();
            payload.put("type", ContentBlock.TYPE_TOOL_RESULT);
            payload.put("tool_use_id", block.toolUseId());
            payload.put("content", block.resultContent());
            if (block.isError() != null) {
                payload.put("is_error", block.isError());
            }
            return TOOL_RESULT_START + stringify(payload) + TOOL_RESULT_END;
        }
        throw new IllegalArgumentException("not a tool block: " + block.type());
    }

    public static boolean containsMarkers(String text) {
        return text != null && (text.contains(TOOL_USE_START) || text.contains(TOOL_RESULT_START));
    }

    /**
     * 从带标记的文本中还原内容块，标记之间的文本成为 text 块
     * <p>
     * 载荷无法解析的标记原样保留为文本
     */
    public static List<ContentBlock> recoverMarkers(String text) {
        List<ContentBlock> blocks = new ArrayList<>();
        StringBuilder pendingText = new StringBuilder();
        Matcher matcher = MARKER.matcher(text);
        int last = 0;
        while (matcher.find()) {
            pendingText.append(text, last, matcher.start());
            last = matcher.end();

            String expectedType = "USE".equals(matcher.group(1))
                    ? ContentBlock.TYPE_TOOL_USE
                    : ContentBlock.TYPE_TOOL_RESULT;
            JSONObject payload = parseMarkerPayload(matcher.group(2));
            if (payload == null || !expectedType.equals(payload.getString("type"))) {
                pendingText.append(matcher.group());
                continue;
            }
            if (!pendingText.isEmpty()) {
                blocks.add(ContentBlock.text(pendingText.toString()));
                pendingText.setLength(0);
            }
            blocks.add(ContentBlock.of(payload));
        }
        pendingText.append(text, last, text.length());
        if (!pendingText.isEmpty()) {
            blocks.add(ContentBlock.text(pendingText.toString()));
        }
        return blocks;
    }

    /**
     * tool_result 内容转纯文本：字符串原样返回，内容块数组拼接其中的 text
     */
    public static String resultText(Object content) {
        if (content == null) return "";
        if (content instanceof String s) return s;
        MessageContent decoded = decode(content);
        return decoded instanceof MessageContent.Blocks ? flatten(decoded, "\n") : stringify(content);
    }

    /**
     * JSON 字符串化，失败时抛出异常而不是返回空串
     */
    public static String stringify(Object value) {
        if (value == null) return "";
        if (value instanceof String s) return s;
        try {
            return JSON.toJSONString(value);
        } catch (JSONException e) {
            throw new ContentParseException("failed to serialize content: " + e.getMessage(), e);
        }
    }

    private static JSONObject parseMarkerPayload(String json) {
        try {
            return JSON.parseObject(json);
        } catch (JSONException e) {
            // 不是我们写出的载荷，按普通文本处理
            return null;
        }
    }

    private static JSONObject toJsonObject(Map<?, ?> map) {
        if (map instanceof JSONObject jo) return jo;
        JSONObject json = new JSONObject();
        map.forEach((k, v) -> json.put(String.valueOf(k), v));
        return json;
    }

    private static String describe(Object value) {
        if (value == null) return "null";
        if (value instanceof JSONObject) return "object";
        if (value instanceof JSONArray) return "array";
        return value.getClass().getSimpleName();
    }
}
