package com.ccproxy.gateway.tool;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.ccproxy.gateway.converter.model.ContentBlock;
import com.ccproxy.gateway.converter.model.ToolCall;
import com.ccproxy.gateway.exception.ToolCallValidationException;

import java.util.ArrayList;
import java.util.List;

/**
 * OpenAI tool_calls ↔ Anthropic tool_use 内容块
 * <p>
 * 转换前先校验调用结构；tool call 的 id 原样写入 tool_use 的 id，反向亦然，保证关联不丢
 */
public final class ToolCallMapper {

    private ToolCallMapper() {
    }

    /**
     * 批量转换，保持原顺序
     */
    public static List<ContentBlock> toToolUseBlocks(List<ToolCall> toolCalls) {
        List<ContentBlock> blocks = new ArrayList<>(toolCalls.size());
        for (int i = 0; i < toolCalls.size(); i++) {
            blocks.add(toToolUse(toolCalls.get(i), i));
        }
        return blocks;
    }

    /**
     * 单个 tool call → tool_use 块；空参数视为 {}
     *
     * @param index 在 tool_calls 中的位置，用于错误信息
     */
    public static ContentBlock toToolUse(ToolCall call, int index) {
        validateStructure(call, index);
        return ContentBlock.toolUse(call.id(), call.name(), parseArguments(call, index));
    }

    /**
     * tool_use 块 → tool call，参数序列化为 JSON 字符串
     */
    public static ToolCall fromToolUse(ContentBlock block) {
        if (!block.isToolUse()) {
            throw new IllegalArgumentException("not a tool_use block: " + block.type());
        }
        return ToolCall.function(block.id(), block.name(), JSON.toJSONString(block.input()));
    }

    /**
     * 校验 tool call 结构：id、类型、函数名、参数 JSON
     * <p>
     * type 缺失时按 function 处理（部分兼容实现不回传该字段）
     */
    public static void validateStructure(ToolCall call, int index) {
        if (call.id() == null || call.id().isEmpty()) {
            throw new ToolCallValidationException(ToolCallValidationException.VALIDATION_ERROR,
                    "tool call " + index + ": tool call ID cannot be empty")
                    .withTool(call.name(), call.id())
                    .withField("id", call.id())
                    .withSuggestions("Every tool call must carry a non-empty id used to correlate its result");
        }
        String type = call.type();
        if (type != null && !type.isEmpty() && !ToolCall.TYPE_FUNCTION.equals(type)) {
            throw new ToolCallValidationException(ToolCallValidationException.VALIDATION_ERROR,
                    "tool call " + index + ": unsupported tool call type: " + type + " (expected 'function')")
                    .withTool(call.name(), call.id())
                    .withField("type", type);
        }
        if (call.name() == null || call.name().isEmpty()) {
            throw new ToolCallValidationException(ToolCallValidationException.VALIDATION_ERROR,
                    "tool call " + index + ": function name cannot be empty")
                    .withTool(call.name(), call.id())
                    .withField("function.name", call.name());
        }
    }

    private static JSONObject parseArguments(ToolCall call, int index) {
        String arguments = call.arguments();
        if (arguments.isBlank()) {
            return new JSONObject();
        }
        try {
            JSONObject input = JSON.parseObject(arguments);
            return input != null ? input : new JSONObject();
        } catch (JSONException e) {
            throw new ToolCallValidationException(ToolCallValidationException.JSON_ERROR,
                    "tool call " + index + " (" + call.name() + "): invalid arguments JSON")
                    .withTool(call.name(), call.id())
                    .withField("arguments", arguments)
                    .withContext("parse_error", e.getMessage())
                    .withSuggestions("Ensure the arguments are valid JSON", "Check for missing quotes or commas");
        }
    }
}
