package com.ccproxy.gateway.converter.codec;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.ccproxy.gateway.converter.model.ContentBlock;
import com.ccproxy.gateway.converter.model.Message;
import com.ccproxy.gateway.converter.model.MessageContent;
import com.ccproxy.gateway.converter.model.MessageFormat;
import com.ccproxy.gateway.converter.model.Request;
import com.ccproxy.gateway.converter.model.Response;
import com.ccproxy.gateway.converter.model.Tool;
import com.ccproxy.gateway.converter.model.ToolCall;
import com.ccproxy.gateway.converter.model.Usage;
import com.ccproxy.gateway.exception.StructuralException;
import com.ccproxy.gateway.exception.ToolCallValidationException;
import com.ccproxy.gateway.tool.ToolCallMapper;

import java.util.ArrayList;
import java.util.List;

/**
 * OpenAI Chat Completions ↔ 通用格式
 * <p>
 * system 是一条普通消息：解码时抽取（多条时以最后一条为准），编码时仅在非空时插到最前。
 * 内容是扁平字符串，内容块数组按 text 拼接；工具调用走原生 tool_calls / tool 角色消息。
 */
public class OpenAiCodec extends AbstractProviderCodec {

    private static final String PROVIDER = "OpenAI";

    public OpenAiCodec(CodecSettings settings) {
        super(settings);
    }

    @Override
    public MessageFormat format() {
        return MessageFormat.OPENAI;
    }

    @Override
    public String providerName() {
        return PROVIDER;
    }

    // ==================== 请求 ====================

    @Override
    protected Request readRequest(JSONObject json) {
        String system = null;
        List<Message> messages = new ArrayList<>();
        List<ContentBlock> pendingToolResults = new ArrayList<>();

        JSONArray arr = WireJson.objects(json, "messages");
        for (int i = 0; i < arr.size(); i++) {
            JSONObject msg = arr.getJSONObject(i);
            if (msg == null) continue;
            String role = msg.getString("role");

            // 连续的 tool 消息合并为一条 user 消息
            if ("tool".equals(role)) {
                pendingToolResults.add(ContentBlock.toolResult(msg.getString("tool_call_id"),
                        flattenText(msg.get("content")), null));
                continue;
            }
            flushToolResults(pendingToolResults, messages);

            if (Message.ROLE_SYSTEM.equals(role) || "developer".equals(role)) {
                system = flattenText(msg.get("content"));
                continue;
            }

            JSONArray toolCalls = msg.getJSONArray("tool_calls");
            if (Message.ROLE_ASSISTANT.equals(role) && toolCalls != null && !toolCalls.isEmpty()) {
                messages.add(new Message(role, assistantWithToolCalls(msg.get("content"), toolCalls), msg.getString("name")));
                continue;
            }

            messages.add(new Message(role, ContentNormalizer.decode(msg.get("content")), msg.getString("name")));
        }
        flushToolResults(pendingToolResults, messages);

        int maxTokens = json.containsKey("max_tokens")
                ? json.getIntValue("max_tokens")
                : json.getIntValue("max_completion_tokens");

        return Request.builder()
                .model(json.getString("model"))
                .messages(messages)
                .system(system)
                .maxTokens(maxTokens)
                .temperature(json.getDoubleValue("temperature"))
                .stream(json.getBooleanValue("stream"))
                .tools(readFunctionTools(WireJson.objects(json, "tools")))
                .toolChoice(toGenericToolChoice(json.get("tool_choice")))
                .topP(json.getDouble("top_p"))
                .stopSequences(WireJson.stringList(json.get("stop")))
                .build();
    }

    @Override
    protected JSONObject writeRequest(Request request) {
        JSONArray messages = new JSONArray();
        if (request.hasSystem()) {
            messages.add(JSONObject.of("role", Message.ROLE_SYSTEM, "content", request.getSystem()));
        }
        for (Message msg : request.getMessages()) {
            writeMessage(msg, messages);
        }

        JSONObject json = new JSONObject();
        json.put("model", WireJson.stringOrEmpty(request.getModel()));
        json.put("messages", messages);
        if (request.getMaxTokens() != 0) json.put("max_tokens", request.getMaxTokens());
        if (request.getTemperature() != 0) json.put("temperature", request.getTemperature());
        if (request.isStream()) json.put("stream", true);
        if (request.getTopP() != null) json.put("top_p", request.getTopP());
        if (request.getStopSequences() != null && !request.getStopSequences().isEmpty()) {
            json.put("stop", request.getStopSequences());
        }
        if (request.hasTools()) json.put("tools", writeFunctionTools(request.getTools()));
        Object toolChoice = toOpenAiToolChoice(request.getToolChoice());
        if (toolChoice != null) json.put("tool_choice", toolChoice);
        return json;
    }

    private void writeMessage(Message msg, JSONArray out) {
        String role = WireJson.stringOrEmpty(msg.role());
        MessageContent content = msg.content();

        if (!(content instanceof MessageContent.Blocks blocks) || !blocks.hasToolBlocks()) {
            JSONObject m = JSONObject.of("role", role, "content", ContentNormalizer.flatten(content, separator()));
            if (msg.name() != null && !msg.name().isEmpty()) m.put("name", msg.name());
            out.add(m);
            return;
        }

        List<String> texts = new ArrayList<>();
        JSONArray toolCalls = new JSONArray();
        List<JSONObject> toolMessages = new ArrayList<>();
        for (ContentBlock block : blocks.blocks()) {
            if (block.isText()) {
                texts.add(WireJson.stringOrEmpty(block.text()));
            } else if (block.isToolUse() && Message.ROLE_ASSISTANT.equals(role)) {
                toolCalls.add(ToolCallMapper.fromToolUse(block).toJson());
            } else if (block.isToolResult() && !Message.ROLE_ASSISTANT.equals(role)) {
                toolMessages.add(JSONObject.of(
                        "role", "tool", //
                        "tool_call_id", block.toolUseId(), //
                        "content", ContentNormalizer.resultText(block.resultContent()) //
                ));
            } else if (block.isToolUse() || block.isToolResult()) {
                // 位置不合法的工具块无法用原生结构表达，降级为标记文本
                texts.add(ContentNormalizer.toMarkerText(block));
            }
        }

        String text = String.join(separator(), texts);
        if (!toolCalls.isEmpty()) {
            JSONObject m = new JSONObject();
            m.put("role", role);
            if (!text.isEmpty()) m.put("content", text);
            m.put("tool_calls", toolCalls);
            out.add(m);
            return;
        }
        // tool 消息必须紧跟在 assistant 的 tool_calls 之后，附带的文本放到后面
        out.addAll(toolMessages);
        if (!text.isEmpty() || toolMessages.isEmpty()) {
            out.add(JSONObject.of("role", role, "content", text));
        }
    }

    // ==================== 响应 ====================

    @Override
    protected Response readResponse(JSONObject json) {
        JSONArray choices = json.getJSONArray("choices");
        if (choices == null || choices.isEmpty()) {
            throw new StructuralException("no choices in OpenAI response");
        }

        JSONObject choice = choices.getJSONObject(0);
        if (choice == null) {
            throw new StructuralException("no choices in OpenAI response");
        }
        JSONObject message = choice.getJSONObject("message");
        if (message == null) message = new JSONObject();

        JSONArray toolCalls = message.getJSONArray("tool_calls");
        boolean hasToolCalls = toolCalls != null && !toolCalls.isEmpty();
        MessageContent content = hasToolCalls
                ? assistantWithToolCalls(message.get("content"), toolCalls)
                : MessageContent.blocks(List.of(ContentBlock.text(flattenText(message.get("content")))));

        String role = message.getString("role");
        return Response.builder()
                .id(json.getString("id"))
                .type("message")
                .role(role != null && !role.isEmpty() ? role : Message.ROLE_ASSISTANT)
                .content(content)
                .model(json.getString("model"))
                .stopReason(hasToolCalls ? StopReasons.TOOL_USE : StopReasons.fromOpenAi(choice.getString("finish_reason")))
                .usage(readUsage(json.getJSONObject("usage")))
                .build();
    }

    @Override
    protected JSONObject writeResponse(Response response) {
        MessageContent content = response.getContent();
        List<String> texts = new ArrayList<>();
        JSONArray toolCalls = new JSONArray();
        if (content instanceof MessageContent.Blocks blocks) {
            for (ContentBlock block : blocks.blocks()) {
                if (block.isText()) {
                    texts.add(WireJson.stringOrEmpty(block.text()));
                } else if (block.isToolUse()) {
                    toolCalls.add(ToolCallMapper.fromToolUse(block).toJson());
                }
            }
        } else {
            texts.add(ContentNormalizer.flatten(content, separator()));
        }

        String role = response.getRole();
        JSONObject message = new JSONObject();
        message.put("role", role != null && !role.isEmpty() ? role : Message.ROLE_ASSISTANT);
        message.put("content", String.join(separator(), texts));
        if (!toolCalls.isEmpty()) message.put("tool_calls", toolCalls);

        JSONObject choice = new JSONObject();
        choice.put("index", 0);
        choice.put("message", message);
        choice.put("finish_reason", toolCalls.isEmpty() ? StopReasons.toOpenAi(response.getStopReason()) : "tool_calls");

        JSONObject json = new JSONObject();
        json.put("id", WireJson.stringOrEmpty(response.getId()));
        json.put("object", "chat.completion");
        json.put("created", 0);
        json.put("model", WireJson.stringOrEmpty(response.getModel()));
        json.put("choices", JSONArray.of(choice));
        if (response.getUsage() != null) {
            json.put("usage", JSONObject.of(
                    "prompt_tokens", response.getUsage().inputTokens(), //
                    "completion_tokens", response.getUsage().outputTokens(), //
                    "total_tokens", response.getUsage().totalTokens() //
            ));
        }
        return json;
    }

    // ==================== 辅助方法 ====================

    private String separator() {
        return settings.openAiTextSeparator();
    }

    /**
     * 字符串原样返回；parts 数组按 text 拼接；null 视为空串
     */
    private String flattenText(Object content) {
        return ContentNormalizer.flatten(ContentNormalizer.decode(content), separator());
    }

    private MessageContent assistantWithToolCalls(Object content, JSONArray toolCalls) {
        List<ContentBlock> blocks = new ArrayList<>();
        String text = flattenText(content);
        if (!text.isEmpty()) {
            blocks.add(ContentBlock.text(text));
        }
        List<ToolCall> calls = new ArrayList<>();
        for (int i = 0; i < toolCalls.size(); i++) {
            JSONObject call = toolCalls.getJSONObject(i);
            if (call == null) {
                throw new ToolCallValidationException(ToolCallValidationException.VALIDATION_ERROR,
                        "tool call " + i + ": tool call cannot be null")
                        .withField("tool_calls[" + i + "]", null);
            }
            calls.add(ToolCall.fromJson(call));
        }
        blocks.addAll(ToolCallMapper.toToolUseBlocks(calls));
        return MessageContent.blocks(blocks);
    }

    private static void flushToolResults(List<ContentBlock> pending, List<Message> messages) {
        if (pending.isEmpty()) return;
        messages.add(new Message(Message.ROLE_USER, MessageContent.blocks(pending)));
        pending.clear();
    }

    private static Usage readUsage(JSONObject usage) {
        if (usage == null) return null;
        long input = usage.getLongValue("prompt_tokens");
        long output = usage.getLongValue("completion_tokens");
        return usage.containsKey("total_tokens")
                ? new Usage(input, output, usage.getLongValue("total_tokens"))
                : Usage.of(input, output);
    }

    private static List<Tool> readFunctionTools(JSONArray tools) {
        List<Tool> result = new ArrayList<>();
        for (int i = 0; i < tools.size(); i++) {
            JSONObject tool = tools.getJSONObject(i);
            JSONObject fn = tool != null ? tool.getJSONObject("function") : null;
            if (fn == null) continue;
            result.add(new Tool(fn.getString("name"), fn.getString("description"), fn.getJSONObject("parameters")));
        }
        return result;
    }

    private static JSONArray writeFunctionTools(List<Tool> tools) {
        JSONArray arr = new JSONArray();
        for (Tool tool : tools) {
            JSONObject fn = new JSONObject();
            fn.put("name", tool.name());
            fn.put("description", WireJson.stringOrEmpty(tool.description()));
            fn.put("parameters", tool.inputSchema());
            arr.add(JSONObject.of("type", "function", "function", fn));
        }
        return arr;
    }

    /**
     * auto / none / required / {function:{name}} → {type: auto|none|any|tool}
     */
    private static Object toGenericToolChoice(Object choice) {
        if (choice == null) return null;
        if (choice instanceof String s) {
            return switch (s) {
                case "required" -> JSONObject.of("type", "any");
                case "none" -> JSONObject.of("type", "none");
                default -> JSONObject.of("type", "auto");
            };
        }
        if (choice instanceof JSONObject jo) {
            JSONObject fn = jo.getJSONObject("function");
            if (fn != null && fn.getString("name") != null) {
                return JSONObject.of("type", "tool", "name", fn.getString("name"));
            }
        }
        return JSONObject.of("type", "auto");
    }

    private static Object toOpenAiToolChoice(Object choice) {
        if (!(choice instanceof JSONObject jo)) {
            return choice instanceof String ? choice : null;
        }
        String type = jo.getString("type");
        if (type == null) return null;
        return switch (type) {
            case "any" -> "required";
            case "none" -> "none";
            case "tool" -> JSONObject.of("type", "function", "function", JSONObject.of("name", jo.getString("name")));
            default -> "auto";
        };
    }
}
