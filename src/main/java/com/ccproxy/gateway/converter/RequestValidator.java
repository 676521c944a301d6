package com.ccproxy.gateway.converter;

import com.alibaba.fastjson2.JSON;
import com.ccproxy.gateway.converter.model.ContentBlock;
import com.ccproxy.gateway.converter.model.Message;
import com.ccproxy.gateway.converter.model.MessageContent;
import com.ccproxy.gateway.converter.model.Request;
import com.ccproxy.gateway.converter.model.Tool;
import com.ccproxy.gateway.exception.ConversionException;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;

/**
 * 严格模式下的请求校验
 */
public class RequestValidator {

    private static final Set<String> VALID_ROLES = Set.of(Message.ROLE_USER, Message.ROLE_ASSISTANT, Message.ROLE_SYSTEM);

    private final ConverterOptions options;
    private final int maxMessageSize;

    public RequestValidator(ConverterOptions options) {
        this(options, ConverterFeatures.DEFAULT_MAX_MESSAGE_SIZE);
    }

    public RequestValidator(ConverterOptions options, int maxMessageSize) {
        this.options = options;
        this.maxMessageSize = maxMessageSize;
    }

    /**
     * @throws ConversionException 第一个不满足的规则
     */
    public void validate(Request request) {
        if (request == null) {
            throw new ConversionException("request cannot be nil");
        }
        if (request.getModel() == null || request.getModel().isEmpty()) {
            throw new ConversionException("model cannot be empty");
        }
        List<Message> messages = request.getMessages();
        if (messages == null || messages.isEmpty()) {
            throw new ConversionException("messages array cannot be empty");
        }
        if (messages.size() > options.maxMessages()) {
            throw new ConversionException("too many messages: " + messages.size() + " (max " + options.maxMessages() + ")");
        }

        long totalSize = 0;
        for (int i = 0; i < messages.size(); i++) {
            validateMessage(i, messages.get(i));
            totalSize += sizeOf(messages.get(i));
        }
        if (totalSize > options.maxRequestSize()) {
            throw new ConversionException("request too large: " + totalSize + " bytes (max " + options.maxRequestSize() + ")");
        }

        List<Tool> tools = request.getTools();
        if (tools != null && !tools.isEmpty()) {
            if (tools.size() > options.maxToolCalls()) {
                throw new ConversionException("too many tools: " + tools.size() + " (max " + options.maxToolCalls() + ")");
            }
            for (int i = 0; i < tools.size(); i++) {
                validateTool(i, tools.get(i));
            }
        }
    }

    private void validateMessage(int index, Message msg) {
        String prefix = "message " + index + ": ";
        if (msg.role() == null || msg.role().isEmpty()) {
            throw new ConversionException(prefix + "role cannot be empty");
        }
        if (!VALID_ROLES.contains(msg.role())) {
            throw new ConversionException(prefix + "invalid role: " + msg.role());
        }

        MessageContent content = msg.content();
        if (content instanceof MessageContent.Text text) {
            int size = text.value().getBytes(StandardCharsets.UTF_8).length;
            if (size > maxMessageSize) {
                throw new ConversionException(prefix + "message content too large: " + size + " bytes (max " + maxMessageSize + ")");
            }
        } else if (content instanceof MessageContent.Blocks blocks) {
            for (int i = 0; i < blocks.blocks().size(); i++) {
                String error = checkBlock(blocks.blocks().get(i));
                if (error != null) {
                    throw new ConversionException(prefix + "content block " + i + ": " + error);
                }
            }
        } else {
            throw new ConversionException(prefix + "invalid content type");
        }
    }

    private static String checkBlock(ContentBlock block) {
        String type = block.type();
        if (type == null || type.isEmpty()) {
            return "content block type cannot be empty";
        }
        return switch (type) {
            case ContentBlock.TYPE_TEXT -> block.text() == null || block.text().isEmpty()
                    ? "text content cannot be empty" : null;
            case ContentBlock.TYPE_TOOL_USE -> {
                if (block.name() == null || block.name().isEmpty()) yield "tool_use name cannot be empty";
                if (block.id() == null || block.id().isEmpty()) yield "tool_use ID cannot be empty";
                yield null;
            }
            case ContentBlock.TYPE_TOOL_RESULT -> block.toolUseId() == null || block.toolUseId().isEmpty()
                    ? "tool_result must have tool_use_id" : null;
            default -> "unsupported content block type: " + type;
        };
    }

    private static void validateTool(int index, Tool tool) {
        String prefix = "tool " + index + " (" + tool.name() + "): ";
        if (tool.name() == null || tool.name().isEmpty()) {
            throw new ConversionException(prefix + "tool name cannot be empty");
        }
        if (tool.inputSchema() == null) {
            throw new ConversionException(prefix + "tool input_schema cannot be nil");
        }
    }

    private static long sizeOf(Message msg) {
        return JSON.toJSONString(msg.content().toRaw()).getBytes(StandardCharsets.UTF_8).length
                + (msg.role() != null ? msg.role().length() : 0);
    }
}
