package com.ccproxy.gateway.converter;

import com.ccproxy.gateway.converter.codec.ProviderCodec;
import com.ccproxy.gateway.converter.model.ContentBlock;
import com.ccproxy.gateway.converter.model.Message;
import com.ccproxy.gateway.converter.model.MessageContent;
import com.ccproxy.gateway.converter.model.MessageFormat;
import com.ccproxy.gateway.converter.model.Request;
import com.ccproxy.gateway.converter.model.Response;
import com.ccproxy.gateway.converter.model.StreamEvent;
import com.ccproxy.gateway.converter.model.Tool;
import com.ccproxy.gateway.exception.ConversionFailedException;
import com.ccproxy.gateway.exception.ConversionPhase;
import com.ccproxy.gateway.exception.GatewayException;
import com.ccproxy.gateway.exception.UnsupportedFormatException;
import com.ccproxy.gateway.tool.ToolCallMapper;
import com.ccproxy.gateway.tool.ToolCallValidator;
import com.ccproxy.gateway.tool.ToolConversionContext;
import com.ccproxy.gateway.tool.ToolSchemaValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 转换调度器
 * <p>
 * 按 (源格式, 目标格式) 选择两个编解码器：源 → 通用 → 目标。
 * 源格式与目标格式相同时原样返回输入（同一个数组）。
 * 失败统一包装为 {@link ConversionFailedException}，通过阶段区分是源解码还是目标编码出错。
 * <p>
 * 注册表在构造后只读，实例无状态，可并发调用
 */
public class MessageConverter {

    private static final Logger log = LoggerFactory.getLogger(MessageConverter.class);

    private final Map<MessageFormat, ProviderCodec> codecs;
    private final ConverterOptions options;
    private final ToolSchemaValidator schemaValidator;
    private final ToolCallValidator toolCallValidator;
    private final RequestValidator requestValidator;

    public MessageConverter(List<ProviderCodec> codecs, ConverterOptions options) {
        this(codecs, options, new ToolSchemaValidator(), new ToolCallValidator());
    }

    public MessageConverter(List<ProviderCodec> codecs, ConverterOptions options,
                            ToolSchemaValidator schemaValidator, ToolCallValidator toolCallValidator) {
        Map<MessageFormat, ProviderCodec> registry = new EnumMap<>(MessageFormat.class);
        for (ProviderCodec codec : codecs) {
            if (codec.format() == MessageFormat.GENERIC) {
                throw new IllegalArgumentException("generic format cannot have a codec");
            }
            registry.put(codec.format(), codec);
        }
        this.codecs = registry;
        this.options = options != null ? options : ConverterOptions.defaults();
        this.requestValidator = new RequestValidator(this.options);
        this.schemaValidator = Objects.requireNonNull(schemaValidator, "schemaValidator");
        this.toolCallValidator = Objects.requireNonNull(toolCallValidator, "toolCallValidator");
    }

    // ==================== 请求 ====================

    public byte[] convertRequest(byte[] data, String from, String to) {
        if (Objects.equals(from, to)) return data;
        return convertRequest(data, requireSource(from), requireTarget(to));
    }

    public byte[] convertRequest(byte[] data, MessageFormat from, MessageFormat to) {
        if (from == to) return data;
        ProviderCodec source = sourceCodec(from);
        ProviderCodec target = targetCodec(to);
        ToolConversionContext ctx = ToolConversionContext.create(target.providerName(), target.features());
        log.debug("[{}] 请求转换开始: {} → {}, {} 字节", ctx.requestId(), from, to, data != null ? data.length : 0);

        Request request;
        try {
            request = source.decodeRequest(data);
        } catch (GatewayException e) {
            throw new ConversionFailedException(ConversionPhase.SOURCE_DECODE, e);
        }

        validate(request, ctx);
        if (request.hasTools() && !target.features().supportsTools()) {
            log.warn("[{}] {} 不支持工具声明，{} 个工具降级为文本描述", ctx.requestId(), target.providerName(), request.getTools().size());
        }

        byte[] result;
        try {
            result = target.encodeRequest(request);
        } catch (GatewayException e) {
            throw new ConversionFailedException(ConversionPhase.TARGET_ENCODE, e);
        }
        log.debug("[{}] 请求转换完成: {} → {}, 耗时 {}ms", ctx.requestId(), from, to, ctx.elapsedMs());
        return result;
    }

    // ==================== 响应 ====================

    public byte[] convertResponse(byte[] data, String from, String to) {
        if (Objects.equals(from, to)) return data;
        return convertResponse(data, requireSource(from), requireTarget(to));
    }

    public byte[] convertResponse(byte[] data, MessageFormat from, MessageFormat to) {
        if (from == to) return data;
        ProviderCodec source = sourceCodec(from);
        ProviderCodec target = targetCodec(to);
        ToolConversionContext ctx = ToolConversionContext.create(target.providerName(), target.features());

        Response response;
        try {
            response = source.decodeResponse(data);
        } catch (GatewayException e) {
            throw new ConversionFailedException(ConversionPhase.SOURCE_DECODE, e);
        }

        byte[] result;
        try {
            result = target.encodeResponse(response);
        } catch (GatewayException e) {
            throw new ConversionFailedException(ConversionPhase.TARGET_ENCODE, e);
        }
        log.debug("[{}] 响应转换完成: {} → {}, 耗时 {}ms", ctx.requestId(), from, to, ctx.elapsedMs());
        return result;
    }

    // ==================== 流式事件 ====================

    /**
     * 流式事件转换，目前各提供方均为透传
     */
    public byte[] convertStreamEvent(byte[] data, MessageFormat from, MessageFormat to) {
        if (from == to) return data;
        ProviderCodec source = sourceCodec(from);
        targetCodec(to);
        StreamEvent event = source.transformStreamEvent(
                new StreamEvent(null, data != null ? new String(data, StandardCharsets.UTF_8) : null));
        return event.data() != null ? event.data().getBytes(StandardCharsets.UTF_8) : data;
    }

    /**
     * 已注册编解码器的格式（不含 generic）
     */
    public List<MessageFormat> supportedFormats() {
        return new ArrayList<>(codecs.keySet());
    }

    public ProviderCodec codec(MessageFormat format) {
        return codecs.get(format);
    }

    public ConverterOptions options() {
        return options;
    }

    public ToolSchemaValidator schemaValidator() {
        return schemaValidator;
    }

    public ToolCallValidator toolCallValidator() {
        return toolCallValidator;
    }

    // ==================== 校验 ====================

    private void validate(Request request, ToolConversionContext ctx) {
        if (options.strictMode()) {
            requestValidator.validate(request);
        }
        if (!request.hasTools()) {
            return;
        }
        if (options.validateSchemas()) {
            for (Tool tool : request.getTools()) {
                schemaValidator.validate(tool, ctx);
            }
        }
        if (options.validateToolArguments()) {
            validateToolUses(request, ctx);
        }
    }

    /**
     * 历史消息中的 tool_use 按同名工具定义校验入参；未声明的工具跳过
     */
    private void validateToolUses(Request request, ToolConversionContext ctx) {
        Map<String, Tool> declared = new HashMap<>();
        for (Tool tool : request.getTools()) {
            declared.put(tool.name(), tool);
        }
        int checked = 0;
        for (Message msg : request.getMessages()) {
            if (!(msg.content() instanceof MessageContent.Blocks blocks)) continue;
            for (ContentBlock block : blocks.blocks()) {
                Tool tool = block.isToolUse() ? declared.get(block.name()) : null;
                if (tool != null) {
                    toolCallValidator.validate(ToolCallMapper.fromToolUse(block), tool);
                    checked++;
                }
            }
        }
        if (checked > 0) {
            log.debug("[{}] 已校验 {} 个工具调用入参", ctx.requestId(), checked);
        }
    }

    private ProviderCodec sourceCodec(MessageFormat format) {
        ProviderCodec codec = format != null ? codecs.get(format) : null;
        if (codec == null) throw UnsupportedFormatException.source(String.valueOf(format));
        return codec;
    }

    private ProviderCodec targetCodec(MessageFormat format) {
        ProviderCodec codec = format != null ? codecs.get(format) : null;
        if (codec == null) throw UnsupportedFormatException.target(String.valueOf(format));
        return codec;
    }

    private static MessageFormat requireSource(String name) {
        MessageFormat format = MessageFormat.fromValue(name);
        if (format == null) throw UnsupportedFormatException.source(name);
        return format;
    }

    private static MessageFormat requireTarget(String name) {
        MessageFormat format = MessageFormat.fromValue(name);
        if (format == null) throw UnsupportedFormatException.target(name);
        return format;
    }
}
