package com.ccproxy.gateway.config;

import com.ccproxy.gateway.converter.ConverterOptions;
import com.ccproxy.gateway.converter.MessageConverter;
import com.ccproxy.gateway.converter.codec.AnthropicCodec;
import com.ccproxy.gateway.converter.codec.AwsCodec;
import com.ccproxy.gateway.converter.codec.CodecSettings;
import com.ccproxy.gateway.converter.codec.GoogleCodec;
import com.ccproxy.gateway.converter.codec.OpenAiCodec;
import com.ccproxy.gateway.tool.ToolCallValidator;
import com.ccproxy.gateway.tool.ToolSchemaValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * 转换引擎装配：编解码器注册到调度器
 */
@Configuration
public class ConverterConfig {

    private static final Logger log = LoggerFactory.getLogger(ConverterConfig.class);

    @Bean
    public CodecSettings codecSettings(AppProperties props) {
        return new CodecSettings(
                props.getAws().getAnthropicVersion(),
                props.getAws().getDefaultMaxTokens(),
                props.getText().getOpenaiSeparator(),
                props.getText().getGoogleSeparator()
        );
    }

    @Bean
    public MessageConverter messageConverter(AppProperties props, CodecSettings settings,
                                             ToolSchemaValidator schemaValidator, ToolCallValidator toolCallValidator) {
        AppProperties.ConverterConfig cfg = props.getConverter();
        ConverterOptions options = new ConverterOptions(
                cfg.isValidateSchemas(),
                cfg.isValidateToolArguments(),
                cfg.isStrictMode(),
                cfg.getMaxRequestSize(),
                cfg.getMaxMessages(),
                cfg.getMaxToolCalls()
        );
        MessageConverter converter = new MessageConverter(List.of(
                new AnthropicCodec(settings),
                new OpenAiCodec(settings),
                new GoogleCodec(settings),
                new AwsCodec(settings)
        ), options, schemaValidator, toolCallValidator);
        log.info("转换引擎已初始化: formats={}, strictMode={}", converter.supportedFormats(), options.strictMode());
        return converter;
    }

    @Bean
    public ToolSchemaValidator toolSchemaValidator() {
        return new ToolSchemaValidator();
    }

    @Bean
    public ToolCallValidator toolCallValidator() {
        return new ToolCallValidator();
    }
}
