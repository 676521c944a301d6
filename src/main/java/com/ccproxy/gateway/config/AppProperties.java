package com.ccproxy.gateway.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 应用配置属性绑定
 */
@Data
@Component
@ConfigurationProperties(prefix = "ccproxy")
public class AppProperties {

    private ConverterConfig converter = new ConverterConfig();
    private AwsConfig aws = new AwsConfig();
    private TextConfig text = new TextConfig();
    private LoggingConfig logging = new LoggingConfig();

    // --- 嵌套配置类 ---

    @Data
    public static class ConverterConfig {
        private long maxRequestSize = 10L * 1024 * 1024;
        private int maxMessages = 100;
        private int maxToolCalls = 50;
        private boolean validateSchemas = true;
        private boolean validateToolArguments = true;
        // 开启后按完整规则校验请求（模型、角色、内容块结构等）
        private boolean strictMode = false;
    }

    @Data
    public static class AwsConfig {
        private String anthropicVersion = "bedrock-2023-05-31";
        private int defaultMaxTokens = 4096;
    }

    @Data
    public static class TextConfig {
        private String openaiSeparator = " ";
        private String googleSeparator = "";
    }

    @Data
    public static class LoggingConfig {
        private String filePath = "data/logs";
        private String maxFileSize = "100MB";
        private int maxHistory = 30;
        private String totalSizeCap = "1GB";
    }
}
