package com.jobtailor.ai.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * AI 模块配置项。
 */
@Data
@ConfigurationProperties(prefix = "jobtailor.ai")
public class AiProperties {

    /** Groq 配置（OpenAI 兼容接口） */
    private GroqConfig groq = new GroqConfig();

    /** 单次 API 调用的超时时间（秒） */
    private int requestTimeoutSeconds = 60;

    @Data
    public static class GroqConfig {
        private String baseUrl = "https://api.groq.com/openai/v1";
        private String model = "llama-3.3-70b-versatile";
        private double temperature = 0.7;
        private int maxTokens = 2000;
    }
}
