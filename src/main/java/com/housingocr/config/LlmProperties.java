package com.housingocr.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 结构化抽取 LLM 配置
 *
 * @author housing-ocr
 * @since 2025-01-12
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "llm")
public class LlmProperties {

    /**
     * chat/completions 完整地址
     */
    private String endpoint = "https://openrouter.ai/api/v1/chat/completions";

    private String apiKey;

    /**
     * 候选模型，按顺序尝试
     */
    private List<String> models = new ArrayList<>();

    /**
     * 触发 429 后的冷却时间
     */
    private Duration rateLimitCooldown = Duration.ofSeconds(60);

    /**
     * 有效字段数下限，低于该值视为低置信度结果
     */
    private Integer minMeaningfulFields = 3;

    private Double temperature = 0.1;

    private Integer maxTokens = 4096;

    private String referer = "http://localhost:8080";

    private String title = "Housing OCR";

    private Duration connectTimeout = Duration.ofSeconds(30);

    private Duration readTimeout = Duration.ofSeconds(120);
}
