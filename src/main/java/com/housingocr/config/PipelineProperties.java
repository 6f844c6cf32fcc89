package com.housingocr.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * 后台处理流水线配置
 *
 * @author housing-ocr
 * @since 2025-01-12
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    /**
     * 是否随应用启动调度器
     */
    private Boolean enabled = true;

    /**
     * 同时处理的文档数上限
     */
    private Integer maxConcurrent = 3;

    /**
     * processing 状态文档的重试上限，LLM 失败次数达到后标记 failed
     */
    private Integer retryLimit = 5;

    /**
     * 每轮查询的文档数量上限
     */
    private Integer batchSize = 10;

    /**
     * 空闲轮询间隔
     */
    private Duration pollInterval = Duration.ofSeconds(1);

    /**
     * 关闭时等待在途任务完成的最长时间
     */
    private Duration shutdownTimeout = Duration.ofMinutes(5);

    /**
     * OCR 空文本次数上限，0 表示不限制
     */
    private Integer maxSoftFailures = 0;
}
