package com.housingocr.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * OCR 服务配置（OpenAI 兼容的视觉模型接口）
 *
 * @author housing-ocr
 * @since 2025-01-12
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "ocr")
public class OcrProperties {

    /**
     * 服务地址，例如 http://localhost:8000/v1
     */
    private String endpoint = "http://localhost:8000/v1";

    /**
     * 模型名称
     */
    private String model = "Qwen/Qwen2-VL-7B-Instruct";

    /**
     * 单页图片最长边像素
     */
    private Integer maxImageSize = 1400;

    /**
     * PDF 栅格化 DPI
     */
    private Integer pdfDpi = 200;

    private Double temperature = 0.1;

    private Duration connectTimeout = Duration.ofSeconds(30);

    /**
     * 读取超时（大图识别较慢）
     */
    private Duration readTimeout = Duration.ofSeconds(300);
}
