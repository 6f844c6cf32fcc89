package com.housingocr.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * OCR / LLM 外部服务专用 HTTP 客户端
 *
 * 两个服务响应时间差异很大，分别设置超时，避免外部服务故障时长期占用处理线程。
 */
@Slf4j
@Configuration
public class ExternalServiceHttpClientConfig {

    @Bean("ocrRestTemplate")
    public RestTemplate ocrRestTemplate(OcrProperties ocrProperties) {
        log.info("配置 OCR HTTP 客户端: 连接超时={}, 读取超时={}",
            ocrProperties.getConnectTimeout(), ocrProperties.getReadTimeout());
        return new RestTemplate(requestFactory(ocrProperties.getConnectTimeout(), ocrProperties.getReadTimeout()));
    }

    @Bean("llmRestTemplate")
    public RestTemplate llmRestTemplate(LlmProperties llmProperties) {
        log.info("配置 LLM HTTP 客户端: 连接超时={}, 读取超时={}",
            llmProperties.getConnectTimeout(), llmProperties.getReadTimeout());
        return new RestTemplate(requestFactory(llmProperties.getConnectTimeout(), llmProperties.getReadTimeout()));
    }

    private SimpleClientHttpRequestFactory requestFactory(Duration connectTimeout, Duration readTimeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(connectTimeout);
        factory.setReadTimeout(readTimeout);
        return factory;
    }
}
