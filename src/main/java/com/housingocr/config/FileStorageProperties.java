package com.housingocr.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * 文件存储配置
 *
 * @author housing-ocr
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "file.storage")
public class FileStorageProperties {

    /**
     * 上传文件保存目录
     */
    private String basePath = "./uploads";
}
