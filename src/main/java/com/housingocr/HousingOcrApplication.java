package com.housingocr;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 房产资料 OCR 处理服务
 *
 * @author housing-ocr
 * @since 2025-01-12
 */
@SpringBootApplication
@MapperScan("com.housingocr.mapper")
public class HousingOcrApplication {

	public static void main(String[] args) {
		SpringApplication.run(HousingOcrApplication.class, args);
	}

}
