package com.housingocr.utils;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import top.continew.starter.core.exception.BusinessException;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * LLM JSON 响应清洗工具类
 * 模型经常在 JSON 前后附带说明文字或 Markdown 代码块，这里负责把对象部分取出来
 *
 * @author housing-ocr
 */
@Slf4j
public class LLMJsonUtils {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private static final Pattern CODE_BLOCK_PATTERN = Pattern.compile("```(?:json)?\\s*([\\s\\S]*?)```");

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private LLMJsonUtils() {}

    /**
     * 提取第一个 '{' 到最后一个 '}' 之间的内容
     *
     * @param rawResponse LLM 原始响应
     * @return JSON 对象字符串
     */
    public static String extractJsonObject(String rawResponse) {
        if (rawResponse == null || rawResponse.trim().isEmpty()) {
            throw new BusinessException("LLM 响应为空");
        }

        String cleaned = rawResponse.trim();

        Matcher codeMatcher = CODE_BLOCK_PATTERN.matcher(cleaned);
        if (codeMatcher.find()) {
            cleaned = codeMatcher.group(1).trim();
        }

        int start = cleaned.indexOf('{');
        int end = cleaned.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new BusinessException("无法从响应中提取JSON");
        }
        return cleaned.substring(start, end + 1);
    }

    /**
     * 清洗并解析为字段 Map
     *
     * @param rawResponse LLM 原始响应
     * @return 字段 Map（保持键顺序）
     */
    public static Map<String, Object> parseObject(String rawResponse) {
        String json = extractJsonObject(rawResponse);
        try {
            return OBJECT_MAPPER.readValue(json, MAP_TYPE);
        } catch (Exception e) {
            log.debug("JSON 解析失败: {}", json, e);
            throw new BusinessException("JSON 解析失败: " + e.getMessage());
        }
    }
}
