package com.housingocr.utils;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 和暦（元号）年份转换为西暦年份
 *
 * 支持 "平成27年"、"令和元年"、"昭和60年築" 以及 "2015年" 这类写法
 *
 * @author housing-ocr
 */
public final class JapaneseEraUtils {

    /**
     * 元号 → 元年对应的西暦年
     */
    private static final Map<String, Integer> ERA_START_YEARS = new LinkedHashMap<>();

    static {
        ERA_START_YEARS.put("令和", 2019);
        ERA_START_YEARS.put("平成", 1989);
        ERA_START_YEARS.put("昭和", 1926);
        ERA_START_YEARS.put("大正", 1912);
        ERA_START_YEARS.put("明治", 1868);
    }

    private static final Pattern ERA_PATTERN = Pattern.compile("(令和|平成|昭和|大正|明治)\\s*(元|\\d{1,2})\\s*年?");

    private static final Pattern WESTERN_YEAR_PATTERN = Pattern.compile("(\\d{4})\\s*年");

    private JapaneseEraUtils() {}

    /**
     * 转换年份文本
     *
     * @param text 原始文本
     * @return 西暦年；无法识别返回 null
     */
    public static Integer toWesternYear(String text) {
        if (StringUtils.isBlank(text)) {
            return null;
        }
        String trimmed = StringUtils.trim(text);

        Matcher eraMatcher = ERA_PATTERN.matcher(trimmed);
        if (eraMatcher.find()) {
            int start = ERA_START_YEARS.get(eraMatcher.group(1));
            String yearText = eraMatcher.group(2);
            int eraYear = "元".equals(yearText) ? 1 : Integer.parseInt(yearText);
            return start + eraYear - 1;
        }

        if (NumberUtils.isDigits(trimmed) && trimmed.length() == 4) {
            return Integer.parseInt(trimmed);
        }

        Matcher westernMatcher = WESTERN_YEAR_PATTERN.matcher(trimmed);
        if (westernMatcher.find()) {
            return Integer.parseInt(westernMatcher.group(1));
        }
        return null;
    }

    /**
     * 将字段 Map 中指定字段的年份规范化为数字，无法识别时保留原值
     *
     * @param properties 抽取结果
     * @param field 字段名
     */
    public static void normalizeYearField(Map<String, Object> properties, String field) {
        Object value = properties.get(field);
        if (value == null || value instanceof Number) {
            return;
        }
        Integer year = toWesternYear(value.toString());
        if (year != null) {
            properties.put(field, year);
        }
    }
}
