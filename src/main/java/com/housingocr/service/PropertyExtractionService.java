package com.housingocr.service;

import java.util.Map;

/**
 * 房产结构化字段抽取服务接口
 *
 * @author housing-ocr
 */
public interface PropertyExtractionService {

    /**
     * 结果中标记产出模型的内部字段，入库前由调用方移除
     */
    String EXTRACTED_BY_MODEL_KEY = "_extracted_by_model";

    /**
     * 按候选模型顺序依次尝试，返回第一个合格结果
     *
     * @param ocrText OCR 文本
     * @param documentId 文档ID（仅用于日志）
     * @return 字段 Map，包含 {@link #EXTRACTED_BY_MODEL_KEY}
     * @throws com.housingocr.exception.CandidatesExhaustedException 所有候选模型均未给出合格结果
     */
    Map<String, Object> extractProperties(String ocrText, Long documentId);

    /**
     * 模型是否处于限流冷却期
     */
    boolean isInCooldown(String model);
}
