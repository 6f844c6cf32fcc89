package com.housingocr.model.constant;

/**
 * 文档两阶段处理状态常量
 * OCR 阶段只会出现 pending / processing / done，LLM 阶段额外有 failed
 */
public final class ProcessingStatus {
    private ProcessingStatus() {}

    public static final String PENDING = "pending";
    public static final String PROCESSING = "processing";
    public static final String DONE = "done";
    public static final String FAILED = "failed"; // 仅 LLM 阶段
}
