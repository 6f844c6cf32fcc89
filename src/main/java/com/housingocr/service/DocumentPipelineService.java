package com.housingocr.service;

/**
 * 文档处理流水线（OCR → LLM 两阶段状态机）
 *
 * @author housing-ocr
 */
public interface DocumentPipelineService {

    /**
     * 推进一个文档最多一个阶段。不会抛出异常，所有失败都转换为状态变更并持久化
     *
     * @param documentId 文档ID
     * @return 文档是否还有后续工作（需要尽快再次调度）
     */
    boolean processDocument(Long documentId);
}
