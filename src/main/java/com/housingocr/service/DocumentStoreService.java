package com.housingocr.service;

import com.housingocr.model.entity.DocumentDO;

import java.util.List;
import java.util.Map;

/**
 * 文档存储服务接口
 *
 * 每个方法都是针对单个文档ID的一次原子写入，不包含业务逻辑；
 * 同一文档的互斥由调度器保证。
 *
 * @author housing-ocr
 */
public interface DocumentStoreService {

    /**
     * 创建文档，初始状态 ocr=pending, llm=pending
     *
     * @param filename 存储文件名
     * @param originalFilename 原始文件名
     * @param fileHash 文件内容哈希
     * @return 文档ID
     */
    Long createDocument(String filename, String originalFilename, String fileHash);

    /**
     * 查询文档，不存在返回 null
     */
    DocumentDO getDocument(Long documentId);

    /**
     * 按内容哈希查询文档（上传去重），不存在返回 null
     */
    DocumentDO getDocumentByHash(String fileHash);

    /**
     * 更新 OCR 状态
     *
     * @param ocrText 为 null 时不修改已有文本
     */
    void updateOcrStatus(Long documentId, String status, String ocrText);

    /**
     * 更新 LLM 状态
     *
     * @param properties 为 null 时不修改已有字段
     * @param extractedModel 为 null 时不修改
     */
    void updateLlmStatus(Long documentId, String status, Map<String, Object> properties, String extractedModel);

    void incrementRetry(Long documentId);

    /**
     * OCR 返回空文本计数 +1
     */
    void incrementSoftFailure(Long documentId);

    /**
     * 记录最近一次失败信息，传 null 清空
     */
    void updateErrorMessage(Long documentId, String errorMessage);

    /**
     * 查询待处理文档: 收藏优先，其次上传时间升序
     *
     * @param limit 数量上限
     */
    List<DocumentDO> getEligibleDocuments(int limit);

    /**
     * 将所有 processing 状态重置为 pending 并计一次失败（启动时的崩溃恢复）
     *
     * @return 受影响的文档数
     */
    int resetStaleProcessing();

    /**
     * 重新 OCR: 清空文本与抽取结果，两个阶段回到 pending
     */
    void resetOcr(Long documentId);

    /**
     * 重新抽取: 清空抽取结果，LLM 回到 pending
     */
    void resetLlm(Long documentId);

    /**
     * 切换收藏状态
     *
     * @return 新状态 0/1
     */
    int toggleFavorite(Long documentId);
}
