package com.housingocr.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.housingocr.config.PipelineProperties;
import com.housingocr.mapper.DocumentMapper;
import com.housingocr.model.entity.DocumentDO;
import com.housingocr.service.DocumentStoreService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import top.continew.starter.core.exception.BusinessException;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static com.housingocr.model.constant.ProcessingStatus.DONE;
import static com.housingocr.model.constant.ProcessingStatus.PENDING;
import static com.housingocr.model.constant.ProcessingStatus.PROCESSING;

/**
 * 基于 MyBatis-Plus 的文档存储实现
 *
 * @author housing-ocr
 * @since 2025-01-12
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentStoreServiceImpl implements DocumentStoreService {

    private final DocumentMapper documentMapper;
    private final PipelineProperties pipelineProperties;

    @Override
    public Long createDocument(String filename, String originalFilename, String fileHash) {
        DocumentDO document = DocumentDO.builder()
            .filename(filename)
            .originalFilename(originalFilename)
            .fileHash(fileHash)
            .ocrStatus(PENDING)
            .llmStatus(PENDING)
            .retryCount(0)
            .softFailureCount(0)
            .favorite(0)
            .build();
        documentMapper.insert(document);
        log.info("创建文档记录: id={}, filename={}, hash={}", document.getId(), filename, fileHash);
        return document.getId();
    }

    @Override
    public DocumentDO getDocument(Long documentId) {
        return documentMapper.selectById(documentId);
    }

    @Override
    public DocumentDO getDocumentByHash(String fileHash) {
        return documentMapper.selectOne(
            new LambdaQueryWrapper<DocumentDO>()
                .eq(DocumentDO::getFileHash, fileHash)
                .last("LIMIT 1")
        );
    }

    @Override
    public void updateOcrStatus(Long documentId, String status, String ocrText) {
        documentMapper.update(null, new LambdaUpdateWrapper<DocumentDO>()
            .eq(DocumentDO::getId, documentId)
            .set(DocumentDO::getOcrStatus, status)
            .set(ocrText != null, DocumentDO::getOcrText, ocrText)
            .set(DocumentDO::getUpdateTime, LocalDateTime.now()));
    }

    @Override
    public void updateLlmStatus(Long documentId, String status, Map<String, Object> properties, String extractedModel) {
        if (properties == null) {
            documentMapper.update(null, new LambdaUpdateWrapper<DocumentDO>()
                .eq(DocumentDO::getId, documentId)
                .set(DocumentDO::getLlmStatus, status)
                .set(extractedModel != null, DocumentDO::getExtractedModel, extractedModel)
                .set(DocumentDO::getUpdateTime, LocalDateTime.now()));
            return;
        }
        // properties 需要走 JacksonTypeHandler，只能通过实体更新
        DocumentDO patch = new DocumentDO();
        patch.setId(documentId);
        patch.setLlmStatus(status);
        patch.setProperties(properties);
        patch.setExtractedModel(extractedModel);
        documentMapper.updateById(patch);
    }

    @Override
    public void incrementRetry(Long documentId) {
        documentMapper.update(null, new LambdaUpdateWrapper<DocumentDO>()
            .eq(DocumentDO::getId, documentId)
            .setSql("retry_count = retry_count + 1")
            .set(DocumentDO::getUpdateTime, LocalDateTime.now()));
    }

    @Override
    public void incrementSoftFailure(Long documentId) {
        documentMapper.update(null, new LambdaUpdateWrapper<DocumentDO>()
            .eq(DocumentDO::getId, documentId)
            .setSql("soft_failure_count = soft_failure_count + 1")
            .set(DocumentDO::getUpdateTime, LocalDateTime.now()));
    }

    @Override
    public void updateErrorMessage(Long documentId, String errorMessage) {
        documentMapper.update(null, new LambdaUpdateWrapper<DocumentDO>()
            .eq(DocumentDO::getId, documentId)
            .set(DocumentDO::getErrorMessage, errorMessage)
            .set(DocumentDO::getUpdateTime, LocalDateTime.now()));
    }

    @Override
    public List<DocumentDO> getEligibleDocuments(int limit) {
        int retryLimit = pipelineProperties.getRetryLimit();
        int softFailureCap = pipelineProperties.getMaxSoftFailures();

        return documentMapper.selectList(
            new LambdaQueryWrapper<DocumentDO>()
                .and(w -> w
                    .nested(n -> n.eq(DocumentDO::getOcrStatus, PENDING)
                        .lt(softFailureCap > 0, DocumentDO::getSoftFailureCount, softFailureCap))
                    .or(n -> n.eq(DocumentDO::getOcrStatus, DONE)
                        .eq(DocumentDO::getLlmStatus, PENDING))
                    .or(n -> n.eq(DocumentDO::getOcrStatus, PROCESSING)
                        .lt(DocumentDO::getRetryCount, retryLimit))
                    .or(n -> n.eq(DocumentDO::getLlmStatus, PROCESSING)
                        .lt(DocumentDO::getRetryCount, retryLimit)))
                .orderByDesc(DocumentDO::getFavorite)
                .orderByAsc(DocumentDO::getUploadTime)
                .orderByAsc(DocumentDO::getId)
                .last("LIMIT " + limit)
        );
    }

    @Override
    public int resetStaleProcessing() {
        int ocr = documentMapper.update(null, new LambdaUpdateWrapper<DocumentDO>()
            .eq(DocumentDO::getOcrStatus, PROCESSING)
            .set(DocumentDO::getOcrStatus, PENDING)
            .setSql("retry_count = retry_count + 1")
            .set(DocumentDO::getUpdateTime, LocalDateTime.now()));
        int llm = documentMapper.update(null, new LambdaUpdateWrapper<DocumentDO>()
            .eq(DocumentDO::getLlmStatus, PROCESSING)
            .set(DocumentDO::getLlmStatus, PENDING)
            .setSql("retry_count = retry_count + 1")
            .set(DocumentDO::getUpdateTime, LocalDateTime.now()));
        if (ocr + llm > 0) {
            log.warn("重置中断的处理状态: ocr={}, llm={}", ocr, llm);
        }
        return ocr + llm;
    }

    @Override
    public void resetOcr(Long documentId) {
        requireDocument(documentId);
        documentMapper.update(null, new LambdaUpdateWrapper<DocumentDO>()
            .eq(DocumentDO::getId, documentId)
            .set(DocumentDO::getOcrStatus, PENDING)
            .set(DocumentDO::getOcrText, null)
            .set(DocumentDO::getLlmStatus, PENDING)
            .set(DocumentDO::getProperties, null)
            .set(DocumentDO::getExtractedModel, null)
            .set(DocumentDO::getRetryCount, 0)
            .set(DocumentDO::getSoftFailureCount, 0)
            .set(DocumentDO::getErrorMessage, null)
            .set(DocumentDO::getUpdateTime, LocalDateTime.now()));
    }

    @Override
    public void resetLlm(Long documentId) {
        requireDocument(documentId);
        documentMapper.update(null, new LambdaUpdateWrapper<DocumentDO>()
            .eq(DocumentDO::getId, documentId)
            .set(DocumentDO::getLlmStatus, PENDING)
            .set(DocumentDO::getProperties, null)
            .set(DocumentDO::getExtractedModel, null)
            .set(DocumentDO::getRetryCount, 0)
            .set(DocumentDO::getErrorMessage, null)
            .set(DocumentDO::getUpdateTime, LocalDateTime.now()));
    }

    @Override
    public int toggleFavorite(Long documentId) {
        DocumentDO document = requireDocument(documentId);
        int favorite = Integer.valueOf(1).equals(document.getFavorite()) ? 0 : 1;
        documentMapper.update(null, new LambdaUpdateWrapper<DocumentDO>()
            .eq(DocumentDO::getId, documentId)
            .set(DocumentDO::getFavorite, favorite)
            .set(DocumentDO::getUpdateTime, LocalDateTime.now()));
        return favorite;
    }

    private DocumentDO requireDocument(Long documentId) {
        DocumentDO document = documentMapper.selectById(documentId);
        if (document == null) {
            throw new BusinessException("文档不存在: " + documentId);
        }
        return document;
    }
}
