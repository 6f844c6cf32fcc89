package com.housingocr.service.impl;

import cn.hutool.core.util.StrUtil;
import com.housingocr.config.FileStorageProperties;
import com.housingocr.config.PipelineProperties;
import com.housingocr.model.entity.DocumentDO;
import com.housingocr.service.DocumentPipelineService;
import com.housingocr.service.DocumentStoreService;
import com.housingocr.service.PropertyExtractionService;
import com.housingocr.service.TextExtractionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

import static com.housingocr.model.constant.ProcessingStatus.DONE;
import static com.housingocr.model.constant.ProcessingStatus.FAILED;
import static com.housingocr.model.constant.ProcessingStatus.PENDING;
import static com.housingocr.model.constant.ProcessingStatus.PROCESSING;

/**
 * 文档处理流水线实现
 *
 * <pre>
 * OCR:  pending → processing → done（非空文本）
 *                           └→ pending（空文本 / 失败，失败时 retry_count+1）
 * LLM:  pending → processing → done
 *                           └→ pending，或失败次数达到上限后 failed
 * </pre>
 *
 * 每次调用最多推进一个阶段，状态在返回前全部写入存储。
 *
 * @author housing-ocr
 * @since 2025-01-12
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentPipelineServiceImpl implements DocumentPipelineService {

    private static final int MAX_ERROR_LENGTH = 500;

    private final DocumentStoreService documentStoreService;
    private final TextExtractionService textExtractionService;
    private final PropertyExtractionService propertyExtractionService;
    private final PipelineProperties pipelineProperties;
    private final FileStorageProperties fileStorageProperties;

    @Override
    public boolean processDocument(Long documentId) {
        DocumentDO document;
        try {
            document = documentStoreService.getDocument(documentId);
        } catch (Exception e) {
            log.error("读取文档失败: documentId={}", documentId, e);
            return true;
        }
        if (document == null) {
            log.warn("文档不存在，跳过: documentId={}", documentId);
            return false;
        }

        log.debug("当前状态: documentId={}, ocr={}, llm={}", documentId, document.getOcrStatus(), document.getLlmStatus());

        try {
            recoverStaleStages(document);

            if (PENDING.equals(document.getOcrStatus())) {
                return runOcrStage(document);
            }

            if (DONE.equals(document.getOcrStatus())
                && (PENDING.equals(document.getLlmStatus()) || FAILED.equals(document.getLlmStatus()))) {
                return runLlmStage(document);
            }

            return false;
        } catch (Exception e) {
            handleFailure(documentId, e);
            return true;
        }
    }

    /**
     * 上次运行中断遗留的 processing 状态，重置为 pending 后重新判断
     */
    private void recoverStaleStages(DocumentDO document) {
        Long documentId = document.getId();
        if (PROCESSING.equals(document.getOcrStatus())) {
            log.warn("检测到OCR处理中状态，重置为pending: documentId={}", documentId);
            documentStoreService.updateOcrStatus(documentId, PENDING, null);
            document.setOcrStatus(PENDING);
        }
        if (PROCESSING.equals(document.getLlmStatus())) {
            log.warn("检测到LLM处理中状态，重置为pending: documentId={}", documentId);
            documentStoreService.updateLlmStatus(documentId, PENDING, null, null);
            document.setLlmStatus(PENDING);
        }
    }

    private boolean runOcrStage(DocumentDO document) {
        Long documentId = document.getId();
        String filePath = Paths.get(fileStorageProperties.getBasePath(), document.getFilename()).toString();

        log.info("开始OCR处理: documentId={}, file={}", documentId, document.getOriginalFilename());
        documentStoreService.updateOcrStatus(documentId, PROCESSING, null);

        String ocrText = textExtractionService.extractText(filePath, documentId);

        if (StrUtil.isBlank(ocrText)) {
            // 空文本属于软失败：不计入 retry_count，等待下一轮轮询
            log.info("OCR返回空文本，保持pending待重试: documentId={}", documentId);
            documentStoreService.updateOcrStatus(documentId, PENDING, null);
            documentStoreService.incrementSoftFailure(documentId);
            return true;
        }

        documentStoreService.updateOcrStatus(documentId, DONE, ocrText);
        log.info("OCR完成: documentId={}, length={}", documentId, ocrText.length());
        return true;
    }

    private boolean runLlmStage(DocumentDO document) {
        Long documentId = document.getId();
        String ocrText = document.getOcrText();

        if (StrUtil.isBlank(ocrText)) {
            log.warn("OCR已完成但文本为空，两阶段重置为pending: documentId={}", documentId);
            documentStoreService.updateOcrStatus(documentId, PENDING, null);
            documentStoreService.updateLlmStatus(documentId, PENDING, null, null);
            return true;
        }

        log.info("开始LLM提取: documentId={}", documentId);
        documentStoreService.updateLlmStatus(documentId, PROCESSING, null, null);

        Map<String, Object> properties = new HashMap<>(propertyExtractionService.extractProperties(ocrText, documentId));
        Object model = properties.remove(PropertyExtractionService.EXTRACTED_BY_MODEL_KEY);
        String extractedModel = model == null ? null : model.toString();

        documentStoreService.updateLlmStatus(documentId, DONE, properties, extractedModel);
        documentStoreService.updateErrorMessage(documentId, null);
        log.info("LLM提取完成: documentId={}, model={}", documentId, extractedModel);
        return false;
    }

    /**
     * 失败统一处理: retry_count+1，记录错误，仍处于 processing 的阶段退回
     */
    private void handleFailure(Long documentId, Exception error) {
        log.error("文档处理失败: documentId={}, error={}", documentId, error.getMessage(), error);
        try {
            documentStoreService.incrementRetry(documentId);
            documentStoreService.updateErrorMessage(documentId, StrUtil.sub(String.valueOf(error.getMessage()), 0, MAX_ERROR_LENGTH));

            DocumentDO current = documentStoreService.getDocument(documentId);
            if (current == null) {
                return;
            }
            if (PROCESSING.equals(current.getOcrStatus())) {
                documentStoreService.updateOcrStatus(documentId, PENDING, null);
            } else if (PROCESSING.equals(current.getLlmStatus())) {
                int retryCount = current.getRetryCount() == null ? 0 : current.getRetryCount();
                if (retryCount >= pipelineProperties.getRetryLimit()) {
                    log.warn("LLM失败次数达到上限，标记为failed: documentId={}, retryCount={}", documentId, retryCount);
                    documentStoreService.updateLlmStatus(documentId, FAILED, null, null);
                } else {
                    documentStoreService.updateLlmStatus(documentId, PENDING, null, null);
                }
            }
        } catch (Exception e) {
            log.error("更新失败状态异常: documentId={}", documentId, e);
        }
    }
}
