package com.housingocr.service.impl;

import cn.hutool.core.util.StrUtil;
import cn.hutool.crypto.digest.DigestUtil;
import com.housingocr.config.FileStorageProperties;
import com.housingocr.model.entity.DocumentDO;
import com.housingocr.model.vo.DocumentUploadVO;
import com.housingocr.scheduler.DocumentProcessingScheduler;
import com.housingocr.service.DocumentIntakeService;
import com.housingocr.service.DocumentStoreService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;
import top.continew.starter.core.exception.BusinessException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Set;

/**
 * 文档录入服务实现 - 本地存储
 *
 * 文件以 {md5}{扩展名} 保存在上传目录，内容相同的文件只保留一份记录。
 *
 * @author housing-ocr
 * @since 2025-01-12
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentIntakeServiceImpl implements DocumentIntakeService {

    private static final Set<String> ALLOWED_EXTENSIONS = Set.of(".pdf", ".png", ".jpg", ".jpeg", ".webp", ".bmp", ".gif", ".tif", ".tiff");

    private final DocumentStoreService documentStoreService;
    private final DocumentProcessingScheduler documentProcessingScheduler;
    private final FileStorageProperties fileStorageProperties;

    @Override
    public DocumentUploadVO upload(MultipartFile file) {
        // 1. 验证文件
        if (file == null || file.isEmpty()) {
            throw new BusinessException("文件不能为空");
        }
        String originalFilename = file.getOriginalFilename();
        if (StrUtil.isBlank(originalFilename)) {
            throw new BusinessException("文件名不能为空");
        }
        String extension = resolveExtension(originalFilename);

        try {
            // 2. 内容哈希去重
            byte[] content = file.getBytes();
            String fileHash = DigestUtil.md5Hex(content);
            DocumentDO existing = documentStoreService.getDocumentByHash(fileHash);
            if (existing != null) {
                log.info("重复文件，跳过上传: originalName={}, existingId={}", originalFilename, existing.getId());
                return duplicateOf(existing);
            }

            // 3. 保存文件
            Path basePath = Paths.get(fileStorageProperties.getBasePath());
            if (!Files.exists(basePath)) {
                Files.createDirectories(basePath);
            }
            String filename = fileHash + extension;
            Files.write(basePath.resolve(filename), content);

            // 4. 创建记录，由调度器接手；并发上传同一文件时以唯一索引为准
            Long documentId;
            try {
                documentId = documentStoreService.createDocument(filename, originalFilename, fileHash);
            } catch (DuplicateKeyException e) {
                DocumentDO winner = documentStoreService.getDocumentByHash(fileHash);
                if (winner == null) {
                    throw e;
                }
                if (!filename.equals(winner.getFilename())) {
                    Files.deleteIfExists(basePath.resolve(filename));
                }
                log.info("并发上传重复文件: originalName={}, existingId={}", originalFilename, winner.getId());
                return duplicateOf(winner);
            }
            log.info("文件上传成功: documentId={}, originalName={}, filename={}, size={}",
                documentId, originalFilename, filename, content.length);
            return DocumentUploadVO.builder()
                .documentId(documentId)
                .filename(originalFilename)
                .duplicate(false)
                .build();
        } catch (IOException e) {
            log.error("文件上传失败: originalName={}", originalFilename, e);
            throw new BusinessException("文件上传失败: " + e.getMessage());
        }
    }

    @Override
    public void retryOcr(Long documentId) {
        documentStoreService.resetOcr(documentId);
        documentProcessingScheduler.submitManual(documentId);
        log.info("重新OCR: documentId={}", documentId);
    }

    @Override
    public void retryLlm(Long documentId) {
        DocumentDO document = documentStoreService.getDocument(documentId);
        if (document == null) {
            throw new BusinessException("文档不存在: " + documentId);
        }
        if (StrUtil.isBlank(document.getOcrText())) {
            throw new BusinessException("文档尚未完成OCR，无法重新抽取");
        }
        documentStoreService.resetLlm(documentId);
        documentProcessingScheduler.submitManual(documentId);
        log.info("重新LLM抽取: documentId={}", documentId);
    }

    @Override
    public int toggleFavorite(Long documentId) {
        int favorite = documentStoreService.toggleFavorite(documentId);
        log.info("切换收藏: documentId={}, favorite={}", documentId, favorite);
        return favorite;
    }

    private DocumentUploadVO duplicateOf(DocumentDO existing) {
        return DocumentUploadVO.builder()
            .documentId(existing.getId())
            .filename(StrUtil.blankToDefault(existing.getOriginalFilename(), existing.getFilename()))
            .duplicate(true)
            .build();
    }

    private String resolveExtension(String originalFilename) {
        int lastDotIndex = originalFilename.lastIndexOf('.');
        if (lastDotIndex == -1 || lastDotIndex == originalFilename.length() - 1) {
            throw new BusinessException("文件缺少扩展名");
        }
        String extension = originalFilename.substring(lastDotIndex).toLowerCase(Locale.ROOT);
        if (!ALLOWED_EXTENSIONS.contains(extension)) {
            throw new BusinessException("不支持的文件类型: " + extension);
        }
        return extension;
    }
}
