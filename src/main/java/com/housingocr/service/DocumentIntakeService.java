package com.housingocr.service;

import com.housingocr.model.vo.DocumentUploadVO;
import org.springframework.web.multipart.MultipartFile;

/**
 * 文档录入服务: 上传、手动重试、收藏
 *
 * @author housing-ocr
 */
public interface DocumentIntakeService {

    /**
     * 保存上传文件并创建文档记录，按内容哈希去重
     *
     * @param file 上传文件
     * @return 上传结果
     */
    DocumentUploadVO upload(MultipartFile file);

    /**
     * 重新 OCR（同时清空抽取结果），并立即加入手动处理队列
     */
    void retryOcr(Long documentId);

    /**
     * 重新 LLM 抽取，并立即加入手动处理队列
     */
    void retryLlm(Long documentId);

    /**
     * 切换收藏状态
     *
     * @return 新状态 0/1
     */
    int toggleFavorite(Long documentId);
}
