package com.housingocr.service;

/**
 * 文本识别（OCR）服务接口
 *
 * 只负责调用外部 OCR 服务并返回文本，不写入文档存储
 *
 * @author housing-ocr
 */
public interface TextExtractionService {

    /**
     * 识别图片或多页 PDF 中的文本
     *
     * @param filePath 文件路径
     * @param documentId 文档ID（仅用于日志）
     * @return 识别文本，多页 PDF 按页拼接；可能为空字符串
     * @throws com.housingocr.exception.TextExtractionException 连接失败、超时、非 2xx 响应或文件无法解码
     */
    String extractText(String filePath, Long documentId);
}
