package com.housingocr.exception;

import top.continew.starter.core.exception.BusinessException;

/**
 * OCR 调用失败（连接失败、超时、非 2xx 响应、文件无法解码）
 *
 * @author housing-ocr
 */
public class TextExtractionException extends BusinessException {

    public TextExtractionException(String message) {
        super(message);
    }

    public TextExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
