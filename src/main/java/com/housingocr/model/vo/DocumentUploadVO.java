package com.housingocr.model.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 文档上传结果
 *
 * @author housing-ocr
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentUploadVO {

    /**
     * 文档ID，重复上传时为已有文档的ID
     */
    private Long documentId;

    /**
     * 文件名（重复时为已有文档的原始文件名）
     */
    private String filename;

    /**
     * 是否为重复文件（内容哈希相同）
     */
    private Boolean duplicate;
}
