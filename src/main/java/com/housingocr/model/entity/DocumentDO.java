package com.housingocr.model.entity;

import com.baomidou.mybatisplus.annotation.FieldFill;
import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.baomidou.mybatisplus.extension.handlers.JacksonTypeHandler;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * 房产资料文档实体
 *
 * @author housing-ocr
 * @since 2025-01-12
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@TableName(value = "documents", autoResultMap = true)
public class DocumentDO implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * 文档ID
     */
    @TableId(type = IdType.AUTO)
    private Long id;

    /**
     * 存储文件名（相对上传目录）
     */
    private String filename;

    /**
     * 上传时的原始文件名
     */
    private String originalFilename;

    /**
     * 文件内容 MD5，用于上传去重，创建后不再修改
     */
    private String fileHash;

    /**
     * OCR 状态: pending, processing, done
     */
    private String ocrStatus;

    /**
     * OCR 识别文本，仅成功时写入
     */
    private String ocrText;

    /**
     * LLM 状态: pending, processing, done, failed
     */
    private String llmStatus;

    /**
     * 抽取出的房产字段(JSON)
     */
    @TableField(typeHandler = JacksonTypeHandler.class)
    private Map<String, Object> properties;

    /**
     * 产出 properties 的模型
     */
    private String extractedModel;

    /**
     * 失败次数（任一阶段失败即 +1）
     */
    private Integer retryCount;

    /**
     * OCR 返回空文本的次数
     */
    private Integer softFailureCount;

    /**
     * 最近一次失败信息
     */
    private String errorMessage;

    /**
     * 是否收藏: 0 否, 1 是
     */
    private Integer favorite;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime uploadTime;

    @TableField(fill = FieldFill.INSERT_UPDATE)
    private LocalDateTime updateTime;
}
