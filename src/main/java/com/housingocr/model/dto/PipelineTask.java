package com.housingocr.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Comparator;

/**
 * 流水线任务（仅内存，不持久化，重启后由文档状态重建）
 *
 * 排序: 手动触发优先，其次 priority 越小越优先，最后按入队顺序
 *
 * @author housing-ocr
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineTask implements Comparable<PipelineTask> {

    public static final int PRIORITY_FAVORITE = 1;
    public static final int PRIORITY_MANUAL = 3;
    public static final int PRIORITY_DEFAULT = 5;

    private static final Comparator<PipelineTask> ORDER = Comparator
        .comparing(PipelineTask::isManual).reversed()
        .thenComparingInt(PipelineTask::getPriority)
        .thenComparingLong(PipelineTask::getSequence);

    /**
     * 文档ID
     */
    private Long documentId;

    private int priority;

    /**
     * 是否手动触发
     */
    private boolean manual;

    /**
     * 入队序号，保证同优先级下按查询顺序执行
     */
    private long sequence;

    @Override
    public int compareTo(PipelineTask other) {
        return ORDER.compare(this, other);
    }
}
