package com.housingocr.service;

import java.util.List;

/**
 * 结构化抽取候选模型管理
 *
 * 列表可在运行时整体替换，抽取时总是读取当前列表，不需要重启调度器
 *
 * @author housing-ocr
 */
public interface ModelCandidateService {

    /**
     * 当前候选模型（按尝试顺序，不可变快照）
     */
    List<String> getCandidates();

    /**
     * 追加模型到末尾
     *
     * @return 更新后的列表
     */
    List<String> addCandidate(String model);

    /**
     * 移除模型，至少保留一个
     *
     * @return 更新后的列表
     */
    List<String> removeCandidate(String model);

    /**
     * 按给定顺序重排，必须与现有模型集合一致
     *
     * @return 更新后的列表
     */
    List<String> reorderCandidates(List<String> models);

    /**
     * 整体替换
     */
    void replaceCandidates(List<String> models);
}
