package com.housingocr.service.impl;

import cn.hutool.core.util.StrUtil;
import com.housingocr.config.LlmProperties;
import com.housingocr.service.ModelCandidateService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import top.continew.starter.core.exception.BusinessException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 候选模型管理实现
 *
 * 每次修改都生成新的不可变列表并整体替换引用，正在进行的抽取继续使用旧快照
 *
 * @author housing-ocr
 * @since 2025-01-12
 */
@Slf4j
@Service
public class ModelCandidateServiceImpl implements ModelCandidateService {

    private final AtomicReference<List<String>> candidates;

    public ModelCandidateServiceImpl(LlmProperties llmProperties) {
        this.candidates = new AtomicReference<>(List.copyOf(llmProperties.getModels()));
        log.info("加载候选模型: {}", this.candidates.get());
    }

    @Override
    public List<String> getCandidates() {
        return candidates.get();
    }

    @Override
    public synchronized List<String> addCandidate(String model) {
        if (StrUtil.isBlank(model)) {
            throw new BusinessException("模型名称不能为空");
        }
        String name = model.trim();
        List<String> current = candidates.get();
        if (current.contains(name)) {
            throw new BusinessException("模型已存在: " + name);
        }
        List<String> updated = new ArrayList<>(current);
        updated.add(name);
        return swap(updated);
    }

    @Override
    public synchronized List<String> removeCandidate(String model) {
        List<String> current = candidates.get();
        if (!current.contains(model)) {
            throw new BusinessException("模型不存在: " + model);
        }
        if (current.size() <= 1) {
            throw new BusinessException("至少需要保留一个模型");
        }
        List<String> updated = new ArrayList<>(current);
        updated.remove(model);
        return swap(updated);
    }

    @Override
    public synchronized List<String> reorderCandidates(List<String> models) {
        if (models == null || models.isEmpty()) {
            throw new BusinessException("模型列表不能为空");
        }
        List<String> current = candidates.get();
        if (models.size() != current.size() || !new HashSet<>(models).equals(new HashSet<>(current))) {
            throw new BusinessException("重排后的模型必须与现有模型一致");
        }
        return swap(models);
    }

    @Override
    public synchronized void replaceCandidates(List<String> models) {
        swap(models == null ? List.of() : models);
    }

    private List<String> swap(List<String> updated) {
        List<String> snapshot = List.copyOf(updated);
        candidates.set(snapshot);
        log.info("候选模型已更新: {}", snapshot);
        return snapshot;
    }
}
