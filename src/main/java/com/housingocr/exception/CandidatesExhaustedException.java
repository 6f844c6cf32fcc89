package com.housingocr.exception;

import top.continew.starter.core.exception.BusinessException;

import java.util.List;

/**
 * 所有候选模型均未给出合格的抽取结果
 *
 * @author housing-ocr
 */
public class CandidatesExhaustedException extends BusinessException {

    private final List<String> attemptedModels;

    public CandidatesExhaustedException(String message, List<String> attemptedModels) {
        super(message);
        this.attemptedModels = List.copyOf(attemptedModels);
    }

    public List<String> getAttemptedModels() {
        return attemptedModels;
    }
}
