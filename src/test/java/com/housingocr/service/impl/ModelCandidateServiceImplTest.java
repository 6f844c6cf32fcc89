package com.housingocr.service.impl;

import com.housingocr.config.LlmProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import top.continew.starter.core.exception.BusinessException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelCandidateServiceImplTest {

    private ModelCandidateServiceImpl candidates;

    @BeforeEach
    void setUp() {
        LlmProperties llmProperties = new LlmProperties();
        llmProperties.setModels(List.of("model-a", "model-b"));
        candidates = new ModelCandidateServiceImpl(llmProperties);
    }

    @Test
    void startsFromConfiguredModels() {
        assertThat(candidates.getCandidates()).containsExactly("model-a", "model-b");
    }

    @Test
    void addAppendsTrimmedName() {
        assertThat(candidates.addCandidate("  model-c ")).containsExactly("model-a", "model-b", "model-c");
    }

    @Test
    void addRejectsDuplicatesAndBlanks() {
        assertThatThrownBy(() -> candidates.addCandidate("model-a")).isInstanceOf(BusinessException.class);
        assertThatThrownBy(() -> candidates.addCandidate(" ")).isInstanceOf(BusinessException.class);
    }

    @Test
    void removeKeepsAtLeastOneModel() {
        assertThat(candidates.removeCandidate("model-a")).containsExactly("model-b");
        assertThatThrownBy(() -> candidates.removeCandidate("model-b"))
            .isInstanceOf(BusinessException.class)
            .hasMessageContaining("至少需要保留一个模型");
        assertThatThrownBy(() -> candidates.removeCandidate("unknown")).isInstanceOf(BusinessException.class);
    }

    @Test
    void reorderRequiresSameModels() {
        assertThat(candidates.reorderCandidates(List.of("model-b", "model-a"))).containsExactly("model-b", "model-a");
        assertThatThrownBy(() -> candidates.reorderCandidates(List.of("model-b", "model-x")))
            .isInstanceOf(BusinessException.class);
        assertThatThrownBy(() -> candidates.reorderCandidates(List.of("model-b")))
            .isInstanceOf(BusinessException.class);
    }

    @Test
    void snapshotsAreNotAffectedByLaterChanges() {
        List<String> before = candidates.getCandidates();

        candidates.replaceCandidates(List.of("model-z"));

        assertThat(before).containsExactly("model-a", "model-b");
        assertThat(candidates.getCandidates()).containsExactly("model-z");
        assertThatThrownBy(() -> before.add("model-x")).isInstanceOf(UnsupportedOperationException.class);
    }
}
