package com.housingocr.model.dto;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PipelineTaskTest {

    private static PipelineTask task(long documentId, int priority, boolean manual, long sequence) {
        return PipelineTask.builder().documentId(documentId).priority(priority).manual(manual).sequence(sequence).build();
    }

    @Test
    void manualBeforeAutomaticThenPriorityThenSequence() {
        List<PipelineTask> tasks = new ArrayList<>(List.of(
            task(1, PipelineTask.PRIORITY_DEFAULT, false, 1),
            task(2, PipelineTask.PRIORITY_FAVORITE, false, 2),
            task(3, PipelineTask.PRIORITY_MANUAL, true, 3),
            task(4, PipelineTask.PRIORITY_DEFAULT, false, 0),
            task(5, PipelineTask.PRIORITY_MANUAL, true, 1)
        ));

        tasks.sort(null);

        assertThat(tasks).extracting(PipelineTask::getDocumentId).containsExactly(5L, 3L, 2L, 4L, 1L);
    }
}
