package com.housingocr.service.impl;

import com.housingocr.config.FileStorageProperties;
import com.housingocr.config.PipelineProperties;
import com.housingocr.exception.CandidatesExhaustedException;
import com.housingocr.exception.TextExtractionException;
import com.housingocr.model.entity.DocumentDO;
import com.housingocr.service.PropertyExtractionService;
import com.housingocr.service.TextExtractionService;
import com.housingocr.support.InMemoryDocumentStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.housingocr.model.constant.ProcessingStatus.DONE;
import static com.housingocr.model.constant.ProcessingStatus.FAILED;
import static com.housingocr.model.constant.ProcessingStatus.PENDING;
import static com.housingocr.model.constant.ProcessingStatus.PROCESSING;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.endsWith;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DocumentPipelineServiceImplTest {

    private static final String OCR_TEXT = "[Page 1]\n東京都渋谷区円山町28-14 マンション 5800万円";

    @Mock
    private TextExtractionService textExtractionService;

    @Mock
    private PropertyExtractionService propertyExtractionService;

    private InMemoryDocumentStore store;
    private DocumentPipelineServiceImpl pipelineService;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore();
        PipelineProperties pipelineProperties = new PipelineProperties();
        FileStorageProperties fileStorageProperties = new FileStorageProperties();
        fileStorageProperties.setBasePath("/data/uploads");
        pipelineService = new DocumentPipelineServiceImpl(store, textExtractionService, propertyExtractionService,
            pipelineProperties, fileStorageProperties);
    }

    private static Map<String, Object> extracted(String model) {
        Map<String, Object> properties = new HashMap<>();
        properties.put("property_type", "マンション");
        properties.put("address", "東京都渋谷区円山町28-14");
        properties.put("price", 5800);
        properties.put(PropertyExtractionService.EXTRACTED_BY_MODEL_KEY, model);
        return properties;
    }

    private void assertOcrPrecedesLlm() {
        for (DocumentDO document : store.findAll()) {
            if (DONE.equals(document.getLlmStatus())) {
                assertThat(document.getOcrStatus()).isEqualTo(DONE);
                assertThat(document.getOcrText()).isNotBlank();
            }
        }
    }

    @Nested
    @DisplayName("OCR stage")
    class OcrStage {

        @Test
        @DisplayName("successful OCR stores the text and leaves LLM for the next invocation")
        void storesTextAndStopsAfterOneStage() {
            // GIVEN
            Long id = store.save(DocumentDO.builder().filename("abc.pdf").build());
            when(textExtractionService.extractText(endsWith("abc.pdf"), eq(id))).thenReturn(OCR_TEXT);

            // WHEN
            boolean remaining = pipelineService.processDocument(id);

            // THEN
            DocumentDO document = store.getDocument(id);
            assertThat(remaining).isTrue();
            assertThat(document.getOcrStatus()).isEqualTo(DONE);
            assertThat(document.getOcrText()).isEqualTo(OCR_TEXT);
            assertThat(document.getLlmStatus()).isEqualTo(PENDING);
            verifyNoInteractions(propertyExtractionService);
        }

        @Test
        @DisplayName("empty OCR text is a soft failure: pending again, retry count untouched, no LLM call")
        void emptyTextIsSoftFailure() {
            Long id = store.save(DocumentDO.builder().build());
            when(textExtractionService.extractText(anyString(), eq(id))).thenReturn("");

            boolean remaining = pipelineService.processDocument(id);

            DocumentDO document = store.getDocument(id);
            assertThat(remaining).isTrue();
            assertThat(document.getOcrStatus()).isEqualTo(PENDING);
            assertThat(document.getRetryCount()).isZero();
            assertThat(document.getSoftFailureCount()).isEqualTo(1);
            assertThat(document.getOcrText()).isNull();
            verifyNoInteractions(propertyExtractionService);
        }

        @Test
        @DisplayName("whitespace-only OCR text counts as empty")
        void whitespaceTextIsSoftFailure() {
            Long id = store.save(DocumentDO.builder().build());
            when(textExtractionService.extractText(anyString(), eq(id))).thenReturn(" \n\t ");

            pipelineService.processDocument(id);

            assertThat(store.getDocument(id).getOcrStatus()).isEqualTo(PENDING);
            assertThat(store.getDocument(id).getRetryCount()).isZero();
        }

        @Test
        @DisplayName("OCR failure returns the stage to pending and increments retry count")
        void failureIsRetryable() {
            Long id = store.save(DocumentDO.builder().build());
            when(textExtractionService.extractText(anyString(), eq(id)))
                .thenThrow(new TextExtractionException("OCR请求失败: Connection refused"));

            boolean remaining = pipelineService.processDocument(id);

            DocumentDO document = store.getDocument(id);
            assertThat(remaining).isTrue();
            assertThat(document.getOcrStatus()).isEqualTo(PENDING);
            assertThat(document.getRetryCount()).isEqualTo(1);
            assertThat(document.getErrorMessage()).contains("Connection refused");
            verifyNoInteractions(propertyExtractionService);
        }

        @Test
        @DisplayName("OCR is never marked failed however many times it fails")
        void ocrNeverFailsTerminally() {
            Long id = store.save(DocumentDO.builder().retryCount(10).build());
            when(textExtractionService.extractText(anyString(), eq(id)))
                .thenThrow(new TextExtractionException("timeout"));

            pipelineService.processDocument(id);

            assertThat(store.getDocument(id).getOcrStatus()).isEqualTo(PENDING);
            assertThat(store.getDocument(id).getRetryCount()).isEqualTo(11);
        }

        @Test
        @DisplayName("long error messages are truncated before they are stored")
        void errorMessageIsTruncated() {
            Long id = store.save(DocumentDO.builder().build());
            when(textExtractionService.extractText(anyString(), eq(id)))
                .thenThrow(new TextExtractionException("x".repeat(2000)));

            pipelineService.processDocument(id);

            assertThat(store.getDocument(id).getErrorMessage()).hasSizeLessThanOrEqualTo(500);
        }
    }

    @Nested
    @DisplayName("LLM stage")
    class LlmStage {

        @Test
        @DisplayName("success persists properties without the model tag and records the model")
        void successStripsModelTag() {
            Long id = store.save(DocumentDO.builder().ocrStatus(DONE).ocrText(OCR_TEXT).errorMessage("old").build());
            when(propertyExtractionService.extractProperties(OCR_TEXT, id)).thenReturn(extracted("model-c"));

            boolean remaining = pipelineService.processDocument(id);

            DocumentDO document = store.getDocument(id);
            assertThat(remaining).isFalse();
            assertThat(document.getLlmStatus()).isEqualTo(DONE);
            assertThat(document.getExtractedModel()).isEqualTo("model-c");
            assertThat(document.getProperties())
                .containsEntry("address", "東京都渋谷区円山町28-14")
                .doesNotContainKey(PropertyExtractionService.EXTRACTED_BY_MODEL_KEY);
            assertThat(document.getErrorMessage()).isNull();
            verifyNoInteractions(textExtractionService);
            assertOcrPrecedesLlm();
        }

        @Test
        @DisplayName("a previously failed LLM stage is retried when the document is dispatched")
        void failedStageIsRetried() {
            Long id = store.save(DocumentDO.builder().ocrStatus(DONE).ocrText(OCR_TEXT).llmStatus(FAILED).build());
            when(propertyExtractionService.extractProperties(OCR_TEXT, id)).thenReturn(extracted("model-a"));

            pipelineService.processDocument(id);

            assertThat(store.getDocument(id).getLlmStatus()).isEqualTo(DONE);
        }

        @Test
        @DisplayName("exhausted candidates return LLM to pending below the retry limit")
        void exhaustionBelowLimitIsPending() {
            Long id = store.save(DocumentDO.builder().ocrStatus(DONE).ocrText(OCR_TEXT).build());
            when(propertyExtractionService.extractProperties(OCR_TEXT, id))
                .thenThrow(new CandidatesExhaustedException("所有模型均失败", List.of("a", "b")));

            boolean remaining = pipelineService.processDocument(id);

            DocumentDO document = store.getDocument(id);
            assertThat(remaining).isTrue();
            assertThat(document.getLlmStatus()).isEqualTo(PENDING);
            assertThat(document.getRetryCount()).isEqualTo(1);
            assertThat(document.getProperties()).isNull();
            assertThat(document.getErrorMessage()).contains("所有模型均失败");
        }

        @Test
        @DisplayName("exhausted candidates mark LLM failed once the retry limit is reached")
        void exhaustionAtLimitIsFailed() {
            Long id = store.save(DocumentDO.builder().ocrStatus(DONE).ocrText(OCR_TEXT).retryCount(4).build());
            when(propertyExtractionService.extractProperties(OCR_TEXT, id))
                .thenThrow(new CandidatesExhaustedException("所有模型均失败", List.of("a")));

            pipelineService.processDocument(id);

            DocumentDO document = store.getDocument(id);
            assertThat(document.getLlmStatus()).isEqualTo(FAILED);
            assertThat(document.getRetryCount()).isEqualTo(5);
            assertThat(document.getOcrStatus()).isEqualTo(DONE);
        }

        @Test
        @DisplayName("OCR marked done without text resets both stages instead of calling the LLM")
        void inconsistentOcrSelfHeals() {
            Long id = store.save(DocumentDO.builder().ocrStatus(DONE).ocrText("  ").build());

            boolean remaining = pipelineService.processDocument(id);

            DocumentDO document = store.getDocument(id);
            assertThat(remaining).isTrue();
            assertThat(document.getOcrStatus()).isEqualTo(PENDING);
            assertThat(document.getLlmStatus()).isEqualTo(PENDING);
            verifyNoInteractions(propertyExtractionService, textExtractionService);
        }
    }

    @Nested
    @DisplayName("re-entry")
    class ReEntry {

        @Test
        @DisplayName("a completed document produces no external calls and no writes")
        void completedDocumentIsNoOp() {
            Map<String, Object> properties = new HashMap<>(Map.of("price", 5800));
            Long id = store.save(DocumentDO.builder().ocrStatus(DONE).ocrText(OCR_TEXT)
                .llmStatus(DONE).properties(properties).extractedModel("model-a").build());
            DocumentDO before = store.getDocument(id);
            int writes = store.getWriteCount();

            boolean first = pipelineService.processDocument(id);
            boolean second = pipelineService.processDocument(id);

            assertThat(first).isFalse();
            assertThat(second).isFalse();
            assertThat(store.getWriteCount()).isEqualTo(writes);
            assertThat(store.getDocument(id)).isEqualTo(before);
            verifyNoInteractions(textExtractionService, propertyExtractionService);
        }

        @Test
        @DisplayName("OCR left processing by a crash is reset and run again")
        void staleOcrIsRestarted() {
            Long id = store.save(DocumentDO.builder().ocrStatus(PROCESSING).build());
            when(textExtractionService.extractText(anyString(), eq(id))).thenReturn(OCR_TEXT);

            pipelineService.processDocument(id);

            assertThat(store.getDocument(id).getOcrStatus()).isEqualTo(DONE);
        }

        @Test
        @DisplayName("LLM left processing by a crash is reset and run again")
        void staleLlmIsRestarted() {
            Long id = store.save(DocumentDO.builder().ocrStatus(DONE).ocrText(OCR_TEXT).llmStatus(PROCESSING).build());
            when(propertyExtractionService.extractProperties(OCR_TEXT, id)).thenReturn(extracted("model-b"));

            pipelineService.processDocument(id);

            assertThat(store.getDocument(id).getLlmStatus()).isEqualTo(DONE);
            assertThat(store.getDocument(id).getExtractedModel()).isEqualTo("model-b");
        }

        @Test
        @DisplayName("missing documents are skipped")
        void missingDocument() {
            assertThat(pipelineService.processDocument(404L)).isFalse();
            verifyNoInteractions(textExtractionService, propertyExtractionService);
        }

        @Test
        @DisplayName("two invocations take a fresh document through both stages")
        void fullRun() {
            Long id = store.save(DocumentDO.builder().build());
            when(textExtractionService.extractText(anyString(), eq(id))).thenReturn(OCR_TEXT);
            when(propertyExtractionService.extractProperties(OCR_TEXT, id)).thenReturn(extracted("model-a"));

            assertThat(pipelineService.processDocument(id)).isTrue();
            assertOcrPrecedesLlm();
            assertThat(pipelineService.processDocument(id)).isFalse();
            assertOcrPrecedesLlm();

            assertThat(store.getDocument(id).getLlmStatus()).isEqualTo(DONE);
            verify(textExtractionService).extractText(anyString(), anyLong());
            verify(propertyExtractionService, never()).extractProperties(eq(""), anyLong());
        }
    }
}
