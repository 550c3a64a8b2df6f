package com.supportgenius.knowledge.service.ingestion;

import com.supportgenius.knowledge.exception.KnowledgeErrorCode;
import com.supportgenius.knowledge.exception.KnowledgeException;
import com.supportgenius.knowledge.persistence.entity.KnowledgeItemEntity;
import com.supportgenius.knowledge.persistence.entity.ProcessingStatus;
import com.supportgenius.knowledge.persistence.repository.KnowledgeItemRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import(JpaProcessingStatusRecorder.class)
class JpaProcessingStatusRecorderTest {

    @Autowired
    private JpaProcessingStatusRecorder recorder;

    @Autowired
    private KnowledgeItemRepository repository;

    @BeforeEach
    void setUp() {
        repository.saveAndFlush(new KnowledgeItemEntity("kb-1", "agent-1", "3f1c.pdf", "guide.pdf", "application/pdf", 2048));
    }

    @Test
    void completedStoresChunkCountAndClearsError() {
        recorder.failed("kb-1", "first attempt failed");
        recorder.processing("kb-1");
        recorder.completed("kb-1", 7);

        KnowledgeItemEntity entity = repository.findById("kb-1").orElseThrow();
        assertThat(entity.getProcessingStatus()).isEqualTo(ProcessingStatus.COMPLETED);
        assertThat(entity.getChunkCount()).isEqualTo(7);
        assertThat(entity.getErrorMessage()).isNull();
    }

    @Test
    void failedKeepsMessageWithinColumnLimit() {
        recorder.failed("kb-1", "e".repeat(5000));

        KnowledgeItemEntity entity = repository.findById("kb-1").orElseThrow();
        assertThat(entity.getProcessingStatus()).isEqualTo(ProcessingStatus.FAILED);
        assertThat(entity.getErrorMessage()).hasSize(KnowledgeItemEntity.MAX_ERROR_MESSAGE_LENGTH);
        assertThat(entity.getChunkCount()).isZero();
    }

    @Test
    void reprocessingResetsOutcomeOfPreviousRun() {
        recorder.completed("kb-1", 7);

        recorder.processing("kb-1");
        KnowledgeItemEntity processing = repository.findById("kb-1").orElseThrow();
        assertThat(processing.getProcessingStatus()).isEqualTo(ProcessingStatus.PROCESSING);
        assertThat(processing.getChunkCount()).isZero();
        assertThat(processing.getErrorMessage()).isNull();

        recorder.failed("kb-1", "Embeddings response size did not match chunks");
        KnowledgeItemEntity failed = repository.findById("kb-1").orElseThrow();
        assertThat(failed.getProcessingStatus()).isEqualTo(ProcessingStatus.FAILED);
        assertThat(failed.getChunkCount()).isZero();
        assertThat(failed.getErrorMessage()).isEqualTo("Embeddings response size did not match chunks");
    }

    @Test
    void processingClearsErrorOfFailedRun() {
        recorder.failed("kb-1", "No text content extracted from document");

        recorder.processing("kb-1");

        KnowledgeItemEntity entity = repository.findById("kb-1").orElseThrow();
        assertThat(entity.getProcessingStatus()).isEqualTo(ProcessingStatus.PROCESSING);
        assertThat(entity.getErrorMessage()).isNull();
    }

    @Test
    void unknownItemIsNotFound() {
        assertThatThrownBy(() -> recorder.processing("missing"))
                .isInstanceOf(KnowledgeException.class)
                .extracting(ex -> ((KnowledgeException) ex).code())
                .isEqualTo(KnowledgeErrorCode.NOT_FOUND);
    }
}
