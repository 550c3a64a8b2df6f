package com.supportgenius.knowledge.service.ingestion;

import com.supportgenius.knowledge.exception.KnowledgeErrorCode;
import com.supportgenius.knowledge.exception.KnowledgeException;
import com.supportgenius.knowledge.persistence.entity.KnowledgeItemEntity;
import com.supportgenius.knowledge.persistence.entity.ProcessingStatus;
import com.supportgenius.knowledge.persistence.repository.KnowledgeItemRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class JpaProcessingStatusRecorder implements ProcessingStatusRecorder {

    private static final Logger log = LoggerFactory.getLogger(JpaProcessingStatusRecorder.class);

    private final KnowledgeItemRepository repository;

    public JpaProcessingStatusRecorder(KnowledgeItemRepository repository) {
        this.repository = repository;
    }

    @Override
    @Transactional
    public void update(String knowledgeItemId, ProcessingStatus status, Integer chunkCount, String errorMessage) {
        KnowledgeItemEntity entity = repository.findById(knowledgeItemId)
                .orElseThrow(() -> new KnowledgeException(KnowledgeErrorCode.NOT_FOUND, "Knowledge item " + knowledgeItemId + " not found"));
        entity.setProcessingStatus(status);
        // chunk count only survives a success, error message only a failure
        if (status == ProcessingStatus.COMPLETED) {
            entity.setChunkCount(chunkCount == null ? 0 : chunkCount);
            entity.setErrorMessage(null);
        } else if (status == ProcessingStatus.FAILED) {
            entity.setChunkCount(0);
            entity.setErrorMessage(truncate(errorMessage == null ? "Processing failed" : errorMessage));
        } else {
            entity.setChunkCount(0);
            entity.setErrorMessage(null);
        }
        repository.save(entity);
        log.debug("Knowledge item {} is now {}", knowledgeItemId, status);
    }

    private String truncate(String message) {
        return message.length() <= KnowledgeItemEntity.MAX_ERROR_MESSAGE_LENGTH
                ? message
                : message.substring(0, KnowledgeItemEntity.MAX_ERROR_MESSAGE_LENGTH);
    }
}
