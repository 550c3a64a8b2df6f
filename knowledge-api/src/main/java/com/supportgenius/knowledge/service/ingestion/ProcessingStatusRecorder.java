package com.supportgenius.knowledge.service.ingestion;

import com.supportgenius.knowledge.persistence.entity.ProcessingStatus;

public interface ProcessingStatusRecorder {

    /**
     * Persists a lifecycle transition. {@code chunkCount} is only meaningful for
     * {@link ProcessingStatus#COMPLETED}, {@code errorMessage} only for {@link ProcessingStatus#FAILED}.
     */
    void update(String knowledgeItemId, ProcessingStatus status, Integer chunkCount, String errorMessage);

    default void processing(String knowledgeItemId) {
        update(knowledgeItemId, ProcessingStatus.PROCESSING, null, null);
    }

    default void completed(String knowledgeItemId, int chunkCount) {
        update(knowledgeItemId, ProcessingStatus.COMPLETED, chunkCount, null);
    }

    default void failed(String knowledgeItemId, String errorMessage) {
        update(knowledgeItemId, ProcessingStatus.FAILED, null, errorMessage);
    }
}
