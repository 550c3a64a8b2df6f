package com.supportgenius.knowledge.model;

import com.supportgenius.knowledge.persistence.entity.KnowledgeItemEntity;
import com.supportgenius.knowledge.persistence.entity.ProcessingStatus;

import java.time.OffsetDateTime;

public record KnowledgeItemView(String id,
                                String agentId,
                                String fileName,
                                String originalName,
                                String fileType,
                                long fileSize,
                                int chunkCount,
                                ProcessingStatus processingStatus,
                                String errorMessage,
                                OffsetDateTime uploadedAt,
                                OffsetDateTime updatedAt) {

    public static KnowledgeItemView from(KnowledgeItemEntity entity) {
        return new KnowledgeItemView(
                entity.getId(),
                entity.getAgentId(),
                entity.getFileName(),
                entity.getOriginalName(),
                entity.getFileType(),
                entity.getFileSize(),
                entity.getChunkCount(),
                entity.getProcessingStatus(),
                entity.getErrorMessage(),
                entity.getUploadedAt(),
                entity.getUpdatedAt());
    }
}
