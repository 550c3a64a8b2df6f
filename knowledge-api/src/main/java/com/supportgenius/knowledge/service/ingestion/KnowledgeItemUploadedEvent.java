package com.supportgenius.knowledge.service.ingestion;

public record KnowledgeItemUploadedEvent(IngestDocumentCommand command) {
}
