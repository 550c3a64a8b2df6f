package com.supportgenius.knowledge.service.ingestion;

public interface IngestionService {

    /**
     * Runs one document through extraction, segmentation, embedding and storage. The outcome is
     * recorded through {@link ProcessingStatusRecorder}; failures are never rethrown.
     */
    void ingest(IngestDocumentCommand command);
}
