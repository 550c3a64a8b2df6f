package com.supportgenius.knowledge.service.ingestion;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

@Component
public class IngestionWorker {

    private static final Logger log = LoggerFactory.getLogger(IngestionWorker.class);

    private final IngestionService ingestionService;

    public IngestionWorker(IngestionService ingestionService) {
        this.ingestionService = ingestionService;
    }

    @Async("ingestionTaskExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onUploaded(KnowledgeItemUploadedEvent event) {
        IngestDocumentCommand command = event.command();
        log.info("Starting background ingestion for knowledge item {}", command.knowledgeItemId());
        try {
            ingestionService.ingest(command);
        } catch (RuntimeException ex) {
            log.error("Background ingestion crashed for knowledge item {}", command.knowledgeItemId(), ex);
        }
    }
}
