package com.supportgenius.knowledge.service.ingestion;

import com.supportgenius.knowledge.exception.KnowledgeErrorCode;
import com.supportgenius.knowledge.exception.KnowledgeException;
import com.supportgenius.knowledge.service.vector.RateLimitBackoff;
import com.supportgenius.knowledge.service.vector.VectorRecord;
import com.supportgenius.knowledge.service.vector.VectorStoreClient;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class DefaultIngestionService implements IngestionService {

    private static final Logger log = LoggerFactory.getLogger(DefaultIngestionService.class);

    private final DocumentTextExtractor textExtractor;
    private final TextChunker textChunker;
    private final EmbeddingsClient embeddingsClient;
    private final VectorStoreClient vectorStoreClient;
    private final RateLimitBackoff backoff;
    private final ProcessingStatusRecorder statusRecorder;
    private final TransientFileStore fileStore;
    private final MeterRegistry meterRegistry;
    private final Counter completedCounter;
    private final Counter failedCounter;
    private final Counter skippedCounter;
    private final Timer ingestionTimer;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public DefaultIngestionService(DocumentTextExtractor textExtractor,
                                   TextChunker textChunker,
                                   EmbeddingsClient embeddingsClient,
                                   VectorStoreClient vectorStoreClient,
                                   RateLimitBackoff backoff,
                                   ProcessingStatusRecorder statusRecorder,
                                   TransientFileStore fileStore,
                                   MeterRegistry meterRegistry) {
        this.textExtractor = textExtractor;
        this.textChunker = textChunker;
        this.embeddingsClient = embeddingsClient;
        this.vectorStoreClient = vectorStoreClient;
        this.backoff = backoff;
        this.statusRecorder = statusRecorder;
        this.fileStore = fileStore;
        this.meterRegistry = meterRegistry;
        this.completedCounter = meterRegistry.counter("knowledge.ingest.events", "outcome", "completed");
        this.failedCounter = meterRegistry.counter("knowledge.ingest.events", "outcome", "failed");
        this.skippedCounter = meterRegistry.counter("knowledge.ingest.events", "outcome", "skipped");
        this.ingestionTimer = meterRegistry.timer("knowledge.ingest.duration");
    }

    @Override
    public void ingest(IngestDocumentCommand command) {
        String knowledgeItemId = command.knowledgeItemId();
        if (!inFlight.add(knowledgeItemId)) {
            skippedCounter.increment();
            log.warn("Ingestion of knowledge item {} is already running, skipping duplicate request", knowledgeItemId);
            return;
        }
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            int chunkCount = process(command);
            statusRecorder.completed(knowledgeItemId, chunkCount);
            completedCounter.increment();
            log.info("Processed knowledge item {} ({}) into {} chunks for agent {}",
                    knowledgeItemId, command.fileName(), chunkCount, command.agentId());
        } catch (Exception ex) {
            failedCounter.increment();
            log.error("Failed to process knowledge item {} ({})", knowledgeItemId, command.fileName(), ex);
            recordFailure(knowledgeItemId, ex);
        } finally {
            deleteTransientFile(command);
            sample.stop(ingestionTimer);
            inFlight.remove(knowledgeItemId);
        }
    }

    private int process(IngestDocumentCommand command) {
        statusRecorder.processing(command.knowledgeItemId());

        String text = textExtractor.extract(command.filePath(), command.mimeType());
        if (text == null || text.isBlank()) {
            throw new KnowledgeException(KnowledgeErrorCode.EMPTY_DOCUMENT, "No text content extracted from document");
        }

        List<String> chunks = textChunker.chunk(text);
        if (chunks.isEmpty()) {
            throw new KnowledgeException(KnowledgeErrorCode.NO_CHUNKS_PRODUCED, "No valid chunks created from document");
        }
        log.debug("Split knowledge item {} into {} chunks", command.knowledgeItemId(), chunks.size());

        EmbeddingsClient.EmbeddingBatch embeddings = backoff.execute("embed chunks", () -> embeddingsClient.embed(chunks));
        if (embeddings.vectors().size() != chunks.size()) {
            throw new KnowledgeException(KnowledgeErrorCode.EMBEDDING_FAILURE, "Embeddings response size did not match chunks");
        }

        List<VectorRecord> records = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            records.add(VectorRecord.of(command.knowledgeItemId(), i, embeddings.vectors().get(i), chunks.get(i), command.fileName()));
        }
        vectorStoreClient.upsert(command.agentId(), records);
        return chunks.size();
    }

    private void recordFailure(String knowledgeItemId, Exception cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : "Unknown error";
        try {
            statusRecorder.failed(knowledgeItemId, message);
        } catch (RuntimeException ex) {
            log.error("Could not record failure for knowledge item {}", knowledgeItemId, ex);
        }
    }

    private void deleteTransientFile(IngestDocumentCommand command) {
        if (command.filePath() == null) {
            return;
        }
        try {
            fileStore.delete(command.filePath());
        } catch (RuntimeException ex) {
            log.warn("Failed to clean up transient file {}", command.filePath(), ex);
        }
    }
}
