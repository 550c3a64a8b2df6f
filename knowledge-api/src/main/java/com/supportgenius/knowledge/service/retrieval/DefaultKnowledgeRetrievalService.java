package com.supportgenius.knowledge.service.retrieval;

import com.supportgenius.knowledge.exception.KnowledgeErrorCode;
import com.supportgenius.knowledge.exception.KnowledgeException;
import com.supportgenius.knowledge.model.QueryResult;
import com.supportgenius.knowledge.service.ingestion.EmbeddingsClient;
import com.supportgenius.knowledge.service.vector.VectorStoreClient;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

@Service
public class DefaultKnowledgeRetrievalService implements KnowledgeRetrievalService {

    private static final Logger log = LoggerFactory.getLogger(DefaultKnowledgeRetrievalService.class);
    static final String CHUNK_SEPARATOR = "\n\n";
    static final String TRUNCATION_MARKER = "...";

    private final EmbeddingsClient embeddingsClient;
    private final VectorStoreClient vectorStoreClient;
    private final int topK;
    private final double relevanceThreshold;
    private final int maxContextCharacters;
    private final Counter hitCounter;
    private final Counter missCounter;
    private final Counter errorCounter;

    public DefaultKnowledgeRetrievalService(EmbeddingsClient embeddingsClient,
                                            VectorStoreClient vectorStoreClient,
                                            MeterRegistry meterRegistry,
                                            @Value("${knowledge.retrieval.top-k:3}") int topK,
                                            @Value("${knowledge.retrieval.relevance-threshold:0.3}") double relevanceThreshold,
                                            @Value("${knowledge.retrieval.max-context-characters:3000}") int maxContextCharacters) {
        this.embeddingsClient = embeddingsClient;
        this.vectorStoreClient = vectorStoreClient;
        this.topK = topK;
        this.relevanceThreshold = relevanceThreshold;
        this.maxContextCharacters = maxContextCharacters;
        this.hitCounter = meterRegistry.counter("knowledge.retrieval.events", "outcome", "hit");
        this.missCounter = meterRegistry.counter("knowledge.retrieval.events", "outcome", "miss");
        this.errorCounter = meterRegistry.counter("knowledge.retrieval.events", "outcome", "error");
    }

    @Override
    public List<QueryResult> retrieve(String query, String agentId) {
        return retrieve(query, agentId, topK, relevanceThreshold);
    }

    @Override
    public List<QueryResult> retrieve(String query, String agentId, int topK, double relevanceThreshold) {
        if (query == null || query.isBlank()) {
            throw new KnowledgeException(KnowledgeErrorCode.INVALID_INPUT, "Query must not be empty");
        }
        if (agentId == null || agentId.isBlank()) {
            throw new KnowledgeException(KnowledgeErrorCode.INVALID_INPUT, "Agent id is required");
        }
        List<QueryResult> matches;
        try {
            EmbeddingsClient.EmbeddingBatch embedding = embeddingsClient.embed(List.of(query));
            matches = vectorStoreClient.query(agentId, embedding.vectors().get(0), topK);
        } catch (RuntimeException ex) {
            errorCounter.increment();
            log.warn("Knowledge search failed for agent {}, continuing without context: {}", agentId, ex.getMessage());
            return List.of();
        }
        List<QueryResult> relevant = matches.stream()
                .filter(result -> result.score() > relevanceThreshold)
                .limit(topK)
                .toList();
        if (relevant.isEmpty()) {
            missCounter.increment();
        } else {
            hitCounter.increment();
        }
        log.debug("Knowledge search for agent {} kept {}/{} matches", agentId, relevant.size(), matches.size());
        return relevant;
    }

    @Override
    public String retrieveContext(String query, String agentId) {
        if (query == null || query.isBlank()) {
            return "";
        }
        return assembleContext(retrieve(query, agentId));
    }

    @Override
    public String assembleContext(List<QueryResult> results) {
        if (results.isEmpty()) {
            return "";
        }
        String context = results.stream()
                .map(QueryResult::text)
                .collect(Collectors.joining(CHUNK_SEPARATOR));
        return context.length() > maxContextCharacters
                ? context.substring(0, maxContextCharacters) + TRUNCATION_MARKER
                : context;
    }
}
