package com.supportgenius.knowledge.service.retrieval;

import com.supportgenius.knowledge.exception.KnowledgeErrorCode;
import com.supportgenius.knowledge.exception.KnowledgeException;
import com.supportgenius.knowledge.model.QueryResult;
import com.supportgenius.knowledge.service.ingestion.EmbeddingsClient;
import com.supportgenius.knowledge.service.vector.VectorStoreClient;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DefaultKnowledgeRetrievalServiceTest {

    private static final float[] QUERY_VECTOR = {0.1f, 0.2f};

    @Mock
    private EmbeddingsClient embeddingsClient;

    @Mock
    private VectorStoreClient vectorStoreClient;

    private SimpleMeterRegistry meterRegistry;
    private DefaultKnowledgeRetrievalService retrievalService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        retrievalService = new DefaultKnowledgeRetrievalService(embeddingsClient, vectorStoreClient, meterRegistry, 3, 0.3, 3000);
    }

    @Test
    void keepsOnlyMatchesAboveThresholdInStoreOrder() {
        stubSearch(List.of(
                new QueryResult("Refunds take five days", 0.9, "faq.md"),
                new QueryResult("Shipping is free", 0.4, "shipping.pdf"),
                new QueryResult("Office dog is called Rex", 0.2, "misc.txt")));

        List<QueryResult> results = retrievalService.retrieve("how long do refunds take", "agent-1");

        assertThat(results).extracting(QueryResult::score).containsExactly(0.9, 0.4);
        assertThat(meterRegistry.counter("knowledge.retrieval.events", "outcome", "hit").count()).isEqualTo(1.0);
    }

    @Test
    void thresholdIsExclusive() {
        stubSearch(List.of(new QueryResult("borderline", 0.3, "faq.md")));

        assertThat(retrievalService.retrieve("question", "agent-1")).isEmpty();
        assertThat(meterRegistry.counter("knowledge.retrieval.events", "outcome", "miss").count()).isEqualTo(1.0);
    }

    @Test
    void lowerThresholdReturnsSuperset() {
        List<QueryResult> matches = List.of(
                new QueryResult("a", 0.8, "a.md"),
                new QueryResult("b", 0.31, "b.md"),
                new QueryResult("c", 0.05, "c.md"));
        when(embeddingsClient.embed(anyList())).thenReturn(new EmbeddingsClient.EmbeddingBatch(List.of(QUERY_VECTOR), "m", 2));
        when(vectorStoreClient.query(eq("agent-1"), any(), eq(3))).thenReturn(matches);

        List<QueryResult> strict = retrievalService.retrieve("question", "agent-1", 3, 0.3);
        List<QueryResult> loose = retrievalService.retrieve("question", "agent-1", 3, 0.0);

        assertThat(strict).allMatch(result -> result.score() > 0.3);
        assertThat(loose).containsAll(strict).hasSize(3);
    }

    @Test
    void blankQueryIsRejected() {
        assertThatThrownBy(() -> retrievalService.retrieve("  ", "agent-1"))
                .isInstanceOf(KnowledgeException.class)
                .extracting(ex -> ((KnowledgeException) ex).code())
                .isEqualTo(KnowledgeErrorCode.INVALID_INPUT);
        verifyNoInteractions(embeddingsClient, vectorStoreClient);
    }

    @Test
    void remoteFailuresDegradeToNoResults() {
        when(embeddingsClient.embed(anyList()))
                .thenThrow(new KnowledgeException(KnowledgeErrorCode.EMBEDDING_FAILURE, "Failed to compute embeddings"));

        assertThat(retrievalService.retrieve("question", "agent-1")).isEmpty();
        assertThat(retrievalService.retrieveContext("question", "agent-1")).isEmpty();
        assertThat(meterRegistry.counter("knowledge.retrieval.events", "outcome", "error").count()).isEqualTo(2.0);
    }

    @Test
    void vectorStoreFailureDegradesToNoResults() {
        when(embeddingsClient.embed(anyList())).thenReturn(new EmbeddingsClient.EmbeddingBatch(List.of(QUERY_VECTOR), "m", 2));
        when(vectorStoreClient.query(eq("agent-1"), any(), eq(3)))
                .thenThrow(new KnowledgeException(KnowledgeErrorCode.VECTOR_STORE_FAILURE, "Vector store query returned 503"));

        assertThat(retrievalService.retrieve("question", "agent-1")).isEmpty();
    }

    @Test
    void contextJoinsTextsWithBlankLines() {
        stubSearch(List.of(
                new QueryResult("Refunds take five days", 0.9, "faq.md"),
                new QueryResult("Shipping is free", 0.4, "shipping.pdf")));

        assertThat(retrievalService.retrieveContext("refunds", "agent-1"))
                .isEqualTo("Refunds take five days\n\nShipping is free");
    }

    @Test
    void blankQueryYieldsEmptyContext() {
        assertThat(retrievalService.retrieveContext("", "agent-1")).isEmpty();
        verifyNoInteractions(embeddingsClient, vectorStoreClient);
    }

    @Test
    void longContextIsTruncatedWithEllipsis() {
        String context = retrievalService.assembleContext(List.of(
                new QueryResult("x".repeat(2000), 0.9, "a.md"),
                new QueryResult("y".repeat(2000), 0.8, "b.md")));

        assertThat(context).hasSize(3003).endsWith("...");
        assertThat(context.substring(0, 3000)).isEqualTo("x".repeat(2000) + "\n\n" + "y".repeat(998));
    }

    @Test
    void contextAtLimitIsNotTruncated() {
        String text = "z".repeat(3000);

        assertThat(retrievalService.assembleContext(List.of(new QueryResult(text, 0.9, "a.md")))).isEqualTo(text);
    }

    private void stubSearch(List<QueryResult> matches) {
        when(embeddingsClient.embed(anyList())).thenReturn(new EmbeddingsClient.EmbeddingBatch(List.of(QUERY_VECTOR), "m", 2));
        when(vectorStoreClient.query("agent-1", QUERY_VECTOR, 3)).thenReturn(matches);
    }
}
