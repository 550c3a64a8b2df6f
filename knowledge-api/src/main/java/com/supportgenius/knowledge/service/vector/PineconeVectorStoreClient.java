package com.supportgenius.knowledge.service.vector;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.supportgenius.knowledge.exception.EmptyDeleteSetException;
import com.supportgenius.knowledge.exception.KnowledgeErrorCode;
import com.supportgenius.knowledge.exception.KnowledgeException;
import com.supportgenius.knowledge.model.QueryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.List;
import java.util.Map;

@Component
public class PineconeVectorStoreClient implements VectorStoreClient {

    private static final Logger log = LoggerFactory.getLogger(PineconeVectorStoreClient.class);

    private final WebClient pineconeWebClient;
    private final RateLimitBackoff backoff;
    private final int upsertBatchSize;

    public PineconeVectorStoreClient(@Qualifier("pineconeWebClient") WebClient pineconeWebClient,
                                     RateLimitBackoff backoff,
                                     @Value("${knowledge.ingest.upsert-batch-size:200}") int upsertBatchSize) {
        this.pineconeWebClient = pineconeWebClient;
        this.backoff = backoff;
        this.upsertBatchSize = Math.max(1, upsertBatchSize);
    }

    @Override
    public void upsert(String namespace, List<VectorRecord> records) {
        requireNamespace(namespace);
        if (records == null || records.isEmpty()) {
            return;
        }
        int batches = (records.size() + upsertBatchSize - 1) / upsertBatchSize;
        log.info("Storing {} vectors in {} batch(es) of up to {} in namespace {}", records.size(), batches, upsertBatchSize, namespace);
        for (int batch = 0; batch < batches; batch++) {
            List<VectorRecord> slice = records.subList(batch * upsertBatchSize, Math.min(records.size(), (batch + 1) * upsertBatchSize));
            UpsertRequest request = new UpsertRequest(slice.stream().map(PineconeVector::from).toList(), namespace);
            String operation = "upsert batch " + (batch + 1) + "/" + batches;
            backoff.run(operation, () -> post("/vectors/upsert", request, UpsertResponse.class, operation));
            log.debug("Batch {}/{} stored in namespace {}", batch + 1, batches, namespace);
        }
    }

    @Override
    public List<QueryResult> query(String namespace, float[] vector, int topK) {
        requireNamespace(namespace);
        QueryResponse response = post("/query", new QueryRequest(namespace, vector, topK, true, false), QueryResponse.class, "query");
        if (response == null || response.matches() == null) {
            return Collections.emptyList();
        }
        return response.matches().stream().map(Match::toResult).toList();
    }

    @Override
    public VectorIdPage listByPrefix(String namespace, String prefix, int pageSize, String pageToken) {
        requireNamespace(namespace);
        ListResponse response = execute("list", pineconeWebClient.get()
                .uri(builder -> {
                    builder.path("/vectors/list")
                            .queryParam("namespace", namespace)
                            .queryParam("prefix", prefix)
                            .queryParam("limit", pageSize);
                    if (pageToken != null && !pageToken.isBlank()) {
                        builder.queryParam("paginationToken", pageToken);
                    }
                    return builder.build();
                })
                .retrieve()
                .bodyToMono(ListResponse.class));
        if (response == null) {
            return new VectorIdPage(List.of(), null);
        }
        List<String> ids = response.vectors() == null ? List.of() : response.vectors().stream()
                .map(ListedVector::id)
                .filter(id -> id != null && !id.isBlank())
                .toList();
        String next = response.pagination() == null ? null : response.pagination().next();
        return new VectorIdPage(ids, next);
    }

    @Override
    public void deleteByIds(String namespace, List<String> ids) {
        requireNamespace(namespace);
        if (ids == null || ids.isEmpty()) {
            throw new EmptyDeleteSetException(namespace);
        }
        DeleteRequest request = new DeleteRequest(List.copyOf(ids), null, namespace);
        backoff.run("delete " + ids.size() + " vectors", () -> post("/vectors/delete", request, Map.class, "delete"));
    }

    @Override
    public void deleteNamespace(String namespace) {
        requireNamespace(namespace);
        DeleteRequest request = new DeleteRequest(null, Boolean.TRUE, namespace);
        backoff.run("delete namespace " + namespace, () -> post("/vectors/delete", request, Map.class, "delete namespace"));
        log.info("Deleted namespace {}", namespace);
    }

    @Override
    public NamespaceStats namespaceStats(String namespace) {
        try {
            StatsResponse response = post("/describe_index_stats", Map.of(), StatsResponse.class, "describe index stats");
            if (response == null || response.namespaces() == null) {
                return NamespaceStats.empty();
            }
            NamespaceSummary summary = response.namespaces().get(namespace);
            return summary == null ? NamespaceStats.empty() : new NamespaceStats(summary.vectorCount());
        } catch (Exception e) {
            log.warn("Failed to read stats for namespace {}: {}", namespace, e.getMessage());
            return NamespaceStats.empty();
        }
    }

    private <T> T post(String path, Object body, Class<T> responseType, String operation) {
        return execute(operation, pineconeWebClient.post()
                .uri(path)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(responseType));
    }

    private <T> T execute(String operation, Mono<T> call) {
        try {
            return call
                    .onErrorResume(WebClientResponseException.class, ex -> Mono.error(translate(operation, ex)))
                    .block();
        } catch (KnowledgeException ex) {
            throw ex;
        } catch (Exception e) {
            log.error("Pinecone {} failed: {}", operation, e.getMessage());
            throw new KnowledgeException(KnowledgeErrorCode.VECTOR_STORE_FAILURE, "Vector store " + operation + " failed", e);
        }
    }

    private KnowledgeException translate(String operation, WebClientResponseException exception) {
        if (exception.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
            return new KnowledgeException(KnowledgeErrorCode.RATE_LIMITED, "Vector store rate limit exceeded during " + operation, exception);
        }
        log.warn("Pinecone {} returned {}: {}", operation, exception.getStatusCode(), exception.getResponseBodyAsString());
        return new KnowledgeException(KnowledgeErrorCode.VECTOR_STORE_FAILURE,
                "Vector store " + operation + " returned " + exception.getStatusCode().value(), exception);
    }

    private void requireNamespace(String namespace) {
        if (namespace == null || namespace.isBlank()) {
            throw new KnowledgeException(KnowledgeErrorCode.INVALID_INPUT, "Namespace (agent id) is required");
        }
    }

    private record PineconeVector(String id, float[] values, VectorMetadata metadata) {
        static PineconeVector from(VectorRecord record) {
            return new PineconeVector(record.id(), record.values(), record.metadata());
        }
    }

    private record UpsertRequest(List<PineconeVector> vectors, String namespace) {}

    private record UpsertResponse(long upsertedCount) {}

    private record QueryRequest(String namespace, float[] vector, int topK, boolean includeMetadata, boolean includeValues) {}

    private record QueryResponse(List<Match> matches, String namespace) {}

    private record Match(String id, double score, Map<String, Object> metadata) {
        QueryResult toResult() {
            Object content = metadata == null ? null : metadata.get("content");
            Object source = metadata == null ? null : metadata.get("source");
            return new QueryResult(content == null ? "" : content.toString(), score, source == null ? "unknown" : source.toString());
        }
    }

    private record ListResponse(List<ListedVector> vectors, Pagination pagination, String namespace) {}

    private record ListedVector(String id) {}

    private record Pagination(String next) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private record DeleteRequest(List<String> ids, Boolean deleteAll, String namespace) {}

    private record StatsResponse(Map<String, NamespaceSummary> namespaces, Integer dimension, Long totalVectorCount) {}

    private record NamespaceSummary(long vectorCount) {}
}
