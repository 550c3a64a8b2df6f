package com.supportgenius.knowledge.service.ingestion;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.supportgenius.knowledge.exception.KnowledgeErrorCode;
import com.supportgenius.knowledge.exception.KnowledgeException;
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

import java.time.Duration;
import java.util.Comparator;
import java.util.List;

@Component
public class OpenAiEmbeddingsClient implements EmbeddingsClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiEmbeddingsClient.class);

    private final WebClient embeddingsWebClient;
    private final String model;
    private final int dimensions;
    private final Duration timeout;

    public OpenAiEmbeddingsClient(@Qualifier("embeddingsWebClient") WebClient embeddingsWebClient,
                                  @Value("${knowledge.openai.embedding-model:text-embedding-3-small}") String model,
                                  @Value("${knowledge.openai.dimensions:1536}") int dimensions,
                                  @Value("${knowledge.openai.timeout-seconds:60}") long timeoutSeconds) {
        this.embeddingsWebClient = embeddingsWebClient;
        this.model = model;
        this.dimensions = dimensions;
        this.timeout = Duration.ofSeconds(Math.max(1, timeoutSeconds));
    }

    @Override
    public EmbeddingBatch embed(List<String> texts) {
        List<String> inputs = texts == null ? List.of() : texts.stream()
                .filter(text -> text != null && !text.isBlank())
                .toList();
        if (inputs.isEmpty()) {
            throw new KnowledgeException(KnowledgeErrorCode.INVALID_INPUT, "No valid inputs provided for embedding");
        }
        try {
            EmbeddingResponse response = embeddingsWebClient.post()
                    .uri("/v1/embeddings")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(new EmbeddingRequest(model, inputs, dimensions, "float"))
                    .retrieve()
                    .bodyToMono(EmbeddingResponse.class)
                    .onErrorResume(WebClientResponseException.class, this::translate)
                    .block(timeout);
            if (response == null || response.data() == null || response.data().size() != inputs.size()) {
                throw new KnowledgeException(KnowledgeErrorCode.EMBEDDING_FAILURE, "Embeddings service returned an incomplete response");
            }
            List<float[]> vectors = response.data().stream()
                    .sorted(Comparator.comparingInt(EmbeddingData::index))
                    .map(EmbeddingData::embedding)
                    .toList();
            log.debug("Embedded {} inputs with model {}", vectors.size(), response.model());
            return new EmbeddingBatch(vectors, response.model() == null ? model : response.model(), dimensions);
        } catch (KnowledgeException ex) {
            throw ex;
        } catch (Exception e) {
            log.error("Embeddings service call failed: {}", e.getMessage());
            throw new KnowledgeException(KnowledgeErrorCode.EMBEDDING_FAILURE, "Failed to compute embeddings", e);
        }
    }

    private Mono<EmbeddingResponse> translate(WebClientResponseException exception) {
        if (exception.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
            log.warn("Embeddings service rate limit exceeded");
            return Mono.error(new KnowledgeException(KnowledgeErrorCode.RATE_LIMITED, "Embeddings rate limit exceeded", exception));
        }
        log.warn("Embeddings service returned {}: {}", exception.getStatusCode(), exception.getResponseBodyAsString());
        return Mono.error(new KnowledgeException(KnowledgeErrorCode.EMBEDDING_FAILURE,
                "Embeddings service returned " + exception.getStatusCode().value(), exception));
    }

    private record EmbeddingRequest(String model,
                                    List<String> input,
                                    int dimensions,
                                    @JsonProperty("encoding_format") String encodingFormat) {}

    private record EmbeddingResponse(List<EmbeddingData> data, String model) {}

    private record EmbeddingData(int index, float[] embedding) {}
}
