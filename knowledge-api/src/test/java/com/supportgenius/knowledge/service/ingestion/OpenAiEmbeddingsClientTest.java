package com.supportgenius.knowledge.service.ingestion;

import com.fasterxml.jackson.databind.JsonNode;
import com.supportgenius.knowledge.exception.KnowledgeErrorCode;
import com.supportgenius.knowledge.exception.KnowledgeException;
import com.supportgenius.knowledge.support.RecordingExchangeFunction;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpenAiEmbeddingsClientTest {

    private final RecordingExchangeFunction remote = new RecordingExchangeFunction();
    private final OpenAiEmbeddingsClient client = new OpenAiEmbeddingsClient(remote.webClient(), "text-embedding-3-small", 2, 5);

    @Test
    void rejectsEmptyInputWithoutCallingTheService() {
        assertThatThrownBy(() -> client.embed(List.of("")))
                .isInstanceOf(KnowledgeException.class)
                .extracting(ex -> ((KnowledgeException) ex).code())
                .isEqualTo(KnowledgeErrorCode.INVALID_INPUT);

        assertThat(remote.requests()).isEmpty();
    }

    @Test
    void sendsOneBatchedRequestAndKeepsInputOrder() {
        remote.replyOk("""
                {"object":"list","model":"text-embedding-3-small",
                 "data":[{"object":"embedding","index":1,"embedding":[0.3,0.4]},
                         {"object":"embedding","index":0,"embedding":[0.1,0.2]}],
                 "usage":{"prompt_tokens":4,"total_tokens":4}}
                """);

        EmbeddingsClient.EmbeddingBatch batch = client.embed(List.of("first chunk", "  ", "second chunk"));

        assertThat(remote.requests()).hasSize(1);
        RecordingExchangeFunction.RecordedRequest request = remote.lastRequest();
        assertThat(request.path()).isEqualTo("/v1/embeddings");
        JsonNode body = request.json();
        assertThat(body.get("model").asText()).isEqualTo("text-embedding-3-small");
        assertThat(body.get("dimensions").asInt()).isEqualTo(2);
        assertThat(body.get("encoding_format").asText()).isEqualTo("float");
        assertThat(body.get("input")).hasSize(2);
        assertThat(body.get("input").get(0).asText()).isEqualTo("first chunk");

        assertThat(batch.vectors()).hasSize(2);
        assertThat(Arrays.equals(batch.vectors().get(0), new float[]{0.1f, 0.2f})).isTrue();
        assertThat(Arrays.equals(batch.vectors().get(1), new float[]{0.3f, 0.4f})).isTrue();
        assertThat(batch.model()).isEqualTo("text-embedding-3-small");
    }

    @Test
    void reportsTooManyRequestsAsRateLimited() {
        remote.reply(HttpStatus.TOO_MANY_REQUESTS, "{\"error\":{\"message\":\"Rate limit reached\"}}");

        assertThatThrownBy(() -> client.embed(List.of("question")))
                .isInstanceOf(KnowledgeException.class)
                .extracting(ex -> ((KnowledgeException) ex).code())
                .isEqualTo(KnowledgeErrorCode.RATE_LIMITED);
    }

    @Test
    void reportsServerErrorsAsEmbeddingFailure() {
        remote.reply(HttpStatus.INTERNAL_SERVER_ERROR, "{\"error\":{\"message\":\"boom\"}}");

        assertThatThrownBy(() -> client.embed(List.of("question")))
                .isInstanceOf(KnowledgeException.class)
                .extracting(ex -> ((KnowledgeException) ex).code())
                .isEqualTo(KnowledgeErrorCode.EMBEDDING_FAILURE);
    }

    @Test
    void rejectsResponseWithMissingVectors() {
        remote.replyOk("{\"data\":[{\"index\":0,\"embedding\":[0.1,0.2]}],\"model\":\"text-embedding-3-small\"}");

        assertThatThrownBy(() -> client.embed(List.of("one", "two")))
                .isInstanceOf(KnowledgeException.class)
                .extracting(ex -> ((KnowledgeException) ex).code())
                .isEqualTo(KnowledgeErrorCode.EMBEDDING_FAILURE);
    }
}
