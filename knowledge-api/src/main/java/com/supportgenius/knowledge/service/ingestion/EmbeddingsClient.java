package com.supportgenius.knowledge.service.ingestion;

import java.util.List;

public interface EmbeddingsClient {

    /**
     * Embeds the non-blank entries of {@code texts} in a single request. Vectors come back in input
     * order with blank entries removed.
     */
    EmbeddingBatch embed(List<String> texts);

    record EmbeddingBatch(List<float[]> vectors, String model, int dimensions) {}
}
