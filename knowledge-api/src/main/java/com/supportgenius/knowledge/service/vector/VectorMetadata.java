package com.supportgenius.knowledge.service.vector;

import com.fasterxml.jackson.annotation.JsonProperty;

public record VectorMetadata(@JsonProperty("knowledge_base_id") String knowledgeBaseId,
                             @JsonProperty("content") String content,
                             @JsonProperty("source") String source,
                             @JsonProperty("chunk_index") int chunkIndex) {
}
