package com.supportgenius.knowledge.service.vector;

/**
 * One embedded chunk as stored in the vector index. The id is derived from the owning knowledge
 * item and the chunk ordinal, so re-upserting the same chunk overwrites instead of duplicating.
 */
public record VectorRecord(String id, float[] values, VectorMetadata metadata) {

    public static final char ID_SEPARATOR = ':';

    public static String idFor(String knowledgeItemId, int ordinal) {
        return knowledgeItemId + ID_SEPARATOR + ordinal;
    }

    public static String prefixFor(String knowledgeItemId) {
        return knowledgeItemId + ID_SEPARATOR;
    }

    public static VectorRecord of(String knowledgeItemId, int ordinal, float[] values, String content, String source) {
        return new VectorRecord(idFor(knowledgeItemId, ordinal), values,
                new VectorMetadata(knowledgeItemId, content, source, ordinal));
    }
}
