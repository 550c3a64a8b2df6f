package com.supportgenius.knowledge.service.vector;

import com.supportgenius.knowledge.model.QueryResult;

import java.util.List;

/**
 * Vector index operations. Every call is scoped to a single namespace, which is the agent id;
 * nothing here reads or writes across namespaces.
 */
public interface VectorStoreClient {

    /**
     * Writes records in fixed-size batches, one request per batch. Batches written before a failing
     * batch stay written.
     */
    void upsert(String namespace, List<VectorRecord> records);

    /** Nearest records by similarity, best first. No relevance cut-off is applied here. */
    List<QueryResult> query(String namespace, float[] vector, int topK);

    VectorIdPage listByPrefix(String namespace, String prefix, int pageSize, String pageToken);

    /**
     * @throws com.supportgenius.knowledge.exception.EmptyDeleteSetException when {@code ids} is empty
     */
    void deleteByIds(String namespace, List<String> ids);

    void deleteNamespace(String namespace);

    /** Best effort: any failure yields a zero count. */
    NamespaceStats namespaceStats(String namespace);
}
