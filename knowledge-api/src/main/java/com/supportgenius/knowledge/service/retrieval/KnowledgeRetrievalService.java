package com.supportgenius.knowledge.service.retrieval;

import com.supportgenius.knowledge.model.QueryResult;

import java.util.List;

public interface KnowledgeRetrievalService {

    /**
     * Semantic search within one agent's namespace using the configured top-k and relevance threshold.
     */
    List<QueryResult> retrieve(String query, String agentId);

    /**
     * Returns at most {@code topK} results whose score is strictly greater than
     * {@code relevanceThreshold}, in the order the vector store ranked them. Remote failures
     * degrade to an empty list; a blank query is rejected.
     */
    List<QueryResult> retrieve(String query, String agentId, int topK, double relevanceThreshold);

    /**
     * Joins the relevant chunk texts into a single context block, or {@code ""} when nothing matched.
     */
    String retrieveContext(String query, String agentId);

    /**
     * Joins result texts with a blank line, truncating to the configured maximum and appending
     * {@code "..."} when cut.
     */
    String assembleContext(List<QueryResult> results);
}
