package com.supportgenius.knowledge.service.knowledge;

import com.supportgenius.knowledge.model.KnowledgeItemView;
import com.supportgenius.knowledge.service.vector.NamespaceStats;

import java.util.List;

public interface KnowledgeBaseService {

    /**
     * Stores the upload, records a PENDING item and schedules background ingestion. Returns before
     * any processing happens.
     */
    KnowledgeItemView upload(UploadKnowledgeCommand command);

    List<KnowledgeItemView> list(String agentId);

    KnowledgeItemView get(String knowledgeItemId);

    /**
     * Removes the item and, best effort, its vectors. A vector store failure never blocks the
     * relational delete.
     */
    void delete(String knowledgeItemId);

    /**
     * Drops the agent's whole namespace and every item it owns. Returns the number of items removed.
     */
    long deleteAgentKnowledge(String agentId);

    NamespaceStats stats(String agentId);
}
