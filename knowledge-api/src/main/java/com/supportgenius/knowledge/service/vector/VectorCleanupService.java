package com.supportgenius.knowledge.service.vector;

import com.supportgenius.knowledge.exception.EmptyDeleteSetException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
public class VectorCleanupService {

    private static final Logger log = LoggerFactory.getLogger(VectorCleanupService.class);

    private final VectorStoreClient vectorStoreClient;
    private final int pageSize;

    public VectorCleanupService(VectorStoreClient vectorStoreClient,
                                @Value("${knowledge.ingest.list-page-size:100}") int pageSize) {
        this.vectorStoreClient = vectorStoreClient;
        this.pageSize = Math.max(1, pageSize);
    }

    /**
     * Removes every vector whose id starts with {@code "{knowledgeItemId}:"} from the agent's
     * namespace, one listed page at a time. Store failures other than an empty delete set propagate.
     */
    public void deleteKnowledgeItemVectors(String knowledgeItemId, String agentId) {
        String prefix = VectorRecord.prefixFor(knowledgeItemId);
        log.info("Deleting vectors with prefix {} from namespace {}", prefix, agentId);
        int deleted = 0;
        String pageToken = null;
        do {
            VectorIdPage page = vectorStoreClient.listByPrefix(agentId, prefix, pageSize, pageToken);
            if (page.ids().isEmpty()) {
                break;
            }
            try {
                vectorStoreClient.deleteByIds(agentId, page.ids());
            } catch (EmptyDeleteSetException ex) {
                log.warn("Stopping vector deletion for {}: {}", knowledgeItemId, ex.getMessage());
                break;
            }
            deleted += page.ids().size();
            pageToken = page.hasNextPage() ? page.nextPageToken() : null;
        } while (pageToken != null);
        log.info("Deleted {} vectors for knowledge item {} from namespace {}", deleted, knowledgeItemId, agentId);
    }
}
