package com.supportgenius.knowledge.persistence.repository;

import com.supportgenius.knowledge.persistence.entity.KnowledgeItemEntity;
import com.supportgenius.knowledge.persistence.entity.ProcessingStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

public interface KnowledgeItemRepository extends JpaRepository<KnowledgeItemEntity, String> {

    List<KnowledgeItemEntity> findByAgentIdOrderByUploadedAtDesc(String agentId);

    long countByAgentIdAndProcessingStatus(String agentId, ProcessingStatus processingStatus);

    @Transactional
    long deleteByAgentId(String agentId);
}
