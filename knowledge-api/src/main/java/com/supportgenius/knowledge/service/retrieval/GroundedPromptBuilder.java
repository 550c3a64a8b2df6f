package com.supportgenius.knowledge.service.retrieval;

import com.supportgenius.knowledge.model.AgentProfile;
import com.supportgenius.knowledge.persistence.entity.ProcessingStatus;
import com.supportgenius.knowledge.persistence.repository.KnowledgeItemRepository;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Builds the system prompt for an agent reply. Knowledge context is appended only when the agent has
 * at least one processed document and the search produced something.
 */
@Component
public class GroundedPromptBuilder {

    static final String KNOWLEDGE_HEADER = "Relevant information from knowledge base:";

    private final KnowledgeRetrievalService retrievalService;
    private final KnowledgeItemRepository knowledgeItemRepository;

    public GroundedPromptBuilder(KnowledgeRetrievalService retrievalService,
                                 KnowledgeItemRepository knowledgeItemRepository) {
        this.retrievalService = retrievalService;
        this.knowledgeItemRepository = knowledgeItemRepository;
    }

    public String build(AgentProfile agent, String query) {
        String knowledgeContext = "";
        if (hasKnowledge(agent.agentId())) {
            String context = retrievalService.retrieveContext(query, agent.agentId());
            if (!context.isEmpty()) {
                knowledgeContext = "\n\n" + KNOWLEDGE_HEADER + "\n" + context;
            }
        }
        return "You are " + agent.name() + ", an AI assistant for customer support.\n"
                + "\n"
                + "Personality and Tone: " + Objects.toString(agent.tone(), "") + "\n"
                + "\n"
                + "Instructions: " + Objects.toString(agent.instructions(), "") + "\n"
                + "\n"
                + "Guidelines:\n"
                + "- Always maintain the specified tone and personality\n"
                + "- Use the knowledge base information when relevant to answer questions\n"
                + "- If the knowledge base doesn't contain relevant information, acknowledge this and provide general helpful responses\n"
                + "- Be concise but thorough\n"
                + "- Always be helpful and professional"
                + knowledgeContext;
    }

    private boolean hasKnowledge(String agentId) {
        return knowledgeItemRepository.countByAgentIdAndProcessingStatus(agentId, ProcessingStatus.COMPLETED) > 0;
    }
}
