package com.supportgenius.knowledge.service.retrieval;

import com.supportgenius.knowledge.model.AgentProfile;
import com.supportgenius.knowledge.persistence.entity.ProcessingStatus;
import com.supportgenius.knowledge.persistence.repository.KnowledgeItemRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GroundedPromptBuilderTest {

    private static final AgentProfile AGENT = new AgentProfile("agent-1", "Ava", "Friendly and upbeat", "Help customers with orders");

    @Mock
    private KnowledgeRetrievalService retrievalService;

    @Mock
    private KnowledgeItemRepository knowledgeItemRepository;

    @InjectMocks
    private GroundedPromptBuilder promptBuilder;

    @Test
    void appendsKnowledgeContextWhenAgentHasProcessedDocuments() {
        when(knowledgeItemRepository.countByAgentIdAndProcessingStatus("agent-1", ProcessingStatus.COMPLETED)).thenReturn(2L);
        when(retrievalService.retrieveContext("refund?", "agent-1")).thenReturn("Refunds take five days");

        String prompt = promptBuilder.build(AGENT, "refund?");

        assertThat(prompt)
                .startsWith("You are Ava, an AI assistant for customer support.")
                .contains("Personality and Tone: Friendly and upbeat")
                .contains("Instructions: Help customers with orders")
                .endsWith("- Always be helpful and professional\n\nRelevant information from knowledge base:\nRefunds take five days");
    }

    @Test
    void fallsBackToGuidelinesWhenNothingRelevantWasFound() {
        when(knowledgeItemRepository.countByAgentIdAndProcessingStatus("agent-1", ProcessingStatus.COMPLETED)).thenReturn(1L);
        when(retrievalService.retrieveContext("weather?", "agent-1")).thenReturn("");

        String prompt = promptBuilder.build(AGENT, "weather?");

        assertThat(prompt)
                .doesNotContain("Relevant information from knowledge base")
                .endsWith("- Always be helpful and professional");
    }

    @Test
    void skipsSearchForAgentsWithoutKnowledge() {
        when(knowledgeItemRepository.countByAgentIdAndProcessingStatus("agent-1", ProcessingStatus.COMPLETED)).thenReturn(0L);

        String prompt = promptBuilder.build(AGENT, "refund?");

        assertThat(prompt).doesNotContain("Relevant information from knowledge base");
        verifyNoInteractions(retrievalService);
    }
}
