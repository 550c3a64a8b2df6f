package com.supportgenius.knowledge.controller;

import com.supportgenius.knowledge.exception.KnowledgeErrorCode;
import com.supportgenius.knowledge.exception.KnowledgeException;
import com.supportgenius.knowledge.model.AgentProfile;
import com.supportgenius.knowledge.model.ContextRequest;
import com.supportgenius.knowledge.model.ContextResponse;
import com.supportgenius.knowledge.model.KnowledgeItemView;
import com.supportgenius.knowledge.model.PromptRequest;
import com.supportgenius.knowledge.model.PromptResponse;
import com.supportgenius.knowledge.model.QueryResult;
import com.supportgenius.knowledge.service.knowledge.KnowledgeBaseService;
import com.supportgenius.knowledge.service.knowledge.UploadKnowledgeCommand;
import com.supportgenius.knowledge.service.retrieval.GroundedPromptBuilder;
import com.supportgenius.knowledge.service.retrieval.KnowledgeRetrievalService;
import com.supportgenius.knowledge.service.vector.NamespaceStats;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;
import java.util.Map;

@RestController
public class KnowledgeBaseController {

    private final KnowledgeBaseService knowledgeBaseService;
    private final KnowledgeRetrievalService retrievalService;
    private final GroundedPromptBuilder promptBuilder;

    public KnowledgeBaseController(KnowledgeBaseService knowledgeBaseService,
                                   KnowledgeRetrievalService retrievalService,
                                   GroundedPromptBuilder promptBuilder) {
        this.knowledgeBaseService = knowledgeBaseService;
        this.retrievalService = retrievalService;
        this.promptBuilder = promptBuilder;
    }

    @PostMapping(value = "/api/agents/{agentId}/knowledge", consumes = MediaType.MULTIPART_FORM_DATA_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public KnowledgeItemView upload(@PathVariable String agentId,
                                    @RequestPart(value = "file", required = false) MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new KnowledgeException(KnowledgeErrorCode.INVALID_INPUT, "No file provided");
        }
        try {
            return knowledgeBaseService.upload(new UploadKnowledgeCommand(agentId, file.getOriginalFilename(), file.getContentType(), file.getBytes()));
        } catch (IOException e) {
            throw new KnowledgeException(KnowledgeErrorCode.STORAGE_FAILURE, "Failed to read uploaded file", e);
        }
    }

    @GetMapping(value = "/api/agents/{agentId}/knowledge", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<KnowledgeItemView> list(@PathVariable String agentId) {
        return knowledgeBaseService.list(agentId);
    }

    @DeleteMapping(value = "/api/agents/{agentId}/knowledge", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> deleteAgentKnowledge(@PathVariable String agentId) {
        long removed = knowledgeBaseService.deleteAgentKnowledge(agentId);
        return Map.of("agentId", agentId, "deleted", removed);
    }

    @GetMapping(value = "/api/agents/{agentId}/knowledge/stats", produces = MediaType.APPLICATION_JSON_VALUE)
    public NamespaceStats stats(@PathVariable String agentId) {
        return knowledgeBaseService.stats(agentId);
    }

    @PostMapping(value = "/api/agents/{agentId}/context", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ContextResponse context(@PathVariable String agentId, @Valid @RequestBody ContextRequest request) {
        List<QueryResult> results = retrievalService.retrieve(request.query(), agentId);
        return new ContextResponse(agentId, retrievalService.assembleContext(results), results);
    }

    @PostMapping(value = "/api/agents/{agentId}/prompt", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public PromptResponse prompt(@PathVariable String agentId, @Valid @RequestBody PromptRequest request) {
        AgentProfile agent = new AgentProfile(agentId, request.name(), request.tone(), request.instructions());
        return new PromptResponse(agentId, promptBuilder.build(agent, request.query()));
    }

    @GetMapping(value = "/api/knowledge/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public KnowledgeItemView get(@PathVariable String id) {
        return knowledgeBaseService.get(id);
    }

    @DeleteMapping(value = "/api/knowledge/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> delete(@PathVariable String id) {
        knowledgeBaseService.delete(id);
        return Map.of("message", "Knowledge base item deleted successfully");
    }
}
