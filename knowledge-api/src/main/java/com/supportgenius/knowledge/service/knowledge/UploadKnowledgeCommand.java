package com.supportgenius.knowledge.service.knowledge;

public record UploadKnowledgeCommand(String agentId,
                                     String originalName,
                                     String contentType,
                                     byte[] bytes) {
}
