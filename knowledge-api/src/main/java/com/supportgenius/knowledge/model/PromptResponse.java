package com.supportgenius.knowledge.model;

public record PromptResponse(String agentId, String systemPrompt) {
}
