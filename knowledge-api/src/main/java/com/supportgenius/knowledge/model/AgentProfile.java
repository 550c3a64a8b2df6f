package com.supportgenius.knowledge.model;

public record AgentProfile(String agentId, String name, String tone, String instructions) {
}
