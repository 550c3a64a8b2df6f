package com.supportgenius.knowledge.model;

import java.util.List;

public record ContextResponse(String agentId, String context, List<QueryResult> results) {
}
