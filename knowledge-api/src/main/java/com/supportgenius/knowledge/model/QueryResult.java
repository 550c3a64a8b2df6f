package com.supportgenius.knowledge.model;

public record QueryResult(
        String text,
        double score,
        String source
) {
}
