package com.supportgenius.knowledge.service.vector;

public record NamespaceStats(long vectorCount) {

    public static NamespaceStats empty() {
        return new NamespaceStats(0);
    }
}
