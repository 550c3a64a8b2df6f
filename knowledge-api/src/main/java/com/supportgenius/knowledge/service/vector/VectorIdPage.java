package com.supportgenius.knowledge.service.vector;

import java.util.List;

public record VectorIdPage(List<String> ids, String nextPageToken) {

    public VectorIdPage {
        ids = ids == null ? List.of() : List.copyOf(ids);
    }

    public boolean hasNextPage() {
        return nextPageToken != null && !nextPageToken.isBlank();
    }
}
