package com.supportgenius.knowledge.service.ingestion;

import java.nio.file.Path;
import java.util.Set;

public interface DocumentTextExtractor {

    Set<String> SUPPORTED_TYPES = Set.of("application/pdf", "text/plain", "text/markdown");

    /**
     * @throws com.supportgenius.knowledge.exception.KnowledgeException with
     *         {@code UNSUPPORTED_TYPE} when the declared type is outside {@link #SUPPORTED_TYPES}
     */
    String extract(Path filePath, String declaredMimeType);
}
