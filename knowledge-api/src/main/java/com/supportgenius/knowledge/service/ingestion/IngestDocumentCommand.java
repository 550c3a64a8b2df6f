package com.supportgenius.knowledge.service.ingestion;

import java.nio.file.Path;

public record IngestDocumentCommand(String knowledgeItemId,
                                    Path filePath,
                                    String mimeType,
                                    String agentId,
                                    String fileName) {
}
