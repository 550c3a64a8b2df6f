package com.supportgenius.knowledge.service.ingestion;

import java.util.List;

public interface TextChunker {

    List<String> chunk(String text);
}
