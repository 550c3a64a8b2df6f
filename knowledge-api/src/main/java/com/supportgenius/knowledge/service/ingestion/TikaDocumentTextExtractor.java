package com.supportgenius.knowledge.service.ingestion;

import com.supportgenius.knowledge.exception.KnowledgeErrorCode;
import com.supportgenius.knowledge.exception.KnowledgeException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.parser.pdf.PDFParser;
import org.apache.tika.sax.BodyContentHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Locale;

@Component
public class TikaDocumentTextExtractor implements DocumentTextExtractor {

    private static final Logger log = LoggerFactory.getLogger(TikaDocumentTextExtractor.class);

    private final TransientFileStore fileStore;

    public TikaDocumentTextExtractor(TransientFileStore fileStore) {
        this.fileStore = fileStore;
    }

    @Override
    public String extract(Path filePath, String declaredMimeType) {
        String mimeType = declaredMimeType == null ? "" : declaredMimeType.trim().toLowerCase(Locale.ROOT);
        if (!SUPPORTED_TYPES.contains(mimeType)) {
            throw new KnowledgeException(KnowledgeErrorCode.UNSUPPORTED_TYPE, "Unsupported file type: " + declaredMimeType);
        }
        byte[] bytes = fileStore.read(filePath);
        if ("application/pdf".equals(mimeType)) {
            return extractPdf(filePath, bytes);
        }
        return new String(bytes, StandardCharsets.UTF_8);
    }

    private String extractPdf(Path filePath, byte[] bytes) {
        try (InputStream inputStream = new ByteArrayInputStream(bytes)) {
            BodyContentHandler handler = new BodyContentHandler(-1);
            Metadata metadata = new Metadata();
            metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, String.valueOf(filePath.getFileName()));
            new PDFParser().parse(inputStream, handler, metadata, new ParseContext());
            return handler.toString();
        } catch (Exception e) {
            log.error("Failed to extract text from {}", filePath.getFileName(), e);
            throw new KnowledgeException(KnowledgeErrorCode.EXTRACTION_FAILURE, "Failed to extract document text", e);
        }
    }
}
