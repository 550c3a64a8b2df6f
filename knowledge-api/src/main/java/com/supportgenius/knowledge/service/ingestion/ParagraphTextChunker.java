package com.supportgenius.knowledge.service.ingestion;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits extracted text into chunks of one or more paragraphs.
 *
 * <p>A chunk boundary is proposed {@code maxChunkSize} characters ahead and pushed forward to the
 * next blank line, so chunks may exceed the maximum but never end mid-paragraph when a paragraph
 * break follows. Slices shorter than {@code minChunkSize} are carried over and joined with the
 * following slices. Chunks whose trimmed length does not exceed {@code minChunkLength} are dropped.
 */
@Component
public class ParagraphTextChunker implements TextChunker {

    private static final String PARAGRAPH_BREAK = "\n\n";

    private final int maxChunkSize;
    private final int minChunkSize;
    private final int minChunkLength;

    public ParagraphTextChunker(@Value("${knowledge.ingest.max-chunk-size:1500}") int maxChunkSize,
                                @Value("${knowledge.ingest.min-chunk-size:500}") int minChunkSize,
                                @Value("${knowledge.ingest.min-chunk-length:50}") int minChunkLength) {
        if (maxChunkSize <= 0) {
            throw new IllegalArgumentException("maxChunkSize must be positive");
        }
        this.maxChunkSize = maxChunkSize;
        this.minChunkSize = minChunkSize;
        this.minChunkLength = minChunkLength;
    }

    @Override
    public List<String> chunk(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<String> chunks = new ArrayList<>();
        StringBuilder carry = new StringBuilder();
        int start = 0;
        while (start < text.length()) {
            int end = start + maxChunkSize;
            if (end >= text.length()) {
                end = text.length();
            } else {
                int paragraphBoundary = text.indexOf(PARAGRAPH_BREAK, end);
                if (paragraphBoundary != -1) {
                    end = paragraphBoundary;
                }
            }
            append(carry, text.substring(start, end).trim());
            if (carry.length() >= minChunkSize) {
                chunks.add(carry.toString());
                carry.setLength(0);
            }
            start = end;
        }
        flushRemainder(chunks, carry.toString());
        return chunks.stream()
                .filter(chunk -> chunk.trim().length() > minChunkLength)
                .toList();
    }

    private void flushRemainder(List<String> chunks, String remainder) {
        if (remainder.length() >= minChunkSize || chunks.isEmpty()) {
            chunks.add(remainder);
        } else if (!remainder.isEmpty()) {
            int last = chunks.size() - 1;
            chunks.set(last, chunks.get(last) + PARAGRAPH_BREAK + remainder);
        }
    }

    private void append(StringBuilder carry, String slice) {
        if (slice.isEmpty()) {
            return;
        }
        if (carry.length() > 0) {
            carry.append(PARAGRAPH_BREAK);
        }
        carry.append(slice);
    }
}
