package com.supportgenius.knowledge.service.ingestion;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ParagraphTextChunkerTest {

    private final ParagraphTextChunker chunker = new ParagraphTextChunker(1500, 500, 50);

    @Test
    void splitsFourThousandCharactersWithTwoParagraphBreaksIntoLargeChunks() {
        String text = paragraph(1800) + "\n\n" + paragraph(1200) + "\n\n" + paragraph(996);
        assertThat(text).hasSize(4000);

        List<String> chunks = chunker.chunk(text);

        assertThat(chunks).hasSizeBetween(2, 3);
        assertThat(chunks.subList(0, chunks.size() - 1)).allSatisfy(chunk -> assertThat(chunk.length()).isGreaterThanOrEqualTo(500));
        assertThat(chunks.get(0)).isEqualTo(paragraph(1800));
    }

    @Test
    void keepsEveryCharacterApartFromBoundaryWhitespace() {
        String text = "Intro line.\n\n" + paragraph(2300) + "\n\n  " + paragraph(640) + "\n\nClosing remarks that are long enough to survive the noise filter.";

        List<String> chunks = chunker.chunk(text);

        assertThat(String.join("", chunks).replaceAll("\\s", "")).isEqualTo(text.replaceAll("\\s", ""));
    }

    @Test
    void shortInputYieldsSingleTrimmedChunk() {
        String input = "   Our support desk is open Monday to Friday from nine to five.  \n";

        assertThat(chunker.chunk(input)).containsExactly(input.trim());
    }

    @Test
    void shortInputBelowNoiseFloorYieldsNothing() {
        assertThat(chunker.chunk("Too short to be useful.")).isEmpty();
    }

    @Test
    void blankInputYieldsNothing() {
        assertThat(chunker.chunk("")).isEmpty();
        assertThat(chunker.chunk(" \n\n\t ")).isEmpty();
        assertThat(chunker.chunk(null)).isEmpty();
    }

    @Test
    void smallTrailingParagraphIsMergedIntoPreviousChunk() {
        ParagraphTextChunker small = new ParagraphTextChunker(100, 60, 10);
        String text = paragraph(120) + "\n\n" + "tail of the document";

        List<String> chunks = small.chunk(text);

        assertThat(chunks).hasSize(1);
        assertThat(chunks.get(0)).endsWith("\n\ntail of the document");
    }

    @Test
    void neverEmitsEmptyChunks() {
        List<String> chunks = chunker.chunk("\n\n\n\n" + paragraph(700) + "\n\n\n\n");

        assertThat(chunks).hasSize(1).allSatisfy(chunk -> assertThat(chunk).isNotBlank());
    }

    private static String paragraph(int length) {
        StringBuilder builder = new StringBuilder(length);
        String words = "customers can reset passwords from the account page ";
        while (builder.length() < length) {
            builder.append(words);
        }
        String value = builder.substring(0, length);
        return value.charAt(length - 1) == ' ' ? value.substring(0, length - 1) + "." : value;
    }
}
