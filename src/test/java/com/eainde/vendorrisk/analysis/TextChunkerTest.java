package com.eainde.vendorrisk.analysis;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TextChunkerTest {

    private final TextChunker chunker = TextChunker.builder()
            .threshold(1_000)
            .chunkSize(400)
            .overlap(50)
            .build();

    @Test
    @DisplayName("should keep short text in a single chunk")
    void shortText() {
        List<TextChunk> chunks = chunker.chunk("We encrypt everything.");

        assertThat(chunks).singleElement().satisfies(c -> {
            assertThat(c.text()).isEqualTo("We encrypt everything.");
            assertThat(c.totalChunks()).isEqualTo(1);
        });
    }

    @Test
    @DisplayName("should cover long text with bounded, overlapping chunks")
    void longText() {
        String text = "control ".repeat(400);

        List<TextChunk> chunks = chunker.chunk(text);

        assertThat(chunks).hasSizeGreaterThan(1);
        assertThat(chunks.get(0).startOffset()).isZero();
        assertThat(chunks.get(chunks.size() - 1).endOffset()).isEqualTo(text.length());
        for (int i = 0; i < chunks.size(); i++) {
            TextChunk chunk = chunks.get(i);
            assertThat(chunk.text().length()).isLessThanOrEqualTo(400);
            assertThat(chunk.chunkIndex()).isEqualTo(i);
            assertThat(chunk.totalChunks()).isEqualTo(chunks.size());
            if (i > 0) {
                assertThat(chunk.startOffset()).isLessThan(chunks.get(i - 1).endOffset());
            }
        }
    }

    @Test
    @DisplayName("should cut at a word boundary rather than mid-word")
    void wordBoundary() {
        String text = "control ".repeat(400);

        List<TextChunk> chunks = chunker.chunk(text);

        assertThat(chunks.get(0).text()).endsWith(" ");
    }

    @Test
    @DisplayName("should reject an overlap of half the chunk size or more")
    void invalidOverlap() {
        assertThatThrownBy(() -> TextChunker.builder().chunkSize(400).overlap(200).build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
