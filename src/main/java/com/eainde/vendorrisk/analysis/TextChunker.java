package com.eainde.vendorrisk.analysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits long document text into overlapping character windows for the narrative pass.
 * <p>
 * Cuts prefer a paragraph break, then a line break, then a space, searching backwards from the
 * window end but never into its first half. The overlap keeps a sentence that straddles a cut
 * visible to both chunks.
 *
 * <pre>
 * TextChunker chunker = TextChunker.builder()
 *         .threshold(8_000)
 *         .chunkSize(4_000)
 *         .overlap(200)
 *         .build();
 *
 * List&lt;TextChunk&gt; chunks = chunker.chunk(text);   // single chunk when below threshold
 * </pre>
 */
public class TextChunker {

    private static final Logger log = LoggerFactory.getLogger(TextChunker.class);

    private final int threshold;
    private final int chunkSize;
    private final int overlap;

    private TextChunker(Builder builder) {
        this.threshold = builder.threshold;
        this.chunkSize = builder.chunkSize;
        this.overlap = builder.overlap;

        if (overlap >= chunkSize / 2) {
            throw new IllegalArgumentException(
                    "overlap (" + overlap + ") must be < half of chunkSize (" + chunkSize + ")");
        }
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    public boolean needsChunking(String text) {
        return text != null && text.length() > threshold;
    }

    /**
     * @return chunks in document order, never empty
     */
    public List<TextChunk> chunk(String text) {
        if (text == null || text.isBlank()) {
            return Collections.singletonList(new TextChunk(0, 0, 0, "", 1));
        }
        if (!needsChunking(text)) {
            return Collections.singletonList(new TextChunk(0, 0, text.length(), text, 1));
        }

        List<int[]> bounds = new ArrayList<>();
        int start = 0;
        while (start < text.length()) {
            int end = Math.min(start + chunkSize, text.length());
            if (end < text.length()) {
                end = breakPoint(text, start, end);
            }
            bounds.add(new int[]{start, end});
            if (end >= text.length()) break;
            start = Math.max(end - overlap, start + 1);
        }

        int total = bounds.size();
        List<TextChunk> chunks = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            int[] b = bounds.get(i);
            chunks.add(new TextChunk(i, b[0], b[1], text.substring(b[0], b[1]), total));
        }
        log.debug("Split {} chars into {} chunks (size={}, overlap={})", text.length(), total, chunkSize, overlap);
        return Collections.unmodifiableList(chunks);
    }

    // =========================================================================
    //  Internal
    // =========================================================================

    private int breakPoint(String text, int start, int end) {
        int floor = start + chunkSize / 2;
        int paragraph = text.lastIndexOf("\n\n", end - 2);
        if (paragraph >= floor) return paragraph + 2;
        int line = text.lastIndexOf('\n', end - 1);
        if (line >= floor) return line + 1;
        int space = text.lastIndexOf(' ', end - 1);
        if (space >= floor) return space + 1;
        return end;
    }

    // =========================================================================
    //  Builder
    // =========================================================================

    public static Builder builder() {
        return new Builder();
    }

    public static TextChunker withDefaults() {
        return builder().build();
    }

    public static class Builder {
        private int threshold = 8_000;
        private int chunkSize = 4_000;
        private int overlap = 200;

        /** Texts up to this many characters are not split. Default: 8000. */
        public Builder threshold(int threshold) {
            if (threshold < 1) throw new IllegalArgumentException("threshold must be >= 1");
            this.threshold = threshold;
            return this;
        }

        /** Maximum characters per chunk. Default: 4000. */
        public Builder chunkSize(int chunkSize) {
            if (chunkSize < 100) throw new IllegalArgumentException("chunkSize must be >= 100");
            this.chunkSize = chunkSize;
            return this;
        }

        /** Characters repeated between adjacent chunks. Default: 200. */
        public Builder overlap(int overlap) {
            if (overlap < 0) throw new IllegalArgumentException("overlap must be >= 0");
            this.overlap = overlap;
            return this;
        }

        public TextChunker build() {
            return new TextChunker(this);
        }
    }
}
