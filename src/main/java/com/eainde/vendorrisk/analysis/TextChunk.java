package com.eainde.vendorrisk.analysis;

/**
 * One slice of a long document sent to the model on its own.
 *
 * <pre>
 *   Chunk 0: chars [0..4000)
 *   Chunk 1: chars [3800..7790)   leading 200 chars repeat the tail of chunk 0
 * </pre>
 *
 * @param chunkIndex  zero-based index of this chunk
 * @param startOffset inclusive character offset in the source text
 * @param endOffset   exclusive character offset in the source text
 * @param text        the chunk content
 * @param totalChunks number of chunks the document was split into
 */
public record TextChunk(int chunkIndex, int startOffset, int endOffset, String text, int totalChunks) {

    public boolean isFirstChunk() {
        return chunkIndex == 0;
    }

    public boolean isLastChunk() {
        return chunkIndex == totalChunks - 1;
    }

    @Override
    public String toString() {
        return String.format("Chunk[%d/%d, chars %d-%d]", chunkIndex + 1, totalChunks, startOffset, endOffset);
    }
}
