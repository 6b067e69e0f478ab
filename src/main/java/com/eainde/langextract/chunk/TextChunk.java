package com.eainde.langextract.chunk;

/**
 * One window of a chunked document.
 *
 * @param index       0-based chunk index
 * @param start       offset of the chunk's first character in the full document
 * @param end         exclusive end offset in the full document
 * @param text        the chunk text, equal to {@code document.substring(start, end)}
 * @param totalChunks number of chunks the document was split into
 */
public record TextChunk(int index, int start, int end, String text, int totalChunks) {

    public int length() {
        return end - start;
    }

    public boolean isLast() {
        return index == totalChunks - 1;
    }

    @Override
    public String toString() {
        return String.format("Chunk[%d/%d: chars %d-%d, %d chars]",
                index + 1, totalChunks, start, end, length());
    }
}
