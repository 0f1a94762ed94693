package com.mimecast.wren.chunking;

/**
 * Text chunk.
 *
 * <p>Covers the source characters {@code [start, end)}.
 * <br>The first {@code overlapChars} characters repeat the tail of the previous chunk.
 */
public class Chunk {

    private final int index;
    private final String text;
    private final int tokenCount;
    private final int start;
    private final int end;
    private final ChunkingStrategy strategy;
    private final int overlapTokens;
    private final int overlapChars;

    /**
     * Constructs a new Chunk instance.
     *
     * @param index         Zero based sequence index.
     * @param text          Chunk text.
     * @param tokenCount    Tokens in chunk.
     * @param start         Source start offset, inclusive.
     * @param end           Source end offset, exclusive.
     * @param strategy      Strategy used.
     * @param overlapTokens Tokens shared with previous chunk.
     * @param overlapChars  Characters shared with previous chunk.
     */
    public Chunk(int index, String text, int tokenCount, int start, int end, ChunkingStrategy strategy,
                 int overlapTokens, int overlapChars) {
        this.index = index;
        this.text = text;
        this.tokenCount = tokenCount;
        this.start = start;
        this.end = end;
        this.strategy = strategy;
        this.overlapTokens = overlapTokens;
        this.overlapChars = overlapChars;
    }

    public int getIndex() {
        return index;
    }

    public String getText() {
        return text;
    }

    public int getTokenCount() {
        return tokenCount;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public ChunkingStrategy getStrategy() {
        return strategy;
    }

    public int getOverlapTokens() {
        return overlapTokens;
    }

    public int getOverlapChars() {
        return overlapChars;
    }

    /**
     * Gets text not shared with the previous chunk.
     *
     * @return Text without leading overlap.
     */
    public String getNewText() {
        return text.substring(overlapChars);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Chunk)) {
            return false;
        }
        Chunk other = (Chunk) o;
        return index == other.index && start == other.start && end == other.end && tokenCount == other.tokenCount
                && overlapTokens == other.overlapTokens && overlapChars == other.overlapChars
                && strategy == other.strategy && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * index + start) + end;
    }

    @Override
    public String toString() {
        return "Chunk{" + index + " [" + start + ", " + end + ") " + tokenCount + " tokens, overlap " + overlapTokens + "}";
    }
}
