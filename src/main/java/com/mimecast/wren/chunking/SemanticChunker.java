package com.mimecast.wren.chunking;

/**
 * Cuts at the last paragraph boundary, else sentence boundary, at or below the limit.
 *
 * <p>Only boundaries within {@code tolerance * maxTokens} of the limit qualify, otherwise the cut falls on the limit.
 */
public class SemanticChunker extends AbstractChunker {

    private final double tolerance;

    /**
     * Constructs a new SemanticChunker instance.
     *
     * @param tolerance Search window as a fraction of {@code maxTokens}.
     */
    public SemanticChunker(double tolerance) {
        this.tolerance = tolerance;
    }

    @Override
    public ChunkingStrategy getStrategy() {
        return ChunkingStrategy.SEMANTIC;
    }

    @Override
    protected int nextEnd(TokenizedText text, int start, int maxTokens, int overlapTokens) {
        int limit = start + maxTokens;
        if (limit >= text.size()) {
            return text.size();
        }

        int window = Math.min((int) Math.round(maxTokens * tolerance), maxTokens - overlapTokens - 1);
        int low = limit - Math.max(0, window);

        int paragraph = text.previousParagraph(limit);
        if (paragraph >= low && paragraph > start) {
            return paragraph;
        }
        int sentence = text.previousSentence(limit);
        if (sentence >= low && sentence > start) {
            return sentence;
        }
        return limit;
    }
}
