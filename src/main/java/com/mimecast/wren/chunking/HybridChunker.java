package com.mimecast.wren.chunking;

/**
 * Cuts at the boundary nearest the limit on either side.
 *
 * <p>Paragraph boundaries win over sentence boundaries. A boundary qualifies when the chunk keeps more tokens than
 * the overlap and stays within one and a half times {@code maxTokens}; with none the cut falls on the limit.
 */
public class HybridChunker extends AbstractChunker {

    @Override
    public ChunkingStrategy getStrategy() {
        return ChunkingStrategy.HYBRID;
    }

    @Override
    protected int nextEnd(TokenizedText text, int start, int maxTokens, int overlapTokens) {
        int n = text.size();
        int limit = start + maxTokens;
        if (limit >= n) {
            return n;
        }

        int low = start + overlapTokens + 1;
        int high = Math.min(start + maxTokens + maxTokens / 2, n);

        int paragraph = nearest(text.previousParagraph(limit), text.nextParagraph(limit), limit, low, high);
        if (paragraph > 0) {
            return paragraph;
        }
        int sentence = nearest(text.previousSentence(limit), text.nextSentence(limit), limit, low, high);
        if (sentence > 0) {
            return sentence;
        }
        return limit;
    }

    /**
     * Picks the candidate closest to the limit, the earlier one on ties.
     *
     * @return Boundary or -1 if neither qualifies.
     */
    private static int nearest(int before, int after, int limit, int low, int high) {
        boolean beforeOk = before >= low && before <= high;
        boolean afterOk = after >= low && after <= high;
        if (beforeOk && afterOk) {
            return limit - before <= after - limit ? before : after;
        }
        if (beforeOk) {
            return before;
        }
        return afterOk ? after : -1;
    }
}
