package com.mimecast.wren.chunking;

import java.util.ArrayList;
import java.util.List;

/**
 * Chunking loop shared by every strategy.
 *
 * <p>Each chunk is the token range {@code [start, end)}; the next one starts {@code overlapTokens} before the end.
 * <br>Implementations only pick the end, which must leave more than {@code overlapTokens} tokens in the chunk.
 */
public abstract class AbstractChunker implements Chunker {

    @Override
    public List<Chunk> chunk(TokenizedText text, int maxTokens, int overlapTokens) {
        List<Chunk> chunks = new ArrayList<>();
        int n = text.size();
        if (n == 0) {
            if (!text.getText().isEmpty()) {
                chunks.add(new Chunk(0, text.getText(), 0, 0, text.getText().length(), getStrategy(), 0, 0));
            }
            return chunks;
        }

        int start = 0;
        int overlap = 0;
        int overlapChars = 0;
        while (true) {
            int end = nextEnd(text, start, maxTokens, overlapTokens);
            if (end <= start || end > n || (end < n && end <= start + overlapTokens)) {
                throw new IllegalStateException(getStrategy() + " chunker did not advance at token " + start);
            }

            int from = text.spanStart(start);
            int to = text.spanEnd(end - 1);
            chunks.add(new Chunk(chunks.size(), text.getText().substring(from, to), end - start, from, to,
                    getStrategy(), overlap, overlapChars));

            if (end == n) {
                return chunks;
            }

            int next = end - overlapTokens;
            overlap = end - next;
            overlapChars = to - text.spanStart(next);
            start = next;
        }
    }

    /**
     * Picks the end of the chunk starting at {@code start}.
     *
     * @param text          TokenizedText instance.
     * @param start         First token of the chunk.
     * @param maxTokens     Token limit.
     * @param overlapTokens Tokens shared by adjacent chunks.
     * @return Exclusive end token, greater than {@code start + overlapTokens} unless it is the text end.
     */
    protected abstract int nextEnd(TokenizedText text, int start, int maxTokens, int overlapTokens);
}
