package com.mimecast.wren.chunking;

/**
 * Fixed windows of {@code maxTokens} tokens.
 */
public class TokenChunker extends AbstractChunker {

    @Override
    public ChunkingStrategy getStrategy() {
        return ChunkingStrategy.TOKEN;
    }

    @Override
    protected int nextEnd(TokenizedText text, int start, int maxTokens, int overlapTokens) {
        return Math.min(start + maxTokens, text.size());
    }
}
