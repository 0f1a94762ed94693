package com.mimecast.wren.chunking;

import java.util.List;

/**
 * Chunking strategy implementation.
 */
public interface Chunker {

    /**
     * Gets strategy implemented.
     *
     * @return ChunkingStrategy.
     */
    ChunkingStrategy getStrategy();

    /**
     * Splits tokenized text into chunks.
     *
     * @param text          TokenizedText instance.
     * @param maxTokens     Token limit.
     * @param overlapTokens Tokens shared by adjacent chunks.
     * @return List of Chunk.
     */
    List<Chunk> chunk(TokenizedText text, int maxTokens, int overlapTokens);
}
