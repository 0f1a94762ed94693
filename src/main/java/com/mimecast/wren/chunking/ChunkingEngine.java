package com.mimecast.wren.chunking;

import com.mimecast.wren.config.ChunkingConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Chunking engine.
 *
 * <p>Tokenizes once and delegates to the chunker of the requested strategy.
 * <br>Results are deterministic: the same input always yields the same chunks.
 * <p>Concatenating every chunk without its overlap rebuilds the input exactly, see {@link #reconstruct(List)}.
 */
public class ChunkingEngine {
    private static final Logger log = LogManager.getLogger(ChunkingEngine.class);

    /**
     * Default boundary search tolerance.
     */
    public static final double DEFAULT_TOLERANCE = 0.2;

    private final Map<ChunkingStrategy, Chunker> chunkers = new EnumMap<>(ChunkingStrategy.class);

    /**
     * Constructs a new ChunkingEngine instance with default tolerance.
     */
    public ChunkingEngine() {
        this(DEFAULT_TOLERANCE);
    }

    /**
     * Constructs a new ChunkingEngine instance.
     *
     * @param tolerance Semantic search window as a fraction of max tokens.
     */
    public ChunkingEngine(double tolerance) {
        chunkers.put(ChunkingStrategy.TOKEN, new TokenChunker());
        chunkers.put(ChunkingStrategy.SEMANTIC, new SemanticChunker(tolerance));
        chunkers.put(ChunkingStrategy.HYBRID, new HybridChunker());
    }

    /**
     * Builds engine from configuration.
     *
     * @param config ChunkingConfig instance.
     * @return ChunkingEngine instance.
     */
    public static ChunkingEngine fromConfig(ChunkingConfig config) {
        return new ChunkingEngine(config.getTolerance());
    }

    /**
     * Chunks text.
     *
     * @param text          Source text.
     * @param strategy      ChunkingStrategy.
     * @param maxTokens     Token limit, positive.
     * @param overlapTokens Shared tokens, below {@code maxTokens}.
     * @return List of Chunk.
     * @throws IllegalArgumentException Invalid limits.
     */
    public List<Chunk> chunk(String text, ChunkingStrategy strategy, int maxTokens, int overlapTokens) {
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive: " + maxTokens);
        }
        if (overlapTokens < 0 || overlapTokens >= maxTokens) {
            throw new IllegalArgumentException("overlapTokens must be in [0, maxTokens): " + overlapTokens);
        }
        if (strategy == null) {
            throw new IllegalArgumentException("strategy is required");
        }

        TokenizedText tokens = new TokenizedText(text == null ? "" : text);
        List<Chunk> chunks = chunkers.get(strategy).chunk(tokens, maxTokens, overlapTokens);
        log.debug("Chunked {} tokens into {} {} chunks", tokens.size(), chunks.size(), strategy);
        return chunks;
    }

    /**
     * Rebuilds source text from chunks.
     *
     * @param chunks Chunks in order.
     * @return Source text.
     */
    public static String reconstruct(List<Chunk> chunks) {
        StringBuilder sb = new StringBuilder();
        for (Chunk chunk : chunks) {
            sb.append(chunk.getNewText());
        }
        return sb.toString();
    }
}
