package com.mimecast.wren.config;

import java.util.Map;

/**
 * Chunking configuration.
 */
public class ChunkingConfig extends ConfigFoundation {

    /**
     * Constructs a new ChunkingConfig instance.
     *
     * @param map Configuration map.
     */
    public ChunkingConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Is chunking enabled.
     *
     * @return Boolean.
     */
    public boolean isEnabled() {
        return getBooleanProperty("enabled", true);
    }

    /**
     * Gets strategy name: token, semantic or hybrid.
     *
     * @return Strategy name.
     */
    public String getStrategy() {
        return getStringProperty("strategy", "hybrid");
    }

    /**
     * Gets maximum tokens per chunk.
     *
     * @return Token count.
     */
    public int getMaxTokens() {
        return Math.toIntExact(getLongProperty("maxTokens", 2000L));
    }

    /**
     * Gets tokens shared by adjacent chunks.
     *
     * @return Token count.
     */
    public int getOverlapTokens() {
        return Math.toIntExact(getLongProperty("overlapTokens", 200L));
    }

    /**
     * Gets boundary search window as a fraction of maximum tokens.
     *
     * @return Fraction between 0 and 1.
     */
    public double getTolerance() {
        return getDoubleProperty("tolerance", 0.2);
    }
}
