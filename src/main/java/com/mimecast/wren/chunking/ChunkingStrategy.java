package com.mimecast.wren.chunking;

import java.util.Locale;

/**
 * Chunking strategy.
 */
public enum ChunkingStrategy {
    /**
     * Fixed size token windows.
     */
    TOKEN,

    /**
     * Paragraph or sentence boundary below the limit.
     */
    SEMANTIC,

    /**
     * Nearest boundary on either side of the limit.
     */
    HYBRID;

    /**
     * Parses strategy name, case insensitive.
     *
     * @param name Strategy name.
     * @return ChunkingStrategy or null if unknown.
     */
    public static ChunkingStrategy fromString(String name) {
        if (name == null) {
            return null;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
