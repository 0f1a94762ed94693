package com.mimecast.wren.config;

import java.util.Map;

/**
 * Word processor conversion configuration.
 */
public class DocxConfig extends ConfigFoundation {

    /**
     * Constructs a new DocxConfig instance.
     *
     * @param map Configuration map.
     */
    public DocxConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Is DOCX conversion enabled.
     *
     * @return Boolean.
     */
    public boolean isEnabled() {
        return getBooleanProperty("enabled", true);
    }

    /**
     * Gets maximum document size in bytes.
     *
     * @return Size in bytes.
     */
    public long getMaxFileSize() {
        return getLongProperty("maxFileSize", 52_428_800L);
    }

    /**
     * Should metadata be extracted.
     *
     * @return Boolean.
     */
    public boolean isExtractMetadata() {
        return getBooleanProperty("extractMetadata", true);
    }

    /**
     * Should custom properties be included in metadata.
     *
     * @return Boolean.
     */
    public boolean isIncludeCustomProperties() {
        return getBooleanProperty("includeCustomProperties", true);
    }

    /**
     * Should a style manifest be written.
     *
     * @return Boolean.
     */
    public boolean isExtractStyles() {
        return getBooleanProperty("extractStyles", true);
    }

    /**
     * Should embedded images be extracted.
     *
     * @return Boolean.
     */
    public boolean isExtractImages() {
        return getBooleanProperty("extractImages", true);
    }

    /**
     * Gets chunking settings.
     *
     * @return ChunkingConfig instance.
     */
    public ChunkingConfig getChunking() {
        return new ChunkingConfig(getMapProperty("chunking"));
    }
}
