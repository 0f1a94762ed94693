package com.mimecast.wren.config;

import java.util.Map;

/**
 * OCR document conversion configuration.
 *
 * <p>The API key is read from {@code apiKey} or, when absent, from the environment variable named by
 * {@code apiKeyEnv}.
 */
public class OcrConfig extends ConfigFoundation {

    /**
     * Constructs a new OcrConfig instance.
     *
     * @param map Configuration map.
     */
    public OcrConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Is OCR conversion enabled.
     *
     * @return Boolean.
     */
    public boolean isEnabled() {
        return getBooleanProperty("enabled", true);
    }

    /**
     * Gets OCR service base URL.
     *
     * @return URL string.
     */
    public String getBaseUrl() {
        return getStringProperty("baseUrl", "https://api.mistral.ai");
    }

    /**
     * Gets OCR model name.
     *
     * @return Model name.
     */
    public String getModel() {
        return getStringProperty("model", "mistral-ocr-latest");
    }

    /**
     * Gets name of the environment variable holding the API key.
     *
     * @return Variable name.
     */
    public String getApiKeyEnv() {
        return getStringProperty("apiKeyEnv", "MISTRALAI_API_KEY");
    }

    /**
     * Gets API key.
     *
     * @return API key or null if not configured.
     */
    public String getApiKey() {
        String key = getStringProperty("apiKey", null);
        return key != null ? key : System.getenv(getApiKeyEnv());
    }

    /**
     * Gets extraction mode: text, images or all.
     *
     * @return Mode string.
     */
    public String getExtractionMode() {
        return getStringProperty("extractionMode", "all");
    }

    /**
     * Gets maximum images kept, 0 for unlimited.
     *
     * @return Limit.
     */
    public int getImageLimit() {
        return Math.toIntExact(getLongProperty("imageLimit", 0L));
    }

    /**
     * Gets minimum image edge in pixels.
     *
     * @return Pixels.
     */
    public int getImageMinSize() {
        return Math.toIntExact(getLongProperty("imageMinSize", 100L));
    }

    /**
     * Should extracted images be saved.
     *
     * @return Boolean.
     */
    public boolean isSaveImages() {
        return getBooleanProperty("saveImages", true);
    }

    /**
     * Gets page separator inserted between pages.
     *
     * @return Separator string.
     */
    public String getPageSeparator() {
        return getStringProperty("pageSeparator", "\n\n---\n\n");
    }

    /**
     * Gets maximum document size in bytes.
     *
     * @return Size in bytes.
     */
    public long getMaxFileSize() {
        return getLongProperty("maxFileSize", 104_857_600L);
    }

    /**
     * Gets HTTP timeout in seconds.
     *
     * @return Seconds.
     */
    public int getTimeoutSeconds() {
        return Math.toIntExact(getLongProperty("timeoutSeconds", 30L));
    }

    /**
     * Gets resilience settings.
     *
     * @return ResilienceConfig instance.
     */
    public ResilienceConfig getResilience() {
        return new ResilienceConfig(getMapProperty("resilience"));
    }
}
