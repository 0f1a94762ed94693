package com.mimecast.wren.config;

import java.util.List;
import java.util.Map;

/**
 * Security configuration.
 *
 * <p>This class provides type safe access to attachment validation settings.
 */
public class SecurityConfig extends ConfigFoundation {

    /**
     * Default allowed extensions.
     */
    public static final List<String> DEFAULT_ALLOWED = List.of(
            ".txt", ".csv", ".pdf", ".doc", ".docx", ".xls", ".xlsx", ".jpg", ".jpeg", ".png", ".gif", ".zip",
            ".html", ".htm", ".eml", ".ics"
    );

    /**
     * Default blocked extensions.
     */
    public static final List<String> DEFAULT_BLOCKED = List.of(
            ".exe", ".bat", ".cmd", ".sh", ".js", ".vbs", ".ps1", ".reg", ".msi", ".com", ".jar", ".php", ".py"
    );

    /**
     * Constructs a new SecurityConfig instance.
     *
     * @param map Configuration map.
     */
    public SecurityConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets maximum attachment size in bytes.
     *
     * @return Size in bytes.
     */
    public long getMaxAttachmentSize() {
        return getLongProperty("maxAttachmentSize", 10_000_000L);
    }

    /**
     * Gets allowed extensions, lower case with leading dot.
     *
     * @return List of String.
     */
    public List<String> getAllowedExtensions() {
        return getStringListProperty("allowedExtensions", DEFAULT_ALLOWED);
    }

    /**
     * Gets blocked extensions, lower case with leading dot.
     *
     * @return List of String.
     */
    public List<String> getBlockedExtensions() {
        return getStringListProperty("blockedExtensions", DEFAULT_BLOCKED);
    }

    /**
     * Checks if type mismatches are only warned about.
     *
     * @return True if permissive.
     */
    public boolean isPermissiveTypes() {
        return getBooleanProperty("permissiveTypes", false);
    }
}
