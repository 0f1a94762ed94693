package com.mimecast.wren.converter.ocr;

import java.util.Locale;

/**
 * OCR extraction mode.
 * <p>All modes share one page traversal and differ only in what is kept.
 */
public enum ExtractionMode {
    TEXT(true, false),
    IMAGES(false, true),
    ALL(true, true);

    private final boolean text;
    private final boolean images;

    ExtractionMode(boolean text, boolean images) {
        this.text = text;
        this.images = images;
    }

    public boolean includesText() {
        return text;
    }

    public boolean includesImages() {
        return images;
    }

    /**
     * Parses mode name, case insensitive.
     *
     * @param name Mode name.
     * @return ExtractionMode or null if unknown.
     */
    public static ExtractionMode fromString(String name) {
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
