package com.mimecast.wren.converter.ocr;

/**
 * OCR request options.
 */
public class OcrRequest {

    private final boolean includeImages;
    private final int imageLimit;
    private final int imageMinSize;

    /**
     * Constructs a new OcrRequest instance.
     *
     * @param includeImages Request image data.
     * @param imageLimit    Maximum images, 0 for unlimited.
     * @param imageMinSize  Minimum image edge in pixels.
     */
    public OcrRequest(boolean includeImages, int imageLimit, int imageMinSize) {
        this.includeImages = includeImages;
        this.imageLimit = imageLimit;
        this.imageMinSize = imageMinSize;
    }

    public boolean isIncludeImages() {
        return includeImages;
    }

    public int getImageLimit() {
        return imageLimit;
    }

    public int getImageMinSize() {
        return imageMinSize;
    }
}
