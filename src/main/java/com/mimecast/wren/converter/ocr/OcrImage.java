package com.mimecast.wren.converter.ocr;

import org.apache.commons.codec.binary.Base64;

/**
 * Image found by OCR on a page, with its bounding box in pixels.
 */
public class OcrImage {

    private final String id;
    private final int topLeftX;
    private final int topLeftY;
    private final int bottomRightX;
    private final int bottomRightY;
    private final String imageBase64;

    /**
     * Constructs a new OcrImage instance.
     *
     * @param id           Image id.
     * @param topLeftX     Left edge.
     * @param topLeftY     Top edge.
     * @param bottomRightX Right edge.
     * @param bottomRightY Bottom edge.
     * @param imageBase64  Base64 data, optionally a data URL, or null when not requested.
     */
    public OcrImage(String id, int topLeftX, int topLeftY, int bottomRightX, int bottomRightY, String imageBase64) {
        this.id = id;
        this.topLeftX = topLeftX;
        this.topLeftY = topLeftY;
        this.bottomRightX = bottomRightX;
        this.bottomRightY = bottomRightY;
        this.imageBase64 = imageBase64;
    }

    public String getId() {
        return id;
    }

    public int getWidth() {
        return Math.abs(bottomRightX - topLeftX);
    }

    public int getHeight() {
        return Math.abs(bottomRightY - topLeftY);
    }

    public String getImageBase64() {
        return imageBase64;
    }

    public boolean hasData() {
        return imageBase64 != null && !imageBase64.isEmpty();
    }

    /**
     * Gets file extension from the data URL media type.
     *
     * @return Extension with leading dot, {@code .png} by default.
     */
    public String getExtension() {
        if (imageBase64 != null && imageBase64.startsWith("data:image/")) {
            int end = imageBase64.indexOf(';');
            if (end > 11) {
                String subtype = imageBase64.substring(11, end);
                return "." + ("jpeg".equals(subtype) ? "jpg" : subtype);
            }
        }
        return ".png";
    }

    /**
     * Decodes image bytes, stripping any data URL prefix.
     *
     * @return Image bytes.
     * @throws IllegalArgumentException No data or not base64.
     */
    public byte[] decode() {
        if (!hasData()) {
            throw new IllegalArgumentException("Image " + id + " has no data");
        }
        String data = imageBase64;
        if (data.startsWith("data:")) {
            int comma = data.indexOf(',');
            data = comma >= 0 ? data.substring(comma + 1) : "";
        }
        if (!Base64.isBase64(data)) {
            throw new IllegalArgumentException("Image " + id + " is not valid base64");
        }
        return Base64.decodeBase64(data);
    }
}
