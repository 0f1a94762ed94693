package com.mimecast.wren.converter.ocr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * OCR page result.
 */
public class OcrPage {

    private final int index;
    private final String markdown;
    private final List<OcrImage> images;

    /**
     * Constructs a new OcrPage instance.
     *
     * @param index    Zero based page index.
     * @param markdown Page markdown or null.
     * @param images   Images found on the page.
     */
    public OcrPage(int index, String markdown, List<OcrImage> images) {
        this.index = index;
        this.markdown = markdown;
        this.images = images != null ? new ArrayList<>(images) : new ArrayList<>();
    }

    public int getIndex() {
        return index;
    }

    public String getMarkdown() {
        return markdown;
    }

    public boolean hasMarkdown() {
        return markdown != null && !markdown.isBlank();
    }

    public List<OcrImage> getImages() {
        return Collections.unmodifiableList(images);
    }
}
