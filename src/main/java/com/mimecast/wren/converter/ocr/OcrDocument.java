package com.mimecast.wren.converter.ocr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * OCR document result.
 */
public class OcrDocument {

    private final String model;
    private final List<OcrPage> pages;
    private final int pagesProcessed;

    /**
     * Constructs a new OcrDocument instance.
     *
     * @param model          Model that produced the result.
     * @param pages          Pages, sorted by index.
     * @param pagesProcessed Pages billed by the service, or page count when not reported.
     */
    public OcrDocument(String model, List<OcrPage> pages, int pagesProcessed) {
        this.model = model;
        this.pages = new ArrayList<>(pages);
        this.pages.sort(Comparator.comparingInt(OcrPage::getIndex));
        this.pagesProcessed = pagesProcessed;
    }

    public String getModel() {
        return model;
    }

    public List<OcrPage> getPages() {
        return Collections.unmodifiableList(pages);
    }

    public int getPagesProcessed() {
        return pagesProcessed;
    }
}
