package com.mimecast.wren.config;

import java.util.Map;

/**
 * Output layout configuration.
 * <p>Directory names are relative to the processing output directory.
 */
public class OutputConfig extends ConfigFoundation {

    /**
     * Constructs a new OutputConfig instance.
     *
     * @param map Configuration map.
     */
    public OutputConfig(Map<String, Object> map) {
        super(map);
    }

    public String getTextDir() {
        return getStringProperty("textDir", "processed_text");
    }

    public String getAttachmentsDir() {
        return getStringProperty("attachmentsDir", "attachments");
    }

    public String getInlineImagesDir() {
        return getStringProperty("inlineImagesDir", "inline_images");
    }

    public String getSpreadsheetDir() {
        return getStringProperty("spreadsheetDir", "converted_excel");
    }

    public String getOcrDir() {
        return getStringProperty("ocrDir", "converted_pdf");
    }

    public String getDocxDir() {
        return getStringProperty("docxDir", "converted_docx");
    }
}
