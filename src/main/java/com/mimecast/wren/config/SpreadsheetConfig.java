package com.mimecast.wren.config;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Spreadsheet conversion configuration.
 */
public class SpreadsheetConfig extends ConfigFoundation {

    /**
     * Constructs a new SpreadsheetConfig instance.
     *
     * @param map Configuration map.
     */
    public SpreadsheetConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Is spreadsheet conversion enabled.
     *
     * @return Boolean.
     */
    public boolean isEnabled() {
        return getBooleanProperty("enabled", true);
    }

    /**
     * Gets maximum rows emitted per sheet.
     *
     * @return Row count.
     */
    public int getMaxRowsPerSheet() {
        return Math.toIntExact(getLongProperty("maxRowsPerSheet", 1_000_000L));
    }

    /**
     * Gets sheet names to convert.
     * <p>Empty means every sheet.
     *
     * @return List of String.
     */
    public List<String> getSheets() {
        return getStringListProperty("sheets", Collections.emptyList());
    }

    /**
     * Gets maximum workbook size in bytes.
     *
     * @return Size in bytes.
     */
    public long getMaxFileSize() {
        return getLongProperty("maxFileSize", 52_428_800L);
    }
}
