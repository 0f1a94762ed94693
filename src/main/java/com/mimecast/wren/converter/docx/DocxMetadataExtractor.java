package com.mimecast.wren.converter.docx;

import org.apache.poi.ooxml.POIXMLProperties;
import org.apache.poi.xwpf.usermodel.IBodyElement;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.openxmlformats.schemas.officeDocument.x2006.customProperties.CTProperty;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Calendar;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Word processor document metadata.
 * <p>Core properties, optionally custom properties, and content counts.
 */
public class DocxMetadataExtractor {

    private final boolean includeCustomProperties;

    /**
     * Constructs a new DocxMetadataExtractor instance.
     *
     * @param includeCustomProperties Include custom document properties.
     */
    public DocxMetadataExtractor(boolean includeCustomProperties) {
        this.includeCustomProperties = includeCustomProperties;
    }

    /**
     * Extracts metadata.
     *
     * @param document XWPFDocument instance.
     * @return Map of metadata, blank values omitted.
     */
    public Map<String, Object> extract(XWPFDocument document) {
        Map<String, Object> metadata = new LinkedHashMap<>();

        POIXMLProperties.CoreProperties core = document.getProperties().getCoreProperties();
        put(metadata, "title", core.getTitle());
        put(metadata, "author", core.getCreator());
        put(metadata, "subject", core.getSubject());
        put(metadata, "keywords", core.getKeywords());
        put(metadata, "description", core.getDescription());
        put(metadata, "category", core.getCategory());
        put(metadata, "lastModifiedBy", core.getLastModifiedByUser());
        put(metadata, "revision", core.getRevision());
        put(metadata, "created", format(core.getCreated()));
        put(metadata, "modified", format(core.getModified()));

        if (includeCustomProperties) {
            Map<String, Object> custom = customProperties(document);
            if (!custom.isEmpty()) {
                metadata.put("custom", custom);
            }
        }

        metadata.put("statistics", statistics(document));
        return metadata;
    }

    /**
     * Gets custom properties.
     *
     * @param document XWPFDocument instance.
     * @return Map of property name to value.
     */
    Map<String, Object> customProperties(XWPFDocument document) {
        Map<String, Object> custom = new LinkedHashMap<>();
        POIXMLProperties.CustomProperties properties = document.getProperties().getCustomProperties();
        if (properties == null || properties.getUnderlyingProperties() == null) {
            return custom;
        }

        for (CTProperty property : properties.getUnderlyingProperties().getPropertyList()) {
            Object value;
            if (property.isSetLpwstr()) {
                value = property.getLpwstr();
            } else if (property.isSetLpstr()) {
                value = property.getLpstr();
            } else if (property.isSetI4()) {
                value = property.getI4();
            } else if (property.isSetI8()) {
                value = property.getI8();
            } else if (property.isSetR8()) {
                value = property.getR8();
            } else if (property.isSetBool()) {
                value = property.getBool();
            } else if (property.isSetFiletime()) {
                Calendar calendar = property.getFiletime();
                value = format(calendar.getTime());
            } else {
                continue;
            }
            custom.put(property.getName(), value);
        }
        return custom;
    }

    /**
     * Counts document content.
     *
     * @param document XWPFDocument instance.
     * @return Map of counts.
     */
    static Map<String, Object> statistics(XWPFDocument document) {
        int paragraphs = 0;
        int tables = 0;
        long words = 0;
        long characters = 0;

        for (IBodyElement element : document.getBodyElements()) {
            String text;
            if (element instanceof XWPFParagraph) {
                text = ((XWPFParagraph) element).getText();
                if (!text.isBlank()) {
                    paragraphs++;
                }
            } else if (element instanceof XWPFTable) {
                tables++;
                text = ((XWPFTable) element).getText();
            } else {
                continue;
            }
            characters += text.length();
            String trimmed = text.trim();
            if (!trimmed.isEmpty()) {
                words += trimmed.split("\\s+").length;
            }
        }

        Map<String, Object> statistics = new LinkedHashMap<>();
        statistics.put("paragraphs", paragraphs);
        statistics.put("tables", tables);
        statistics.put("words", words);
        statistics.put("characters", characters);
        statistics.put("images", document.getAllPictures().size());
        return statistics;
    }

    private static void put(Map<String, Object> metadata, String key, String value) {
        if (value != null && !value.isBlank()) {
            metadata.put(key, value.trim());
        }
    }

    private static String format(Date date) {
        return date == null ? null : DateTimeFormatter.ISO_INSTANT.format(date.toInstant().atOffset(ZoneOffset.UTC));
    }
}
