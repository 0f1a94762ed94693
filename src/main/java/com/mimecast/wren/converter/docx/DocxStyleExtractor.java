package com.mimecast.wren.converter.docx;

import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFStyle;
import org.apache.poi.xwpf.usermodel.XWPFStyles;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Builds a style manifest from the styles, fonts and paragraph formatting the document actually uses.
 */
public class DocxStyleExtractor {

    /**
     * Extracts style manifest.
     *
     * @param document XWPFDocument instance.
     * @return Manifest map.
     */
    public Map<String, Object> extract(XWPFDocument document) {
        Map<String, Integer> styleUsage = new TreeMap<>();
        Map<String, Integer> fonts = new TreeMap<>();
        Map<String, Integer> fontSizes = new TreeMap<>();
        Map<String, Integer> alignments = new TreeMap<>();
        int boldRuns = 0;
        int italicRuns = 0;
        int underlinedRuns = 0;

        for (XWPFParagraph paragraph : paragraphs(document)) {
            increment(styleUsage, paragraph.getStyleID() != null ? paragraph.getStyleID() : "Normal");
            increment(alignments, paragraph.getAlignment().name().toLowerCase(Locale.ROOT));

            for (XWPFRun run : paragraph.getRuns()) {
                if (run.getFontFamily() != null) {
                    increment(fonts, run.getFontFamily());
                }
                Double size = run.getFontSizeAsDouble();
                if (size != null) {
                    increment(fontSizes, String.valueOf(size));
                }
                if (run.isBold()) {
                    boldRuns++;
                }
                if (run.isItalic()) {
                    italicRuns++;
                }
                if (run.getUnderline() != null && !"NONE".equals(run.getUnderline().name())) {
                    underlinedRuns++;
                }
            }
        }

        List<Map<String, Object>> styles = new ArrayList<>();
        XWPFStyles documentStyles = document.getStyles();
        for (Map.Entry<String, Integer> usage : styleUsage.entrySet()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("style_id", usage.getKey());
            XWPFStyle style = documentStyles != null ? documentStyles.getStyle(usage.getKey()) : null;
            if (style != null) {
                entry.put("name", style.getName());
                entry.put("type", style.getType() != null ? style.getType().toString() : null);
                entry.put("based_on", style.getBasisStyleID());
            }
            entry.put("paragraphs", usage.getValue());
            styles.add(entry);
        }

        Map<String, Object> emphasis = new LinkedHashMap<>();
        emphasis.put("bold_runs", boldRuns);
        emphasis.put("italic_runs", italicRuns);
        emphasis.put("underlined_runs", underlinedRuns);

        Map<String, Object> manifest = new LinkedHashMap<>();
        manifest.put("styles", styles);
        manifest.put("fonts", fonts);
        manifest.put("font_sizes", fontSizes);
        manifest.put("alignments", alignments);
        manifest.put("emphasis", emphasis);
        return manifest;
    }

    /**
     * Gets body paragraphs and table cell paragraphs.
     *
     * @param document XWPFDocument instance.
     * @return List of XWPFParagraph.
     */
    private static List<XWPFParagraph> paragraphs(XWPFDocument document) {
        List<XWPFParagraph> paragraphs = new ArrayList<>(document.getParagraphs());
        for (XWPFTable table : document.getTables()) {
            for (XWPFTableRow row : table.getRows()) {
                for (XWPFTableCell cell : row.getTableCells()) {
                    paragraphs.addAll(cell.getParagraphs());
                }
            }
        }
        return paragraphs;
    }

    private static void increment(Map<String, Integer> counts, String key) {
        counts.merge(key, 1, Integer::sum);
    }
}
