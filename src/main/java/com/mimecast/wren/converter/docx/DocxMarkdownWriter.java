package com.mimecast.wren.converter.docx;

import org.apache.poi.xwpf.usermodel.IBodyElement;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFStyle;
import org.apache.poi.xwpf.usermodel.XWPFStyles;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders a word processor document as markdown.
 *
 * <p>Headings come from the {@code Title} and {@code heading N} styles, list items from paragraph numbering.
 * <br>Bold and italic runs are wrapped, adjacent runs with the same formatting are merged first.
 * <br>Tables render as pipe tables with the first row as header.
 */
public class DocxMarkdownWriter {

    /**
     * Writes document as markdown.
     *
     * @param document XWPFDocument instance.
     * @return Markdown text.
     */
    public String write(XWPFDocument document) {
        StringBuilder markdown = new StringBuilder();
        boolean previousListItem = false;

        for (IBodyElement element : document.getBodyElements()) {
            String block;
            boolean listItem = false;
            if (element instanceof XWPFParagraph) {
                XWPFParagraph paragraph = (XWPFParagraph) element;
                listItem = paragraph.getNumID() != null;
                block = paragraph(paragraph, document.getStyles());
            } else if (element instanceof XWPFTable) {
                block = table((XWPFTable) element);
            } else {
                continue;
            }

            if (block.isEmpty()) {
                continue;
            }
            if (markdown.length() > 0) {
                markdown.append(listItem && previousListItem ? "\n" : "\n\n");
            }
            markdown.append(block);
            previousListItem = listItem;
        }

        return markdown.toString();
    }

    /**
     * Renders paragraph.
     *
     * @param paragraph XWPFParagraph instance.
     * @param styles    Document styles, may be null.
     * @return Markdown line or empty string.
     */
    String paragraph(XWPFParagraph paragraph, XWPFStyles styles) {
        int level = headingLevel(paragraph, styles);
        if (level > 0) {
            String text = paragraph.getText().trim();
            return text.isEmpty() ? "" : "#".repeat(level) + " " + text;
        }

        String text = runs(paragraph.getRuns()).trim();
        if (text.isEmpty()) {
            return "";
        }

        if (paragraph.getNumID() != null) {
            BigInteger ilvl = paragraph.getNumIlvl();
            String indent = "  ".repeat(ilvl != null ? ilvl.intValue() : 0);
            String marker = "bullet".equals(paragraph.getNumFmt()) || paragraph.getNumFmt() == null ? "- " : "1. ";
            return indent + marker + text;
        }
        return text;
    }

    /**
     * Gets heading level from paragraph style.
     *
     * @param paragraph XWPFParagraph instance.
     * @param styles    Document styles, may be null.
     * @return Level 1 to 6, or 0 if not a heading.
     */
    static int headingLevel(XWPFParagraph paragraph, XWPFStyles styles) {
        String styleId = paragraph.getStyleID();
        if (styleId == null) {
            return 0;
        }

        String name = styleId;
        if (styles != null) {
            XWPFStyle style = styles.getStyle(styleId);
            if (style != null && style.getName() != null) {
                name = style.getName();
            }
        }

        String normalized = name.toLowerCase(Locale.ROOT).replace(" ", "");
        if (normalized.equals("title")) {
            return 1;
        }
        if (normalized.startsWith("heading") && normalized.length() > 7) {
            try {
                int level = Integer.parseInt(normalized.substring(7));
                return level >= 1 ? Math.min(level, 6) : 0;
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return 0;
    }

    /**
     * Renders runs, merging neighbours with the same formatting.
     *
     * @param runs List of XWPFRun.
     * @return Markdown text.
     */
    static String runs(List<XWPFRun> runs) {
        List<String> texts = new ArrayList<>();
        List<String> marks = new ArrayList<>();
        for (XWPFRun run : runs) {
            String text = run.text();
            if (text == null || text.isEmpty()) {
                continue;
            }
            String mark = (run.isBold() ? "**" : "") + (run.isItalic() ? "*" : "");
            int last = marks.size() - 1;
            if (last >= 0 && marks.get(last).equals(mark)) {
                texts.set(last, texts.get(last) + text);
            } else {
                texts.add(text);
                marks.add(mark);
            }
        }

        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < texts.size(); i++) {
            sb.append(emphasize(texts.get(i), marks.get(i)));
        }
        return sb.toString();
    }

    /**
     * Wraps text in emphasis markers, keeping surrounding whitespace outside.
     *
     * @param text Run text.
     * @param mark Markers.
     * @return Markdown text.
     */
    static String emphasize(String text, String mark) {
        String core = text.trim();
        if (mark.isEmpty() || core.isEmpty()) {
            return text;
        }
        int start = text.indexOf(core);
        String closing = new StringBuilder(mark).reverse().toString();
        return text.substring(0, start) + mark + core + closing + text.substring(start + core.length());
    }

    /**
     * Renders table.
     *
     * @param table XWPFTable instance.
     * @return Markdown table or empty string.
     */
    static String table(XWPFTable table) {
        List<XWPFTableRow> rows = table.getRows();
        if (rows.isEmpty()) {
            return "";
        }

        int columns = 0;
        for (XWPFTableRow row : rows) {
            columns = Math.max(columns, row.getTableCells().size());
        }
        if (columns == 0) {
            return "";
        }

        StringBuilder sb = new StringBuilder();
        for (int r = 0; r < rows.size(); r++) {
            List<XWPFTableCell> cells = rows.get(r).getTableCells();
            sb.append('|');
            for (int c = 0; c < columns; c++) {
                String text = c < cells.size() ? cells.get(c).getText() : "";
                sb.append(' ').append(cell(text)).append(" |");
            }
            sb.append('\n');
            if (r == 0) {
                sb.append('|');
                sb.append(" --- |".repeat(columns));
                sb.append('\n');
            }
        }
        return sb.toString().trim();
    }

    private static String cell(String text) {
        return text.trim().replace("|", "\\|").replaceAll("\\s*[\\r\\n]+\\s*", " ");
    }
}
