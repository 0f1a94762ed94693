package com.mimecast.wren.extraction;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;

import java.util.Map;

/**
 * HTML helpers backed by jsoup.
 */
public final class HtmlText {

    private static final String BLOCKS = "p, div, li, tr, h1, h2, h3, h4, h5, h6, table, blockquote, pre";

    /**
     * Private constructor for utility class.
     */
    private HtmlText() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Strips HTML to readable text keeping line structure.
     *
     * @param html HTML source.
     * @return Plain text.
     */
    public static String toText(String html) {
        Document doc = Jsoup.parse(html);
        doc.select("script, style, head, title").remove();
        for (Element br : doc.select("br")) {
            br.after(new TextNode("\n"));
        }
        for (Element block : doc.select(BLOCKS)) {
            block.prependChild(new TextNode("\n"));
            block.appendChild(new TextNode("\n"));
        }

        String text = doc.body() != null ? doc.body().wholeText() : doc.wholeText();
        return text.replace('\u00a0', ' ')
                .replaceAll("[ \t]+", " ")
                .replaceAll("(?m)^ +| +$", "")
                .replaceAll("\n{3,}", "\n\n")
                .trim();
    }

    /**
     * Rewrites {@code cid:} references to generated names.
     *
     * @param html     HTML source.
     * @param mappings Content id to replacement name.
     * @return Rewritten HTML.
     */
    public static String rewriteCid(String html, Map<String, String> mappings) {
        if (mappings.isEmpty()) {
            return html;
        }
        Document doc = Jsoup.parse(html);
        for (Element element : doc.select("[src^=cid:], [background^=cid:]")) {
            String attribute = element.hasAttr("src") ? "src" : "background";
            String cid = element.attr(attribute).substring(4).trim();
            String name = mappings.get(cid);
            if (name != null) {
                element.attr(attribute, name);
            }
        }
        return doc.outerHtml();
    }
}
