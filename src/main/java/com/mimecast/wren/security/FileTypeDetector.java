package com.mimecast.wren.security;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.tika.Tika;
import org.apache.tika.mime.MimeTypeException;
import org.apache.tika.mime.MimeTypes;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * True file type detection from magic bytes.
 *
 * <p>Uses Apache Tika signature detection only, the file name is never consulted.
 */
public class FileTypeDetector {
    private static final Logger log = LogManager.getLogger(FileTypeDetector.class);

    /**
     * Generic binary type returned when no signature matches.
     */
    public static final String OCTET_STREAM = "application/octet-stream";

    private static final List<String> OOXML = List.of("application/zip", "application/x-tika-ooxml");
    private static final List<String> OLE2 = List.of("application/x-tika-msoffice", "application/vnd.ms-excel",
            "application/msword", "application/vnd.ms-outlook");

    /**
     * Extension to acceptable detected types, for extensions with a binary signature.
     */
    private static final Map<String, List<String>> SIGNATURES = new HashMap<>();

    /**
     * Extensions whose content has no signature and must look like text.
     */
    private static final List<String> TEXTUAL = List.of(".txt", ".csv", ".tsv", ".md", ".json", ".xml", ".html", ".htm",
            ".ics", ".eml", ".log");

    static {
        SIGNATURES.put(".pdf", List.of("application/pdf"));
        SIGNATURES.put(".zip", List.of("application/zip"));
        SIGNATURES.put(".docx", OOXML);
        SIGNATURES.put(".xlsx", OOXML);
        SIGNATURES.put(".pptx", OOXML);
        SIGNATURES.put(".doc", OLE2);
        SIGNATURES.put(".xls", OLE2);
        SIGNATURES.put(".ppt", OLE2);
        SIGNATURES.put(".png", List.of("image/png"));
        SIGNATURES.put(".jpg", List.of("image/jpeg"));
        SIGNATURES.put(".jpeg", List.of("image/jpeg"));
        SIGNATURES.put(".gif", List.of("image/gif"));
        SIGNATURES.put(".bmp", List.of("image/bmp", "image/x-ms-bmp"));
        SIGNATURES.put(".tif", List.of("image/tiff"));
        SIGNATURES.put(".tiff", List.of("image/tiff"));
        SIGNATURES.put(".webp", List.of("image/webp"));
    }

    private final Tika tika = new Tika();

    /**
     * Detects type from content.
     *
     * @param content Content bytes.
     * @return MIME type, {@code application/octet-stream} if unknown.
     */
    public String detect(byte[] content) {
        if (content == null || content.length == 0) {
            return OCTET_STREAM;
        }
        return tika.detect(content);
    }

    /**
     * Checks detected type against extension.
     * <p>Extensions without a known signature always match.
     *
     * @param extension    Lower case extension with leading dot.
     * @param detectedType Detected MIME type.
     * @return True if consistent.
     */
    public boolean matches(String extension, String detectedType) {
        String ext = extension == null ? "" : extension.toLowerCase(Locale.ROOT);
        List<String> expected = SIGNATURES.get(ext);
        if (expected != null) {
            return expected.contains(detectedType);
        }
        if (TEXTUAL.contains(ext)) {
            return detectedType.startsWith("text/") || detectedType.startsWith("message/")
                    || detectedType.endsWith("+xml") || detectedType.equals("application/xml")
                    || detectedType.equals("application/json") || detectedType.equals(OCTET_STREAM);
        }
        return true;
    }

    /**
     * Gets preferred extension for a MIME type.
     *
     * @param type MIME type.
     * @return Extension with leading dot or {@code .bin}.
     */
    public static String extensionFor(String type) {
        if (type != null) {
            try {
                String extension = MimeTypes.getDefaultMimeTypes().forName(type).getExtension();
                if (extension != null && !extension.isEmpty()) {
                    return extension;
                }
            } catch (MimeTypeException e) {
                log.debug("Unknown MIME type {}: {}", type, e.getMessage());
            }
        }
        return ".bin";
    }
}
