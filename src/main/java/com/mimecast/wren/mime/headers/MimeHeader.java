package com.mimecast.wren.mime.headers;

import jakarta.mail.internet.MimeUtility;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayOutputStream;
import java.io.UnsupportedEncodingException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * MIME header.
 *
 * <p>Holds an unfolded header and lazily parses its parameters.
 * <p>Parameter values support quoted strings, RFC 2231 extended and continued values and RFC 2047 encoded words.
 */
public class MimeHeader {
    private static final Logger log = LogManager.getLogger(MimeHeader.class);

    /**
     * Header name.
     */
    private final String name;

    /**
     * Header value, unfolded.
     */
    private final String value;

    /**
     * Parsed parameters, keyed by lower case name.
     */
    private Map<String, String> parameters;

    /**
     * Constructs a new MimeHeader instance from a raw header line.
     *
     * @param header Raw header, may contain folding.
     */
    public MimeHeader(String header) {
        String unfolded = unfold(header);
        int colon = unfolded.indexOf(':');
        if (colon > 0) {
            this.name = unfolded.substring(0, colon).trim();
            this.value = unfolded.substring(colon + 1).trim();
        } else {
            this.name = unfolded.trim();
            this.value = "";
        }
    }

    /**
     * Constructs a new MimeHeader instance.
     *
     * @param name  Header name.
     * @param value Header value.
     */
    public MimeHeader(String name, String value) {
        this.name = name;
        this.value = unfold(value).trim();
    }

    /**
     * Unfolds header per RFC 5322.
     *
     * @param header Raw header.
     * @return Unfolded string.
     */
    static String unfold(String header) {
        return header.replaceAll("\r?\n(?=[ \t])", "").replaceAll("[\r\n]+$", "");
    }

    public String getName() {
        return name;
    }

    public String getValue() {
        return value;
    }

    /**
     * Gets value with RFC 2047 encoded words decoded.
     *
     * @return Decoded value.
     */
    public String getDecodedValue() {
        return decodeWords(value);
    }

    /**
     * Gets value before any parameters, lower cased.
     *
     * @return Clean value, for example {@code text/plain}.
     */
    public String getCleanValue() {
        int semicolon = indexOutsideQuotes(value, ';', 0);
        String clean = semicolon >= 0 ? value.substring(0, semicolon) : value;
        return clean.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Gets parameter value, decoded.
     *
     * @param parameter Parameter name, case insensitive.
     * @return Value or null if absent.
     */
    public String getParameter(String parameter) {
        if (parameters == null) {
            parameters = parseParameters(value);
        }
        return parameters.get(parameter.toLowerCase(Locale.ROOT));
    }

    /**
     * Parses parameter list.
     *
     * @param value Header value.
     * @return Map of lower case name to decoded value.
     */
    private static Map<String, String> parseParameters(String value) {
        Map<String, String> plain = new LinkedHashMap<>();
        Map<String, TreeMap<Integer, String[]>> continued = new LinkedHashMap<>();

        int pos = indexOutsideQuotes(value, ';', 0);
        while (pos >= 0 && pos < value.length()) {
            int next = indexOutsideQuotes(value, ';', pos + 1);
            String pair = value.substring(pos + 1, next >= 0 ? next : value.length()).trim();
            pos = next;

            int equals = pair.indexOf('=');
            if (equals <= 0) {
                continue;
            }
            String key = pair.substring(0, equals).trim().toLowerCase(Locale.ROOT);
            String raw = pair.substring(equals + 1).trim();
            boolean quoted = raw.length() >= 2 && raw.startsWith("\"") && raw.endsWith("\"");
            String val = quoted ? unquote(raw) : raw;

            // RFC 2231: name*=charset'lang'value, name*0=..., name*1*=...
            int star = key.indexOf('*');
            if (star > 0) {
                String base = key.substring(0, star);
                String suffix = key.substring(star + 1);
                boolean extended = suffix.endsWith("*") || suffix.isEmpty();
                String section = suffix.replace("*", "");
                int index = 0;
                if (!section.isEmpty()) {
                    try {
                        index = Integer.parseInt(section);
                    } catch (NumberFormatException e) {
                        log.debug("Ignoring malformed parameter section: {}", key);
                        continue;
                    }
                }
                continued.computeIfAbsent(base, k -> new TreeMap<>())
                        .put(index, new String[]{val, extended && !quoted ? "1" : "0"});
            } else {
                plain.put(key, decodeWords(val));
            }
        }

        for (Map.Entry<String, TreeMap<Integer, String[]>> entry : continued.entrySet()) {
            plain.put(entry.getKey(), joinExtended(entry.getValue()));
        }
        return plain;
    }

    /**
     * Joins RFC 2231 sections and percent decodes extended ones using the first section charset.
     *
     * @param sections Ordered sections of value and extended flag.
     * @return Decoded value.
     */
    private static String joinExtended(TreeMap<Integer, String[]> sections) {
        Charset charset = StandardCharsets.UTF_8;
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        boolean first = true;
        for (String[] section : sections.values()) {
            String val = section[0];
            boolean extended = "1".equals(section[1]);
            if (first && extended) {
                int q1 = val.indexOf('\'');
                int q2 = q1 >= 0 ? val.indexOf('\'', q1 + 1) : -1;
                if (q2 > q1) {
                    String name = val.substring(0, q1);
                    if (!name.isEmpty()) {
                        try {
                            charset = Charset.forName(name);
                        } catch (IllegalArgumentException e) {
                            log.debug("Unknown RFC 2231 charset: {}", name);
                        }
                    }
                    val = val.substring(q2 + 1);
                }
            }
            first = false;
            if (extended) {
                percentDecode(val, bytes);
            } else {
                byte[] raw = val.getBytes(charset);
                bytes.write(raw, 0, raw.length);
            }
        }
        return bytes.toString(charset);
    }

    /**
     * Percent decodes into given buffer, keeping invalid escapes literally.
     *
     * @param val   Encoded value.
     * @param bytes Output buffer.
     */
    private static void percentDecode(String val, ByteArrayOutputStream bytes) {
        for (int i = 0; i < val.length(); i++) {
            char c = val.charAt(i);
            if (c == '%' && i + 2 < val.length()) {
                int high = Character.digit(val.charAt(i + 1), 16);
                int low = Character.digit(val.charAt(i + 2), 16);
                if (high >= 0 && low >= 0) {
                    bytes.write((high << 4) | low);
                    i += 2;
                    continue;
                }
            }
            bytes.write((byte) c);
        }
    }

    /**
     * Decodes RFC 2047 encoded words, leaving the input as is when decoding fails.
     *
     * @param text Text.
     * @return Decoded text.
     */
    static String decodeWords(String text) {
        if (text == null || !text.contains("=?")) {
            return text;
        }
        try {
            return MimeUtility.decodeText(text);
        } catch (UnsupportedEncodingException e) {
            log.debug("Unable to decode encoded words: {}", e.getMessage());
            return text;
        }
    }

    /**
     * Removes surrounding quotes and backslash escapes.
     *
     * @param quoted Quoted string.
     * @return Unquoted string.
     */
    private static String unquote(String quoted) {
        StringBuilder sb = new StringBuilder(quoted.length());
        for (int i = 1; i < quoted.length() - 1; i++) {
            char c = quoted.charAt(i);
            if (c == '\\' && i + 1 < quoted.length() - 1) {
                c = quoted.charAt(++i);
            }
            sb.append(c);
        }
        return sb.toString();
    }

    /**
     * Finds character index outside double quotes.
     *
     * @param text Text.
     * @param ch   Character.
     * @param from Start index.
     * @return Index or -1.
     */
    private static int indexOutsideQuotes(String text, char ch, int from) {
        boolean inQuotes = false;
        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\' && inQuotes) {
                i++;
            } else if (c == '"') {
                inQuotes = !inQuotes;
            } else if (c == ch && !inQuotes) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public String toString() {
        return name + ": " + value;
    }
}
