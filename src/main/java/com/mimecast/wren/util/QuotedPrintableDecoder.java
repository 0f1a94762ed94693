package com.mimecast.wren.util;

import java.io.ByteArrayOutputStream;

/**
 * Lenient quoted-printable decoder.
 *
 * <p>Accepts soft line breaks terminated by CRLF or bare LF and tolerates trailing whitespace before them.
 * <br>Invalid escape sequences are kept literally instead of failing the whole part.
 */
public final class QuotedPrintableDecoder {

    /**
     * Private constructor for utility class.
     */
    private QuotedPrintableDecoder() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Decodes quoted-printable bytes.
     *
     * @param bytes Encoded bytes.
     * @return Decoded bytes.
     */
    public static byte[] decode(byte[] bytes) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(bytes.length);
        int i = 0;
        while (i < bytes.length) {
            byte b = bytes[i];
            if (b != '=') {
                out.write(b);
                i++;
                continue;
            }

            // Soft line break, possibly with transport padding.
            int j = i + 1;
            while (j < bytes.length && (bytes[j] == ' ' || bytes[j] == '\t')) {
                j++;
            }
            if (j < bytes.length && bytes[j] == '\n') {
                i = j + 1;
                continue;
            }
            if (j + 1 < bytes.length && bytes[j] == '\r' && bytes[j + 1] == '\n') {
                i = j + 2;
                continue;
            }
            if (j == bytes.length) {
                // Trailing '=' at end of input.
                i = j;
                continue;
            }

            if (i + 2 < bytes.length) {
                int high = Character.digit(bytes[i + 1], 16);
                int low = Character.digit(bytes[i + 2], 16);
                if (high >= 0 && low >= 0) {
                    out.write((high << 4) | low);
                    i += 3;
                    continue;
                }
            }

            out.write(b);
            i++;
        }
        return out.toByteArray();
    }
}
