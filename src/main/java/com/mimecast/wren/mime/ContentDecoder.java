package com.mimecast.wren.mime;

import com.mimecast.wren.util.QuotedPrintableDecoder;
import org.apache.commons.codec.binary.Base64;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.tika.parser.txt.CharsetDetector;
import org.apache.tika.parser.txt.CharsetMatch;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

/**
 * Transfer encoding and charset decoding for leaf parts.
 */
public final class ContentDecoder {
    private static final Logger log = LogManager.getLogger(ContentDecoder.class);

    /**
     * Minimum detector confidence to trust a detected charset.
     */
    private static final int MIN_CONFIDENCE = 50;

    /**
     * Last resort charset.
     */
    private static final Charset FALLBACK = Charset.forName("windows-1252");

    /**
     * Private constructor for utility class.
     */
    private ContentDecoder() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Decodes transfer encoding.
     * <p>Unknown encodings pass through unchanged with a warning.
     *
     * @param encoding Transfer encoding, lower case.
     * @param raw      Raw bytes.
     * @param warnings Warnings sink.
     * @return Decoded bytes.
     */
    public static byte[] decodeTransfer(String encoding, byte[] raw, List<String> warnings) {
        String enc = encoding == null ? "7bit" : encoding.toLowerCase(Locale.ROOT);
        switch (enc) {
            case "base64":
                return Base64.decodeBase64(raw);

            case "quoted-printable":
                return QuotedPrintableDecoder.decode(raw);

            case "7bit":
            case "8bit":
            case "binary":
                return raw;

            default:
                log.warn("Unknown transfer encoding passed through: {}", enc);
                warnings.add("Unknown transfer encoding passed through: " + enc);
                return raw;
        }
    }

    /**
     * Decodes text bytes to string.
     * <p>Declared charset is used when valid, otherwise the charset is detected.
     * <br>Falls back to strict UTF-8 and finally windows-1252.
     *
     * @param bytes    Decoded body bytes.
     * @param declared Declared charset or null.
     * @param warnings Warnings sink.
     * @return Text.
     */
    public static String decodeText(byte[] bytes, String declared, List<String> warnings) {
        if (declared != null && !declared.isBlank()) {
            Charset charset = lookup(declared.trim());
            if (charset != null) {
                return new String(bytes, charset);
            }
            warnings.add("Invalid declared charset: " + declared);
            log.debug("Invalid declared charset: {}", declared);
        }

        if (bytes.length == 0) {
            return "";
        }

        if (isAscii(bytes)) {
            return new String(bytes, StandardCharsets.US_ASCII);
        }

        CharsetDetector detector = new CharsetDetector();
        detector.setText(bytes);
        CharsetMatch match = detector.detect();
        if (match != null && match.getConfidence() >= MIN_CONFIDENCE) {
            Charset detected = lookup(match.getName());
            if (detected != null) {
                log.debug("Detected charset {} with confidence {}", match.getName(), match.getConfidence());
                return new String(bytes, detected);
            }
        }

        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            return new String(bytes, FALLBACK);
        }
    }

    /**
     * Looks up charset by name.
     *
     * @param name Charset name.
     * @return Charset or null if unknown.
     */
    private static Charset lookup(String name) {
        try {
            return Charset.forName(name);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static boolean isAscii(byte[] bytes) {
        for (byte b : bytes) {
            if (b < 0) {
                return false;
            }
        }
        return true;
    }
}
