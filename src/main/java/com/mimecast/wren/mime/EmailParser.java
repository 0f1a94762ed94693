package com.mimecast.wren.mime;

import com.mimecast.wren.mime.headers.MimeHeader;
import com.mimecast.wren.mime.headers.MimeHeaders;
import com.mimecast.wren.mime.parts.MimePart;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * EmailParser is a standalone MIME parser building a part tree from RFC 5322 message bytes.
 * <p>
 * This parser handles:
 * <ul>
 *     <li>Multi-line headers with proper folding support</li>
 *     <li>Single and nested multipart structures</li>
 *     <li>Embedded messages (message/rfc822) parsed as child trees</li>
 *     <li>Transfer encodings (Base64, Quoted-Printable, 7bit, 8bit, binary)</li>
 * </ul>
 * <p>
 * Boundary delimiter lines are matched by literal byte comparison so any boundary characters work.
 * <br>A multipart without a usable boundary degrades to a single text/plain part and a warning.
 * <p>
 * Example usage:
 * <pre>
 * EmailMessage message = new EmailParser().parse(bytes);
 * MimeHeaders headers = message.getHeaders();
 * List&lt;MimePart&gt; leaves = message.getLeaves();
 * </pre>
 *
 * @see EmailMessage
 * @see MimePart
 */
public class EmailParser {
    private static final Logger log = LogManager.getLogger(EmailParser.class);

    /**
     * Header field line: printable name without colon or space, followed by a colon.
     */
    private static final Pattern HEADER_LINE = Pattern.compile("^[!-9;-~]+[ \t]*:.*", Pattern.DOTALL);

    /**
     * Nesting limit guarding against hostile structures.
     */
    private static final int MAX_DEPTH = 64;

    /**
     * Parses message bytes.
     *
     * @param data Message bytes.
     * @return EmailMessage instance.
     * @throws MalformedMessageException Empty input or no header block.
     */
    public EmailMessage parse(byte[] data) throws MalformedMessageException {
        if (data == null || data.length == 0) {
            throw new MalformedMessageException("Empty message");
        }

        List<String> warnings = new ArrayList<>();
        int start = skipEnvelopeLine(data);
        Section section = split(data, start, data.length);
        if (section.headers.size() == 0) {
            throw new MalformedMessageException("No header block found");
        }

        MimePart root = build("1", null, section.headers, data, section.bodyStart, data.length, 0, warnings);
        log.debug("Parsed message with {} warnings", warnings.size());
        return new EmailMessage(section.headers, root, warnings);
    }

    /**
     * Skips a leading mbox {@code From } envelope line if present.
     *
     * @param data Message bytes.
     * @return Start offset.
     */
    private static int skipEnvelopeLine(byte[] data) {
        byte[] from = "From ".getBytes(StandardCharsets.US_ASCII);
        if (data.length > from.length && Arrays.equals(Arrays.copyOf(data, from.length), from)) {
            return lineEnd(data, 0, data.length);
        }
        return 0;
    }

    /**
     * Builds part and its subtree.
     *
     * @param id        Part id.
     * @param parentId  Parent id.
     * @param headers   Part headers.
     * @param data      Backing bytes.
     * @param start     Body start.
     * @param end       Body end.
     * @param depth     Nesting depth.
     * @param warnings  Warnings sink.
     * @return MimePart instance.
     */
    private MimePart build(String id, String parentId, MimeHeaders headers, byte[] data, int start, int end, int depth, List<String> warnings) {
        MimePart part = new MimePart(id, parentId, headers);
        byte[] raw = Arrays.copyOfRange(data, start, end);
        part.setRawBytes(raw);

        if (depth > MAX_DEPTH) {
            warnings.add("Part " + id + " exceeds nesting limit and was kept as binary");
            part.setContentTypeOverride("application/octet-stream").setDecodedBytes(raw);
            return part;
        }

        if (part.isMultipart()) {
            String boundary = part.getContentTypeParameter("boundary");
            if (boundary == null || boundary.isEmpty()) {
                return degrade(part, "Multipart part " + id + " has no boundary", warnings);
            }

            Delimited delimited = splitMultipart(data, start, end, boundary);
            if (delimited == null || delimited.bodies.isEmpty()) {
                return degrade(part, "Multipart part " + id + " boundary not found", warnings);
            }
            if (!delimited.closed) {
                warnings.add("Multipart part " + id + " missing closing boundary");
            }

            int index = 1;
            for (int[] body : delimited.bodies) {
                Section section = split(data, body[0], body[1]);
                part.addChild(build(id + "." + index++, id, section.headers, data, section.bodyStart, body[1], depth + 1, warnings));
            }
            part.setDecodedBytes(raw);
            return part;
        }

        byte[] decoded = ContentDecoder.decodeTransfer(part.getTransferEncoding(), raw, warnings);
        part.setDecodedBytes(decoded);

        if (part.isMessage()) {
            Section nested = split(decoded, 0, decoded.length);
            if (nested.headers.size() == 0) {
                warnings.add("Embedded message " + id + " has no headers and was kept as attachment");
            } else {
                part.addChild(build(id + ".1", id, nested.headers, decoded, nested.bodyStart, decoded.length, depth + 1, warnings));
            }
        }

        return part;
    }

    /**
     * Degrades part to plain text holding the whole body.
     *
     * @param part     MimePart instance.
     * @param warning  Warning message.
     * @param warnings Warnings sink.
     * @return Same part.
     */
    private MimePart degrade(MimePart part, String warning, List<String> warnings) {
        log.warn("{}, degrading to text/plain", warning);
        warnings.add(warning + ", degraded to text/plain");
        part.setContentTypeOverride("text/plain");
        part.setDecodedBytes(ContentDecoder.decodeTransfer(part.getTransferEncoding(), part.getRawBytes(), warnings));
        return part;
    }

    /**
     * Splits header block from body.
     * <p>When the first line is neither a header nor blank the range has no headers and is all body.
     *
     * @param data  Backing bytes.
     * @param start Range start.
     * @param end   Range end.
     * @return Section instance.
     */
    private static Section split(byte[] data, int start, int end) {
        MimeHeaders headers = new MimeHeaders();
        StringBuilder current = new StringBuilder();
        int pos = start;
        while (pos < end) {
            int next = lineEnd(data, pos, end);
            String line = new String(data, pos, next - pos, StandardCharsets.UTF_8);

            if (line.trim().isEmpty()) {
                flush(headers, current);
                return new Section(headers, next);
            }

            if ((line.charAt(0) == ' ' || line.charAt(0) == '\t') && current.length() > 0) {
                current.append(line);
            } else if (HEADER_LINE.matcher(line).matches()) {
                flush(headers, current);
                current.append(line);
            } else {
                flush(headers, current);
                if (headers.size() == 0) {
                    return new Section(headers, start);
                }
                // Header block ended without separator line.
                return new Section(headers, pos);
            }
            pos = next;
        }

        flush(headers, current);
        return new Section(headers, end);
    }

    private static void flush(MimeHeaders headers, StringBuilder current) {
        if (current.length() > 0) {
            headers.put(new MimeHeader(current.toString()));
            current.setLength(0);
        }
    }

    /**
     * Splits multipart body on boundary delimiter lines.
     * <p>The line break before a delimiter belongs to the delimiter.
     *
     * @param data     Backing bytes.
     * @param start    Body start.
     * @param end      Body end.
     * @param boundary Boundary parameter.
     * @return Delimited instance or null if no delimiter line exists.
     */
    private static Delimited splitMultipart(byte[] data, int start, int end, String boundary) {
        byte[] delimiter = ("--" + boundary).getBytes(StandardCharsets.UTF_8);
        Delimited result = null;
        int partStart = -1;
        int pos = start;
        while (pos < end) {
            int next = lineEnd(data, pos, end);
            int kind = matchDelimiter(data, pos, next, delimiter);
            if (kind != 0) {
                if (result == null) {
                    result = new Delimited();
                }
                if (partStart >= 0) {
                    result.bodies.add(new int[]{partStart, Math.max(partStart, trimLineBreak(data, partStart, pos))});
                }
                if (kind == 2) {
                    result.closed = true;
                    return result;
                }
                partStart = next;
            }
            pos = next;
        }

        if (result != null && partStart >= 0) {
            result.bodies.add(new int[]{partStart, end});
        }
        return result;
    }

    /**
     * Compares a line with the delimiter.
     *
     * @param data      Backing bytes.
     * @param lineStart Line start.
     * @param lineEnd   Line end including line break.
     * @param delimiter Delimiter bytes.
     * @return 0 for no match, 1 for part delimiter, 2 for close delimiter.
     */
    private static int matchDelimiter(byte[] data, int lineStart, int lineEnd, byte[] delimiter) {
        int contentEnd = lineEnd;
        while (contentEnd > lineStart && isLinearWhitespace(data[contentEnd - 1])) {
            contentEnd--;
        }
        int length = contentEnd - lineStart;
        if (length != delimiter.length && length != delimiter.length + 2) {
            return 0;
        }
        for (int i = 0; i < delimiter.length; i++) {
            if (data[lineStart + i] != delimiter[i]) {
                return 0;
            }
        }
        if (length == delimiter.length) {
            return 1;
        }
        return data[contentEnd - 2] == '-' && data[contentEnd - 1] == '-' ? 2 : 0;
    }

    private static boolean isLinearWhitespace(byte b) {
        return b == ' ' || b == '\t' || b == '\r' || b == '\n';
    }

    /**
     * Removes the line break that precedes a delimiter.
     *
     * @param data  Backing bytes.
     * @param start Lower bound.
     * @param pos   Delimiter line start.
     * @return Content end.
     */
    private static int trimLineBreak(byte[] data, int start, int pos) {
        int end = pos;
        if (end > start && data[end - 1] == '\n') {
            end--;
            if (end > start && data[end - 1] == '\r') {
                end--;
            }
        }
        return end;
    }

    /**
     * Finds end of line including LF.
     *
     * @param data  Backing bytes.
     * @param start Line start.
     * @param limit Range end.
     * @return Offset after line break or limit.
     */
    private static int lineEnd(byte[] data, int start, int limit) {
        for (int i = start; i < limit; i++) {
            if (data[i] == '\n') {
                return i + 1;
            }
        }
        return limit;
    }

    /**
     * Header block and body offset.
     */
    private static class Section {
        private final MimeHeaders headers;
        private final int bodyStart;

        Section(MimeHeaders headers, int bodyStart) {
            this.headers = headers;
            this.bodyStart = bodyStart;
        }
    }

    /**
     * Multipart body ranges.
     */
    private static class Delimited {
        private final List<int[]> bodies = new ArrayList<>();
        private boolean closed;
    }
}
