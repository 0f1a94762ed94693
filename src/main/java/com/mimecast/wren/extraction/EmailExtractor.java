package com.mimecast.wren.extraction;

import com.mimecast.wren.mime.ContentDecoder;
import com.mimecast.wren.mime.EmailMessage;
import com.mimecast.wren.mime.EmailParser;
import com.mimecast.wren.mime.MalformedMessageException;
import com.mimecast.wren.mime.parts.MimePart;
import com.mimecast.wren.security.FileTypeDetector;
import com.mimecast.wren.util.NameAllocator;
import com.mimecast.wren.util.PathUtils;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Email extractor.
 *
 * <p>Walks the part tree in document order and classifies each leaf as body text, attachment or inline image.
 * <br>A marker {@code [attachment:N name]} or {@code [image:N cid]} is inserted into the body text where each
 * attachment or inline image was found.
 * <p>Inside {@code multipart/alternative} the plain text version is preferred and HTML is the fallback.
 * <br>Alternatives not chosen are still walked so their attachments and images are not lost.
 * <p>An embedded message with attachment disposition or a filename is kept whole as one attachment, its inner
 * parts are not extracted. Embedded messages without either are walked like any other container.
 * <p>Output names are allocated per message.
 */
public class EmailExtractor {
    private static final Logger log = LogManager.getLogger(EmailExtractor.class);

    private final EmailParser parser;
    private final FileTypeDetector detector;
    private final Clock clock;

    /**
     * Constructs a new EmailExtractor instance using the system clock.
     */
    public EmailExtractor() {
        this(Clock.systemUTC());
    }

    /**
     * Constructs a new EmailExtractor instance.
     *
     * @param clock Clock for output name timestamps.
     */
    public EmailExtractor(Clock clock) {
        this(new EmailParser(), new FileTypeDetector(), clock);
    }

    /**
     * Constructs a new EmailExtractor instance.
     *
     * @param parser   EmailParser instance.
     * @param detector FileTypeDetector instance.
     * @param clock    Clock for output name timestamps.
     */
    public EmailExtractor(EmailParser parser, FileTypeDetector detector, Clock clock) {
        this.parser = parser;
        this.detector = detector;
        this.clock = clock;
    }

    /**
     * Parses and extracts message bytes.
     *
     * @param data Message bytes.
     * @return ExtractionResult instance.
     * @throws MalformedMessageException Top level structure unparseable.
     */
    public ExtractionResult extract(byte[] data) throws MalformedMessageException {
        EmailMessage message = parser.parse(data);
        String id = message.getMessageId();
        if (id == null || id.isEmpty()) {
            id = "msg-" + DigestUtils.sha256Hex(data).substring(0, 16);
        }
        return extract(message, id);
    }

    /**
     * Extracts parsed message.
     *
     * @param message   EmailMessage instance.
     * @param messageId Message id used for naming.
     * @return ExtractionResult instance.
     */
    public ExtractionResult extract(EmailMessage message, String messageId) {
        Walk walk = new Walk(messageId, new NameAllocator(clock));
        walk.warnings.addAll(message.getWarnings());
        visit(message.getRoot(), walk, false, false);

        String html = walk.html != null ? HtmlText.rewriteCid(walk.html, walk.cidNames) : null;
        String body = walk.body.toString();
        log.info("Extracted message {}: {} attachments, {} inline images, {} chars of text",
                messageId, walk.attachments.size(), walk.images.size(), body.length());

        return new ExtractionResult(messageId, message.getHeaders(), body, html, walk.attachments, walk.images,
                walk.positions, walk.warnings);
    }

    /**
     * Visits part.
     *
     * @param part         MimePart instance.
     * @param walk         Walk state.
     * @param related      Inside multipart/related.
     * @param suppressText Inside an alternative that was not chosen for display.
     */
    private void visit(MimePart part, Walk walk, boolean related, boolean suppressText) {
        String type = part.getContentType();

        if (part.isMessage() && ("attachment".equals(part.getDisposition()) || part.getFilename() != null)) {
            addAttachment(part, walk);
            return;
        }

        if (!part.isLeaf()) {
            if ("multipart/alternative".equals(type)) {
                MimePart chosen = chooseAlternative(part);
                for (MimePart child : part.getChildren()) {
                    visit(child, walk, related, suppressText || child != chosen);
                }
            } else {
                boolean inRelated = related || "multipart/related".equals(type);
                for (MimePart child : part.getChildren()) {
                    visit(child, walk, inRelated, suppressText);
                }
            }
            return;
        }

        String disposition = part.getDisposition();
        String cid = part.getContentId();
        boolean text = part.isText();

        if (type.startsWith("image/") && cid != null
                && ("inline".equals(disposition) || (disposition == null && related))) {
            addImage(part, cid, walk);

        } else if ("attachment".equals(disposition) || !text) {
            addAttachment(part, walk);

        } else {
            String content = ContentDecoder.decodeText(part.getDecodedBytes(), part.getCharset(), walk.warnings);
            if ("text/html".equals(type)) {
                if (walk.html == null) {
                    walk.html = content;
                }
                if (!suppressText) {
                    appendText(walk, HtmlText.toText(content));
                }
            } else if (!suppressText) {
                appendText(walk, content);
            }
        }
    }

    /**
     * Chooses the alternative used for display text.
     *
     * @param alternative multipart/alternative part.
     * @return Chosen child or null.
     */
    private static MimePart chooseAlternative(MimePart alternative) {
        MimePart html = null;
        MimePart nested = null;
        for (MimePart child : alternative.getChildren()) {
            if (child.isLeaf() && "text/plain".equals(child.getContentType()) && !"attachment".equals(child.getDisposition())) {
                return child;
            }
            if (html == null && child.isLeaf() && "text/html".equals(child.getContentType())) {
                html = child;
            }
            if (nested == null && !child.isLeaf()) {
                nested = child;
            }
        }
        return html != null ? html : nested;
    }

    private void addImage(MimePart part, String cid, Walk walk) {
        String uniqueCid = cid;
        int suffix = walk.cidCounts.getOrDefault(cid, 0);
        while (!walk.cids.add(uniqueCid)) {
            uniqueCid = cid + "_" + ++suffix;
        }
        walk.cidCounts.put(cid, suffix);

        String detected = detector.detect(part.getDecodedBytes());
        String original = part.getFilename();
        if (original == null) {
            original = PathUtils.sanitize(uniqueCid) + FileTypeDetector.extensionFor(part.getContentType());
        }
        String output = walk.allocator.allocate(original, walk.messageId + ":" + part.getId());
        walk.cidNames.putIfAbsent(cid, output);

        InlineImage image = new InlineImage(uniqueCid, cid, original, output, part.getDecodedBytes(), detected, part.getId());
        walk.images.add(image);
        int index = walk.images.size();
        int offset = insertMarker(walk, "[image:" + index + " " + uniqueCid + "]");
        walk.positions.add(new Position(Position.Kind.IMAGE, index, offset, output, part.getId()));
    }

    private void addAttachment(MimePart part, Walk walk) {
        int index = walk.attachments.size() + 1;
        String original = part.getFilename();
        if (original == null) {
            original = "attachment_" + index + FileTypeDetector.extensionFor(part.getContentType());
            walk.warnings.add("Part " + part.getId() + " has no filename, named " + original);
        }
        String output = walk.allocator.allocate(original, walk.messageId + ":" + part.getId());

        Attachment attachment = new Attachment(original, output, part.getDecodedBytes(), part.getContentType(), part.getId());
        attachment.setDetectedType(detector.detect(part.getDecodedBytes()));
        walk.attachments.add(attachment);
        int offset = insertMarker(walk, "[attachment:" + index + " " + original + "]");
        walk.positions.add(new Position(Position.Kind.ATTACHMENT, index, offset, output, part.getId()));
    }

    private static void appendText(Walk walk, String text) {
        if (text == null || text.isEmpty()) {
            return;
        }
        if (walk.body.length() > 0 && walk.body.charAt(walk.body.length() - 1) != '\n') {
            walk.body.append('\n');
        }
        walk.body.append(text);
    }

    /**
     * Inserts marker on its own line.
     *
     * @param walk   Walk state.
     * @param marker Marker text.
     * @return Marker offset.
     */
    private static int insertMarker(Walk walk, String marker) {
        if (walk.body.length() > 0 && walk.body.charAt(walk.body.length() - 1) != '\n') {
            walk.body.append('\n');
        }
        int offset = walk.body.length();
        walk.body.append(marker).append('\n');
        return offset;
    }

    /**
     * Mutable state of one extraction.
     */
    private static class Walk {
        private final String messageId;
        private final StringBuilder body = new StringBuilder();
        private final List<Attachment> attachments = new ArrayList<>();
        private final List<InlineImage> images = new ArrayList<>();
        private final List<Position> positions = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();
        private final Map<String, Integer> cidCounts = new HashMap<>();
        private final Set<String> cids = new HashSet<>();
        private final Map<String, String> cidNames = new LinkedHashMap<>();
        private final NameAllocator allocator;
        private String html;

        Walk(String messageId, NameAllocator allocator) {
            this.messageId = messageId;
            this.allocator = allocator;
        }
    }
}
