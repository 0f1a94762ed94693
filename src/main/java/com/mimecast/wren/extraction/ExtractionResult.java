package com.mimecast.wren.extraction;

import com.mimecast.wren.mime.headers.MimeHeaders;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of extracting one message.
 */
public class ExtractionResult {

    private final String messageId;
    private final MimeHeaders headers;
    private final String bodyText;
    private final String htmlBody;
    private final List<Attachment> attachments;
    private final List<InlineImage> images;
    private final List<Position> positions;
    private final List<String> warnings;

    /**
     * Constructs a new ExtractionResult instance.
     *
     * @param messageId   Message id used for output naming.
     * @param headers     Top level headers.
     * @param bodyText    Body text with markers.
     * @param htmlBody    HTML body with rewritten cid references or null.
     * @param attachments Attachments in document order.
     * @param images      Inline images in document order.
     * @param positions   Marker positions in document order.
     * @param warnings    Parse and extraction warnings.
     */
    public ExtractionResult(String messageId, MimeHeaders headers, String bodyText, String htmlBody, List<Attachment> attachments,
                            List<InlineImage> images, List<Position> positions, List<String> warnings) {
        this.messageId = messageId;
        this.headers = headers;
        this.bodyText = bodyText;
        this.htmlBody = htmlBody;
        this.attachments = new ArrayList<>(attachments);
        this.images = new ArrayList<>(images);
        this.positions = new ArrayList<>(positions);
        this.warnings = new ArrayList<>(warnings);
    }

    public String getMessageId() {
        return messageId;
    }

    public MimeHeaders getHeaders() {
        return headers;
    }

    public String getSubject() {
        return headers.getDecoded("Subject");
    }

    public String getBodyText() {
        return bodyText;
    }

    public String getHtmlBody() {
        return htmlBody;
    }

    public List<Attachment> getAttachments() {
        return Collections.unmodifiableList(attachments);
    }

    public List<InlineImage> getImages() {
        return Collections.unmodifiableList(images);
    }

    public List<Position> getPositions() {
        return Collections.unmodifiableList(positions);
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }
}
