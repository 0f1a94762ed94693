package com.mimecast.wren.mime;

import com.mimecast.wren.mime.headers.MimeHeaders;
import com.mimecast.wren.mime.parts.MimePart;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Parsed email message.
 *
 * <p>Top level headers, the root part and any warnings raised while parsing.
 */
public class EmailMessage {

    private final MimeHeaders headers;
    private final MimePart root;
    private final List<String> warnings;

    /**
     * Constructs a new EmailMessage instance.
     *
     * @param headers  Top level headers.
     * @param root     Root part.
     * @param warnings Parse warnings.
     */
    public EmailMessage(MimeHeaders headers, MimePart root, List<String> warnings) {
        this.headers = headers;
        this.root = root;
        this.warnings = warnings != null ? warnings : new ArrayList<>();
    }

    public MimeHeaders getHeaders() {
        return headers;
    }

    public MimePart getRoot() {
        return root;
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public String getSubject() {
        return headers.getDecoded("Subject");
    }

    /**
     * Gets Message-ID without angle brackets.
     *
     * @return Message id or null.
     */
    public String getMessageId() {
        String id = headers.getDecoded("Message-ID");
        return id == null ? null : id.replaceAll("^\\s*<|>\\s*$", "").trim();
    }

    /**
     * Gets all parts in document order, depth first.
     *
     * @return List of MimePart.
     */
    public List<MimePart> getParts() {
        List<MimePart> parts = new ArrayList<>();
        collect(root, parts, false);
        return parts;
    }

    /**
     * Gets leaf parts in document order.
     *
     * @return List of MimePart.
     */
    public List<MimePart> getLeaves() {
        List<MimePart> parts = new ArrayList<>();
        collect(root, parts, true);
        return parts;
    }

    /**
     * Finds part by id.
     *
     * @param id Dotted part id.
     * @return MimePart or null.
     */
    public MimePart findPart(String id) {
        for (MimePart part : getParts()) {
            if (part.getId().equals(id)) {
                return part;
            }
        }
        return null;
    }

    private static void collect(MimePart part, List<MimePart> sink, boolean leavesOnly) {
        if (!leavesOnly || part.isLeaf()) {
            sink.add(part);
        }
        for (MimePart child : part.getChildren()) {
            collect(child, sink, leavesOnly);
        }
    }
}
