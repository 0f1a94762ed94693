package com.mimecast.wren.mime.parts;

import com.mimecast.wren.mime.headers.MimeHeader;
import com.mimecast.wren.mime.headers.MimeHeaders;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * MIME part tree node.
 *
 * <p>Parts own their children and are identified by a dotted path such as {@code 1.2.1}.
 * <p>Leaf parts carry raw (transfer encoded) and decoded bytes.
 * <br>Multipart and rfc822 parts carry children instead.
 */
public class MimePart {

    /**
     * Part id as dotted path.
     */
    private final String id;

    /**
     * Parent part id, null for root.
     */
    private final String parentId;

    /**
     * Part headers.
     */
    private final MimeHeaders headers;

    /**
     * Child parts.
     */
    private final List<MimePart> children = new ArrayList<>();

    /**
     * Raw body bytes as found in the message.
     */
    private byte[] rawBytes = new byte[0];

    /**
     * Body bytes after transfer decoding.
     */
    private byte[] decodedBytes = new byte[0];

    /**
     * Content type override set when structure degrades.
     */
    private String contentTypeOverride;

    /**
     * Constructs a new MimePart instance.
     *
     * @param id       Part id.
     * @param parentId Parent part id.
     * @param headers  Part headers.
     */
    public MimePart(String id, String parentId, MimeHeaders headers) {
        this.id = id;
        this.parentId = parentId;
        this.headers = headers != null ? headers : new MimeHeaders();
    }

    public String getId() {
        return id;
    }

    public String getParentId() {
        return parentId;
    }

    public MimeHeaders getHeaders() {
        return headers;
    }

    public List<MimePart> getChildren() {
        return Collections.unmodifiableList(children);
    }

    /**
     * Adds child part.
     *
     * @param child MimePart instance.
     * @return Self.
     */
    public MimePart addChild(MimePart child) {
        children.add(child);
        return this;
    }

    public byte[] getRawBytes() {
        return rawBytes;
    }

    public MimePart setRawBytes(byte[] rawBytes) {
        this.rawBytes = rawBytes;
        return this;
    }

    public byte[] getDecodedBytes() {
        return decodedBytes;
    }

    public MimePart setDecodedBytes(byte[] decodedBytes) {
        this.decodedBytes = decodedBytes;
        return this;
    }

    /**
     * Forces the content type, used when a part degrades to plain text.
     *
     * @param contentType Content type.
     * @return Self.
     */
    public MimePart setContentTypeOverride(String contentType) {
        this.contentTypeOverride = contentType;
        return this;
    }

    /**
     * Gets content type without parameters, lower case.
     * <p>Defaults to {@code text/plain} as per RFC 2045.
     *
     * @return Content type.
     */
    public String getContentType() {
        if (contentTypeOverride != null) {
            return contentTypeOverride;
        }
        Optional<MimeHeader> ct = headers.get("Content-Type");
        if (ct.isPresent() && !ct.get().getCleanValue().isEmpty()) {
            return ct.get().getCleanValue();
        }
        return "text/plain";
    }

    /**
     * Gets Content-Type parameter.
     *
     * @param name Parameter name.
     * @return Value or null.
     */
    public String getContentTypeParameter(String name) {
        return headers.get("Content-Type").map(h -> h.getParameter(name)).orElse(null);
    }

    /**
     * Gets declared charset.
     *
     * @return Charset name or null.
     */
    public String getCharset() {
        return getContentTypeParameter("charset");
    }

    /**
     * Gets transfer encoding, lower case.
     *
     * @return Encoding, {@code 7bit} if absent.
     */
    public String getTransferEncoding() {
        return headers.get("Content-Transfer-Encoding")
                .map(MimeHeader::getCleanValue)
                .filter(v -> !v.isEmpty())
                .orElse("7bit");
    }

    /**
     * Gets disposition type, lower case.
     *
     * @return {@code inline}, {@code attachment} or null.
     */
    public String getDisposition() {
        return headers.get("Content-Disposition")
                .map(MimeHeader::getCleanValue)
                .filter(v -> !v.isEmpty())
                .orElse(null);
    }

    /**
     * Gets filename from disposition or legacy Content-Type name parameter.
     *
     * @return Filename or null.
     */
    public String getFilename() {
        String filename = headers.get("Content-Disposition").map(h -> h.getParameter("filename")).orElse(null);
        if (filename == null || filename.isBlank()) {
            filename = getContentTypeParameter("name");
        }
        return filename == null || filename.isBlank() ? null : filename.trim();
    }

    /**
     * Gets content id without angle brackets.
     *
     * @return Content id or null.
     */
    public String getContentId() {
        return headers.get("Content-ID")
                .map(MimeHeader::getValue)
                .map(v -> v.replaceAll("^\\s*<|>\\s*$", "").trim())
                .filter(v -> !v.isEmpty())
                .orElse(null);
    }

    public boolean isMultipart() {
        return getContentType().startsWith("multipart/");
    }

    public boolean isMessage() {
        return "message/rfc822".equals(getContentType());
    }

    /**
     * Is a leaf, meaning it carries content rather than children.
     *
     * @return Boolean.
     */
    public boolean isLeaf() {
        return children.isEmpty() && !isMultipart();
    }

    public boolean isText() {
        return getContentType().startsWith("text/");
    }

    public int getSize() {
        return decodedBytes.length;
    }

    @Override
    public String toString() {
        return "MimePart{" + id + " " + getContentType() + (getFilename() != null ? " " + getFilename() : "") + "}";
    }
}
