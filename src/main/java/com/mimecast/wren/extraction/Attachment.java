package com.mimecast.wren.extraction;

import com.mimecast.wren.util.PathUtils;
import org.apache.commons.codec.digest.DigestUtils;

/**
 * Extracted attachment.
 */
public class Attachment {

    private final String originalName;
    private final String outputName;
    private final byte[] content;
    private final String declaredType;
    private final String partId;
    private final String sha256;
    private String detectedType;

    /**
     * Constructs a new Attachment instance.
     *
     * @param originalName Original name as found in the message.
     * @param outputName   Sanitized unique output name.
     * @param content      Decoded content.
     * @param declaredType Declared content type.
     * @param partId       Source part id.
     */
    public Attachment(String originalName, String outputName, byte[] content, String declaredType, String partId) {
        this.originalName = originalName;
        this.outputName = outputName;
        this.content = content;
        this.declaredType = declaredType;
        this.partId = partId;
        this.sha256 = DigestUtils.sha256Hex(content);
    }

    public String getOriginalName() {
        return originalName;
    }

    public String getOutputName() {
        return outputName;
    }

    public byte[] getContent() {
        return content;
    }

    public long getSize() {
        return content.length;
    }

    public String getDeclaredType() {
        return declaredType;
    }

    public String getDetectedType() {
        return detectedType;
    }

    public Attachment setDetectedType(String detectedType) {
        this.detectedType = detectedType;
        return this;
    }

    public String getPartId() {
        return partId;
    }

    public String getSha256() {
        return sha256;
    }

    /**
     * Gets lower case extension of the original name.
     *
     * @return Extension with leading dot or empty string.
     */
    public String getExtension() {
        return PathUtils.extension(originalName);
    }

    @Override
    public String toString() {
        return "Attachment{" + originalName + " -> " + outputName + ", " + content.length + " bytes}";
    }
}
