package com.mimecast.wren.extraction;

/**
 * Extracted inline image referenced by content id.
 */
public class InlineImage {

    private final String contentId;
    private final String originalContentId;
    private final String originalName;
    private final String outputName;
    private final byte[] content;
    private final String detectedType;
    private final String partId;

    /**
     * Constructs a new InlineImage instance.
     *
     * @param contentId         Deduplicated content id.
     * @param originalContentId Content id as found in the message.
     * @param originalName      Original or derived name.
     * @param outputName        Sanitized unique output name.
     * @param content           Decoded content.
     * @param detectedType      Detected type.
     * @param partId            Source part id.
     */
    public InlineImage(String contentId, String originalContentId, String originalName, String outputName, byte[] content,
                       String detectedType, String partId) {
        this.contentId = contentId;
        this.originalContentId = originalContentId;
        this.originalName = originalName;
        this.outputName = outputName;
        this.content = content;
        this.detectedType = detectedType;
        this.partId = partId;
    }

    public String getContentId() {
        return contentId;
    }

    public String getOriginalContentId() {
        return originalContentId;
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

    public String getDetectedType() {
        return detectedType;
    }

    public String getPartId() {
        return partId;
    }
}
