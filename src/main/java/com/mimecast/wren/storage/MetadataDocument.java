package com.mimecast.wren.storage;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per message metadata document.
 * <p>Serialized by Gson with snake case field names to {@code <id>_metadata.json}.
 */
public class MetadataDocument {

    private static final Gson GSON = new GsonBuilder()
            .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .create();

    private final String messageId;
    private final String source;
    private final String subject;
    private final String processedAt;
    private Map<String, List<String>> headers = new LinkedHashMap<>();
    private Map<String, String> body = new LinkedHashMap<>();
    private final List<AttachmentEntry> attachments = new ArrayList<>();
    private final List<ImageEntry> inlineImages = new ArrayList<>();
    private final List<PositionEntry> positions = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    /**
     * Constructs a new MetadataDocument instance.
     *
     * @param messageId   Message id.
     * @param source      Input source description.
     * @param subject     Decoded subject.
     * @param processedAt Processing timestamp, ISO-8601.
     */
    public MetadataDocument(String messageId, String source, String subject, String processedAt) {
        this.messageId = messageId;
        this.source = source;
        this.subject = subject;
        this.processedAt = processedAt;
    }

    public MetadataDocument setHeaders(Map<String, List<String>> headers) {
        this.headers = new LinkedHashMap<>(headers);
        return this;
    }

    public MetadataDocument putBody(String kind, String path) {
        body.put(kind, path);
        return this;
    }

    public MetadataDocument addAttachment(AttachmentEntry entry) {
        attachments.add(entry);
        return this;
    }

    public MetadataDocument addInlineImage(ImageEntry entry) {
        inlineImages.add(entry);
        return this;
    }

    public MetadataDocument addPosition(PositionEntry entry) {
        positions.add(entry);
        return this;
    }

    public MetadataDocument addWarning(String warning) {
        warnings.add(warning);
        return this;
    }

    public String getMessageId() {
        return messageId;
    }

    public List<AttachmentEntry> getAttachments() {
        return attachments;
    }

    public List<ImageEntry> getInlineImages() {
        return inlineImages;
    }

    public List<PositionEntry> getPositions() {
        return positions;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    /**
     * Serializes to JSON.
     *
     * @return JSON string.
     */
    public String toJson() {
        return GSON.toJson(this);
    }

    /**
     * Parses from JSON.
     *
     * @param json JSON string.
     * @return MetadataDocument instance.
     */
    public static MetadataDocument fromJson(String json) {
        return GSON.fromJson(json, MetadataDocument.class);
    }

    /**
     * Attachment name mapping and conversion status.
     */
    public static class AttachmentEntry {
        private final String originalName;
        private final String outputName;
        private String path;
        private final String partId;
        private final long size;
        private final String sha256;
        private final String declaredType;
        private final String detectedType;
        private String status;
        private String converter;
        private String errorKind;
        private String reason;
        private String partialOutput;
        private int attempts;
        private List<String> artifacts = new ArrayList<>();
        private List<String> warnings = new ArrayList<>();

        /**
         * Constructs a new AttachmentEntry instance.
         *
         * @param originalName Original name.
         * @param outputName   Unique output name.
         * @param partId       Source part id.
         * @param size         Size in bytes.
         * @param sha256       Content hash.
         * @param declaredType Declared content type.
         * @param detectedType Detected content type.
         */
        public AttachmentEntry(String originalName, String outputName, String partId, long size, String sha256,
                               String declaredType, String detectedType) {
            this.originalName = originalName;
            this.outputName = outputName;
            this.partId = partId;
            this.size = size;
            this.sha256 = sha256;
            this.declaredType = declaredType;
            this.detectedType = detectedType;
        }

        public AttachmentEntry setPath(String path) {
            this.path = path;
            return this;
        }

        /**
         * Sets conversion status.
         *
         * @param status    Status name.
         * @param converter Converter name or null.
         * @param errorKind Error kind name or null.
         * @param reason    Failure reason or null.
         * @return Self.
         */
        public AttachmentEntry setStatus(String status, String converter, String errorKind, String reason) {
            this.status = status;
            this.converter = converter;
            this.errorKind = errorKind;
            this.reason = reason;
            return this;
        }

        public AttachmentEntry setPartialOutput(String partialOutput) {
            this.partialOutput = partialOutput;
            return this;
        }

        public AttachmentEntry setAttempts(int attempts) {
            this.attempts = attempts;
            return this;
        }

        public AttachmentEntry addArtifact(String artifact) {
            artifacts.add(artifact);
            return this;
        }

        public AttachmentEntry addWarning(String warning) {
            warnings.add(warning);
            return this;
        }

        public String getOriginalName() {
            return originalName;
        }

        public String getOutputName() {
            return outputName;
        }

        public String getPath() {
            return path;
        }

        public String getStatus() {
            return status;
        }

        public String getConverter() {
            return converter;
        }

        public String getErrorKind() {
            return errorKind;
        }

        public String getReason() {
            return reason;
        }

        public List<String> getArtifacts() {
            return artifacts;
        }

        public int getAttempts() {
            return attempts;
        }
    }

    /**
     * Inline image name mapping.
     */
    public static class ImageEntry {
        private final String contentId;
        private final String originalContentId;
        private final String originalName;
        private final String outputName;
        private final String path;
        private final String partId;
        private final long size;
        private final String detectedType;

        /**
         * Constructs a new ImageEntry instance.
         *
         * @param contentId         Deduplicated content id.
         * @param originalContentId Content id as found in the message.
         * @param originalName      Original name.
         * @param outputName        Unique output name.
         * @param path              Stored path or null if not stored.
         * @param partId            Source part id.
         * @param size              Size in bytes.
         * @param detectedType      Detected content type.
         */
        public ImageEntry(String contentId, String originalContentId, String originalName, String outputName, String path,
                          String partId, long size, String detectedType) {
            this.contentId = contentId;
            this.originalContentId = originalContentId;
            this.originalName = originalName;
            this.outputName = outputName;
            this.path = path;
            this.partId = partId;
            this.size = size;
            this.detectedType = detectedType;
        }

        public String getContentId() {
            return contentId;
        }

        public String getOutputName() {
            return outputName;
        }

        public String getPath() {
            return path;
        }
    }

    /**
     * Marker position in the body text.
     */
    public static class PositionEntry {
        private final String marker;
        private final String kind;
        private final int index;
        private final int offset;
        private final String filename;
        private final String partId;

        /**
         * Constructs a new PositionEntry instance.
         *
         * @param marker   Marker id.
         * @param kind     Marker kind.
         * @param index    One based index within the kind.
         * @param offset   Character offset in the body text.
         * @param filename Generated filename.
         * @param partId   Source part id.
         */
        public PositionEntry(String marker, String kind, int index, int offset, String filename, String partId) {
            this.marker = marker;
            this.kind = kind;
            this.index = index;
            this.offset = offset;
            this.filename = filename;
            this.partId = partId;
        }

        public String getMarker() {
            return marker;
        }

        public int getOffset() {
            return offset;
        }
    }
}
