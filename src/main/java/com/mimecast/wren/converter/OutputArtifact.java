package com.mimecast.wren.converter;

import java.nio.charset.StandardCharsets;

/**
 * Converter output file, relative to the output root.
 */
public class OutputArtifact {

    /**
     * Artifact kind.
     */
    public enum Kind {
        TEXT,
        CSV,
        MARKDOWN,
        IMAGE,
        JSON,
        CHUNK
    }

    private final String path;
    private final byte[] content;
    private final Kind kind;

    /**
     * Constructs a new OutputArtifact instance.
     *
     * @param path    Relative path using forward slashes.
     * @param content Content bytes.
     * @param kind    Artifact kind.
     */
    public OutputArtifact(String path, byte[] content, Kind kind) {
        this.path = path;
        this.content = content;
        this.kind = kind;
    }

    /**
     * Constructs a new text OutputArtifact instance, UTF-8 encoded.
     *
     * @param path    Relative path using forward slashes.
     * @param content Text content.
     * @param kind    Artifact kind.
     */
    public OutputArtifact(String path, String content, Kind kind) {
        this(path, content.getBytes(StandardCharsets.UTF_8), kind);
    }

    public String getPath() {
        return path;
    }

    public byte[] getContent() {
        return content;
    }

    public Kind getKind() {
        return kind;
    }

    @Override
    public String toString() {
        return kind + ":" + path;
    }
}
