package com.mimecast.wren.converter;

import com.mimecast.wren.chunking.Chunk;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of converting one attachment.
 */
public class ConversionResult {

    private final String converter;
    private String text = "";
    private final List<OutputArtifact> artifacts = new ArrayList<>();
    private final List<Chunk> chunks = new ArrayList<>();
    private final Map<String, Object> metadata = new LinkedHashMap<>();
    private final List<String> warnings = new ArrayList<>();
    private boolean partial = false;
    private int attempts = 1;

    /**
     * Constructs a new ConversionResult instance.
     *
     * @param converter Converter name.
     */
    public ConversionResult(String converter) {
        this.converter = converter;
    }

    public String getConverter() {
        return converter;
    }

    public String getText() {
        return text;
    }

    public ConversionResult setText(String text) {
        this.text = text;
        return this;
    }

    public List<OutputArtifact> getArtifacts() {
        return Collections.unmodifiableList(artifacts);
    }

    public ConversionResult addArtifact(OutputArtifact artifact) {
        artifacts.add(artifact);
        return this;
    }

    /**
     * Gets image artifacts.
     *
     * @return List of OutputArtifact.
     */
    public List<OutputArtifact> getImages() {
        List<OutputArtifact> images = new ArrayList<>();
        for (OutputArtifact artifact : artifacts) {
            if (artifact.getKind() == OutputArtifact.Kind.IMAGE) {
                images.add(artifact);
            }
        }
        return images;
    }

    public List<Chunk> getChunks() {
        return Collections.unmodifiableList(chunks);
    }

    public ConversionResult setChunks(List<Chunk> chunks) {
        this.chunks.clear();
        this.chunks.addAll(chunks);
        return this;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public ConversionResult putMetadata(String key, Object value) {
        metadata.put(key, value);
        return this;
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public ConversionResult addWarning(String warning) {
        warnings.add(warning);
        return this;
    }

    public boolean isPartial() {
        return partial;
    }

    public ConversionResult setPartial(boolean partial) {
        this.partial = partial;
        return this;
    }

    public int getAttempts() {
        return attempts;
    }

    public ConversionResult setAttempts(int attempts) {
        this.attempts = attempts;
        return this;
    }
}
