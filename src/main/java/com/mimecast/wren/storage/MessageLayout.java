package com.mimecast.wren.storage;

import com.mimecast.wren.config.OutputConfig;
import com.mimecast.wren.util.PathUtils;

/**
 * Per message output layout, relative to the output root.
 */
public class MessageLayout {

    private final OutputConfig config;
    private final String id;

    /**
     * Constructs a new MessageLayout instance.
     *
     * @param config    OutputConfig instance.
     * @param messageId Message id, sanitized for use in file names.
     */
    public MessageLayout(OutputConfig config, String messageId) {
        this.config = config;
        this.id = PathUtils.sanitize(messageId).replace(' ', '_');
    }

    /**
     * Gets the file name safe message id.
     *
     * @return String.
     */
    public String getId() {
        return id;
    }

    public String plainTextPath() {
        return config.getTextDir() + "/" + id + "_plain.txt";
    }

    public String htmlPath() {
        return config.getTextDir() + "/" + id + "_html.html";
    }

    public String attachmentPath(String outputName) {
        return config.getAttachmentsDir() + "/" + outputName;
    }

    public String inlineImagePath(String outputName) {
        return config.getInlineImagesDir() + "/" + outputName;
    }

    public String metadataPath() {
        return id + "_metadata.json";
    }
}
