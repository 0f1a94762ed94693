package com.mimecast.wren.config;

import java.util.Map;

/**
 * Processing configuration.
 */
public class ProcessingConfig extends ConfigFoundation {

    /**
     * Constructs a new ProcessingConfig instance.
     *
     * @param map Configuration map.
     */
    public ProcessingConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets output directory.
     *
     * @return Directory path.
     */
    public String getOutputDirectory() {
        return getStringProperty("outputDirectory", "output");
    }

    /**
     * Gets message worker pool size.
     *
     * @return Worker count.
     */
    public int getMaxWorkers() {
        return Math.toIntExact(getLongProperty("maxWorkers", 4L));
    }

    /**
     * Gets attachment worker pool size.
     *
     * @return Worker count.
     */
    public int getAttachmentWorkers() {
        return Math.toIntExact(getLongProperty("attachmentWorkers", 4L));
    }
}
