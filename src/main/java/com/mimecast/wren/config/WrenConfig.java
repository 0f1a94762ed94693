package com.mimecast.wren.config;

import com.mimecast.wren.chunking.ChunkingStrategy;
import com.mimecast.wren.converter.ocr.ExtractionMode;
import com.mimecast.wren.exception.ConfigurationException;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Root configuration.
 *
 * <p>This class provides type safe access to every configuration section.
 * <p>Sections are views over the shared map so edits through a section are visible here.
 *
 * @see ProcessingConfig
 * @see SecurityConfig
 * @see SpreadsheetConfig
 * @see OcrConfig
 * @see DocxConfig
 * @see OutputConfig
 */
public class WrenConfig extends ConfigFoundation {

    /**
     * Constructs a new WrenConfig instance with defaults.
     */
    public WrenConfig() {
        super();
    }

    /**
     * Constructs a new WrenConfig instance.
     *
     * @param map Configuration map.
     */
    public WrenConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Constructs a new WrenConfig instance from file.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read file.
     */
    public WrenConfig(String path) throws IOException {
        super(path);
    }

    public ProcessingConfig getProcessing() {
        return new ProcessingConfig(getMapProperty("processing"));
    }

    public SecurityConfig getSecurity() {
        return new SecurityConfig(getMapProperty("security"));
    }

    public SpreadsheetConfig getSpreadsheet() {
        return new SpreadsheetConfig(getMapProperty("spreadsheet"));
    }

    public OcrConfig getOcr() {
        return new OcrConfig(getMapProperty("ocr"));
    }

    public DocxConfig getDocx() {
        return new DocxConfig(getMapProperty("docx"));
    }

    public OutputConfig getOutput() {
        return new OutputConfig(getMapProperty("output"));
    }

    /**
     * Validates configuration.
     * <p>All problems are collected and reported together.
     *
     * @throws ConfigurationException Invalid settings.
     */
    public void validate() throws ConfigurationException {
        List<String> problems = new ArrayList<>();

        ProcessingConfig processing = getProcessing();
        if (StringUtils.isBlank(processing.getOutputDirectory())) {
            problems.add("processing.outputDirectory must not be blank");
        }
        if (processing.getMaxWorkers() < 1) {
            problems.add("processing.maxWorkers must be at least 1");
        }
        if (processing.getAttachmentWorkers() < 1) {
            problems.add("processing.attachmentWorkers must be at least 1");
        }

        SecurityConfig security = getSecurity();
        if (security.getMaxAttachmentSize() < 1) {
            problems.add("security.maxAttachmentSize must be positive");
        }
        for (String extension : security.getAllowedExtensions()) {
            if (!extension.startsWith(".")) {
                problems.add("security.allowedExtensions entry must start with a dot: " + extension);
            }
        }

        if (getSpreadsheet().getMaxRowsPerSheet() < 1) {
            problems.add("spreadsheet.maxRowsPerSheet must be at least 1");
        }

        OcrConfig ocr = getOcr();
        if (ocr.isEnabled()) {
            if (StringUtils.isBlank(ocr.getApiKey())) {
                problems.add("ocr.apiKey missing and environment variable " + ocr.getApiKeyEnv() + " not set");
            }
            if (ExtractionMode.fromString(ocr.getExtractionMode()) == null) {
                problems.add("ocr.extractionMode unknown: " + ocr.getExtractionMode());
            }
            if (ocr.getImageLimit() < 0 || ocr.getImageMinSize() < 0) {
                problems.add("ocr.imageLimit and ocr.imageMinSize must not be negative");
            }
            if (ocr.getTimeoutSeconds() < 1) {
                problems.add("ocr.timeoutSeconds must be at least 1");
            }
            ResilienceConfig resilience = ocr.getResilience();
            if (resilience.getMaxRetries() < 0) {
                problems.add("ocr.resilience.maxRetries must not be negative");
            }
            if (resilience.getRetryDelayMillis() < 1 || resilience.getBackoffMultiplier() < 1.0) {
                problems.add("ocr.resilience.retryDelayMillis must be positive and backoffMultiplier at least 1");
            }
            if (resilience.getFailureThreshold() < 1) {
                problems.add("ocr.resilience.failureThreshold must be at least 1");
            }
            if (resilience.getRecoveryTimeoutSeconds() < 0) {
                problems.add("ocr.resilience.recoveryTimeoutSeconds must not be negative");
            }
        }

        DocxConfig docx = getDocx();
        ChunkingConfig chunking = docx.getChunking();
        if (docx.isEnabled() && chunking.isEnabled()) {
            if (ChunkingStrategy.fromString(chunking.getStrategy()) == null) {
                problems.add("docx.chunking.strategy unknown: " + chunking.getStrategy());
            }
            if (chunking.getMaxTokens() < 1) {
                problems.add("docx.chunking.maxTokens must be positive");
            }
            if (chunking.getOverlapTokens() < 0 || chunking.getOverlapTokens() >= chunking.getMaxTokens()) {
                problems.add("docx.chunking.overlapTokens must be between 0 and maxTokens - 1");
            }
            if (chunking.getTolerance() < 0.0 || chunking.getTolerance() > 1.0) {
                problems.add("docx.chunking.tolerance must be between 0 and 1");
            }
        }

        if (!problems.isEmpty()) {
            throw new ConfigurationException("Invalid configuration: " + String.join("; ", problems));
        }
    }
}
