package com.mimecast.wren.processor;

import com.mimecast.wren.exception.ErrorKind;

/**
 * Outcome of processing one message.
 */
public class MessageOutcome {

    private final String source;
    private final String messageId;
    private final ProcessingReport report;
    private final String metadataPath;
    private final ErrorKind errorKind;
    private final String reason;

    private MessageOutcome(String source, String messageId, ProcessingReport report, String metadataPath,
                           ErrorKind errorKind, String reason) {
        this.source = source;
        this.messageId = messageId;
        this.report = report;
        this.metadataPath = metadataPath;
        this.errorKind = errorKind;
        this.reason = reason;
    }

    /**
     * Processed message.
     *
     * @param source       Input source.
     * @param report       ProcessingReport instance.
     * @param metadataPath Metadata document path relative to the output root.
     * @return MessageOutcome instance.
     */
    public static MessageOutcome processed(String source, ProcessingReport report, String metadataPath) {
        return new MessageOutcome(source, report.getMessageId(), report, metadataPath, null, null);
    }

    /**
     * Aborted message.
     *
     * @param source Input source.
     * @param kind   Error kind.
     * @param reason Failure reason.
     * @return MessageOutcome instance.
     */
    public static MessageOutcome failed(String source, ErrorKind kind, String reason) {
        return new MessageOutcome(source, null, null, null, kind, reason);
    }

    public String getSource() {
        return source;
    }

    public String getMessageId() {
        return messageId;
    }

    public ProcessingReport getReport() {
        return report;
    }

    public String getMetadataPath() {
        return metadataPath;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public String getReason() {
        return reason;
    }

    public boolean isSuccess() {
        return errorKind == null;
    }

    @Override
    public String toString() {
        return source + ": " + (isSuccess() ? report : errorKind + " " + reason);
    }
}
