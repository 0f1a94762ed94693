package com.mimecast.wren.exception;

/**
 * Base of all attachment scoped failures.
 *
 * <p>Carries the attachment identity, the error kind and, where some output was already produced,
 * the location of that partial output.
 * <p>These never escape the per-attachment boundary of the orchestrator.
 */
public class ConversionException extends Exception {

    /**
     * Error kind.
     */
    private final ErrorKind kind;

    /**
     * Attachment name, if known.
     */
    private String attachmentName;

    /**
     * Partial output location, if any.
     */
    private String partialOutput;

    /**
     * Constructs a new ConversionException instance.
     *
     * @param kind    Error kind.
     * @param message Error message.
     */
    public ConversionException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    /**
     * Constructs a new ConversionException instance with cause.
     *
     * @param kind    Error kind.
     * @param message Error message.
     * @param cause   Underlying cause.
     */
    public ConversionException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * Gets error kind.
     *
     * @return ErrorKind.
     */
    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Gets attachment name.
     *
     * @return Attachment name or null.
     */
    public String getAttachmentName() {
        return attachmentName;
    }

    /**
     * Sets attachment name.
     *
     * @param attachmentName Attachment name.
     * @return Self.
     */
    public ConversionException setAttachmentName(String attachmentName) {
        this.attachmentName = attachmentName;
        return this;
    }

    /**
     * Gets partial output location.
     *
     * @return Relative output path or null.
     */
    public String getPartialOutput() {
        return partialOutput;
    }

    /**
     * Sets partial output location.
     *
     * @param partialOutput Relative output path.
     * @return Self.
     */
    public ConversionException setPartialOutput(String partialOutput) {
        this.partialOutput = partialOutput;
        return this;
    }
}
