package com.mimecast.wren.processor;

import com.mimecast.wren.converter.ConversionResult;
import com.mimecast.wren.exception.ConversionException;
import com.mimecast.wren.exception.ErrorKind;
import com.mimecast.wren.exception.ExternalServiceException;
import com.mimecast.wren.extraction.Attachment;

/**
 * Outcome of processing one attachment.
 */
public class AttachmentOutcome {

    /**
     * Outcome status.
     */
    public enum Status {
        CONVERTED,
        PARTIAL,
        FAILED,
        UNSUPPORTED,
        REJECTED,
        CANCELLED
    }

    private final Attachment attachment;
    private final Status status;
    private final String converter;
    private final ConversionResult result;
    private final ErrorKind errorKind;
    private final String reason;
    private final String partialOutput;
    private final int attempts;
    private final long durationMillis;

    private AttachmentOutcome(Attachment attachment, Status status, String converter, ConversionResult result,
                              ErrorKind errorKind, String reason, String partialOutput, int attempts, long durationMillis) {
        this.attachment = attachment;
        this.status = status;
        this.converter = converter;
        this.result = result;
        this.errorKind = errorKind;
        this.reason = reason;
        this.partialOutput = partialOutput;
        this.attempts = attempts;
        this.durationMillis = durationMillis;
    }

    /**
     * Successful conversion, possibly partial.
     *
     * @param attachment     Attachment instance.
     * @param result         ConversionResult instance.
     * @param durationMillis Conversion time.
     * @return AttachmentOutcome instance.
     */
    public static AttachmentOutcome converted(Attachment attachment, ConversionResult result, long durationMillis) {
        String partialOutput = null;
        if (result.isPartial() && !result.getArtifacts().isEmpty()) {
            partialOutput = result.getArtifacts().get(0).getPath();
        }
        return new AttachmentOutcome(attachment, result.isPartial() ? Status.PARTIAL : Status.CONVERTED,
                result.getConverter(), result, null, result.isPartial() ? String.join("; ", result.getWarnings()) : null,
                partialOutput, result.getAttempts(), durationMillis);
    }

    /**
     * Failed conversion.
     *
     * @param attachment     Attachment instance.
     * @param converter      Converter name.
     * @param e              ConversionException instance.
     * @param durationMillis Conversion time.
     * @return AttachmentOutcome instance.
     */
    public static AttachmentOutcome failed(Attachment attachment, String converter, ConversionException e, long durationMillis) {
        int attempts = e instanceof ExternalServiceException
                ? ((ExternalServiceException) e).getAttempts() : 0;
        return new AttachmentOutcome(attachment, Status.FAILED, converter, null, e.getKind(), e.getMessage(),
                e.getPartialOutput(), attempts, durationMillis);
    }

    /**
     * Failed with unexpected error.
     *
     * @param attachment Attachment instance.
     * @param converter  Converter name.
     * @param reason     Failure reason.
     * @return AttachmentOutcome instance.
     */
    public static AttachmentOutcome failed(Attachment attachment, String converter, String reason) {
        return new AttachmentOutcome(attachment, Status.FAILED, converter, null, ErrorKind.PROCESSING, reason, null, 0, 0);
    }

    /**
     * No converter supports the attachment.
     *
     * @param attachment Attachment instance.
     * @return AttachmentOutcome instance.
     */
    public static AttachmentOutcome unsupported(Attachment attachment) {
        return new AttachmentOutcome(attachment, Status.UNSUPPORTED, null, null, ErrorKind.UNSUPPORTED_FORMAT,
                "No converter for " + (attachment.getExtension().isEmpty() ? "files without extension" : attachment.getExtension()),
                null, 0, 0);
    }

    /**
     * Attachment failed validation and was not preserved.
     *
     * @param attachment Attachment instance.
     * @param kind       Validation error kind.
     * @param reason     Denial reason.
     * @return AttachmentOutcome instance.
     */
    public static AttachmentOutcome rejected(Attachment attachment, ErrorKind kind, String reason) {
        return new AttachmentOutcome(attachment, Status.REJECTED, null, null, kind, reason, null, 0, 0);
    }

    /**
     * Work cancelled before completion.
     *
     * @param attachment Attachment instance.
     * @param converter  Converter name.
     * @return AttachmentOutcome instance.
     */
    public static AttachmentOutcome cancelled(Attachment attachment, String converter) {
        return new AttachmentOutcome(attachment, Status.CANCELLED, converter, null, ErrorKind.PROCESSING, "Cancelled", null, 0, 0);
    }

    public Attachment getAttachment() {
        return attachment;
    }

    public Status getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status == Status.CONVERTED || status == Status.PARTIAL;
    }

    public String getConverter() {
        return converter;
    }

    public ConversionResult getResult() {
        return result;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public String getReason() {
        return reason;
    }

    public String getPartialOutput() {
        return partialOutput;
    }

    public int getAttempts() {
        return attempts;
    }

    public long getDurationMillis() {
        return durationMillis;
    }

    @Override
    public String toString() {
        return attachment.getOriginalName() + ": " + status + (errorKind != null ? " " + errorKind + " " + reason : "");
    }
}
