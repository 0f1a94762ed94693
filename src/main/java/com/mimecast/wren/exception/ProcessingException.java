package com.mimecast.wren.exception;

/**
 * Unexpected internal failure while converting an attachment.
 */
public class ProcessingException extends ConversionException {

    /**
     * Constructs a new ProcessingException instance.
     *
     * @param message Error message.
     */
    public ProcessingException(String message) {
        super(ErrorKind.PROCESSING, message);
    }

    /**
     * Constructs a new ProcessingException instance with cause.
     *
     * @param message Error message.
     * @param cause   Underlying cause.
     */
    public ProcessingException(String message, Throwable cause) {
        super(ErrorKind.PROCESSING, message, cause);
    }
}
