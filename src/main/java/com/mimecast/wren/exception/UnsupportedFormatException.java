package com.mimecast.wren.exception;

/**
 * Thrown when no converter handles an attachment or a converter is handed a format it cannot read.
 */
public class UnsupportedFormatException extends ConversionException {

    /**
     * Constructs a new UnsupportedFormatException instance.
     *
     * @param message Error message.
     */
    public UnsupportedFormatException(String message) {
        super(ErrorKind.UNSUPPORTED_FORMAT, message);
    }

    /**
     * Constructs a new UnsupportedFormatException instance with cause.
     *
     * @param message Error message.
     * @param cause   Underlying cause.
     */
    public UnsupportedFormatException(String message, Throwable cause) {
        super(ErrorKind.UNSUPPORTED_FORMAT, message, cause);
    }
}
