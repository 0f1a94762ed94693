package com.mimecast.wren.exception;

/**
 * Magic-byte signature does not match the declared extension.
 */
public class TypeMismatchException extends ValidationException {

    /**
     * Constructs a new TypeMismatchException instance.
     *
     * @param message Error message.
     */
    public TypeMismatchException(String message) {
        super(ErrorKind.TYPE_MISMATCH, message);
    }
}
