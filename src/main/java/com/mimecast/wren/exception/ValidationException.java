package com.mimecast.wren.exception;

/**
 * Security validation failure.
 * <p>Aborts only the conversion of the offending attachment.
 */
public class ValidationException extends ConversionException {

    /**
     * Constructs a new ValidationException instance.
     *
     * @param kind    Validation kind.
     * @param message Error message.
     */
    public ValidationException(ErrorKind kind, String message) {
        super(kind, message);
    }

    /**
     * Builds the exception subtype matching the given kind.
     *
     * @param kind    Validation kind.
     * @param message Error message.
     * @return ValidationException instance.
     */
    public static ValidationException of(ErrorKind kind, String message) {
        switch (kind) {
            case TYPE_MISMATCH:
                return new TypeMismatchException(message);
            case FILE_SIZE:
                return new FileSizeException(message);
            case PATH_TRAVERSAL:
                return new PathTraversalException(message);
            case EXTENSION_NOT_ALLOWED:
                return new ExtensionNotAllowedException(message);
            default:
                return new ValidationException(kind, message);
        }
    }
}
