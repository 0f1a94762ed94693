package com.mimecast.wren.exception;

/**
 * Error kinds reported per message and per attachment.
 * <p>Every failure recorded in a processing report carries one of these.
 */
public enum ErrorKind {
    MALFORMED_MESSAGE,
    UNSUPPORTED_FORMAT,
    TYPE_MISMATCH,
    FILE_SIZE,
    PATH_TRAVERSAL,
    EXTENSION_NOT_ALLOWED,
    EXTERNAL_SERVICE,
    SERVICE_UNAVAILABLE,
    CONFIGURATION,
    PROCESSING;

    /**
     * Checks if this kind belongs to the validation family.
     *
     * @return True for type, size, path and extension violations.
     */
    public boolean isValidation() {
        return this == TYPE_MISMATCH || this == FILE_SIZE || this == PATH_TRAVERSAL || this == EXTENSION_NOT_ALLOWED;
    }
}
