package com.mimecast.wren.exception;

/**
 * Extension is blocked or missing from the allow-list.
 */
public class ExtensionNotAllowedException extends ValidationException {

    /**
     * Constructs a new ExtensionNotAllowedException instance.
     *
     * @param message Error message.
     */
    public ExtensionNotAllowedException(String message) {
        super(ErrorKind.EXTENSION_NOT_ALLOWED, message);
    }
}
