package com.mimecast.wren.exception;

/**
 * Content is empty or larger than the configured limit.
 */
public class FileSizeException extends ValidationException {

    /**
     * Constructs a new FileSizeException instance.
     *
     * @param message Error message.
     */
    public FileSizeException(String message) {
        super(ErrorKind.FILE_SIZE, message);
    }
}
