package com.mimecast.wren.exception;

/**
 * Name carries path traversal or absolute path segments.
 */
public class PathTraversalException extends ValidationException {

    /**
     * Constructs a new PathTraversalException instance.
     *
     * @param message Error message.
     */
    public PathTraversalException(String message) {
        super(ErrorKind.PATH_TRAVERSAL, message);
    }
}
