package com.mimecast.wren.mime;

import java.io.IOException;

/**
 * Top level message structure could not be parsed.
 *
 * <p>Message scoped: aborts processing of one message only.
 */
public class MalformedMessageException extends IOException {

    /**
     * Constructs a new MalformedMessageException instance.
     *
     * @param message Error message.
     */
    public MalformedMessageException(String message) {
        super(message);
    }

    /**
     * Constructs a new MalformedMessageException instance with cause.
     *
     * @param message Error message.
     * @param cause   Underlying cause.
     */
    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
