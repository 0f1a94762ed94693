package com.mimecast.wren.converter;

import com.mimecast.wren.security.AttachmentValidator;
import com.mimecast.wren.security.ValidationPolicy;

import java.time.Instant;

/**
 * Per message conversion context.
 */
public class ConversionContext {

    private final String messageId;
    private final ValidationPolicy policy;
    private final AttachmentValidator validator;
    private final Instant timestamp;

    /**
     * Constructs a new ConversionContext instance.
     *
     * @param messageId Message id.
     * @param policy    Base validation policy.
     * @param validator AttachmentValidator instance.
     * @param timestamp Processing timestamp.
     */
    public ConversionContext(String messageId, ValidationPolicy policy, AttachmentValidator validator, Instant timestamp) {
        this.messageId = messageId;
        this.policy = policy;
        this.validator = validator;
        this.timestamp = timestamp;
    }

    public String getMessageId() {
        return messageId;
    }

    public ValidationPolicy getPolicy() {
        return policy;
    }

    public AttachmentValidator getValidator() {
        return validator;
    }

    public Instant getTimestamp() {
        return timestamp;
    }
}
