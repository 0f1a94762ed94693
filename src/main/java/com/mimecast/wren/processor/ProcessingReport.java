package com.mimecast.wren.processor;

import com.mimecast.wren.exception.ErrorKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Attachment outcomes of one message, in attachment order.
 */
public class ProcessingReport {

    private final String messageId;
    private final List<AttachmentOutcome> outcomes;

    /**
     * Constructs a new ProcessingReport instance.
     *
     * @param messageId Message id.
     * @param outcomes  Outcomes in attachment order.
     */
    public ProcessingReport(String messageId, List<AttachmentOutcome> outcomes) {
        this.messageId = messageId;
        this.outcomes = new ArrayList<>(outcomes);
    }

    public String getMessageId() {
        return messageId;
    }

    public List<AttachmentOutcome> getOutcomes() {
        return Collections.unmodifiableList(outcomes);
    }

    public int getSuccessCount() {
        return (int) outcomes.stream().filter(AttachmentOutcome::isSuccess).count();
    }

    public int getFailureCount() {
        return outcomes.size() - getSuccessCount();
    }

    /**
     * Gets outcomes that did not convert.
     *
     * @return List of AttachmentOutcome.
     */
    public List<AttachmentOutcome> getFailures() {
        List<AttachmentOutcome> failures = new ArrayList<>();
        for (AttachmentOutcome outcome : outcomes) {
            if (!outcome.isSuccess()) {
                failures.add(outcome);
            }
        }
        return failures;
    }

    /**
     * Counts outcomes of the given error kind.
     *
     * @param kind ErrorKind.
     * @return Count.
     */
    public int count(ErrorKind kind) {
        return (int) outcomes.stream().filter(o -> o.getErrorKind() == kind).count();
    }

    @Override
    public String toString() {
        return messageId + ": " + getSuccessCount() + " converted, " + getFailureCount() + " not converted";
    }
}
