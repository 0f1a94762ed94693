package com.mimecast.wren.processor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcomes of a batch run.
 */
public class BatchReport {

    private final List<MessageOutcome> outcomes;
    private final int cancelled;

    /**
     * Constructs a new BatchReport instance.
     *
     * @param outcomes  Completed message outcomes in input order.
     * @param cancelled Inputs not processed due to cancellation.
     */
    public BatchReport(List<MessageOutcome> outcomes, int cancelled) {
        this.outcomes = new ArrayList<>(outcomes);
        this.cancelled = cancelled;
    }

    public List<MessageOutcome> getOutcomes() {
        return Collections.unmodifiableList(outcomes);
    }

    public int getCancelled() {
        return cancelled;
    }

    public int getProcessedCount() {
        return (int) outcomes.stream().filter(MessageOutcome::isSuccess).count();
    }

    public int getFailedCount() {
        return outcomes.size() - getProcessedCount();
    }

    @Override
    public String toString() {
        return getProcessedCount() + " processed, " + getFailedCount() + " failed, " + cancelled + " cancelled";
    }
}
