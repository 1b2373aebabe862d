package com.basisengine.event;

import com.basisengine.domain.model.ReconciliationRecord;
import java.time.Instant;
import java.util.List;
import org.springframework.context.ApplicationEvent;

/**
 * Published after every reconciliation run with one record per compared venue.
 *
 * <p>ExecutionMetricsService listens to count flagged drifts.
 */
public class ReconciliationEvent extends ApplicationEvent {

    private final List<ReconciliationRecord> records;
    private final String trigger;
    private final Instant reconciledAt;

    public ReconciliationEvent(Object source, List<ReconciliationRecord> records, String trigger) {
        super(source);
        this.records = List.copyOf(records);
        this.trigger = trigger;
        this.reconciledAt = Instant.now();
    }

    public List<ReconciliationRecord> getRecords() {
        return records;
    }

    /** POST_EXECUTION, SCHEDULED or MANUAL. */
    public String getTrigger() {
        return trigger;
    }

    public Instant getReconciledAt() {
        return reconciledAt;
    }

    public boolean hasFlaggedDrift() {
        return records.stream().anyMatch(ReconciliationRecord::isFlagged);
    }
}
