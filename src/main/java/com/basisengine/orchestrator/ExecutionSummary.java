package com.basisengine.orchestrator;

import com.basisengine.domain.enums.AtomicGroupStatus;
import com.basisengine.domain.enums.ExecutionStatus;
import com.basisengine.domain.model.ExecutionResult;
import com.basisengine.domain.model.ReconciliationRecord;
import com.basisengine.event.AuditEvent;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.Builder;
import lombok.Data;

/** What one tick did: every instruction's result, group outcomes, halts and the audit trail. */
@Data
@Builder
public class ExecutionSummary {

    private String tickId;

    /** One result per input instruction, in execution order. */
    private List<ExecutionResult> results;

    private List<ExecutionResult> compensations;
    private Map<String, AtomicGroupStatus> groupStatuses;
    private Set<String> haltedVenues;
    private List<AuditEvent> auditEvents;
    private List<ReconciliationRecord> reconciliationRecords;
    private long durationMs;

    public long getFilledCount() {
        return count(ExecutionStatus.FILLED);
    }

    public long getConfirmedCount() {
        return count(ExecutionStatus.CONFIRMED);
    }

    public long getFailedCount() {
        return count(ExecutionStatus.FAILED);
    }

    public long getTimedOutCount() {
        return count(ExecutionStatus.TIMEOUT);
    }

    public long getSucceededCount() {
        return getFilledCount() + getConfirmedCount();
    }

    private long count(ExecutionStatus status) {
        return results.stream().filter(r -> r.getStatus() == status).count();
    }
}
