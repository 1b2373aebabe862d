package com.basisengine.coordination;

import com.basisengine.domain.enums.AtomicGroupStatus;
import com.basisengine.domain.model.ExecutionResult;
import com.basisengine.exception.ErrorCode;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/** Outcome of one atomic group: a result per member in sequence order plus any compensations. */
@Data
@Builder
public class GroupExecutionResult {

    private String groupId;
    private AtomicGroupStatus status;
    private List<ExecutionResult> results;
    private List<ExecutionResult> compensations;
    private List<AtomicGroupStatus> transitions;

    /** Why the group did not commit; null when committed. */
    private ErrorCode abortCode;

    private String failureReason;
    private int deltasApplied;

    public boolean isCommitted() {
        return status == AtomicGroupStatus.COMMITTED;
    }
}
