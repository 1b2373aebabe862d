package com.basisengine.exception;

import com.basisengine.coordination.GroupExecutionResult;
import java.util.Set;
import lombok.Getter;

/**
 * An atomic group failed in a way the coordinator could not unwind (no compensation exists, a
 * compensation failed, a leg timed out or retries were exhausted). Escalated to halt the venues
 * the group touched.
 */
@Getter
public class AtomicGroupAbortException extends BaseException {

    private final transient GroupExecutionResult groupResult;
    private final Set<String> affectedVenues;

    public AtomicGroupAbortException(
            ErrorCode errorCode, String message, GroupExecutionResult groupResult, Set<String> affectedVenues) {
        this(errorCode, message, groupResult, affectedVenues, null);
    }

    public AtomicGroupAbortException(
            ErrorCode errorCode,
            String message,
            GroupExecutionResult groupResult,
            Set<String> affectedVenues,
            Throwable cause) {
        super(errorCode, message, cause);
        this.groupResult = groupResult;
        this.affectedVenues = Set.copyOf(affectedVenues);
    }
}
