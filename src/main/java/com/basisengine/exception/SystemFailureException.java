package com.basisengine.exception;

import com.basisengine.domain.model.ExecutionResult;
import java.util.Map;
import lombok.Getter;

/**
 * Retries against a venue were exhausted. Submission to the venue halts until an operator
 * resumes it; the failed result travels with the exception so the outcome is still reported.
 */
@Getter
public class SystemFailureException extends BaseException {

    private final String venue;
    private final transient ExecutionResult failedResult;

    public SystemFailureException(String venue, ExecutionResult failedResult, Throwable cause) {
        super(
                ErrorCode.RETRIES_EXHAUSTED,
                "Retries exhausted on venue " + venue + " for instruction " + failedResult.getInstructionId(),
                Map.of("venue", venue, "instructionId", failedResult.getInstructionId()),
                cause);
        this.venue = venue;
        this.failedResult = failedResult;
    }
}
