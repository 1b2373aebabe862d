package com.basisengine.domain.model;

import com.basisengine.domain.enums.ExecutionStatus;
import com.basisengine.exception.ErrorCode;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Normalized outcome of executing one instruction on one venue. Immutable once produced;
 * {@link #withRetriesUsed(int)} returns a copy.
 */
@Value
@Builder(toBuilder = true)
public class ExecutionResult {

    String instructionId;
    String venue;
    ExecutionStatus status;

    /** CEX order id or on-chain tx hash. */
    String venueRef;

    BigDecimal filledPrice;
    BigDecimal filledSize;
    /** Asset a spot fill was paid or received in; null for anything but exchange trades. */
    String quoteAsset;

    BigDecimal fee;
    String feeAsset;

    /** Null on success. */
    ErrorCode errorCode;

    String errorMessage;
    int retriesUsed;
    Instant completedAt;

    public boolean isSuccess() {
        return status != null && status.isSuccess();
    }

    /** Whether the venue charged a fee for this outcome, successful or not. */
    public boolean hasFee() {
        return fee != null && fee.signum() != 0 && feeAsset != null;
    }

    public ExecutionResult withRetriesUsed(int retries) {
        return toBuilder().retriesUsed(retries).build();
    }

    public static ExecutionResult failed(Instruction instruction, ErrorCode errorCode, String message) {
        return ExecutionResult.builder()
                .instructionId(instruction.getId())
                .venue(instruction.getVenue())
                .status(ExecutionStatus.FAILED)
                .errorCode(errorCode)
                .errorMessage(message)
                .completedAt(Instant.now())
                .build();
    }
}
