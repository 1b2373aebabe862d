package com.basisengine.domain.enums;

/**
 * Outcome of a single adapter call.
 *
 * <p>FILLED is a CEX fill, CONFIRMED an on-chain transaction with the required confirmations.
 * TIMEOUT means the engine stopped waiting: the operation may still settle and is resolved by a
 * later reconciliation pass, it is never treated as a failure.
 */
public enum ExecutionStatus {
    FILLED,
    CONFIRMED,
    FAILED,
    TIMEOUT;

    public boolean isSuccess() {
        return this == FILLED || this == CONFIRMED;
    }
}
