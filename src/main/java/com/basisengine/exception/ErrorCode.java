package com.basisengine.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    INVALID_INSTRUCTION("INVALID_INSTRUCTION", ErrorKind.VALIDATION),
    INVALID_GROUP("INVALID_GROUP", ErrorKind.VALIDATION),
    DUPLICATE_INSTRUCTION("DUPLICATE_INSTRUCTION", ErrorKind.VALIDATION),
    UNROUTABLE("UNROUTABLE", ErrorKind.UNROUTABLE),
    VENUE_UNAVAILABLE("VENUE_UNAVAILABLE", ErrorKind.TRANSIENT),
    VENUE_TIMEOUT("VENUE_TIMEOUT", ErrorKind.TRANSIENT),
    RATE_LIMITED("RATE_LIMITED", ErrorKind.TRANSIENT),
    INSUFFICIENT_BALANCE("INSUFFICIENT_BALANCE", ErrorKind.TERMINAL),
    INVALID_SYMBOL("INVALID_SYMBOL", ErrorKind.TERMINAL),
    ORDER_REJECTED("ORDER_REJECTED", ErrorKind.TERMINAL),
    FILL_TIMEOUT("FILL_TIMEOUT", ErrorKind.TERMINAL),
    TX_REJECTED("TX_REJECTED", ErrorKind.TERMINAL),
    TX_REVERTED("TX_REVERTED", ErrorKind.TERMINAL),
    SKIPPED_GROUP_ABORT("SKIPPED_GROUP_ABORT", ErrorKind.GROUP_ABORT),
    NO_COMPENSATION("NO_COMPENSATION", ErrorKind.GROUP_ABORT),
    COMPENSATION_FAILED("COMPENSATION_FAILED", ErrorKind.GROUP_ABORT),
    UNRESOLVED_GROUP_LEG("UNRESOLVED_GROUP_LEG", ErrorKind.GROUP_ABORT),
    RECONCILIATION_DRIFT("RECONCILIATION_DRIFT", ErrorKind.DRIFT),
    RETRIES_EXHAUSTED("RETRIES_EXHAUSTED", ErrorKind.SYSTEM_FAILURE),
    VENUE_HALTED("VENUE_HALTED", ErrorKind.SYSTEM_FAILURE),
    INTERNAL_ERROR("INTERNAL_ERROR", ErrorKind.SYSTEM_FAILURE);

    private final String code;
    private final ErrorKind kind;

    public boolean isRetryable() {
        return kind == ErrorKind.TRANSIENT;
    }
}
