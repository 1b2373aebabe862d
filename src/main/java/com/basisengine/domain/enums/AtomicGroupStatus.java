package com.basisengine.domain.enums;

/**
 * Lifecycle of an atomic group: PENDING -> IN_PROGRESS -> {COMMITTED | ROLLED_BACK | FAILED}.
 * Transitions only move forward; terminal states never change.
 */
public enum AtomicGroupStatus {
    PENDING,
    IN_PROGRESS,
    COMMITTED,
    ROLLED_BACK,
    FAILED;

    public boolean isTerminal() {
        return this == COMMITTED || this == ROLLED_BACK || this == FAILED;
    }

    public boolean canTransitionTo(AtomicGroupStatus next) {
        return switch (this) {
            case PENDING -> next == IN_PROGRESS;
            case IN_PROGRESS -> next.isTerminal();
            case COMMITTED, ROLLED_BACK, FAILED -> false;
        };
    }
}
