package com.basisengine.event;

public enum AuditEventType {
    INSTRUCTION_OUTCOME,
    GROUP_TRANSITION,
    COMPENSATION_EXECUTED,
    VENUE_HALTED,
    VENUE_RESUMED,
    PENDING_SETTLEMENT_RESOLVED,
    RECONCILIATION_DRIFT,
    RECONCILIATION_FAILED,
    LEDGER_OVERRIDE_APPROVED
}
