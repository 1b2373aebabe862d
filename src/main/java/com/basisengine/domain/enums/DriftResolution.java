package com.basisengine.domain.enums;

/**
 * ACCEPTED = ledger and venue agree within tolerance. FLAGGED = drift beyond tolerance,
 * left for operator review. Neither resolution modifies the ledger.
 */
public enum DriftResolution {
    ACCEPTED,
    FLAGGED
}
