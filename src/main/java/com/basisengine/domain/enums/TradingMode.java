package com.basisengine.domain.enums;

/** PAPER wires simulated venue clients, LIVE wires the REST clients. */
public enum TradingMode {
    PAPER,
    LIVE
}
