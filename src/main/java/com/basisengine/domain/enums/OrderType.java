package com.basisengine.domain.enums;

/** Order execution type. LIMIT requires a limit price on the instruction. */
public enum OrderType {
    MARKET,
    LIMIT
}
