package com.basisengine.venue.cex;

/** Exchange order states. NEW and PARTIALLY_FILLED are still working on the book. */
public enum CexOrderStatus {
    NEW,
    PARTIALLY_FILLED,
    FILLED,
    CANCELED,
    REJECTED,
    EXPIRED;

    public boolean isOpen() {
        return this == NEW || this == PARTIALLY_FILLED;
    }
}
