package com.basisengine.venue.cex;

public enum CexOrderSide {
    BUY,
    SELL
}
