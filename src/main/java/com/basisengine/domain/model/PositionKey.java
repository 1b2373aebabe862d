package com.basisengine.domain.model;

/** Ledger coordinate: one asset balance held at one venue. */
public record PositionKey(String venue, String asset) {

    @Override
    public String toString() {
        return venue + ":" + asset;
    }
}
