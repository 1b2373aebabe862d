package com.basisengine.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;
import lombok.Value;

/**
 * Read-only copy of the ledger at a point in time. Safe to hand to any component.
 */
@Value
public class PositionSnapshot {

    Instant takenAt;
    Map<PositionKey, BigDecimal> balances;
    int appliedDeltaCount;

    public PositionSnapshot(Instant takenAt, Map<PositionKey, BigDecimal> balances, int appliedDeltaCount) {
        this.takenAt = takenAt;
        this.balances = Map.copyOf(balances);
        this.appliedDeltaCount = appliedDeltaCount;
    }

    public BigDecimal balance(String venue, String asset) {
        return balances.getOrDefault(new PositionKey(venue, asset), BigDecimal.ZERO);
    }

    /** Asset -> balance for one venue, sorted by asset. */
    public Map<String, BigDecimal> forVenue(String venue) {
        Map<String, BigDecimal> result = new TreeMap<>();
        balances.forEach((key, amount) -> {
            if (key.venue().equals(venue)) {
                result.put(key.asset(), amount);
            }
        });
        return result;
    }
}
