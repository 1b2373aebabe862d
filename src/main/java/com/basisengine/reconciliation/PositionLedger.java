package com.basisengine.reconciliation;

import com.basisengine.domain.model.PositionDelta;
import com.basisengine.domain.model.PositionKey;
import com.basisengine.domain.model.PositionSnapshot;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Authoritative balances per (venue, asset).
 *
 * <p>Each delta is applied at most once per instruction id; re-delivery of the same delta is a
 * no-op. Reads are safe from any thread. Writes are serialized by the owning
 * {@link PositionReconciliationService}, the only component holding a reference.
 */
public class PositionLedger {

    private final Map<PositionKey, BigDecimal> balances = new ConcurrentHashMap<>();
    private final Set<String> appliedInstructionIds = ConcurrentHashMap.newKeySet();

    /**
     * Applies every leg of the delta.
     *
     * @return false if a delta for this instruction id was already applied
     */
    public synchronized boolean apply(PositionDelta delta) {
        if (!appliedInstructionIds.add(delta.getInstructionId())) {
            return false;
        }
        for (PositionDelta.Leg leg : delta.legs()) {
            balances.merge(leg.key(), leg.signedAmount(), BigDecimal::add);
        }
        return true;
    }

    public boolean isApplied(String instructionId) {
        return appliedInstructionIds.contains(instructionId);
    }

    public BigDecimal balance(String venue, String asset) {
        return balances.getOrDefault(new PositionKey(venue, asset), BigDecimal.ZERO);
    }

    public int appliedCount() {
        return appliedInstructionIds.size();
    }

    public synchronized PositionSnapshot snapshot() {
        return new PositionSnapshot(Instant.now(), balances, appliedInstructionIds.size());
    }
}
