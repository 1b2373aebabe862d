package com.basisengine.domain.model;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Ledger change derived from one {@link ExecutionResult}. Applied at most once per instruction id.
 *
 * <p>Legs booked together:
 * <ul>
 *   <li>the primary leg ({@code venue}, {@code asset}, {@code signedAmount})</li>
 *   <li>{@code offset}: the counter-leg of a transfer, swap or spot trade (the quote asset paid or received)</li>
 *   <li>{@code fee}: trading fee, withdrawal fee or gas, debited in the asset it was charged in</li>
 * </ul>
 * A fee-only delta (reverted transaction) has a zero primary leg.
 */
@Value
@Builder
public class PositionDelta {

    String instructionId;
    String venue;
    String asset;
    BigDecimal signedAmount;

    /** Counter-leg, null for single-leg changes. */
    Leg offset;

    /** Fee debit, null when nothing was charged. */
    Leg fee;

    public PositionKey key() {
        return new PositionKey(venue, asset);
    }

    /** Every non-empty leg, primary first. */
    public List<Leg> legs() {
        List<Leg> legs = new ArrayList<>(3);
        if (signedAmount != null && signedAmount.signum() != 0) {
            legs.add(new Leg(venue, asset, signedAmount));
        }
        if (offset != null) {
            legs.add(offset);
        }
        if (fee != null) {
            legs.add(fee);
        }
        return legs;
    }

    public record Leg(String venue, String asset, BigDecimal signedAmount) {

        public PositionKey key() {
            return new PositionKey(venue, asset);
        }
    }
}
