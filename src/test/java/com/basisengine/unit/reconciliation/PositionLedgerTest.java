package com.basisengine.unit.reconciliation;

import static org.assertj.core.api.Assertions.assertThat;

import com.basisengine.domain.model.PositionDelta;
import com.basisengine.domain.model.PositionSnapshot;
import com.basisengine.reconciliation.PositionLedger;
import java.math.BigDecimal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PositionLedgerTest {

    private final PositionLedger ledger = new PositionLedger();

    private static PositionDelta delta(String id, String venue, String asset, String amount) {
        return PositionDelta.builder()
                .instructionId(id)
                .venue(venue)
                .asset(asset)
                .signedAmount(new BigDecimal(amount))
                .build();
    }

    @Test
    @DisplayName("Deltas accumulate per venue and asset")
    void accumulates() {
        ledger.apply(delta("A", "binance", "BTC", "1.5"));
        ledger.apply(delta("B", "binance", "BTC", "-0.5"));
        ledger.apply(delta("C", "okx", "BTC", "2"));

        assertThat(ledger.balance("binance", "BTC")).isEqualByComparingTo("1");
        assertThat(ledger.balance("okx", "BTC")).isEqualByComparingTo("2");
        assertThat(ledger.balance("okx", "ETH")).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("A delta is applied at most once per instruction id")
    void appliedOnce() {
        assertThat(ledger.apply(delta("A", "binance", "BTC", "1"))).isTrue();
        assertThat(ledger.apply(delta("A", "binance", "BTC", "1"))).isFalse();

        assertThat(ledger.balance("binance", "BTC")).isEqualByComparingTo("1");
        assertThat(ledger.appliedCount()).isEqualTo(1);
        assertThat(ledger.isApplied("A")).isTrue();
    }

    @Test
    @DisplayName("Offset leg is booked together with the main leg")
    void offsetLeg() {
        ledger.apply(PositionDelta.builder()
                .instructionId("TR-1")
                .venue("binance")
                .asset("USDT")
                .signedAmount(new BigDecimal("-100"))
                .offset(new PositionDelta.Leg("treasury", "USDT", new BigDecimal("100")))
                .build());

        assertThat(ledger.balance("binance", "USDT")).isEqualByComparingTo("-100");
        assertThat(ledger.balance("treasury", "USDT")).isEqualByComparingTo("100");
    }

    @Test
    @DisplayName("Snapshot is a detached copy")
    void snapshotDetached() {
        ledger.apply(delta("A", "binance", "BTC", "1"));
        PositionSnapshot snapshot = ledger.snapshot();

        ledger.apply(delta("B", "binance", "BTC", "1"));

        assertThat(snapshot.balance("binance", "BTC")).isEqualByComparingTo("1");
        assertThat(snapshot.getAppliedDeltaCount()).isEqualTo(1);
        assertThat(snapshot.forVenue("binance")).containsOnlyKeys("BTC");
    }
}
