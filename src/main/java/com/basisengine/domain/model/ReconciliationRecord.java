package com.basisengine.domain.model;

import com.basisengine.domain.enums.DriftResolution;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of comparing the ledger with one venue's reported balances.
 *
 * <p>Drift is {@code expected - reported} per asset. The record is FLAGGED when any asset drifts
 * beyond its tolerance; the ledger itself is left untouched either way.
 */
@Value
@Builder
public class ReconciliationRecord {

    String id;
    Instant timestamp;
    String trigger;
    String venue;
    Map<String, BigDecimal> expectedSnapshot;
    Map<String, BigDecimal> venueReportedSnapshot;
    Map<String, BigDecimal> driftPerAsset;
    List<String> flaggedAssets;
    DriftResolution resolution;

    public boolean isFlagged() {
        return resolution == DriftResolution.FLAGGED;
    }
}
