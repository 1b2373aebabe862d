package com.basisengine.observability;

import com.basisengine.domain.model.ReconciliationRecord;
import com.basisengine.reconciliation.PendingSettlement;
import com.basisengine.reconciliation.PositionReconciliationService;
import com.basisengine.reconciliation.ReconciliationRecordStore;
import com.basisengine.routing.VenueHaltRegistry;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Service;

/**
 * Summarizes engine health for operators: halted venues, unresolved timeouts and the latest
 * flagged drift.
 */
@Service
public class EngineHealthService {

    private final VenueHaltRegistry venueHaltRegistry;
    private final PositionReconciliationService positionReconciliationService;
    private final ReconciliationRecordStore reconciliationRecordStore;

    public EngineHealthService(
            VenueHaltRegistry venueHaltRegistry,
            PositionReconciliationService positionReconciliationService,
            ReconciliationRecordStore reconciliationRecordStore) {
        this.venueHaltRegistry = venueHaltRegistry;
        this.positionReconciliationService = positionReconciliationService;
        this.reconciliationRecordStore = reconciliationRecordStore;
    }

    public EngineHealth check() {
        List<VenueHaltRegistry.Halt> halts = venueHaltRegistry.haltedVenues().stream()
                .map(venueHaltRegistry::find)
                .flatMap(Optional::stream)
                .toList();
        List<PendingSettlement> pending = positionReconciliationService.pendingSettlements();
        ReconciliationRecord latestFlagged =
                reconciliationRecordStore.latestFlagged().orElse(null);

        EngineHealth.Level level;
        if (!halts.isEmpty()) {
            level = EngineHealth.Level.DEGRADED;
        } else if (!pending.isEmpty() || latestFlagged != null) {
            level = EngineHealth.Level.WARNING;
        } else {
            level = EngineHealth.Level.HEALTHY;
        }

        return EngineHealth.builder()
                .level(level)
                .haltedVenues(halts)
                .pendingSettlements(pending)
                .latestFlagged(latestFlagged)
                .checkedAt(Instant.now())
                .build();
    }
}
