package com.basisengine.observability;

import com.basisengine.domain.model.ReconciliationRecord;
import com.basisengine.reconciliation.PendingSettlement;
import com.basisengine.routing.VenueHaltRegistry;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Point-in-time view of what needs operator attention. */
@Value
@Builder
public class EngineHealth {

    public enum Level {
        /** Nothing halted, nothing pending, last reconciliation clean. */
        HEALTHY,

        /** Pending settlements or flagged drift; submission continues. */
        WARNING,

        /** At least one venue halted; units touching it are not submitted. */
        DEGRADED
    }

    Level level;
    List<VenueHaltRegistry.Halt> haltedVenues;
    List<PendingSettlement> pendingSettlements;

    /** Most recent flagged reconciliation record, null if none. */
    ReconciliationRecord latestFlagged;

    Instant checkedAt;
}
