package com.basisengine.observability;

import com.basisengine.domain.enums.AtomicGroupStatus;
import com.basisengine.event.AuditEvent;
import com.basisengine.event.ReconciliationEvent;
import com.basisengine.reconciliation.PositionReconciliationService;
import com.basisengine.routing.VenueHaltRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer metrics for the engine, driven by audit and reconciliation events:
 * <ul>
 *   <li><b>execution.instructions</b> (counter, tag status): every instruction outcome</li>
 *   <li><b>execution.groups</b> (counter, tag status): atomic groups reaching a terminal state</li>
 *   <li><b>execution.compensations</b> (counter): compensations executed during rollbacks</li>
 *   <li><b>reconciliation.drift.flagged</b> (counter): flagged (venue, asset) drifts</li>
 *   <li><b>venue.halts</b> (counter): venues halted after a system failure</li>
 *   <li><b>venue.halted</b> (gauge): venues currently halted</li>
 *   <li><b>settlement.pending</b> (gauge): timed-out instructions awaiting resolution</li>
 * </ul>
 */
@Service
public class ExecutionMetricsService {

    private static final Logger log = LoggerFactory.getLogger(ExecutionMetricsService.class);

    private final MeterRegistry meterRegistry;
    private final Counter compensationCounter;
    private final Counter driftFlaggedCounter;
    private final Counter venueHaltCounter;

    public ExecutionMetricsService(
            MeterRegistry meterRegistry,
            VenueHaltRegistry venueHaltRegistry,
            PositionReconciliationService positionReconciliationService) {
        this.meterRegistry = meterRegistry;

        this.compensationCounter = Counter.builder("execution.compensations")
                .description("Compensating instructions executed while rolling back atomic groups")
                .register(meterRegistry);

        this.driftFlaggedCounter = Counter.builder("reconciliation.drift.flagged")
                .description("Ledger/venue balance drifts beyond tolerance")
                .register(meterRegistry);

        this.venueHaltCounter = Counter.builder("venue.halts")
                .description("Venues halted after a system failure")
                .register(meterRegistry);

        meterRegistry.gauge("venue.halted", venueHaltRegistry, registry -> registry.haltedVenues()
                .size());
        meterRegistry.gauge(
                "settlement.pending",
                positionReconciliationService,
                service -> service.pendingSettlements().size());
    }

    @EventListener
    @Order(20)
    public void onAuditEvent(AuditEvent event) {
        switch (event.getEventType()) {
            case INSTRUCTION_OUTCOME -> instructionCounter(String.valueOf(event.getDetails().get("status")))
                    .increment();
            case GROUP_TRANSITION -> {
                Object to = event.getDetails().get("to");
                if (to instanceof AtomicGroupStatus status && status.isTerminal()) {
                    groupCounter(status.name()).increment();
                }
            }
            case COMPENSATION_EXECUTED -> compensationCounter.increment();
            case VENUE_HALTED -> venueHaltCounter.increment();
            default -> {
                // not metered
            }
        }
    }

    @EventListener
    @Order(20)
    public void onReconciliationEvent(ReconciliationEvent event) {
        long flagged = event.getRecords().stream()
                .mapToLong(r -> r.getFlaggedAssets().size())
                .sum();
        if (flagged > 0) {
            driftFlaggedCounter.increment(flagged);
            log.warn("Reconciliation ({}) flagged {} drifting balances", event.getTrigger(), flagged);
        }
    }

    private Counter instructionCounter(String status) {
        return Counter.builder("execution.instructions")
                .description("Instruction outcomes by status")
                .tag("status", status)
                .register(meterRegistry);
    }

    private Counter groupCounter(String status) {
        return Counter.builder("execution.groups")
                .description("Atomic group terminal states")
                .tag("status", status)
                .register(meterRegistry);
    }
}
