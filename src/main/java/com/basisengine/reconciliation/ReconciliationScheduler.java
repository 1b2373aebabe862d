package com.basisengine.reconciliation;

import com.basisengine.config.ExecutionProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic reconciliation of every enabled venue, every {@code reconciliation.interval-ms}.
 */
@Component
public class ReconciliationScheduler {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationScheduler.class);

    static final String TRIGGER = "SCHEDULED";

    private final PositionReconciliationService positionReconciliationService;
    private final ExecutionProperties executionProperties;

    public ReconciliationScheduler(
            PositionReconciliationService positionReconciliationService, ExecutionProperties executionProperties) {
        this.positionReconciliationService = positionReconciliationService;
        this.executionProperties = executionProperties;
    }

    @Scheduled(
            fixedDelayString = "${basisengine.reconciliation.interval-ms:60000}",
            initialDelayString = "${basisengine.reconciliation.interval-ms:60000}")
    public void scheduledReconciliation() {
        if (!executionProperties.getReconciliation().isScheduled()) {
            log.debug("Scheduled reconciliation disabled");
            return;
        }
        positionReconciliationService.reconcile(TRIGGER);
    }
}
