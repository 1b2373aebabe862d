package com.basisengine.event;

import com.basisengine.domain.model.ExecutionResult;
import com.basisengine.domain.model.ReconciliationRecord;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed factory methods over Spring's {@link ApplicationEventPublisher} for the engine's events.
 *
 * <p>Every audit event gets the next value of a process-wide sequence. Delivery is synchronous
 * unless a listener opts into {@code @Async}.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;
    private final AtomicLong sequence = new AtomicLong();

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Audit ----

    public void publishAudit(
            Object source, AuditEventType eventType, String subject, String message, Map<String, Object> details) {
        applicationEventPublisher.publishEvent(
                new AuditEvent(source, sequence.incrementAndGet(), eventType, subject, message, details));
    }

    public void publishAudit(Object source, AuditEventType eventType, String subject, String message) {
        publishAudit(source, eventType, subject, message, Map.of());
    }

    public void publishInstructionOutcome(Object source, ExecutionResult result) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("venue", result.getVenue());
        details.put("status", result.getStatus());
        details.put("retriesUsed", result.getRetriesUsed());
        if (result.getVenueRef() != null) {
            details.put("venueRef", result.getVenueRef());
        }
        if (result.getErrorCode() != null) {
            details.put("errorCode", result.getErrorCode().getCode());
        }
        String message = result.getErrorMessage() != null
                ? result.getStatus() + ": " + result.getErrorMessage()
                : String.valueOf(result.getStatus());
        publishAudit(source, AuditEventType.INSTRUCTION_OUTCOME, result.getInstructionId(), message, details);
    }

    /** Highest sequence handed out so far. */
    public long lastSequence() {
        return sequence.get();
    }

    // ---- Reconciliation ----

    public void publishReconciliation(Object source, List<ReconciliationRecord> records, String trigger) {
        applicationEventPublisher.publishEvent(new ReconciliationEvent(source, records, trigger));
    }
}
