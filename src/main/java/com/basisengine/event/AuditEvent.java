package com.basisengine.event;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Append-only audit record for every state change the engine makes: instruction outcomes, group
 * transitions, compensations, venue halts and resumes, drift and operator overrides.
 *
 * <p>The {@code sequence} is assigned by {@link EventPublisherHelper} and increases strictly,
 * so a consumer can ask for "everything after N".
 */
public class AuditEvent extends ApplicationEvent {

    private final long sequence;
    private final AuditEventType eventType;
    private final String subject;
    private final String message;
    private final Map<String, Object> details;
    private final Instant occurredAt;

    public AuditEvent(
            Object source,
            long sequence,
            AuditEventType eventType,
            String subject,
            String message,
            Map<String, Object> details) {
        super(source);
        this.sequence = sequence;
        this.eventType = eventType;
        this.subject = subject;
        this.message = message;
        this.details = details != null ? new HashMap<>(details) : new HashMap<>();
        this.occurredAt = Instant.now();
    }

    public long getSequence() {
        return sequence;
    }

    public AuditEventType getEventType() {
        return eventType;
    }

    /** Instruction id, group id or venue name the event is about. */
    public String getSubject() {
        return subject;
    }

    public String getMessage() {
        return message;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }

    @Override
    public String toString() {
        return "AuditEvent[" + sequence + " " + eventType + " " + subject + ": " + message + "]";
    }
}
