package com.basisengine.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.basisengine.event.AuditEvent;
import com.basisengine.event.AuditEventType;
import com.basisengine.event.EventPublisherHelper;
import com.basisengine.observability.AuditTrail;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AuditTrailTest {

    private AuditTrail auditTrail;
    private EventPublisherHelper eventPublisherHelper;

    @BeforeEach
    void setUp() {
        auditTrail = new AuditTrail();
        eventPublisherHelper = new EventPublisherHelper(event -> auditTrail.onAuditEvent((AuditEvent) event));
    }

    @Test
    @DisplayName("since returns only newer events, oldest first")
    void since() {
        eventPublisherHelper.publishAudit(this, AuditEventType.VENUE_HALTED, "binance", "halted");
        long mark = eventPublisherHelper.lastSequence();
        eventPublisherHelper.publishAudit(this, AuditEventType.INSTRUCTION_OUTCOME, "I-1", "FILLED");
        eventPublisherHelper.publishAudit(this, AuditEventType.INSTRUCTION_OUTCOME, "I-2", "FAILED");

        assertThat(auditTrail.since(mark)).extracting(AuditEvent::getSubject).containsExactly("I-1", "I-2");
        assertThat(auditTrail.since(eventPublisherHelper.lastSequence())).isEmpty();
    }

    @Test
    @DisplayName("since keeps events that arrived out of sequence order and leaves older ones out")
    void sinceOutOfOrder() {
        auditTrail.onAuditEvent(new AuditEvent(this, 1, AuditEventType.INSTRUCTION_OUTCOME, "I-1", "FILLED", Map.of()));
        auditTrail.onAuditEvent(new AuditEvent(this, 3, AuditEventType.INSTRUCTION_OUTCOME, "I-3", "FILLED", Map.of()));
        auditTrail.onAuditEvent(new AuditEvent(this, 2, AuditEventType.RECONCILIATION_DRIFT, "okx", "drift", Map.of()));
        auditTrail.onAuditEvent(new AuditEvent(this, 4, AuditEventType.INSTRUCTION_OUTCOME, "I-4", "FILLED", Map.of()));

        assertThat(auditTrail.since(1)).extracting(AuditEvent::getSequence).containsExactly(2L, 3L, 4L);
        assertThat(auditTrail.since(2)).extracting(AuditEvent::getSubject).containsExactly("I-3", "I-4");
    }

    @Test
    @DisplayName("A recording holds only the events published on its own thread")
    void recordingIgnoresOtherThreads() throws Exception {
        eventPublisherHelper.publishAudit(this, AuditEventType.VENUE_HALTED, "binance", "before");

        List<AuditEvent> recorded;
        try (AuditTrail.Recording recording = auditTrail.startRecording()) {
            eventPublisherHelper.publishAudit(this, AuditEventType.INSTRUCTION_OUTCOME, "I-1", "FILLED");
            Thread other = new Thread(() ->
                    eventPublisherHelper.publishAudit(this, AuditEventType.RECONCILIATION_DRIFT, "okx", "drift"));
            other.start();
            other.join();
            eventPublisherHelper.publishAudit(this, AuditEventType.INSTRUCTION_OUTCOME, "I-2", "FAILED");
            recorded = recording.events();
        }
        eventPublisherHelper.publishAudit(this, AuditEventType.VENUE_RESUMED, "binance", "after");

        assertThat(recorded).extracting(AuditEvent::getSubject).containsExactly("I-1", "I-2");
        assertThat(auditTrail.size()).isEqualTo(5);
    }

    @Test
    @DisplayName("Recordings do not nest")
    void recordingDoesNotNest() {
        try (AuditTrail.Recording ignored = auditTrail.startRecording()) {
            assertThatThrownBy(auditTrail::startRecording).isInstanceOf(IllegalStateException.class);
        }
        auditTrail.startRecording().close();
    }

    @Test
    @DisplayName("recent is newest first and bounded by the limit")
    void recent() {
        eventPublisherHelper.publishAudit(this, AuditEventType.INSTRUCTION_OUTCOME, "I-1", "FILLED");
        eventPublisherHelper.publishAudit(this, AuditEventType.INSTRUCTION_OUTCOME, "I-2", "FILLED");
        eventPublisherHelper.publishAudit(this, AuditEventType.INSTRUCTION_OUTCOME, "I-3", "FILLED");

        assertThat(auditTrail.recent(2)).extracting(AuditEvent::getSubject).containsExactly("I-3", "I-2");
        assertThat(auditTrail.size()).isEqualTo(3);
    }

    @Test
    @DisplayName("recentOfType filters by event type")
    void recentOfType() {
        eventPublisherHelper.publishAudit(this, AuditEventType.INSTRUCTION_OUTCOME, "I-1", "FILLED");
        eventPublisherHelper.publishAudit(this, AuditEventType.VENUE_HALTED, "aave", "halted");
        eventPublisherHelper.publishAudit(this, AuditEventType.INSTRUCTION_OUTCOME, "I-2", "FILLED");

        assertThat(auditTrail.recentOfType(AuditEventType.VENUE_HALTED, 10))
                .extracting(AuditEvent::getSubject)
                .containsExactly("aave");
    }

    @Test
    @DisplayName("Oldest events are evicted beyond the buffer size")
    void eviction() {
        for (int i = 0; i < 5_010; i++) {
            eventPublisherHelper.publishAudit(this, AuditEventType.INSTRUCTION_OUTCOME, "I-" + i, "FILLED");
        }

        assertThat(auditTrail.size()).isEqualTo(5_000);
        assertThat(auditTrail.recent(1).get(0).getSubject()).isEqualTo("I-5009");
    }
}
