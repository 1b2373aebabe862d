package com.basisengine.observability;

import com.basisengine.event.AuditEvent;
import com.basisengine.event.AuditEventType;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * In-memory ring buffer of the most recent audit events, newest first.
 *
 * <p>Persistence belongs to whoever listens to {@link AuditEvent}; this buffer lets operators look
 * at recent history. A tick collects its own events with {@link #startRecording()}: listeners run
 * on the publishing thread, so events raised concurrently elsewhere (a scheduled reconciliation,
 * an operator resume) never end up in the tick's list.
 */
@Component
public class AuditTrail {

    private static final Logger log = LoggerFactory.getLogger(AuditTrail.class);

    static final int RING_BUFFER_SIZE = 5000;

    private final ConcurrentLinkedDeque<AuditEvent> ringBuffer = new ConcurrentLinkedDeque<>();
    private final AtomicInteger size = new AtomicInteger();
    private final ThreadLocal<List<AuditEvent>> recordings = new ThreadLocal<>();

    @EventListener
    public void onAuditEvent(AuditEvent event) {
        List<AuditEvent> recording = recordings.get();
        if (recording != null) {
            recording.add(event);
        }
        ringBuffer.addFirst(event);
        if (size.incrementAndGet() > RING_BUFFER_SIZE) {
            ringBuffer.pollLast();
            size.decrementAndGet();
        }
    }

    /**
     * Starts collecting every audit event published on the calling thread until the returned
     * recording is closed. Recordings do not nest.
     */
    public Recording startRecording() {
        if (recordings.get() != null) {
            throw new IllegalStateException("Audit recording already open on " + Thread.currentThread().getName());
        }
        List<AuditEvent> events = new ArrayList<>();
        recordings.set(events);
        return new Recording(events);
    }

    /**
     * Buffered events with a sequence greater than {@code sequence}, ordered by sequence. Events
     * from concurrent publishers can reach the buffer out of sequence order, so the whole buffer
     * is scanned.
     */
    public List<AuditEvent> since(long sequence) {
        List<AuditEvent> events = ringBuffer.stream()
                .filter(e -> e.getSequence() > sequence)
                .sorted(Comparator.comparingLong(AuditEvent::getSequence))
                .toList();
        if (size.get() >= RING_BUFFER_SIZE && ringBuffer.stream().noneMatch(e -> e.getSequence() <= sequence + 1)) {
            log.warn("Audit events after sequence {} partly evicted, returning the {} still buffered", sequence, events.size());
        }
        return events;
    }

    public List<AuditEvent> recent(int limit) {
        return ringBuffer.stream().limit(limit).toList();
    }

    public List<AuditEvent> recentOfType(AuditEventType type, int limit) {
        return ringBuffer.stream()
                .filter(e -> e.getEventType() == type)
                .limit(limit)
                .toList();
    }

    public int size() {
        return size.get();
    }

    /** Events collected on one thread; closing it stops the collection. */
    public final class Recording implements AutoCloseable {

        private final List<AuditEvent> events;

        private Recording(List<AuditEvent> events) {
            this.events = events;
        }

        /** Collected events, in publication order. */
        public List<AuditEvent> events() {
            return List.copyOf(events);
        }

        @Override
        public void close() {
            recordings.remove();
        }
    }
}
