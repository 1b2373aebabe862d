package com.basisengine.routing;

import com.basisengine.event.AuditEventType;
import com.basisengine.event.EventPublisherHelper;
import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Per-venue kill switch. A venue is halted when retries against it are exhausted or an atomic
 * group touching it failed without a clean rollback; nothing is submitted to a halted venue
 * until an operator resumes it.
 *
 * <p>Halting is idempotent: a second halt of the same venue keeps the first reason.
 */
@Service
public class VenueHaltRegistry {

    private static final Logger log = LoggerFactory.getLogger(VenueHaltRegistry.class);

    private final EventPublisherHelper eventPublisherHelper;
    private final Map<String, Halt> halts = new ConcurrentHashMap<>();

    public VenueHaltRegistry(EventPublisherHelper eventPublisherHelper) {
        this.eventPublisherHelper = eventPublisherHelper;
    }

    /** @return true if the venue was running and is now halted */
    public boolean halt(String venue, String reason) {
        Halt halt = new Halt(venue, reason, Instant.now());
        if (halts.putIfAbsent(venue, halt) != null) {
            log.warn("Venue {} already halted, ignoring halt: reason={}", venue, reason);
            return false;
        }
        log.error("VENUE HALTED: venue={}, reason={}", venue, reason);
        eventPublisherHelper.publishAudit(
                this, AuditEventType.VENUE_HALTED, venue, "Venue halted: " + reason, Map.of("reason", reason));
        return true;
    }

    /** Operator intervention: allows submission to the venue again. */
    public boolean resume(String venue, String operator) {
        Halt removed = halts.remove(venue);
        if (removed == null) {
            log.info("Resume requested for venue {} which is not halted", venue);
            return false;
        }
        log.info("Venue {} resumed by {} (halted since {}: {})", venue, operator, removed.haltedAt(), removed.reason());
        eventPublisherHelper.publishAudit(
                this,
                AuditEventType.VENUE_RESUMED,
                venue,
                "Venue resumed by " + operator,
                Map.of("operator", operator, "haltReason", removed.reason()));
        return true;
    }

    public boolean isHalted(String venue) {
        return halts.containsKey(venue);
    }

    public boolean anyHalted(Collection<String> venues) {
        return venues.stream().anyMatch(halts::containsKey);
    }

    public Optional<Halt> find(String venue) {
        return Optional.ofNullable(halts.get(venue));
    }

    public Set<String> haltedVenues() {
        return Set.copyOf(halts.keySet());
    }

    public record Halt(String venue, String reason, Instant haltedAt) {}
}
