package com.basisengine.orchestrator;

import com.basisengine.config.ExecutionProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Rejects instruction ids already accepted within the dedup window.
 *
 * <p>A strategy that re-sends the same block after a crash or a slow tick must not trade twice.
 * This guard sits in front of execution; the ledger's once-per-id booking is a separate, later
 * guarantee.
 */
@Component
public class InstructionDeduplicator {

    private static final Logger log = LoggerFactory.getLogger(InstructionDeduplicator.class);

    private final Cache<String, Instant> seen;

    @Autowired
    public InstructionDeduplicator(ExecutionProperties executionProperties) {
        this(executionProperties, Ticker.systemTicker());
    }

    public InstructionDeduplicator(ExecutionProperties executionProperties, Ticker ticker) {
        this.seen = Caffeine.newBuilder()
                .expireAfterWrite(executionProperties.getDedupWindow())
                .ticker(ticker)
                .build();
    }

    /**
     * Records the id and reports whether it was new.
     *
     * @return true if the id has not been accepted within the window
     */
    public boolean markIfUnique(String instructionId) {
        Instant now = Instant.now();
        boolean unique = seen.asMap().putIfAbsent(instructionId, now) == null;
        if (!unique) {
            log.debug("Duplicate instruction id within dedup window: {}", instructionId);
        }
        return unique;
    }

    public boolean isSeen(String instructionId) {
        return seen.getIfPresent(instructionId) != null;
    }

    public long size() {
        seen.cleanUp();
        return seen.estimatedSize();
    }
}
