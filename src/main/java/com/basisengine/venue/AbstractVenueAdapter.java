package com.basisengine.venue;

import com.basisengine.config.ExecutionProperties;
import com.basisengine.exception.BaseException;
import com.basisengine.exception.ErrorCode;
import com.basisengine.exception.TerminalVenueException;
import com.basisengine.exception.TransientVenueException;
import com.basisengine.exception.VenueApiException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared plumbing for venue adapters: venue settings, deadline clock, poll pauses and the
 * classification of raw client errors into transient or terminal failures.
 */
public abstract class AbstractVenueAdapter implements VenueAdapter {

    private static final Logger log = LoggerFactory.getLogger(AbstractVenueAdapter.class);

    protected final String venueName;
    protected final ExecutionProperties.Venue settings;
    protected final Clock clock;

    protected AbstractVenueAdapter(String venueName, ExecutionProperties.Venue settings, Clock clock) {
        this.venueName = venueName;
        this.settings = settings;
        this.clock = clock;
    }

    @Override
    public String venueName() {
        return venueName;
    }

    /**
     * Maps the venue's own reject code to an error code. Only called for non-retryable errors.
     */
    protected abstract ErrorCode terminalCodeFor(String venueCode);

    /**
     * Converts a client error raised before anything irreversible happened.
     * Retryable errors become transient, everything else terminal.
     */
    protected BaseException classify(VenueApiException e) {
        if (e.isRetryable()) {
            ErrorCode code = e.getHttpStatus() == 429
                    ? ErrorCode.RATE_LIMITED
                    : e.getHttpStatus() == 0 ? ErrorCode.VENUE_TIMEOUT : ErrorCode.VENUE_UNAVAILABLE;
            return new TransientVenueException(code, venueName + ": " + e.getMessage(), e);
        }
        return new TerminalVenueException(terminalCodeFor(e.getVenueCode()), venueName + ": " + e.getMessage(), e);
    }

    protected Instant deadlineAfter(Duration wait) {
        return clock.instant().plus(wait);
    }

    protected boolean isPast(Instant deadline) {
        return !clock.instant().isBefore(deadline);
    }

    /**
     * Sleeps one poll interval.
     *
     * @return false if the thread was interrupted; the interrupt flag is restored
     */
    protected boolean pause() {
        Duration interval = settings.getPollInterval();
        if (interval == null || interval.isZero()) {
            return !Thread.currentThread().isInterrupted();
        }
        try {
            Thread.sleep(interval.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Polling on venue {} interrupted", venueName);
            return false;
        }
    }
}
