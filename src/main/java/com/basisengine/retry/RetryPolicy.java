package com.basisengine.retry;

import com.basisengine.config.ExecutionProperties;
import com.basisengine.domain.enums.ExecutionStatus;
import com.basisengine.domain.model.ExecutionResult;
import com.basisengine.domain.model.Instruction;
import com.basisengine.exception.ErrorCode;
import com.basisengine.exception.SystemFailureException;
import com.basisengine.exception.TerminalVenueException;
import com.basisengine.exception.TransientVenueException;
import com.basisengine.venue.VenueAdapter;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Wraps every adapter call with bounded retry, exponential backoff and the venue's rate limit.
 *
 * <p>Each call ends in exactly one of three ways:
 * <ul>
 *   <li><b>success</b>: the adapter's result (FILLED, CONFIRMED or TIMEOUT) with {@code retriesUsed} set</li>
 *   <li><b>terminal failure</b>: a FAILED result carrying the venue's error code; never retried</li>
 *   <li><b>escalation</b>: transient failures outlasted {@code maxRetries} retries; a
 *       {@link SystemFailureException} carrying the FAILED result is thrown and the caller halts the venue</li>
 * </ul>
 *
 * <p>Backoff before retry n (1-based) is {@code baseDelay * 2^(n-1)}, capped at {@code maxDelay}.
 * One Resilience4j {@link Retry} and {@link RateLimiter} instance exists per venue.
 */
@Service
public class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private static final Duration RATE_LIMIT_WAIT = Duration.ofSeconds(5);

    private final RetryRegistry retryRegistry;
    private final RateLimiterRegistry rateLimiterRegistry;
    private final ExecutionProperties executionProperties;
    private final int maxRetries;

    public RetryPolicy(ExecutionProperties executionProperties) {
        this.executionProperties = executionProperties;
        ExecutionProperties.Retry retry = executionProperties.getRetry();
        this.maxRetries = retry.getMaxRetries();

        IntervalFunction backoff = IntervalFunction.ofExponentialBackoff(
                retry.getBaseDelay(), 2.0, retry.getMaxDelay());
        this.retryRegistry = RetryRegistry.of(RetryConfig.custom()
                .maxAttempts(maxRetries + 1)
                .intervalFunction(backoff)
                .retryExceptions(TransientVenueException.class)
                .ignoreExceptions(TerminalVenueException.class)
                .build());
        this.rateLimiterRegistry = RateLimiterRegistry.ofDefaults();
    }

    /**
     * Executes the instruction through the adapter.
     *
     * @return the adapter's result, or a FAILED result for a terminal venue error
     * @throws SystemFailureException when retries are exhausted
     */
    public ExecutionResult execute(Instruction instruction, VenueAdapter adapter) {
        String venue = adapter.venueName();
        Retry retry = retryRegistry.retry(venue);
        RateLimiter rateLimiter = rateLimiterFor(venue);
        AtomicInteger attempts = new AtomicInteger();

        Supplier<ExecutionResult> call = () -> {
            int attempt = attempts.incrementAndGet();
            if (attempt > 1) {
                log.info("Retrying instruction {} on {}: attempt {}/{}", instruction.getId(), venue, attempt, maxRetries + 1);
            }
            if (!rateLimiter.acquirePermission()) {
                throw new TransientVenueException(ErrorCode.RATE_LIMITED, "Local rate limit reached for " + venue);
            }
            return adapter.execute(instruction);
        };

        try {
            ExecutionResult result = Retry.decorateSupplier(retry, call).get();
            return result.withRetriesUsed(attempts.get() - 1);
        } catch (TerminalVenueException e) {
            log.warn(
                    "Terminal failure: instructionId={}, venue={}, kind={}, code={}, message={}",
                    instruction.getId(),
                    venue,
                    e.getKind(),
                    e.getErrorCode(),
                    e.getMessage());
            return ExecutionResult.failed(instruction, e.getErrorCode(), e.getMessage()).toBuilder()
                    .venueRef(e.getVenueRef())
                    .fee(e.getFee())
                    .feeAsset(e.getFeeAsset())
                    .retriesUsed(attempts.get() - 1)
                    .build();
        } catch (TransientVenueException e) {
            int retriesUsed = attempts.get() - 1;
            log.error(
                    "Retries exhausted: instructionId={}, venue={}, retries={}, lastError={}",
                    instruction.getId(),
                    venue,
                    retriesUsed,
                    e.getMessage());
            ExecutionResult failed = ExecutionResult.builder()
                    .instructionId(instruction.getId())
                    .venue(instruction.getVenue())
                    .status(ExecutionStatus.FAILED)
                    .errorCode(ErrorCode.RETRIES_EXHAUSTED)
                    .errorMessage("Retries exhausted after " + retriesUsed + " retries: " + e.getMessage())
                    .retriesUsed(retriesUsed)
                    .completedAt(Instant.now())
                    .build();
            throw new SystemFailureException(venue, failed, e);
        }
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    private RateLimiter rateLimiterFor(String venue) {
        ExecutionProperties.Venue settings = executionProperties.getVenues().get(venue);
        double perSecond = settings != null ? settings.getRateLimitPerSecond() : 0;
        if (perSecond <= 0) {
            return rateLimiterRegistry.rateLimiter(venue + "-unlimited", RateLimiterConfig.custom()
                    .limitForPeriod(Integer.MAX_VALUE)
                    .limitRefreshPeriod(Duration.ofSeconds(1))
                    .build());
        }
        return rateLimiterRegistry.rateLimiter(venue, RateLimiterConfig.custom()
                .limitForPeriod((int) Math.max(1, Math.round(perSecond)))
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .timeoutDuration(RATE_LIMIT_WAIT)
                .build());
    }
}
