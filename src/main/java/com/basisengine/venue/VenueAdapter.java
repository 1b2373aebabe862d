package com.basisengine.venue;

import com.basisengine.domain.enums.ActionClass;
import com.basisengine.domain.model.ExecutionResult;
import com.basisengine.domain.model.Instruction;
import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Uniform contract every venue connector implements. The router selects an adapter by
 * (venue, action class); callers never talk to venue-specific clients directly.
 *
 * <p>Two families exist:
 * <ul>
 *   <li>{@code CexVenueAdapter}: order-based centralized exchanges, fills within seconds</li>
 *   <li>{@code OnChainVenueAdapter}: broadcast transactions that settle after block confirmations</li>
 * </ul>
 *
 * <p>Calls block the caller until the venue answers or the adapter's own wait limit passes.
 */
public interface VenueAdapter {

    /** The configured venue name this adapter serves. */
    String venueName();

    Set<ActionClass> supportedActionClasses();

    /**
     * Executes one instruction and normalizes the venue's answer.
     *
     * @return FILLED or CONFIRMED on success, TIMEOUT when the wait limit passed and the outcome is unknown
     * @throws com.basisengine.exception.TransientVenueException when the call may succeed if repeated
     * @throws com.basisengine.exception.TerminalVenueException when the venue refused the instruction for good
     */
    ExecutionResult execute(Instruction instruction);

    /**
     * Balances the venue currently reports, by asset.
     *
     * @throws com.basisengine.exception.BaseException when the venue cannot be queried
     */
    Map<String, BigDecimal> getBalances();

    /**
     * Looks up the final outcome of an instruction that previously ended in TIMEOUT.
     *
     * @param instruction the instruction that timed out
     * @param timedOut    the TIMEOUT result, carrying the order id or tx hash
     * @return the settled result (success or FAILED), or empty while the outcome is still unknown
     */
    Optional<ExecutionResult> resolvePending(Instruction instruction, ExecutionResult timedOut);
}
