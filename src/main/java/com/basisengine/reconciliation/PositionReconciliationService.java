package com.basisengine.reconciliation;

import com.basisengine.config.ExecutionProperties;
import com.basisengine.domain.enums.DriftResolution;
import com.basisengine.domain.enums.ExecutionStatus;
import com.basisengine.domain.model.ExecutedInstruction;
import com.basisengine.domain.model.ExecutionResult;
import com.basisengine.domain.model.Instruction;
import com.basisengine.domain.model.PositionDelta;
import com.basisengine.domain.model.PositionKey;
import com.basisengine.domain.model.PositionSnapshot;
import com.basisengine.domain.model.ReconciliationRecord;
import com.basisengine.event.AuditEventType;
import com.basisengine.event.EventPublisherHelper;
import com.basisengine.routing.InstructionRouter;
import com.basisengine.routing.VenueRegistry;
import com.basisengine.venue.VenueAdapter;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Owns the position ledger: applies execution results to it and compares it with what the
 * venues report.
 *
 * <p>Ledger updates:
 * <ul>
 *   <li>a successful result books its {@link PositionDelta} exactly once per instruction id</li>
 *   <li>a TIMEOUT result is parked as a {@link PendingSettlement}; the next reconciliation asks
 *       the adapter whether it landed and books it then</li>
 *   <li>failed results book nothing</li>
 * </ul>
 *
 * <p>Reconciliation compares expected (ledger) with reported (venue) balances per asset. Drift is
 * {@code expected - reported}; beyond the asset's tolerance the venue's record is FLAGGED,
 * otherwise ACCEPTED. The ledger is never changed to match the venue, except through an explicit
 * {@link #approveVenueBalance operator approval}.
 *
 * <p>All writes are serialized on this service, so scheduled runs and the orchestrator's
 * post-execution runs never mutate the ledger concurrently.
 */
@Service
public class PositionReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(PositionReconciliationService.class);

    private final PositionLedger ledger = new PositionLedger();
    private final Map<String, PendingSettlement> pendingSettlements = new ConcurrentHashMap<>();
    private final Map<PositionKey, BigDecimal> lastReported = new ConcurrentHashMap<>();

    private final ExecutionProperties executionProperties;
    private final VenueRegistry venueRegistry;
    private final InstructionRouter instructionRouter;
    private final ReconciliationRecordStore recordStore;
    private final EventPublisherHelper eventPublisherHelper;

    public PositionReconciliationService(
            ExecutionProperties executionProperties,
            VenueRegistry venueRegistry,
            InstructionRouter instructionRouter,
            ReconciliationRecordStore recordStore,
            EventPublisherHelper eventPublisherHelper) {
        this.executionProperties = executionProperties;
        this.venueRegistry = venueRegistry;
        this.instructionRouter = instructionRouter;
        this.recordStore = recordStore;
        this.eventPublisherHelper = eventPublisherHelper;
        bookOpeningBalances();
    }

    // ---- Ledger updates ----

    /**
     * Books the outcome of one independent instruction.
     *
     * @return true if a delta was applied by this call
     */
    public synchronized boolean applyResult(Instruction instruction, ExecutionResult result) {
        if (result.getStatus() == ExecutionStatus.TIMEOUT) {
            if (pendingSettlements.putIfAbsent(
                            instruction.getId(), new PendingSettlement(instruction, result, Instant.now()))
                    == null) {
                log.warn(
                        "Instruction {} timed out on {}, pending settlement: venueRef={}",
                        instruction.getId(),
                        instruction.getVenue(),
                        result.getVenueRef());
            }
            return false;
        }
        if (!result.isSuccess()) {
            return instruction.toFeeDelta(result).map(this::book).orElse(false);
        }
        return book(instruction.toDelta(result));
    }

    /**
     * Books every successful result of a finished atomic group in one step, plus the fees charged
     * on failed members.
     *
     * @return number of deltas applied
     */
    public synchronized int applyGroup(String groupId, List<ExecutedInstruction> executed) {
        int applied = 0;
        for (ExecutedInstruction entry : executed) {
            Optional<PositionDelta> delta = entry.isSuccess()
                    ? Optional.of(entry.instruction().toDelta(entry.result()))
                    : entry.instruction().toFeeDelta(entry.result());
            if (delta.isPresent() && book(delta.get())) {
                applied++;
            }
        }
        log.info("Group {} booked: {} deltas applied", groupId, applied);
        return applied;
    }

    private boolean book(PositionDelta delta) {
        boolean applied = ledger.apply(delta);
        if (applied) {
            log.debug("Delta applied: instructionId={}, legs={}", delta.getInstructionId(), delta.legs());
        } else {
            log.info("Duplicate delta ignored for instruction {}", delta.getInstructionId());
        }
        return applied;
    }

    // ---- Reconciliation ----

    /** Reconciles every enabled venue. */
    public List<ReconciliationRecord> reconcile(String trigger) {
        return reconcile(trigger, venueRegistry.enabledVenues());
    }

    /**
     * Resolves pending settlements, then compares the ledger with each venue's reported balances.
     * Produces one record per venue that could be queried.
     */
    public synchronized List<ReconciliationRecord> reconcile(String trigger, Collection<String> venues) {
        long startTime = System.currentTimeMillis();
        log.info("Reconciliation started: trigger={}, venues={}", trigger, venues);

        int resolved = resolvePendingSettlements();

        PositionSnapshot snapshot = ledger.snapshot();
        List<ReconciliationRecord> records = new ArrayList<>();
        for (String venue : venues) {
            compareVenue(trigger, venue, snapshot).ifPresent(records::add);
        }
        records.forEach(recordStore::add);

        long flagged = records.stream().filter(ReconciliationRecord::isFlagged).count();
        eventPublisherHelper.publishReconciliation(this, records, trigger);

        if (flagged > 0) {
            log.warn(
                    "Reconciliation complete: trigger={}, {} of {} venues flagged, pendingResolved={}, duration={}ms",
                    trigger,
                    flagged,
                    records.size(),
                    resolved,
                    System.currentTimeMillis() - startTime);
        } else {
            log.info(
                    "Reconciliation complete: trigger={}, venues={}, pendingResolved={}, duration={}ms",
                    trigger,
                    records.size(),
                    resolved,
                    System.currentTimeMillis() - startTime);
        }
        return records;
    }

    private Optional<ReconciliationRecord> compareVenue(String trigger, String venue, PositionSnapshot snapshot) {
        Optional<VenueAdapter> adapter = instructionRouter.adapterForVenue(venue);
        if (adapter.isEmpty()) {
            log.warn("No adapter for venue {}, skipped in reconciliation", venue);
            return Optional.empty();
        }

        Map<String, BigDecimal> reported;
        try {
            reported = new TreeMap<>(adapter.get().getBalances());
        } catch (RuntimeException e) {
            log.error("Balance query failed for venue {}: {}", venue, e.getMessage());
            eventPublisherHelper.publishAudit(
                    this,
                    AuditEventType.RECONCILIATION_FAILED,
                    venue,
                    "Balance query failed: " + e.getMessage(),
                    Map.of("trigger", trigger));
            return Optional.empty();
        }
        reported.forEach((asset, amount) -> lastReported.put(new PositionKey(venue, asset), amount));

        Map<String, BigDecimal> expected = snapshot.forVenue(venue);
        Map<String, BigDecimal> drift = new TreeMap<>();
        List<String> flaggedAssets = new ArrayList<>();
        ExecutionProperties.Reconciliation settings = executionProperties.getReconciliation();

        for (String asset : new TreeSet<>(union(expected, reported))) {
            BigDecimal assetDrift = expected.getOrDefault(asset, BigDecimal.ZERO)
                    .subtract(reported.getOrDefault(asset, BigDecimal.ZERO));
            drift.put(asset, assetDrift);
            if (assetDrift.abs().compareTo(settings.toleranceFor(asset)) > 0) {
                flaggedAssets.add(asset);
            }
        }

        ReconciliationRecord record = ReconciliationRecord.builder()
                .id(UUID.randomUUID().toString())
                .timestamp(Instant.now())
                .trigger(trigger)
                .venue(venue)
                .expectedSnapshot(Map.copyOf(expected))
                .venueReportedSnapshot(Map.copyOf(reported))
                .driftPerAsset(Map.copyOf(drift))
                .flaggedAssets(List.copyOf(flaggedAssets))
                .resolution(flaggedAssets.isEmpty() ? DriftResolution.ACCEPTED : DriftResolution.FLAGGED)
                .build();

        if (record.isFlagged()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("trigger", trigger);
            details.put("recordId", record.getId());
            flaggedAssets.forEach(asset -> details.put(asset, drift.get(asset)));
            log.warn("Drift flagged on {}: assets={}, drift={}", venue, flaggedAssets, drift);
            eventPublisherHelper.publishAudit(
                    this,
                    AuditEventType.RECONCILIATION_DRIFT,
                    venue,
                    "Drift beyond tolerance on " + flaggedAssets,
                    details);
        }
        return Optional.of(record);
    }

    private static Set<String> union(Map<String, BigDecimal> a, Map<String, BigDecimal> b) {
        Set<String> keys = new HashSet<>(a.keySet());
        keys.addAll(b.keySet());
        return keys;
    }

    /**
     * Asks each pending instruction's adapter whether it settled.
     *
     * @return number of pending settlements resolved (landed or dropped)
     */
    private int resolvePendingSettlements() {
        int resolved = 0;
        for (PendingSettlement pending : List.copyOf(pendingSettlements.values())) {
            Optional<ExecutionResult> outcome;
            try {
                outcome = instructionRouter
                        .route(pending.instruction())
                        .resolvePending(pending.instruction(), pending.timedOut());
            } catch (RuntimeException e) {
                log.warn("Pending settlement {} not resolvable now: {}", pending.instructionId(), e.getMessage());
                continue;
            }
            if (outcome.isEmpty()) {
                continue;
            }

            ExecutionResult settled = outcome.get();
            pendingSettlements.remove(pending.instructionId());
            resolved++;
            boolean landed = settled.isSuccess();
            if (landed) {
                book(pending.instruction().toDelta(settled));
            } else {
                pending.instruction().toFeeDelta(settled).ifPresent(this::book);
            }
            log.info(
                    "Pending settlement resolved: instructionId={}, venue={}, landed={}",
                    pending.instructionId(),
                    pending.venue(),
                    landed);
            eventPublisherHelper.publishAudit(
                    this,
                    AuditEventType.PENDING_SETTLEMENT_RESOLVED,
                    pending.instructionId(),
                    landed ? "Settled: " + settled.getStatus() : "Did not settle: " + settled.getErrorMessage(),
                    Map.of("venue", pending.venue(), "landed", landed));
        }
        return resolved;
    }

    // ---- Operator override ----

    /**
     * Moves the ledger balance of one asset to the venue's most recently reported value, on
     * explicit operator approval. Books an adjustment delta and audits it.
     *
     * @return the adjustment delta, or empty when ledger and venue already agree
     * @throws IllegalStateException if the venue has not reported this asset yet
     */
    public synchronized Optional<PositionDelta> approveVenueBalance(String venue, String asset, String approvedBy) {
        BigDecimal reported = lastReported.get(new PositionKey(venue, asset));
        if (reported == null) {
            throw new IllegalStateException("No reported balance for " + venue + ":" + asset + "; reconcile first");
        }
        BigDecimal current = ledger.balance(venue, asset);
        BigDecimal adjustment = reported.subtract(current);
        if (adjustment.signum() == 0) {
            return Optional.empty();
        }

        PositionDelta delta = PositionDelta.builder()
                .instructionId("ADJ-" + UUID.randomUUID())
                .venue(venue)
                .asset(asset)
                .signedAmount(adjustment)
                .build();
        ledger.apply(delta);
        log.warn(
                "Ledger override approved by {}: {}:{} {} -> {} (adjustment {})",
                approvedBy,
                venue,
                asset,
                current,
                reported,
                adjustment);
        eventPublisherHelper.publishAudit(
                this,
                AuditEventType.LEDGER_OVERRIDE_APPROVED,
                venue,
                "Ledger set to venue balance for " + asset + " by " + approvedBy,
                Map.of(
                        "asset", asset,
                        "previous", current,
                        "reported", reported,
                        "adjustment", adjustment,
                        "approvedBy", approvedBy,
                        "adjustmentId", delta.getInstructionId()));
        return Optional.of(delta);
    }

    // ---- Queries ----

    public PositionSnapshot snapshot() {
        return ledger.snapshot();
    }

    public BigDecimal balance(String venue, String asset) {
        return ledger.balance(venue, asset);
    }

    public boolean isApplied(String instructionId) {
        return ledger.isApplied(instructionId);
    }

    public List<PendingSettlement> pendingSettlements() {
        return List.copyOf(pendingSettlements.values());
    }

    private void bookOpeningBalances() {
        venueRegistry.all().forEach((venue, settings) -> settings.getInitialBalances()
                .forEach((asset, amount) -> ledger.apply(PositionDelta.builder()
                        .instructionId("OPENING-" + venue + "-" + asset)
                        .venue(venue)
                        .asset(asset)
                        .signedAmount(amount)
                        .build())));
        log.info("Ledger opened with {} balances", ledger.snapshot().getBalances().size());
    }
}
