package com.basisengine.orchestrator;

import com.basisengine.config.ExecutionProperties;
import com.basisengine.coordination.AtomicGroupCoordinator;
import com.basisengine.coordination.GroupExecutionResult;
import com.basisengine.domain.enums.AtomicGroupStatus;
import com.basisengine.domain.model.AtomicGroup;
import com.basisengine.domain.model.ExecutionResult;
import com.basisengine.domain.model.Instruction;
import com.basisengine.domain.model.ReconciliationRecord;
import com.basisengine.event.EventPublisherHelper;
import com.basisengine.exception.AtomicGroupAbortException;
import com.basisengine.exception.ErrorCode;
import com.basisengine.exception.SystemFailureException;
import com.basisengine.exception.UnroutableInstructionException;
import com.basisengine.observability.AuditTrail;
import com.basisengine.reconciliation.PositionReconciliationService;
import com.basisengine.retry.RetryPolicy;
import com.basisengine.routing.InstructionRouter;
import com.basisengine.routing.VenueHaltRegistry;
import com.basisengine.validation.InstructionValidator;
import com.basisengine.venue.VenueAdapter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Top-level driver: executes one instruction block per tick.
 *
 * <p>Per tick:
 * <ol>
 *   <li>Reject instruction ids seen within the dedup window</li>
 *   <li>Partition into atomic groups and singletons, preserving block order</li>
 *   <li>Execute one unit at a time: singletons through validation, routing, the
 *       {@link RetryPolicy} and the ledger; groups through the {@link AtomicGroupCoordinator}</li>
 *   <li>Skip units touching a halted venue; halt venues on {@link SystemFailureException} or
 *       {@link AtomicGroupAbortException}</li>
 *   <li>Optionally reconcile the venues the tick touched</li>
 * </ol>
 *
 * <p>Ticks are serialized: the engine never runs two units concurrently, so ledger writes and
 * venue rate limits are never contended. Every instruction gets a result in the summary, and
 * every result is published as an audit event.
 */
@Service
public class ExecutionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ExecutionOrchestrator.class);

    public static final String POST_EXECUTION_TRIGGER = "POST_EXECUTION";

    private final InstructionDeduplicator instructionDeduplicator;
    private final InstructionBlockPartitioner instructionBlockPartitioner;
    private final InstructionValidator instructionValidator;
    private final InstructionRouter instructionRouter;
    private final RetryPolicy retryPolicy;
    private final AtomicGroupCoordinator atomicGroupCoordinator;
    private final PositionReconciliationService positionReconciliationService;
    private final VenueHaltRegistry venueHaltRegistry;
    private final EventPublisherHelper eventPublisherHelper;
    private final AuditTrail auditTrail;
    private final ExecutionProperties executionProperties;

    private final AtomicLong tickCounter = new AtomicLong();

    public ExecutionOrchestrator(
            InstructionDeduplicator instructionDeduplicator,
            InstructionBlockPartitioner instructionBlockPartitioner,
            InstructionValidator instructionValidator,
            InstructionRouter instructionRouter,
            RetryPolicy retryPolicy,
            AtomicGroupCoordinator atomicGroupCoordinator,
            PositionReconciliationService positionReconciliationService,
            VenueHaltRegistry venueHaltRegistry,
            EventPublisherHelper eventPublisherHelper,
            AuditTrail auditTrail,
            ExecutionProperties executionProperties) {
        this.instructionDeduplicator = instructionDeduplicator;
        this.instructionBlockPartitioner = instructionBlockPartitioner;
        this.instructionValidator = instructionValidator;
        this.instructionRouter = instructionRouter;
        this.retryPolicy = retryPolicy;
        this.atomicGroupCoordinator = atomicGroupCoordinator;
        this.positionReconciliationService = positionReconciliationService;
        this.venueHaltRegistry = venueHaltRegistry;
        this.eventPublisherHelper = eventPublisherHelper;
        this.auditTrail = auditTrail;
        this.executionProperties = executionProperties;
    }

    public synchronized ExecutionSummary executeTick(List<Instruction> block) {
        try (AuditTrail.Recording recording = auditTrail.startRecording()) {
            return executeTick(block, recording);
        }
    }

    private ExecutionSummary executeTick(List<Instruction> block, AuditTrail.Recording recording) {
        String tickId = "TICK-" + tickCounter.incrementAndGet();
        long startTime = System.currentTimeMillis();
        log.info("Tick {} started: {} instructions", tickId, block.size());

        List<ExecutionResult> results = new ArrayList<>();
        List<ExecutionResult> compensations = new ArrayList<>();
        Map<String, AtomicGroupStatus> groupStatuses = new LinkedHashMap<>();
        Set<String> touchedVenues = new LinkedHashSet<>();

        List<Instruction> accepted = new ArrayList<>();
        for (Instruction instruction : block) {
            if (instruction.getId() != null && !instructionDeduplicator.markIfUnique(instruction.getId())) {
                record(results, ExecutionResult.failed(
                        instruction, ErrorCode.DUPLICATE_INSTRUCTION, "Instruction id already accepted within dedup window"));
            } else {
                accepted.add(instruction);
            }
        }

        for (ExecutionUnit unit : instructionBlockPartitioner.partition(accepted)) {
            Set<String> venues = unit.touchedVenues();
            if (venueHaltRegistry.anyHalted(venues)) {
                skipHalted(unit, venues, results);
                continue;
            }
            touchedVenues.addAll(venues);

            if (unit instanceof ExecutionUnit.Group groupUnit) {
                executeGroup(groupUnit.group(), results, compensations, groupStatuses);
            } else if (unit instanceof ExecutionUnit.Single single) {
                executeSingle(single.instruction(), results);
            }
        }

        List<ReconciliationRecord> records = List.of();
        if (executionProperties.getReconciliation().isPostExecution() && !touchedVenues.isEmpty()) {
            records = positionReconciliationService.reconcile(POST_EXECUTION_TRIGGER, touchedVenues);
        }

        long durationMs = System.currentTimeMillis() - startTime;
        ExecutionSummary summary = ExecutionSummary.builder()
                .tickId(tickId)
                .results(List.copyOf(results))
                .compensations(List.copyOf(compensations))
                .groupStatuses(groupStatuses)
                .haltedVenues(venueHaltRegistry.haltedVenues())
                .auditEvents(recording.events())
                .reconciliationRecords(records)
                .durationMs(durationMs)
                .build();

        log.info(
                "Tick {} complete in {}ms: filled={}, confirmed={}, failed={}, timedOut={}, groups={}, halted={}",
                tickId,
                durationMs,
                summary.getFilledCount(),
                summary.getConfirmedCount(),
                summary.getFailedCount(),
                summary.getTimedOutCount(),
                groupStatuses,
                summary.getHaltedVenues());
        return summary;
    }

    private void executeSingle(Instruction instruction, List<ExecutionResult> results) {
        List<String> violations = instructionValidator.validate(instruction);
        if (!violations.isEmpty()) {
            log.warn("Instruction {} rejected: {}", instruction.getId(), violations);
            record(results, ExecutionResult.failed(instruction, ErrorCode.INVALID_INSTRUCTION, String.join("; ", violations)));
            return;
        }

        VenueAdapter adapter;
        try {
            adapter = instructionRouter.route(instruction);
        } catch (UnroutableInstructionException e) {
            log.warn("Instruction {} unroutable: {}", instruction.getId(), e.getMessage());
            record(results, ExecutionResult.failed(instruction, ErrorCode.UNROUTABLE, e.getMessage()));
            return;
        }

        try {
            ExecutionResult result = retryPolicy.execute(instruction, adapter);
            positionReconciliationService.applyResult(instruction, result);
            record(results, result);
        } catch (SystemFailureException e) {
            record(results, e.getFailedResult());
            venueHaltRegistry.halt(e.getVenue(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected failure executing instruction {}", instruction.getId(), e);
            record(results, ExecutionResult.failed(instruction, ErrorCode.INTERNAL_ERROR, e.toString()));
            venueHaltRegistry.halt(adapter.venueName(), "Unexpected failure: " + e);
        }
    }

    private void executeGroup(
            AtomicGroup group,
            List<ExecutionResult> results,
            List<ExecutionResult> compensations,
            Map<String, AtomicGroupStatus> groupStatuses) {
        GroupExecutionResult outcome;
        try {
            outcome = atomicGroupCoordinator.execute(group);
        } catch (AtomicGroupAbortException e) {
            outcome = e.getGroupResult();
            for (String venue : e.getAffectedVenues()) {
                venueHaltRegistry.halt(venue, "Atomic group " + group.getGroupId() + " failed: " + e.getErrorCode());
            }
        }
        outcome.getResults().forEach(r -> record(results, r));
        outcome.getCompensations().forEach(r -> record(compensations, r));
        groupStatuses.put(group.getGroupId(), outcome.getStatus());
    }

    private void skipHalted(ExecutionUnit unit, Set<String> venues, List<ExecutionResult> results) {
        Set<String> halted = new LinkedHashSet<>(venues);
        halted.retainAll(venueHaltRegistry.haltedVenues());
        log.warn("Skipping {}: venue(s) halted {}", unit.label(), halted);
        String message = "Venue halted: " + halted;
        if (unit instanceof ExecutionUnit.Group groupUnit) {
            groupUnit.group().getInstructions().forEach(i ->
                    record(results, ExecutionResult.failed(i, ErrorCode.VENUE_HALTED, message)));
        } else if (unit instanceof ExecutionUnit.Single single) {
            record(results, ExecutionResult.failed(single.instruction(), ErrorCode.VENUE_HALTED, message));
        }
    }

    private void record(List<ExecutionResult> target, ExecutionResult result) {
        target.add(result);
        eventPublisherHelper.publishInstructionOutcome(this, result);
    }
}
