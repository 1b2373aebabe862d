package com.basisengine.coordination;

import com.basisengine.domain.enums.AtomicGroupStatus;
import com.basisengine.domain.enums.ExecutionStatus;
import com.basisengine.domain.model.AtomicGroup;
import com.basisengine.domain.model.ExecutedInstruction;
import com.basisengine.domain.model.ExecutionResult;
import com.basisengine.domain.model.Instruction;
import com.basisengine.event.AuditEventType;
import com.basisengine.event.EventPublisherHelper;
import com.basisengine.exception.AtomicGroupAbortException;
import com.basisengine.exception.ErrorCode;
import com.basisengine.exception.SystemFailureException;
import com.basisengine.exception.UnroutableInstructionException;
import com.basisengine.reconciliation.PositionReconciliationService;
import com.basisengine.retry.RetryPolicy;
import com.basisengine.routing.InstructionRouter;
import com.basisengine.validation.InstructionValidator;
import com.basisengine.venue.VenueAdapter;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Executes atomic groups with all-or-nothing ledger semantics.
 *
 * <p>Protocol for one group:
 * <ol>
 *   <li>PENDING to IN_PROGRESS, then pre-flight: validate the group and route every member. Any
 *       failure ends the group ROLLED_BACK before a single member is submitted.</li>
 *   <li>Execute members strictly in {@code sequenceInGroup} order through the {@link RetryPolicy},
 *       stopping at the first failure. Later members are reported as skipped.</li>
 *   <li>All members succeeded: book every delta, COMMITTED.</li>
 *   <li>A member failed terminally: compensate settled members in reverse order
 *       ({@link CompensationPlanner}). Every compensation fully filled: book settled legs and
 *       compensations together (net zero, fees aside), ROLLED_BACK.</li>
 *   <li>No compensation exists, a compensation failed or filled short, a member timed out or retries were
 *       exhausted: FAILED, nothing booked, {@link AtomicGroupAbortException} escalates so the
 *       orchestrator halts the venues involved.</li>
 * </ol>
 *
 * <p>Deltas of a group are staged until the group's outcome is known, so the ledger never shows
 * a partial group. Atomicity across on-chain legs is only as strong as this sequencing; the
 * adapters submit one transaction per leg.
 */
@Service
public class AtomicGroupCoordinator {

    private static final Logger log = LoggerFactory.getLogger(AtomicGroupCoordinator.class);

    private final InstructionRouter instructionRouter;
    private final RetryPolicy retryPolicy;
    private final CompensationPlanner compensationPlanner;
    private final InstructionValidator instructionValidator;
    private final PositionReconciliationService positionReconciliationService;
    private final EventPublisherHelper eventPublisherHelper;

    public AtomicGroupCoordinator(
            InstructionRouter instructionRouter,
            RetryPolicy retryPolicy,
            CompensationPlanner compensationPlanner,
            InstructionValidator instructionValidator,
            PositionReconciliationService positionReconciliationService,
            EventPublisherHelper eventPublisherHelper) {
        this.instructionRouter = instructionRouter;
        this.retryPolicy = retryPolicy;
        this.compensationPlanner = compensationPlanner;
        this.instructionValidator = instructionValidator;
        this.positionReconciliationService = positionReconciliationService;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    /**
     * Executes the group.
     *
     * @return the outcome when the group COMMITTED or ROLLED_BACK cleanly
     * @throws AtomicGroupAbortException when the group ended FAILED and needs operator attention
     */
    public GroupExecutionResult execute(AtomicGroup group) {
        List<Instruction> members = group.getInstructions();
        log.info("Starting atomic group: groupId={}, members={}", group.getGroupId(), members.size());
        transition(group, AtomicGroupStatus.IN_PROGRESS, null);

        // Pre-flight: nothing is submitted unless every member is valid and routable
        List<String> violations = instructionValidator.validateGroup(members);
        if (!violations.isEmpty()) {
            return rejectBeforeExecution(group, ErrorCode.INVALID_GROUP, String.join("; ", violations), null);
        }
        List<VenueAdapter> adapters = new ArrayList<>();
        for (Instruction member : members) {
            try {
                adapters.add(instructionRouter.route(member));
            } catch (UnroutableInstructionException e) {
                return rejectBeforeExecution(group, ErrorCode.UNROUTABLE, e.getMessage(), member.getId());
            }
        }

        List<ExecutionResult> results = new ArrayList<>();
        List<ExecutedInstruction> settled = new ArrayList<>();
        ExecutionResult failure = null;
        Instruction failedMember = null;

        for (int i = 0; i < members.size(); i++) {
            Instruction member = members.get(i);
            if (failure != null) {
                results.add(skipped(member, failure));
                continue;
            }

            ExecutionResult result;
            try {
                result = retryPolicy.execute(member, adapters.get(i));
            } catch (SystemFailureException e) {
                results.add(e.getFailedResult());
                skipRemaining(members, i + 1, e.getFailedResult(), results);
                throw escalate(group, results, List.of(), ErrorCode.RETRIES_EXHAUSTED, e.getMessage(), e);
            } catch (RuntimeException e) {
                ExecutionResult unexpected = ExecutionResult.failed(member, ErrorCode.INTERNAL_ERROR, e.toString());
                results.add(unexpected);
                skipRemaining(members, i + 1, unexpected, results);
                throw escalate(group, results, List.of(), ErrorCode.INTERNAL_ERROR, e.toString(), e);
            }
            results.add(result);

            if (result.getStatus() == ExecutionStatus.TIMEOUT) {
                skipRemaining(members, i + 1, result, results);
                throw escalate(
                        group,
                        results,
                        List.of(),
                        ErrorCode.UNRESOLVED_GROUP_LEG,
                        "Member " + member.getId() + " timed out with unknown outcome (ref " + result.getVenueRef() + ")",
                        null);
            }
            if (result.isSuccess()) {
                settled.add(new ExecutedInstruction(member, result));
                log.info(
                        "Group leg {} executed: groupId={}, instructionId={}, status={}",
                        member.getSequenceInGroup(),
                        group.getGroupId(),
                        member.getId(),
                        result.getStatus());
            } else {
                failure = result;
                failedMember = member;
                log.warn(
                        "Group leg {} failed: groupId={}, instructionId={}, code={}",
                        member.getSequenceInGroup(),
                        group.getGroupId(),
                        member.getId(),
                        result.getErrorCode());
            }
        }

        if (failure == null) {
            int applied = positionReconciliationService.applyGroup(group.getGroupId(), settled);
            transition(group, AtomicGroupStatus.COMMITTED, null);
            return finish(group, results, List.of(), null, null, applied);
        }
        return rollback(group, results, settled, new ExecutedInstruction(failedMember, failure));
    }

    private GroupExecutionResult rollback(
            AtomicGroup group, List<ExecutionResult> results, List<ExecutedInstruction> settled, ExecutedInstruction failed) {
        ExecutionResult failure = failed.result();
        if (settled.isEmpty()) {
            int applied = failure.hasFee()
                    ? positionReconciliationService.applyGroup(group.getGroupId(), List.of(failed))
                    : 0;
            transition(group, AtomicGroupStatus.ROLLED_BACK, failure.getErrorCode());
            return finish(group, results, List.of(), failure.getErrorCode(), failure.getErrorMessage(), applied);
        }

        // Plan every compensation before executing any
        List<ExecutedInstruction> reversed = new ArrayList<>(settled);
        Collections.reverse(reversed);
        List<Instruction> plan = new ArrayList<>();
        for (ExecutedInstruction leg : reversed) {
            Optional<Instruction> compensation = compensationPlanner.plan(leg.instruction(), leg.result());
            if (compensation.isEmpty()) {
                throw escalate(
                        group,
                        results,
                        List.of(),
                        ErrorCode.NO_COMPENSATION,
                        "No compensation for settled " + leg.instruction().getAction() + " " + leg.instruction().getId(),
                        null);
            }
            plan.add(compensation.get());
        }

        log.warn("Rolling back group {}: {} compensations", group.getGroupId(), plan.size());
        List<ExecutionResult> compensations = new ArrayList<>();
        List<ExecutedInstruction> booked = new ArrayList<>(settled);
        if (failure.hasFee()) {
            booked.add(failed);
        }
        for (Instruction compensation : plan) {
            ExecutionResult result;
            try {
                result = retryPolicy.execute(compensation, instructionRouter.route(compensation));
            } catch (SystemFailureException e) {
                compensations.add(e.getFailedResult());
                throw escalate(group, results, compensations, ErrorCode.COMPENSATION_FAILED, e.getMessage(), e);
            } catch (RuntimeException e) {
                compensations.add(ExecutionResult.failed(compensation, ErrorCode.COMPENSATION_FAILED, e.toString()));
                throw escalate(group, results, compensations, ErrorCode.COMPENSATION_FAILED, e.toString(), e);
            }
            compensations.add(result);
            eventPublisherHelper.publishAudit(
                    this,
                    AuditEventType.COMPENSATION_EXECUTED,
                    compensation.getId(),
                    "Compensation " + compensation.getAction() + " " + result.getStatus(),
                    Map.of("groupId", group.getGroupId(), "venue", compensation.getVenue(), "status", result.getStatus()));
            if (!result.isSuccess()) {
                throw escalate(
                        group,
                        results,
                        compensations,
                        ErrorCode.COMPENSATION_FAILED,
                        "Compensation " + compensation.getId() + " ended " + result.getStatus(),
                        null);
            }
            BigDecimal shortfall = shortfall(compensation, result);
            if (shortfall.signum() > 0) {
                throw escalate(
                        group,
                        results,
                        compensations,
                        ErrorCode.COMPENSATION_FAILED,
                        "Compensation " + compensation.getId() + " reversed only " + result.getFilledSize()
                                + " of " + compensation.absoluteSize() + " (short " + shortfall + ")",
                        null);
            }
            booked.add(new ExecutedInstruction(compensation, result));
        }

        int applied = positionReconciliationService.applyGroup(group.getGroupId(), booked);
        transition(group, AtomicGroupStatus.ROLLED_BACK, failure.getErrorCode());
        return finish(group, results, compensations, failure.getErrorCode(), failure.getErrorMessage(), applied);
    }

    private GroupExecutionResult rejectBeforeExecution(
            AtomicGroup group, ErrorCode code, String reason, String offendingId) {
        log.warn("Atomic group {} rejected before execution: {}", group.getGroupId(), reason);
        List<ExecutionResult> results = new ArrayList<>();
        for (Instruction member : group.getInstructions()) {
            boolean offending = offendingId == null || offendingId.equals(member.getId());
            results.add(ExecutionResult.failed(
                    member, offending ? code : ErrorCode.SKIPPED_GROUP_ABORT, offending ? reason : "Group rejected: " + reason));
        }
        transition(group, AtomicGroupStatus.ROLLED_BACK, code);
        return finish(group, results, List.of(), code, reason, 0);
    }

    private AtomicGroupAbortException escalate(
            AtomicGroup group,
            List<ExecutionResult> results,
            List<ExecutionResult> compensations,
            ErrorCode code,
            String reason,
            Throwable cause) {
        transition(group, AtomicGroupStatus.FAILED, code);
        GroupExecutionResult outcome = finish(group, results, compensations, code, reason, 0);
        Set<String> venues = new LinkedHashSet<>(group.touchedVenues());
        log.error("ATOMIC GROUP FAILED: groupId={}, code={}, reason={}, venues={}", group.getGroupId(), code, reason, venues);
        return new AtomicGroupAbortException(
                code, "Atomic group " + group.getGroupId() + " failed: " + reason, outcome, venues, cause);
    }

    /** Size a compensation left unreversed; zero when the venue reported no fill size. */
    private BigDecimal shortfall(Instruction compensation, ExecutionResult result) {
        if (result.getFilledSize() == null) {
            return BigDecimal.ZERO;
        }
        return compensation.absoluteSize().subtract(result.getFilledSize().abs()).max(BigDecimal.ZERO);
    }

    private GroupExecutionResult finish(
            AtomicGroup group,
            List<ExecutionResult> results,
            List<ExecutionResult> compensations,
            ErrorCode abortCode,
            String reason,
            int deltasApplied) {
        return GroupExecutionResult.builder()
                .groupId(group.getGroupId())
                .status(group.getStatus())
                .results(List.copyOf(results))
                .compensations(List.copyOf(compensations))
                .transitions(List.copyOf(group.getHistory()))
                .abortCode(abortCode)
                .failureReason(reason)
                .deltasApplied(deltasApplied)
                .build();
    }

    private void skipRemaining(List<Instruction> members, int from, ExecutionResult cause, List<ExecutionResult> results) {
        for (int i = from; i < members.size(); i++) {
            results.add(skipped(members.get(i), cause));
        }
    }

    private ExecutionResult skipped(Instruction member, ExecutionResult cause) {
        return ExecutionResult.failed(
                member, ErrorCode.SKIPPED_GROUP_ABORT, "Skipped: member " + cause.getInstructionId() + " did not succeed");
    }

    private void transition(AtomicGroup group, AtomicGroupStatus next, ErrorCode reason) {
        AtomicGroupStatus previous = group.transitionTo(next);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("from", previous);
        details.put("to", next);
        if (reason != null) {
            details.put("reason", reason.getCode());
        }
        log.info("Atomic group {} {} -> {}", group.getGroupId(), previous, next);
        eventPublisherHelper.publishAudit(
                this, AuditEventType.GROUP_TRANSITION, group.getGroupId(), previous + " -> " + next, details);
    }
}
