package com.basisengine.integration;

import static org.assertj.core.api.Assertions.assertThat;

import com.basisengine.domain.enums.AtomicGroupStatus;
import com.basisengine.domain.enums.DriftResolution;
import com.basisengine.domain.enums.ExecutionStatus;
import com.basisengine.domain.enums.InstructionAction;
import com.basisengine.domain.model.ExecutionResult;
import com.basisengine.domain.model.FlashLoanInstruction;
import com.basisengine.domain.model.Instruction;
import com.basisengine.domain.model.ReconciliationRecord;
import com.basisengine.domain.model.SwapInstruction;
import com.basisengine.domain.model.TradeInstruction;
import com.basisengine.domain.model.TransferInstruction;
import com.basisengine.event.AuditEvent;
import com.basisengine.event.AuditEventType;
import com.basisengine.exception.ErrorCode;
import com.basisengine.orchestrator.ExecutionSummary;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * End-to-end flows through the orchestrator, coordinator, retry policy, adapters and ledger,
 * against the in-memory venues.
 */
class ExecutionFlowIntegrationTest {

    private static TradeInstruction trade(String id, String venue, String asset, String size) {
        return TradeInstruction.builder()
                .id(id)
                .action(new BigDecimal(size).signum() > 0 ? InstructionAction.OPEN : InstructionAction.HEDGE)
                .venue(venue)
                .asset(asset)
                .signedSize(new BigDecimal(size))
                .build();
    }

    private static FlashLoanInstruction flash(String id, InstructionAction action, String group, int seq, String size) {
        return FlashLoanInstruction.builder()
                .id(id)
                .action(action)
                .venue("aave")
                .asset("USDT")
                .signedSize(new BigDecimal(size))
                .atomicGroupId(group)
                .sequenceInGroup(seq)
                .build();
    }

    private static SwapInstruction swap(String id, String group, int seq, String size) {
        return SwapInstruction.builder()
                .id(id)
                .action(InstructionAction.SWAP)
                .venue("aave")
                .asset("ETH")
                .assetIn("USDT")
                .signedSize(new BigDecimal(size))
                .atomicGroupId(group)
                .sequenceInGroup(seq)
                .build();
    }

    private static ExecutionResult resultFor(ExecutionSummary summary, String instructionId) {
        return summary.getResults().stream()
                .filter(r -> instructionId.equals(r.getInstructionId()))
                .findFirst()
                .orElseThrow();
    }

    @Nested
    @DisplayName("Independent instructions")
    class IndependentInstructions {

        @Test
        @DisplayName("Three instructions on two exchanges all fill and book exactly three deltas")
        void threeIndependentInstructionsAllFill() {
            EngineHarness engine = new EngineHarness();
            int appliedBefore = engine.reconciliationService.snapshot().getAppliedDeltaCount();

            ExecutionSummary summary = engine.orchestrator.executeTick(List.of(
                    trade("A-1", "binance", "BTC", "0.5"),
                    trade("A-2", "okx", "BTC", "-0.25"),
                    trade("A-3", "binance", "ETH", "3")));

            assertThat(summary.getFilledCount()).isEqualTo(3);
            assertThat(summary.getFailedCount()).isZero();
            assertThat(summary.getResults())
                    .extracting(ExecutionResult::getInstructionId)
                    .containsExactly("A-1", "A-2", "A-3");
            assertThat(engine.reconciliationService.snapshot().getAppliedDeltaCount() - appliedBefore)
                    .isEqualTo(3);
            assertThat(engine.ledger("binance", "BTC")).isEqualByComparingTo("2.5");
            assertThat(engine.ledger("okx", "BTC")).isEqualByComparingTo("-0.25");
            assertThat(engine.ledger("binance", "ETH")).isEqualByComparingTo("3");
        }

        @Test
        @DisplayName("Post-execution reconciliation of touched venues finds no drift")
        void postExecutionReconciliationIsClean() {
            EngineHarness engine = new EngineHarness();

            ExecutionSummary summary = engine.orchestrator.executeTick(List.of(
                    trade("A-1", "binance", "BTC", "0.5"), trade("A-2", "okx", "BTC", "-0.25")));

            assertThat(summary.getReconciliationRecords())
                    .extracting(ReconciliationRecord::getVenue)
                    .containsExactlyInAnyOrder("binance", "okx");
            assertThat(summary.getReconciliationRecords())
                    .allMatch(r -> r.getResolution() == DriftResolution.ACCEPTED);
        }

        @Test
        @DisplayName("Priced fills with fees keep the quote asset in line with the venue")
        void pricedFillsReconcileQuoteAndFees() {
            EngineHarness engine = new EngineHarness(props ->
                    props.getReconciliation().getAssetTolerances().put("USDT", new BigDecimal("0.000001")));
            engine.book.setMarkPrice("BTC", new BigDecimal("50000"));
            engine.okx.setFeeRate(new BigDecimal("0.001"));

            ExecutionSummary summary = engine.orchestrator.executeTick(List.of(
                    trade("Q-1", "binance", "BTC", "-0.1"), trade("Q-2", "okx", "BTC", "0.01")));

            assertThat(summary.getFilledCount()).isEqualTo(2);
            assertThat(engine.ledger("binance", "USDT")).isEqualByComparingTo("15000");
            assertThat(engine.ledger("okx", "USDT")).isEqualByComparingTo("9499.5");
            assertThat(engine.venue("okx", "USDT")).isEqualByComparingTo("9499.5");
            assertThat(summary.getReconciliationRecords())
                    .extracting(ReconciliationRecord::getResolution)
                    .containsOnly(DriftResolution.ACCEPTED);
        }

        @Test
        @DisplayName("Every outcome is returned as an audit event in the summary")
        void summaryCarriesInstructionOutcomes() {
            EngineHarness engine = new EngineHarness();

            ExecutionSummary summary = engine.orchestrator.executeTick(List.of(
                    trade("A-1", "binance", "BTC", "0.5"), trade("A-X", "kraken", "BTC", "1")));

            assertThat(summary.getAuditEvents())
                    .filteredOn(e -> e.getEventType() == AuditEventType.INSTRUCTION_OUTCOME)
                    .extracting(AuditEvent::getSubject)
                    .containsExactly("A-1", "A-X");
            assertThat(resultFor(summary, "A-X").getErrorCode()).isEqualTo(ErrorCode.UNROUTABLE);
            assertThat(engine.reconciliationService.isApplied("A-X")).isFalse();
        }

        @Test
        @DisplayName("Transfer between exchange and wallet moves both ledger balances")
        void transferBooksBothSides() {
            EngineHarness engine = new EngineHarness();
            TransferInstruction transfer = TransferInstruction.builder()
                    .id("T-1")
                    .action(InstructionAction.TRANSFER)
                    .venue("binance")
                    .targetVenue("treasury")
                    .asset("USDT")
                    .signedSize(new BigDecimal("2500"))
                    .build();

            ExecutionSummary summary = engine.orchestrator.executeTick(List.of(transfer));

            assertThat(resultFor(summary, "T-1").getStatus()).isEqualTo(ExecutionStatus.FILLED);
            assertThat(engine.ledger("binance", "USDT")).isEqualByComparingTo("7500");
            assertThat(engine.ledger("treasury", "USDT")).isEqualByComparingTo("22500");
            assertThat(engine.venue("treasury", "USDT")).isEqualByComparingTo("22500");
        }

        @Test
        @DisplayName("An instruction id re-sent within the dedup window is rejected")
        void duplicateIdRejected() {
            EngineHarness engine = new EngineHarness();
            engine.orchestrator.executeTick(List.of(trade("D-1", "binance", "BTC", "0.1")));

            ExecutionSummary second = engine.orchestrator.executeTick(List.of(trade("D-1", "binance", "BTC", "0.1")));

            assertThat(second.getResults()).hasSize(1);
            assertThat(second.getResults().get(0).getErrorCode()).isEqualTo(ErrorCode.DUPLICATE_INSTRUCTION);
            assertThat(engine.ledger("binance", "BTC")).isEqualByComparingTo("2.1");
        }
    }

    @Nested
    @DisplayName("Atomic groups")
    class AtomicGroups {

        @Test
        @DisplayName("Flash loan group commits when every leg confirms")
        void flashLoanGroupCommits() {
            EngineHarness engine = new EngineHarness();

            ExecutionSummary summary = engine.orchestrator.executeTick(List.of(
                    flash("B-BORROW", InstructionAction.FLASH_BORROW, "G-1", 1, "100"),
                    swap("B-SWAP", "G-1", 2, "100"),
                    backSwap(),
                    flash("B-REPAY", InstructionAction.FLASH_REPAY, "G-1", 4, "-100")));

            assertThat(summary.getGroupStatuses()).containsEntry("G-1", AtomicGroupStatus.COMMITTED);
            assertThat(summary.getConfirmedCount()).isEqualTo(4);
            assertThat(engine.ledger("aave", "USDT")).isEqualByComparingTo("5000");
            assertThat(engine.ledger("aave", "ETH")).isEqualByComparingTo("0.998");
            assertThat(engine.venue("aave", "ETH")).isEqualByComparingTo("0.998");
        }

        private SwapInstruction backSwap() {
            return SwapInstruction.builder()
                    .id("B-BACK")
                    .action(InstructionAction.SWAP)
                    .venue("aave")
                    .asset("USDT")
                    .assetIn("ETH")
                    .signedSize(new BigDecimal("100"))
                    .atomicGroupId("G-1")
                    .sequenceInGroup(3)
                    .build();
        }

        @Test
        @DisplayName("Failed swap rolls the group back: repay never runs, borrow is compensated, net change zero")
        void failedSwapRollsBackFlashLoanGroup() {
            EngineHarness engine = new EngineHarness();
            engine.aave.revertReference("B-SWAP", "slippage exceeded");

            ExecutionSummary summary = engine.orchestrator.executeTick(List.of(
                    flash("B-BORROW", InstructionAction.FLASH_BORROW, "G-2", 1, "100"),
                    swap("B-SWAP", "G-2", 2, "100"),
                    flash("B-REPAY", InstructionAction.FLASH_REPAY, "G-2", 3, "-100")));

            assertThat(summary.getGroupStatuses()).containsEntry("G-2", AtomicGroupStatus.ROLLED_BACK);
            assertThat(resultFor(summary, "B-SWAP").getErrorCode()).isEqualTo(ErrorCode.TX_REVERTED);
            assertThat(resultFor(summary, "B-REPAY").getErrorCode()).isEqualTo(ErrorCode.SKIPPED_GROUP_ABORT);
            assertThat(summary.getCompensations())
                    .extracting(ExecutionResult::getInstructionId)
                    .containsExactly("B-BORROW-COMP");

            assertThat(engine.ledger("aave", "USDT")).isEqualByComparingTo("5000");
            assertThat(engine.ledger("aave", "ETH")).isEqualByComparingTo("0.9985");
            assertThat(engine.venue("aave", "ETH")).isEqualByComparingTo("0.9985");
            assertThat(engine.reconciliationService.isApplied("B-REPAY")).isFalse();
            assertThat(engine.haltRegistry.haltedVenues()).isEmpty();
            assertThat(summary.getReconciliationRecords())
                    .allMatch(r -> r.getResolution() == DriftResolution.ACCEPTED);
        }

        @Test
        @DisplayName("Group transitions are audited in order")
        void groupTransitionsAudited() {
            EngineHarness engine = new EngineHarness();
            engine.aave.revertReference("B-SWAP", "slippage exceeded");

            ExecutionSummary summary = engine.orchestrator.executeTick(List.of(
                    flash("B-BORROW", InstructionAction.FLASH_BORROW, "G-3", 1, "100"),
                    swap("B-SWAP", "G-3", 2, "100"),
                    flash("B-REPAY", InstructionAction.FLASH_REPAY, "G-3", 3, "-100")));

            assertThat(summary.getAuditEvents())
                    .filteredOn(e -> e.getEventType() == AuditEventType.GROUP_TRANSITION)
                    .extracting(AuditEvent::getMessage)
                    .containsExactly("PENDING -> IN_PROGRESS", "IN_PROGRESS -> ROLLED_BACK");
            assertThat(summary.getAuditEvents())
                    .extracting(AuditEvent::getEventType)
                    .contains(AuditEventType.COMPENSATION_EXECUTED);
        }

        @Test
        @DisplayName("Group leg timeout fails the group and halts its venues")
        void groupLegTimeoutEscalates() {
            EngineHarness engine = new EngineHarness();
            engine.aave.setWithholdReceipts(true);

            ExecutionSummary summary = engine.orchestrator.executeTick(List.of(
                    flash("C-BORROW", InstructionAction.FLASH_BORROW, "G-4", 1, "100"),
                    flash("C-REPAY", InstructionAction.FLASH_REPAY, "G-4", 2, "-100")));

            assertThat(summary.getGroupStatuses()).containsEntry("G-4", AtomicGroupStatus.FAILED);
            assertThat(resultFor(summary, "C-BORROW").getStatus()).isEqualTo(ExecutionStatus.TIMEOUT);
            assertThat(resultFor(summary, "C-REPAY").getErrorCode()).isEqualTo(ErrorCode.SKIPPED_GROUP_ABORT);
            assertThat(summary.getHaltedVenues()).containsExactly("aave");
            assertThat(engine.ledger("aave", "USDT")).isEqualByComparingTo("5000");
        }
    }

    @Nested
    @DisplayName("Retries and escalation")
    class RetriesAndEscalation {

        @Test
        @DisplayName("Two transient failures then success: filled with two retries used")
        void transientTwiceThenFilled() {
            EngineHarness engine = new EngineHarness();
            engine.binance.failNextRequests(2, true);

            ExecutionSummary summary = engine.orchestrator.executeTick(List.of(trade("C-1", "binance", "BTC", "0.5")));

            ExecutionResult result = resultFor(summary, "C-1");
            assertThat(result.getStatus()).isEqualTo(ExecutionStatus.FILLED);
            assertThat(result.getRetriesUsed()).isEqualTo(2);
            assertThat(engine.ledger("binance", "BTC")).isEqualByComparingTo("2.5");
        }

        @Test
        @DisplayName("Retry exhaustion halts the venue and later instructions for it are skipped")
        void retryExhaustionHaltsVenue() {
            EngineHarness engine = new EngineHarness();
            engine.binance.failNextRequests(4, true);

            ExecutionSummary summary = engine.orchestrator.executeTick(List.of(
                    trade("H-1", "binance", "BTC", "0.5"),
                    trade("H-2", "okx", "BTC", "0.5"),
                    trade("H-3", "binance", "BTC", "0.5")));

            assertThat(resultFor(summary, "H-1").getErrorCode()).isEqualTo(ErrorCode.RETRIES_EXHAUSTED);
            assertThat(resultFor(summary, "H-1").getRetriesUsed()).isEqualTo(3);
            assertThat(resultFor(summary, "H-2").getStatus()).isEqualTo(ExecutionStatus.FILLED);
            assertThat(resultFor(summary, "H-3").getErrorCode()).isEqualTo(ErrorCode.VENUE_HALTED);
            assertThat(summary.getHaltedVenues()).containsExactly("binance");
            assertThat(engine.ledger("binance", "BTC")).isEqualByComparingTo("2");
        }

        @Test
        @DisplayName("Operator resume lets the venue trade again")
        void resumeReopensVenue() {
            EngineHarness engine = new EngineHarness();
            engine.binance.failNextRequests(4, true);
            engine.orchestrator.executeTick(List.of(trade("H-1", "binance", "BTC", "0.5")));

            engine.haltRegistry.resume("binance", "ops-oncall");
            ExecutionSummary summary = engine.orchestrator.executeTick(List.of(trade("H-4", "binance", "BTC", "0.5")));

            assertThat(resultFor(summary, "H-4").getStatus()).isEqualTo(ExecutionStatus.FILLED);
        }

        @Test
        @DisplayName("Terminal rejection is not retried and does not halt the venue")
        void terminalRejectionNotRetried() {
            EngineHarness engine = new EngineHarness();
            engine.binance.failNextRequests(1, false);

            ExecutionSummary summary = engine.orchestrator.executeTick(List.of(trade("R-1", "binance", "BTC", "0.5")));

            ExecutionResult result = resultFor(summary, "R-1");
            assertThat(result.getErrorCode()).isEqualTo(ErrorCode.ORDER_REJECTED);
            assertThat(result.getRetriesUsed()).isZero();
            assertThat(summary.getHaltedVenues()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Confirmation timeouts")
    class ConfirmationTimeouts {

        private Instruction lonelySwap() {
            return SwapInstruction.builder()
                    .id("D-SWAP")
                    .action(InstructionAction.SWAP)
                    .venue("aave")
                    .asset("ETH")
                    .assetIn("USDT")
                    .signedSize(new BigDecimal("100"))
                    .build();
        }

        @Test
        @DisplayName("Timed-out transaction is not booked until a later reconciliation sees it land")
        void timeoutResolvedByLaterReconciliation() {
            EngineHarness engine = new EngineHarness();
            engine.aave.setWithholdReceipts(true);

            ExecutionSummary summary = engine.orchestrator.executeTick(List.of(lonelySwap()));

            assertThat(resultFor(summary, "D-SWAP").getStatus()).isEqualTo(ExecutionStatus.TIMEOUT);
            assertThat(summary.getTimedOutCount()).isEqualTo(1);
            assertThat(engine.reconciliationService.isApplied("D-SWAP")).isFalse();
            assertThat(engine.ledger("aave", "USDT")).isEqualByComparingTo("5000");
            assertThat(engine.reconciliationService.pendingSettlements()).hasSize(1);

            engine.aave.mineWithheld();
            engine.reconciliationService.reconcile("MANUAL");

            assertThat(engine.reconciliationService.isApplied("D-SWAP")).isTrue();
            assertThat(engine.reconciliationService.pendingSettlements()).isEmpty();
            assertThat(engine.ledger("aave", "USDT")).isEqualByComparingTo("4900");
            assertThat(engine.ledger("aave", "ETH")).isEqualByComparingTo("100.9995");
        }

        @Test
        @DisplayName("A timeout does not halt the venue")
        void timeoutDoesNotHalt() {
            EngineHarness engine = new EngineHarness();
            engine.aave.setWithholdReceipts(true);

            ExecutionSummary summary = engine.orchestrator.executeTick(List.of(lonelySwap()));

            assertThat(summary.getHaltedVenues()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Reconciliation drift")
    class ReconciliationDrift {

        @Test
        @DisplayName("Venue reporting 995 USDT against 1000 expected with tolerance 1 is flagged with drift 5")
        void driftBeyondToleranceFlagged() {
            EngineHarness engine = new EngineHarness(props ->
                    props.getVenues().get("okx").getInitialBalances().put("USDT", new BigDecimal("1000")));
            engine.book.adjust("okx", "USDT", new BigDecimal("-5"));

            List<ReconciliationRecord> records = engine.reconciliationService.reconcile("MANUAL", List.of("okx"));

            assertThat(records).hasSize(1);
            ReconciliationRecord record = records.get(0);
            assertThat(record.getResolution()).isEqualTo(DriftResolution.FLAGGED);
            assertThat(record.getDriftPerAsset().get("USDT")).isEqualByComparingTo("5");
            assertThat(engine.ledger("okx", "USDT")).isEqualByComparingTo("1000");
            assertThat(engine.meterRegistry.get("reconciliation.drift.flagged").counter().count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("Only operator approval moves the ledger to the venue value")
        void operatorApprovalOverridesLedger() {
            EngineHarness engine = new EngineHarness();
            engine.book.adjust("okx", "USDT", new BigDecimal("-5"));
            engine.reconciliationService.reconcile("MANUAL", List.of("okx"));
            engine.reconciliationService.reconcile("MANUAL", List.of("okx"));
            assertThat(engine.ledger("okx", "USDT")).isEqualByComparingTo("10000");

            engine.reconciliationService.approveVenueBalance("okx", "USDT", "ops-oncall");

            assertThat(engine.ledger("okx", "USDT")).isEqualByComparingTo("9995");
            assertThat(engine.reconciliationService.reconcile("MANUAL", List.of("okx")).get(0).getResolution())
                    .isEqualTo(DriftResolution.ACCEPTED);
        }
    }
}
