package com.basisengine.unit.validation;

import static org.assertj.core.api.Assertions.assertThat;

import com.basisengine.domain.enums.InstructionAction;
import com.basisengine.domain.enums.OrderType;
import com.basisengine.domain.model.FlashLoanInstruction;
import com.basisengine.domain.model.Instruction;
import com.basisengine.domain.model.SwapInstruction;
import com.basisengine.domain.model.TradeInstruction;
import com.basisengine.domain.model.TransferInstruction;
import com.basisengine.validation.InstructionValidator;
import jakarta.validation.Validation;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class InstructionValidatorTest {

    private final InstructionValidator validator =
            new InstructionValidator(Validation.buildDefaultValidatorFactory().getValidator());

    private static TradeInstruction trade() {
        return TradeInstruction.builder()
                .id("T-1")
                .action(InstructionAction.OPEN)
                .venue("binance")
                .asset("BTC")
                .signedSize(BigDecimal.ONE)
                .build();
    }

    private static Instruction member(String id, InstructionAction action, String asset, int sequence) {
        if (action == InstructionAction.SWAP) {
            return SwapInstruction.builder()
                    .id(id)
                    .action(action)
                    .venue("aave")
                    .asset(asset)
                    .assetIn("USDT")
                    .signedSize(BigDecimal.TEN)
                    .atomicGroupId("G-1")
                    .sequenceInGroup(sequence)
                    .build();
        }
        return FlashLoanInstruction.builder()
                .id(id)
                .action(action)
                .venue("aave")
                .asset(asset)
                .signedSize(BigDecimal.TEN)
                .atomicGroupId("G-1")
                .sequenceInGroup(sequence)
                .build();
    }

    @Nested
    @DisplayName("Single instruction")
    class Single {

        @Test
        @DisplayName("Well-formed market trade is valid")
        void validTrade() {
            assertThat(validator.validate(trade())).isEmpty();
        }

        @Test
        @DisplayName("Null instruction is reported, not thrown")
        void nullInstruction() {
            assertThat(validator.validate(null)).containsExactly("instruction is null");
        }

        @Test
        @DisplayName("Blank id and venue are both reported")
        void blankFields() {
            List<String> violations = validator.validate(trade().toBuilder().id(" ").venue("").build());

            assertThat(violations).anyMatch(v -> v.startsWith("id "));
            assertThat(violations).anyMatch(v -> v.startsWith("venue "));
        }

        @Test
        @DisplayName("Zero size is rejected")
        void zeroSize() {
            assertThat(validator.validate(trade().toBuilder().signedSize(BigDecimal.ZERO).build()))
                    .anyMatch(v -> v.contains("signedSize must be non-zero"));
        }

        @Test
        @DisplayName("LIMIT without a positive price is rejected")
        void limitNeedsPrice() {
            TradeInstruction limit = trade().toBuilder().orderType(OrderType.LIMIT).build();

            assertThat(validator.validate(limit)).contains("limitPrice required for LIMIT orders");
            assertThat(validator.validate(limit.toBuilder().limitPrice(new BigDecimal("60000")).build()))
                    .isEmpty();
        }

        @Test
        @DisplayName("Action carried by the wrong subtype is rejected")
        void actionMismatch() {
            assertThat(validator.validate(trade().toBuilder().action(InstructionAction.SWAP).build()))
                    .anyMatch(v -> v.contains("action does not match instruction type"));
        }

        @Test
        @DisplayName("Transfer to its own venue is rejected")
        void transferToSelf() {
            TransferInstruction transfer = TransferInstruction.builder()
                    .id("TR-1")
                    .action(InstructionAction.TRANSFER)
                    .venue("binance")
                    .targetVenue("binance")
                    .asset("USDT")
                    .signedSize(BigDecimal.TEN)
                    .build();

            assertThat(validator.validate(transfer)).anyMatch(v -> v.contains("targetVenue must differ from venue"));
        }
    }

    @Nested
    @DisplayName("Atomic group")
    class Group {

        @Test
        @DisplayName("Borrow, swap, repay of the same asset is valid")
        void validFlashLoan() {
            List<Instruction> members = List.of(
                    member("B", InstructionAction.FLASH_BORROW, "USDT", 1),
                    member("S", InstructionAction.SWAP, "ETH", 2),
                    member("R", InstructionAction.FLASH_REPAY, "USDT", 3));

            assertThat(validator.validateGroup(members)).isEmpty();
        }

        @Test
        @DisplayName("Flash loan group not ending with a repay is rejected")
        void missingRepay() {
            List<Instruction> members = List.of(
                    member("B", InstructionAction.FLASH_BORROW, "USDT", 1),
                    member("S", InstructionAction.SWAP, "ETH", 2));

            assertThat(validator.validateGroup(members)).contains("flash loan group must end with FLASH_REPAY");
        }

        @Test
        @DisplayName("Repay of a different asset is rejected")
        void repayWrongAsset() {
            List<Instruction> members = List.of(
                    member("B", InstructionAction.FLASH_BORROW, "USDT", 1),
                    member("R", InstructionAction.FLASH_REPAY, "DAI", 2));

            assertThat(validator.validateGroup(members))
                    .containsExactly("B: FLASH_REPAY must repay the borrowed asset on the same venue");
        }

        @Test
        @DisplayName("Duplicate sequence numbers are rejected")
        void duplicateSequence() {
            List<Instruction> members = List.of(
                    member("B", InstructionAction.FLASH_BORROW, "USDT", 1),
                    member("R", InstructionAction.FLASH_REPAY, "USDT", 1));

            assertThat(validator.validateGroup(members)).contains("R: duplicate sequenceInGroup 1");
        }

        @Test
        @DisplayName("Member violations are prefixed with the member id")
        void memberViolationsPrefixed() {
            Instruction broken = ((FlashLoanInstruction) member("R", InstructionAction.FLASH_REPAY, "USDT", 2))
                    .toBuilder()
                    .signedSize(BigDecimal.ZERO)
                    .build();
            List<Instruction> members = List.of(member("B", InstructionAction.FLASH_BORROW, "USDT", 1), broken);

            assertThat(validator.validateGroup(members)).anyMatch(v -> v.startsWith("R: ") && v.contains("non-zero"));
        }

        @Test
        @DisplayName("Empty group is rejected")
        void emptyGroup() {
            assertThat(validator.validateGroup(List.of())).containsExactly("group is empty");
        }
    }
}
