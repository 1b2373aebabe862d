package com.basisengine.domain.model;

import com.basisengine.domain.enums.InstructionAction;
import com.basisengine.domain.enums.OrderType;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * One unit of trading intent handed to the engine by the strategy layer.
 *
 * <p>Each action family has its own subtype with the fields that family requires, and the
 * {@code action} property selects the subtype when an instruction block is read from JSON.
 * Instructions are consumed read-only: the engine never changes or originates them.
 *
 * <p>Instructions sharing an {@code atomicGroupId} execute as a unit in ascending
 * {@code sequenceInGroup} order. Sizes are signed: positive = buy/increase, negative = sell/decrease.
 */
@Data
@SuperBuilder(toBuilder = true)
@NoArgsConstructor
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "action", visible = true)
@JsonSubTypes({
    @JsonSubTypes.Type(
            value = TradeInstruction.class,
            names = {"OPEN", "CLOSE", "REBALANCE", "HEDGE"}),
    @JsonSubTypes.Type(value = TransferInstruction.class, name = "TRANSFER"),
    @JsonSubTypes.Type(
            value = FlashLoanInstruction.class,
            names = {"FLASH_BORROW", "FLASH_REPAY"}),
    @JsonSubTypes.Type(value = SwapInstruction.class, name = "SWAP"),
})
public abstract class Instruction {

    @NotBlank
    private String id;

    @NotNull
    private InstructionAction action;

    @NotBlank
    private String venue;

    @NotBlank
    private String asset;

    @NotNull
    private BigDecimal signedSize;

    @NotNull
    @Builder.Default
    private OrderType orderType = OrderType.MARKET;

    /** Null for independent instructions. */
    private String atomicGroupId;

    private int sequenceInGroup;

    private Instant timestamp;

    /** Optional leverage for margin/perp trades. */
    private BigDecimal leverage;

    /** Whether this subtype is the right carrier for its {@link #getAction()}. */
    @JsonIgnore
    public abstract boolean supportsAction();

    /**
     * Derives the ledger change caused by a successful execution of this instruction, fee included.
     * Exactly one delta per result.
     */
    public abstract PositionDelta toDelta(ExecutionResult result);

    /**
     * Ledger change of a failed execution that was still charged (gas of a reverted transaction,
     * fee of a failed withdrawal). Empty when nothing was charged.
     */
    public Optional<PositionDelta> toFeeDelta(ExecutionResult result) {
        if (!result.hasFee()) {
            return Optional.empty();
        }
        return Optional.of(PositionDelta.builder()
                .instructionId(id)
                .venue(venue)
                .asset(asset)
                .signedAmount(BigDecimal.ZERO)
                .fee(feeLeg(result))
                .build());
    }

    @JsonIgnore
    @AssertTrue(message = "signedSize must be non-zero")
    public boolean isNonZeroSize() {
        return signedSize == null || signedSize.signum() != 0;
    }

    @JsonIgnore
    @AssertTrue(message = "action does not match instruction type")
    public boolean isActionSupported() {
        return action == null || supportsAction();
    }

    @JsonIgnore
    public boolean isGrouped() {
        return atomicGroupId != null && !atomicGroupId.isBlank();
    }

    @JsonIgnore
    public BigDecimal absoluteSize() {
        return signedSize.abs();
    }

    /** Every venue whose balances this instruction can change. */
    @JsonIgnore
    public Set<String> touchedVenues() {
        return Set.of(venue);
    }

    /** Fee debit on this instruction's venue, null when nothing was charged. */
    protected PositionDelta.Leg feeLeg(ExecutionResult result) {
        return result.hasFee() ? new PositionDelta.Leg(venue, result.getFeeAsset(), result.getFee().abs().negate()) : null;
    }

    /** Size actually executed: the venue-reported fill when present, otherwise the instructed size. */
    protected BigDecimal executedSize(ExecutionResult result) {
        BigDecimal filled = result.getFilledSize();
        return filled != null ? filled.abs() : absoluteSize();
    }
}
