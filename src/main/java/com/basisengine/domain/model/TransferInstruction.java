package com.basisengine.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.basisengine.domain.enums.InstructionAction;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import java.math.BigDecimal;
import java.util.Set;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/**
 * Moves {@code |signedSize|} of the asset from {@code venue} to {@code targetVenue}.
 * Books a debit at the source and a credit at the target under the same instruction id.
 */
@Data
@SuperBuilder(toBuilder = true)
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class TransferInstruction extends Instruction {

    @NotBlank
    private String targetVenue;

    @Override
    public boolean supportsAction() {
        return getAction() == InstructionAction.TRANSFER;
    }

    @JsonIgnore
    @AssertTrue(message = "targetVenue must differ from venue")
    public boolean isDistinctTarget() {
        return targetVenue == null || !targetVenue.equals(getVenue());
    }

    @Override
    public Set<String> touchedVenues() {
        return Set.of(getVenue(), targetVenue);
    }

    @Override
    public PositionDelta toDelta(ExecutionResult result) {
        BigDecimal amount = executedSize(result);
        return PositionDelta.builder()
                .instructionId(getId())
                .venue(getVenue())
                .asset(getAsset())
                .signedAmount(amount.negate())
                .offset(new PositionDelta.Leg(targetVenue, getAsset(), amount))
                .fee(feeLeg(result))
                .build();
    }
}
