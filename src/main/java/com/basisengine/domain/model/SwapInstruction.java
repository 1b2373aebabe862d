package com.basisengine.domain.model;

import com.basisengine.domain.enums.InstructionAction;
import jakarta.validation.constraints.NotBlank;
import java.math.BigDecimal;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/**
 * On-chain swap of {@code |signedSize|} {@code assetIn} into {@code asset}. The received amount
 * comes from the transaction receipt.
 */
@Data
@SuperBuilder(toBuilder = true)
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class SwapInstruction extends Instruction {

    @NotBlank
    private String assetIn;

    /** Max accepted slippage as a fraction, e.g. 0.005. */
    private BigDecimal slippageTolerance;

    @Override
    public boolean supportsAction() {
        return getAction() == InstructionAction.SWAP;
    }

    @Override
    public PositionDelta toDelta(ExecutionResult result) {
        BigDecimal received = result.getFilledSize() != null ? result.getFilledSize().abs() : BigDecimal.ZERO;
        return PositionDelta.builder()
                .instructionId(getId())
                .venue(getVenue())
                .asset(getAsset())
                .signedAmount(received)
                .offset(new PositionDelta.Leg(getVenue(), assetIn, absoluteSize().negate()))
                .fee(feeLeg(result))
                .build();
    }
}
