package com.basisengine.domain.model;

import com.basisengine.domain.enums.InstructionAction;
import java.math.BigDecimal;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/**
 * FLASH_BORROW / FLASH_REPAY. The size is the loan principal; borrow credits it, repay debits it,
 * whatever sign the strategy used.
 */
@Data
@SuperBuilder(toBuilder = true)
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class FlashLoanInstruction extends Instruction {

    /** Flash loan fee in basis points, 0 for fee-free sources. */
    private BigDecimal feeBps;

    @Override
    public boolean supportsAction() {
        return getAction().isFlashLoan();
    }

    @Override
    public PositionDelta toDelta(ExecutionResult result) {
        BigDecimal amount = executedSize(result);
        return PositionDelta.builder()
                .instructionId(getId())
                .venue(getVenue())
                .asset(getAsset())
                .signedAmount(getAction() == InstructionAction.FLASH_REPAY ? amount.negate() : amount)
                .fee(feeLeg(result))
                .build();
    }
}
