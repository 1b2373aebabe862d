package com.basisengine.domain.model;

import java.math.BigDecimal;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/**
 * OPEN / CLOSE / REBALANCE / HEDGE: a position trade, direction given by the sign of the size.
 *
 * <p>An exchange fill books both sides of the spot trade: the asset bought or sold and, as the
 * offset leg, the quote asset paid or received at the fill price.
 */
@Data
@SuperBuilder(toBuilder = true)
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class TradeInstruction extends Instruction {

    /** Required when {@code orderType} is LIMIT. */
    private BigDecimal limitPrice;

    @Override
    public boolean supportsAction() {
        return getAction().isTrade();
    }

    @Override
    public PositionDelta toDelta(ExecutionResult result) {
        BigDecimal amount = executedSize(result);
        boolean sell = getSignedSize().signum() < 0;
        return PositionDelta.builder()
                .instructionId(getId())
                .venue(getVenue())
                .asset(getAsset())
                .signedAmount(sell ? amount.negate() : amount)
                .offset(quoteLeg(result, amount, sell))
                .fee(feeLeg(result))
                .build();
    }

    private PositionDelta.Leg quoteLeg(ExecutionResult result, BigDecimal amount, boolean sell) {
        if (result.getQuoteAsset() == null || result.getFilledPrice() == null) {
            return null;
        }
        BigDecimal notional = amount.multiply(result.getFilledPrice());
        return new PositionDelta.Leg(getVenue(), result.getQuoteAsset(), sell ? notional : notional.negate());
    }
}
