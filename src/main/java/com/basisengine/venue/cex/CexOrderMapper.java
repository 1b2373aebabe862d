package com.basisengine.venue.cex;

import com.basisengine.domain.enums.ExecutionStatus;
import com.basisengine.domain.enums.OrderType;
import com.basisengine.domain.model.ExecutionResult;
import com.basisengine.domain.model.Instruction;
import com.basisengine.domain.model.TradeInstruction;
import com.basisengine.domain.model.TransferInstruction;
import java.time.Instant;

/**
 * Maps between instructions/results and the exchange's order and withdrawal payloads.
 *
 * <p>The exchange symbol is the instruction asset followed by the venue's quote asset
 * (BTC + USDT = BTCUSDT). The side follows the sign of the instruction size.
 */
public class CexOrderMapper {

    private final String quoteAsset;

    public CexOrderMapper(String quoteAsset) {
        this.quoteAsset = quoteAsset;
    }

    public CexOrderRequest toOrderRequest(TradeInstruction instruction) {
        return CexOrderRequest.builder()
                .clientOrderId(instruction.getId())
                .symbol(toSymbol(instruction.getAsset()))
                .side(instruction.getSignedSize().signum() < 0 ? CexOrderSide.SELL : CexOrderSide.BUY)
                .type(instruction.getOrderType())
                .quantity(instruction.absoluteSize())
                .price(instruction.getOrderType() == OrderType.LIMIT ? instruction.getLimitPrice() : null)
                .leverage(instruction.getLeverage())
                .build();
    }

    public CexWithdrawalRequest toWithdrawalRequest(TransferInstruction instruction, String address) {
        return CexWithdrawalRequest.builder()
                .clientWithdrawalId(instruction.getId())
                .asset(instruction.getAsset())
                .amount(instruction.absoluteSize())
                .address(address)
                .build();
    }

    public ExecutionResult toFilledResult(Instruction instruction, CexOrder order) {
        return ExecutionResult.builder()
                .instructionId(instruction.getId())
                .venue(instruction.getVenue())
                .status(ExecutionStatus.FILLED)
                .venueRef(order.getOrderId())
                .filledPrice(order.getAveragePrice())
                .filledSize(order.getFilledQuantity())
                .quoteAsset(quoteAsset)
                .fee(order.getFee())
                .feeAsset(order.getFeeAsset())
                .completedAt(Instant.now())
                .build();
    }

    public ExecutionResult toFilledResult(Instruction instruction, CexWithdrawal withdrawal) {
        return ExecutionResult.builder()
                .instructionId(instruction.getId())
                .venue(instruction.getVenue())
                .status(ExecutionStatus.FILLED)
                .venueRef(withdrawal.getWithdrawalId())
                .filledSize(withdrawal.getAmount())
                .fee(withdrawal.getFee())
                .feeAsset(withdrawal.getAsset())
                .completedAt(Instant.now())
                .build();
    }

    public ExecutionResult toTimeoutResult(Instruction instruction, String venueRef, String message) {
        return ExecutionResult.builder()
                .instructionId(instruction.getId())
                .venue(instruction.getVenue())
                .status(ExecutionStatus.TIMEOUT)
                .venueRef(venueRef)
                .errorMessage(message)
                .completedAt(Instant.now())
                .build();
    }

    public String toSymbol(String asset) {
        return asset + quoteAsset;
    }
}
