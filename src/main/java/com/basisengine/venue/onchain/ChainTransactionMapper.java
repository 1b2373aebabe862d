package com.basisengine.venue.onchain;

import com.basisengine.domain.enums.ExecutionStatus;
import com.basisengine.domain.model.ExecutionResult;
import com.basisengine.domain.model.FlashLoanInstruction;
import com.basisengine.domain.model.Instruction;
import com.basisengine.domain.model.SwapInstruction;
import com.basisengine.domain.model.TransferInstruction;
import java.time.Instant;

/**
 * Builds relayer transactions from instructions and results from receipts.
 */
public class ChainTransactionMapper {

    public ChainTransaction toTransaction(Instruction instruction, String toAddress) {
        ChainTransaction.ChainTransactionBuilder builder = ChainTransaction.builder()
                .reference(instruction.getId())
                .asset(instruction.getAsset())
                .leverage(instruction.getLeverage())
                .atomicGroupId(instruction.getAtomicGroupId());

        if (instruction instanceof TransferInstruction) {
            return builder.operation(ChainOperation.TRANSFER)
                    .amount(instruction.absoluteSize())
                    .toAddress(toAddress)
                    .build();
        }
        if (instruction instanceof FlashLoanInstruction flashLoan) {
            return builder.operation(ChainOperation.valueOf(flashLoan.getAction().name()))
                    .amount(flashLoan.absoluteSize())
                    .feeBps(flashLoan.getFeeBps())
                    .build();
        }
        if (instruction instanceof SwapInstruction swap) {
            return builder.operation(ChainOperation.SWAP)
                    .amount(swap.absoluteSize())
                    .assetIn(swap.getAssetIn())
                    .slippageTolerance(swap.getSlippageTolerance())
                    .build();
        }
        return builder.operation(ChainOperation.TRADE)
                .amount(instruction.getSignedSize())
                .build();
    }

    public ExecutionResult toConfirmedResult(Instruction instruction, ChainReceipt receipt) {
        return ExecutionResult.builder()
                .instructionId(instruction.getId())
                .venue(instruction.getVenue())
                .status(ExecutionStatus.CONFIRMED)
                .venueRef(receipt.getTxHash())
                .filledPrice(receipt.getRealizedPrice())
                .filledSize(receipt.getRealizedAmount())
                .fee(receipt.getFee())
                .feeAsset(receipt.getFeeAsset())
                .completedAt(Instant.now())
                .build();
    }

    public ExecutionResult toTimeoutResult(Instruction instruction, String txHash, String message) {
        return ExecutionResult.builder()
                .instructionId(instruction.getId())
                .venue(instruction.getVenue())
                .status(ExecutionStatus.TIMEOUT)
                .venueRef(txHash)
                .errorMessage(message)
                .completedAt(Instant.now())
                .build();
    }
}
