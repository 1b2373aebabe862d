package com.basisengine.venue.onchain;

import com.basisengine.config.ExecutionProperties;
import com.basisengine.domain.enums.ActionClass;
import com.basisengine.domain.enums.VenueType;
import com.basisengine.domain.model.ExecutionResult;
import com.basisengine.domain.model.Instruction;
import com.basisengine.domain.model.TransferInstruction;
import com.basisengine.exception.ErrorCode;
import com.basisengine.exception.TerminalVenueException;
import com.basisengine.exception.VenueApiException;
import com.basisengine.routing.VenueRegistry;
import com.basisengine.venue.AbstractVenueAdapter;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes on-chain operations (flash loans, swaps, trades) and wallet transfers.
 *
 * <p>Only the broadcast may fail transiently. Once a transaction hash exists the adapter never
 * throws a transient error, so the retry layer can never broadcast the same instruction twice:
 * receipt polling errors are logged and polling continues until the confirmation timeout.
 *
 * <p>Outcomes:
 * <ul>
 *   <li>receipt with {@code requiredConfirmations} blocks on top: CONFIRMED</li>
 *   <li>receipt marked reverted: terminal TX_REVERTED, with the gas fee burnt</li>
 *   <li>timeout: TIMEOUT with the tx hash; the transaction may still land</li>
 * </ul>
 *
 * <p>WALLET venues only move funds, so they are served for transfers alone.
 */
public class OnChainVenueAdapter extends AbstractVenueAdapter {

    private static final Logger log = LoggerFactory.getLogger(OnChainVenueAdapter.class);

    private final ChainClient client;
    private final VenueRegistry venueRegistry;
    private final ChainTransactionMapper mapper = new ChainTransactionMapper();

    public OnChainVenueAdapter(
            String venueName,
            ExecutionProperties.Venue settings,
            ChainClient client,
            VenueRegistry venueRegistry,
            Clock clock) {
        super(venueName, settings, clock);
        this.client = client;
        this.venueRegistry = venueRegistry;
    }

    @Override
    public Set<ActionClass> supportedActionClasses() {
        if (settings.getType() == VenueType.WALLET) {
            return EnumSet.of(ActionClass.WALLET_TRANSFER);
        }
        return EnumSet.of(ActionClass.ONCHAIN_OPERATION, ActionClass.WALLET_TRANSFER);
    }

    @Override
    public ExecutionResult execute(Instruction instruction) {
        String toAddress = null;
        if (instruction instanceof TransferInstruction transfer) {
            toAddress = venueRegistry
                    .depositAddress(transfer.getTargetVenue())
                    .orElseThrow(() -> new TerminalVenueException(
                            ErrorCode.TX_REJECTED, "No deposit address configured for " + transfer.getTargetVenue()));
        }

        String txHash;
        try {
            txHash = client.broadcast(mapper.toTransaction(instruction, toAddress));
        } catch (VenueApiException e) {
            throw classify(e);
        }
        log.info(
                "Transaction broadcast: instructionId={}, venue={}, action={}, txHash={}",
                instruction.getId(),
                venueName,
                instruction.getAction(),
                txHash);

        return awaitConfirmation(instruction, txHash);
    }

    private ExecutionResult awaitConfirmation(Instruction instruction, String txHash) {
        Instant deadline = deadlineAfter(settings.getConfirmationTimeout());
        while (true) {
            try {
                Optional<ChainReceipt> receipt = client.getReceipt(txHash);
                if (receipt.isPresent()) {
                    ChainReceipt mined = receipt.get();
                    if (!mined.isSuccess()) {
                        throw reverted(mined);
                    }
                    long confirmations = client.latestBlock() - mined.getBlockNumber() + 1;
                    if (confirmations >= settings.getRequiredConfirmations()) {
                        log.info(
                                "Transaction confirmed: txHash={}, block={}, confirmations={}",
                                txHash,
                                mined.getBlockNumber(),
                                confirmations);
                        return mapper.toConfirmedResult(instruction, mined);
                    }
                }
            } catch (VenueApiException e) {
                log.warn("Receipt poll failed for {} on {}: {}", txHash, venueName, e.getMessage());
            }

            if (isPast(deadline) || !pause()) {
                log.warn(
                        "Confirmation wait expired: instructionId={}, txHash={}, timeout={}",
                        instruction.getId(),
                        txHash,
                        settings.getConfirmationTimeout());
                return mapper.toTimeoutResult(
                        instruction,
                        txHash,
                        "Not confirmed within " + settings.getConfirmationTimeout() + ", may still land");
            }
        }
    }

    @Override
    public Map<String, BigDecimal> getBalances() {
        try {
            return client.getBalances();
        } catch (VenueApiException e) {
            throw classify(e);
        }
    }

    @Override
    public Optional<ExecutionResult> resolvePending(Instruction instruction, ExecutionResult timedOut) {
        if (timedOut.getVenueRef() == null) {
            return Optional.empty();
        }
        try {
            Optional<ChainReceipt> receipt = client.getReceipt(timedOut.getVenueRef());
            if (receipt.isEmpty()) {
                return Optional.empty();
            }
            ChainReceipt mined = receipt.get();
            if (!mined.isSuccess()) {
                return Optional.of(ExecutionResult.failed(
                                instruction, ErrorCode.TX_REVERTED, "Reverted: " + mined.getRevertReason())
                        .toBuilder()
                        .venueRef(mined.getTxHash())
                        .fee(mined.getFee())
                        .feeAsset(mined.getFeeAsset())
                        .build());
            }
            long confirmations = client.latestBlock() - mined.getBlockNumber() + 1;
            if (confirmations < settings.getRequiredConfirmations()) {
                return Optional.empty();
            }
            return Optional.of(mapper.toConfirmedResult(instruction, mined));
        } catch (VenueApiException e) {
            log.warn("Could not resolve pending tx {} on {}: {}", timedOut.getVenueRef(), venueName, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    protected ErrorCode terminalCodeFor(String venueCode) {
        if ("INSUFFICIENT_BALANCE".equals(venueCode)) {
            return ErrorCode.INSUFFICIENT_BALANCE;
        }
        return ErrorCode.TX_REJECTED;
    }

    private TerminalVenueException reverted(ChainReceipt receipt) {
        log.warn("Transaction reverted: txHash={}, reason={}", receipt.getTxHash(), receipt.getRevertReason());
        return new TerminalVenueException(
                ErrorCode.TX_REVERTED,
                "Transaction " + receipt.getTxHash() + " reverted: " + receipt.getRevertReason(),
                receipt.getTxHash(),
                receipt.getFee(),
                receipt.getFeeAsset(),
                null);
    }
}
