package com.basisengine.venue.cex;

import com.basisengine.config.ExecutionProperties;
import com.basisengine.domain.enums.ActionClass;
import com.basisengine.domain.model.ExecutionResult;
import com.basisengine.domain.model.Instruction;
import com.basisengine.domain.model.TradeInstruction;
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
 * Executes trades and outbound transfers on a centralized exchange.
 *
 * <p>Trades are submitted with the instruction id as client order id. Before submitting, the
 * adapter looks the id up on the exchange, so a retry after a lost response resumes the order
 * already on the book instead of placing a second one. The adapter then polls until the order
 * is filled, rejected or the fill timeout passes.
 *
 * <p>At fill timeout the working order is cancelled:
 * <ul>
 *   <li>cancelled with no fill: FAILED with FILL_TIMEOUT</li>
 *   <li>cancelled with a partial fill: FILLED for the partial quantity</li>
 *   <li>cancel itself failed: TIMEOUT, left to reconciliation to settle</li>
 * </ul>
 *
 * <p>Transfers are exchange withdrawals to the target venue's deposit address.
 */
public class CexVenueAdapter extends AbstractVenueAdapter {

    private static final Logger log = LoggerFactory.getLogger(CexVenueAdapter.class);

    private final CexVenueClient client;
    private final CexOrderMapper mapper;
    private final VenueRegistry venueRegistry;

    public CexVenueAdapter(
            String venueName,
            ExecutionProperties.Venue settings,
            CexVenueClient client,
            VenueRegistry venueRegistry,
            Clock clock) {
        super(venueName, settings, clock);
        this.client = client;
        this.venueRegistry = venueRegistry;
        this.mapper = new CexOrderMapper(settings.getQuoteAsset());
    }

    @Override
    public Set<ActionClass> supportedActionClasses() {
        return EnumSet.of(ActionClass.CEX_TRADE, ActionClass.WALLET_TRANSFER);
    }

    @Override
    public ExecutionResult execute(Instruction instruction) {
        if (instruction instanceof TransferInstruction transfer) {
            return executeWithdrawal(transfer);
        }
        if (instruction instanceof TradeInstruction trade) {
            return executeTrade(trade);
        }
        throw new TerminalVenueException(
                ErrorCode.ORDER_REJECTED, instruction.getAction() + " cannot be executed on exchange " + venueName);
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
        try {
            if (instruction instanceof TransferInstruction) {
                return resolveWithdrawal(instruction, client.getWithdrawal(timedOut.getVenueRef()));
            }
            CexOrder order = timedOut.getVenueRef() != null
                    ? client.getOrder(timedOut.getVenueRef())
                    : client.findOrderByClientId(instruction.getId()).orElse(null);
            if (order == null || order.getStatus().isOpen()) {
                return Optional.empty();
            }
            if (order.hasFill()) {
                return Optional.of(mapper.toFilledResult(instruction, order));
            }
            return Optional.of(ExecutionResult.failed(
                    instruction, ErrorCode.ORDER_REJECTED, "Order " + order.getOrderId() + " ended " + order.getStatus()));
        } catch (VenueApiException e) {
            log.warn("Could not resolve pending instruction {} on {}: {}", instruction.getId(), venueName, e.getMessage());
            return Optional.empty();
        }
    }

    // ---- Trades ----

    private ExecutionResult executeTrade(TradeInstruction instruction) {
        CexOrder order = submit(instruction);
        log.info(
                "Order submitted: instructionId={}, venue={}, orderId={}, symbol={}, side={}",
                instruction.getId(),
                venueName,
                order.getOrderId(),
                order.getSymbol(),
                order.getSide());

        Instant deadline = deadlineAfter(settings.getFillTimeout());
        while (true) {
            switch (order.getStatus()) {
                case FILLED:
                    return mapper.toFilledResult(instruction, order);
                case REJECTED:
                    throw new TerminalVenueException(
                            terminalCodeFor(order.getRejectCode()),
                            "Order " + order.getOrderId() + " rejected: " + order.getRejectReason(),
                            order.getOrderId(),
                            null,
                            null);
                case CANCELED:
                case EXPIRED:
                    if (order.hasFill()) {
                        return mapper.toFilledResult(instruction, order);
                    }
                    throw new TerminalVenueException(
                            ErrorCode.ORDER_REJECTED,
                            "Order " + order.getOrderId() + " ended " + order.getStatus() + " without fill",
                            order.getOrderId(),
                            null,
                            null);
                default:
                    if (isPast(deadline) || !pause()) {
                        return cancelAfterFillTimeout(instruction, order);
                    }
                    order = refresh(order);
            }
        }
    }

    private CexOrder submit(TradeInstruction instruction) {
        try {
            Optional<CexOrder> existing = client.findOrderByClientId(instruction.getId());
            if (existing.isPresent()) {
                log.info("Resuming existing order {} for instruction {}", existing.get().getOrderId(), instruction.getId());
                return existing.get();
            }
            return client.placeOrder(mapper.toOrderRequest(instruction));
        } catch (VenueApiException e) {
            throw classify(e);
        }
    }

    private CexOrder refresh(CexOrder order) {
        try {
            return client.getOrder(order.getOrderId());
        } catch (VenueApiException e) {
            log.warn("Order status poll failed for {} on {}: {}", order.getOrderId(), venueName, e.getMessage());
            return order;
        }
    }

    private ExecutionResult cancelAfterFillTimeout(TradeInstruction instruction, CexOrder order) {
        CexOrder cancelled;
        try {
            cancelled = client.cancelOrder(order.getOrderId());
        } catch (VenueApiException e) {
            log.warn(
                    "Cancel after fill timeout failed: instructionId={}, orderId={}, error={}",
                    instruction.getId(),
                    order.getOrderId(),
                    e.getMessage());
            return mapper.toTimeoutResult(instruction, order.getOrderId(), "Fill timeout, cancel failed: " + e.getMessage());
        }
        if (cancelled.hasFill()) {
            log.info(
                    "Order {} partially filled before cancel: filled={} of {}",
                    cancelled.getOrderId(),
                    cancelled.getFilledQuantity(),
                    cancelled.getQuantity());
            return mapper.toFilledResult(instruction, cancelled);
        }
        throw new TerminalVenueException(
                ErrorCode.FILL_TIMEOUT,
                "Order " + order.getOrderId() + " not filled within " + settings.getFillTimeout(),
                order.getOrderId(),
                null,
                null);
    }

    // ---- Withdrawals ----

    private ExecutionResult executeWithdrawal(TransferInstruction instruction) {
        String address = venueRegistry
                .depositAddress(instruction.getTargetVenue())
                .orElseThrow(() -> new TerminalVenueException(
                        ErrorCode.ORDER_REJECTED, "No deposit address configured for " + instruction.getTargetVenue()));

        CexWithdrawal withdrawal;
        try {
            withdrawal = client.withdraw(mapper.toWithdrawalRequest(instruction, address));
        } catch (VenueApiException e) {
            throw classify(e);
        }
        log.info(
                "Withdrawal requested: instructionId={}, venue={}, withdrawalId={}, target={}",
                instruction.getId(),
                venueName,
                withdrawal.getWithdrawalId(),
                instruction.getTargetVenue());

        Instant deadline = deadlineAfter(settings.getConfirmationTimeout());
        while (!withdrawal.getStatus().isFinal()) {
            if (isPast(deadline) || !pause()) {
                return mapper.toTimeoutResult(
                        instruction, withdrawal.getWithdrawalId(), "Withdrawal not completed within deadline");
            }
            try {
                withdrawal = client.getWithdrawal(withdrawal.getWithdrawalId());
            } catch (VenueApiException e) {
                log.warn("Withdrawal status poll failed for {}: {}", withdrawal.getWithdrawalId(), e.getMessage());
            }
        }
        if (withdrawal.getStatus() == CexWithdrawalStatus.FAILED) {
            throw new TerminalVenueException(
                    ErrorCode.TX_REJECTED,
                    "Withdrawal " + withdrawal.getWithdrawalId() + " failed: " + withdrawal.getFailureReason(),
                    withdrawal.getWithdrawalId(),
                    withdrawal.getFee(),
                    withdrawal.getAsset(),
                    null);
        }
        return mapper.toFilledResult(instruction, withdrawal);
    }

    private Optional<ExecutionResult> resolveWithdrawal(Instruction instruction, CexWithdrawal withdrawal) {
        return switch (withdrawal.getStatus()) {
            case COMPLETED -> Optional.of(mapper.toFilledResult(instruction, withdrawal));
            case FAILED -> Optional.of(ExecutionResult.failed(
                    instruction, ErrorCode.TX_REJECTED, "Withdrawal failed: " + withdrawal.getFailureReason()));
            default -> Optional.empty();
        };
    }

    @Override
    protected ErrorCode terminalCodeFor(String venueCode) {
        if (venueCode == null) {
            return ErrorCode.ORDER_REJECTED;
        }
        return switch (venueCode) {
            case "INSUFFICIENT_BALANCE" -> ErrorCode.INSUFFICIENT_BALANCE;
            case "INVALID_SYMBOL" -> ErrorCode.INVALID_SYMBOL;
            default -> ErrorCode.ORDER_REJECTED;
        };
    }
}
