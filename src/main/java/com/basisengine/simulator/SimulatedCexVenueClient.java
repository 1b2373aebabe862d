package com.basisengine.simulator;

import com.basisengine.exception.VenueApiException;
import com.basisengine.venue.cex.CexOrder;
import com.basisengine.venue.cex.CexOrderRequest;
import com.basisengine.venue.cex.CexOrderSide;
import com.basisengine.venue.cex.CexOrderStatus;
import com.basisengine.venue.cex.CexVenueClient;
import com.basisengine.venue.cex.CexWithdrawal;
import com.basisengine.venue.cex.CexWithdrawalRequest;
import com.basisengine.venue.cex.CexWithdrawalStatus;
import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory exchange for paper trading. Market orders fill immediately at the book's mark price,
 * withdrawals complete immediately and credit the venue owning the destination address.
 *
 * <p>A fill moves both sides of the spot trade on the book: the traded asset and the quote asset
 * at the mark price, less the fee charged in the quote asset.
 *
 * <p>Failures can be scripted for tests: {@link #failNextRequests} makes the next order or
 * withdrawal submissions throw, {@link #setHoldFills} keeps new orders working on the book.
 */
public class SimulatedCexVenueClient implements CexVenueClient {

    private static final Logger log = LoggerFactory.getLogger(SimulatedCexVenueClient.class);

    private final String venueName;
    private final String quoteAsset;
    private final SimulatedVenueBook book;

    private final Map<String, CexOrder> orders = new HashMap<>();
    private final Map<String, String> orderIdByClientId = new HashMap<>();
    private final Map<String, CexWithdrawal> withdrawals = new HashMap<>();
    private final Deque<VenueApiException> scriptedFailures = new ArrayDeque<>();
    private final AtomicLong idSequence = new AtomicLong(1);

    private boolean holdFills;
    private BigDecimal feeRate = BigDecimal.ZERO;

    public SimulatedCexVenueClient(String venueName, String quoteAsset, SimulatedVenueBook book) {
        this.venueName = venueName;
        this.quoteAsset = quoteAsset;
        this.book = book;
    }

    /** The next {@code count} submissions fail with a retryable 503 or a non-retryable 400. */
    public synchronized void failNextRequests(int count, boolean retryable) {
        for (int i = 0; i < count; i++) {
            scriptedFailures.add(new VenueApiException(
                    venueName,
                    retryable ? 503 : 400,
                    retryable ? null : "ORDER_REJECTED",
                    retryable ? "Service unavailable (simulated)" : "Rejected (simulated)",
                    retryable));
        }
    }

    public synchronized void failNext(VenueApiException failure) {
        scriptedFailures.add(failure);
    }

    public synchronized void setHoldFills(boolean holdFills) {
        this.holdFills = holdFills;
    }

    public synchronized void setFeeRate(BigDecimal feeRate) {
        this.feeRate = feeRate;
    }

    @Override
    public synchronized CexOrder placeOrder(CexOrderRequest request) {
        throwScriptedFailure();
        String existingId = orderIdByClientId.get(request.getClientOrderId());
        if (existingId != null) {
            return orders.get(existingId);
        }
        if (!request.getSymbol().endsWith(quoteAsset) || request.getSymbol().equals(quoteAsset)) {
            throw new VenueApiException(venueName, 400, "INVALID_SYMBOL", "Unknown symbol " + request.getSymbol(), false);
        }

        String orderId = venueName + "-" + idSequence.getAndIncrement();
        CexOrder order = CexOrder.builder()
                .orderId(orderId)
                .clientOrderId(request.getClientOrderId())
                .symbol(request.getSymbol())
                .side(request.getSide())
                .status(CexOrderStatus.NEW)
                .quantity(request.getQuantity())
                .filledQuantity(BigDecimal.ZERO)
                .build();
        if (!holdFills) {
            order = fill(order);
        }
        orders.put(orderId, order);
        orderIdByClientId.put(request.getClientOrderId(), orderId);
        log.debug("Simulated order {} {} {} qty={} -> {}", orderId, order.getSide(), order.getSymbol(), order.getQuantity(), order.getStatus());
        return order;
    }

    @Override
    public synchronized CexOrder getOrder(String orderId) {
        CexOrder order = orders.get(orderId);
        if (order == null) {
            throw new VenueApiException(venueName, 404, "ORDER_NOT_FOUND", "No order " + orderId, false);
        }
        return order;
    }

    @Override
    public synchronized Optional<CexOrder> findOrderByClientId(String clientOrderId) {
        return Optional.ofNullable(orderIdByClientId.get(clientOrderId)).map(orders::get);
    }

    @Override
    public synchronized CexOrder cancelOrder(String orderId) {
        CexOrder order = getOrder(orderId);
        if (order.getStatus().isOpen()) {
            order = order.toBuilder().status(CexOrderStatus.CANCELED).build();
            orders.put(orderId, order);
        }
        return order;
    }

    /** Fills a working order, as if the market reached it. */
    public synchronized CexOrder fillWorkingOrder(String orderId) {
        CexOrder order = fill(getOrder(orderId));
        orders.put(orderId, order);
        return order;
    }

    @Override
    public synchronized CexWithdrawal withdraw(CexWithdrawalRequest request) {
        throwScriptedFailure();
        for (CexWithdrawal existing : withdrawals.values()) {
            if (existing.getClientWithdrawalId().equals(request.getClientWithdrawalId())) {
                return existing;
            }
        }
        if (book.balance(venueName, request.getAsset()).compareTo(request.getAmount()) < 0) {
            throw new VenueApiException(
                    venueName, 400, "INSUFFICIENT_BALANCE", "Insufficient " + request.getAsset() + " for withdrawal", false);
        }
        String withdrawalId = venueName + "-W" + idSequence.getAndIncrement();
        book.adjust(venueName, request.getAsset(), request.getAmount().negate());
        book.venueForAddress(request.getAddress())
                .ifPresent(target -> book.adjust(target, request.getAsset(), request.getAmount()));
        CexWithdrawal withdrawal = CexWithdrawal.builder()
                .withdrawalId(withdrawalId)
                .clientWithdrawalId(request.getClientWithdrawalId())
                .asset(request.getAsset())
                .amount(request.getAmount())
                .address(request.getAddress())
                .status(CexWithdrawalStatus.COMPLETED)
                .fee(BigDecimal.ZERO)
                .build();
        withdrawals.put(withdrawalId, withdrawal);
        return withdrawal;
    }

    @Override
    public synchronized CexWithdrawal getWithdrawal(String withdrawalId) {
        CexWithdrawal withdrawal = withdrawals.get(withdrawalId);
        if (withdrawal == null) {
            throw new VenueApiException(venueName, 404, "WITHDRAWAL_NOT_FOUND", "No withdrawal " + withdrawalId, false);
        }
        return withdrawal;
    }

    @Override
    public synchronized Map<String, BigDecimal> getBalances() {
        return book.balancesOf(venueName);
    }

    private CexOrder fill(CexOrder order) {
        String asset = order.getSymbol().substring(0, order.getSymbol().length() - quoteAsset.length());
        BigDecimal price = book.markPrice(asset);
        BigDecimal quantity = order.getQuantity();
        BigDecimal notional = quantity.multiply(price);
        BigDecimal fee = notional.multiply(feeRate);
        boolean sell = order.getSide() == CexOrderSide.SELL;
        book.adjust(venueName, asset, sell ? quantity.negate() : quantity);
        book.adjust(venueName, quoteAsset, (sell ? notional : notional.negate()).subtract(fee));
        return order.toBuilder()
                .status(CexOrderStatus.FILLED)
                .filledQuantity(quantity)
                .averagePrice(price)
                .fee(fee)
                .feeAsset(quoteAsset)
                .build();
    }

    private void throwScriptedFailure() {
        VenueApiException failure = scriptedFailures.poll();
        if (failure != null) {
            log.debug("Simulated failure on {}: {}", venueName, failure.getMessage());
            throw failure;
        }
    }
}
