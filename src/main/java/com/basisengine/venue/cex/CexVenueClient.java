package com.basisengine.venue.cex;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;

/**
 * Raw access to one centralized exchange account. Implementations report failures as
 * {@link com.basisengine.exception.VenueApiException}; classification into transient or
 * terminal is the adapter's job.
 *
 * <ul>
 *   <li>{@code RestCexVenueClient}: signed REST calls for live trading</li>
 *   <li>{@code SimulatedCexVenueClient}: in-memory exchange for paper trading and tests</li>
 * </ul>
 */
public interface CexVenueClient {

    /**
     * Submits an order. Submitting a request whose client order id already exists returns the
     * existing order instead of creating a second one.
     */
    CexOrder placeOrder(CexOrderRequest request);

    CexOrder getOrder(String orderId);

    /** Looks up an order by the client order id it was submitted with. */
    Optional<CexOrder> findOrderByClientId(String clientOrderId);

    /** @return the order after cancellation, with its final filled quantity */
    CexOrder cancelOrder(String orderId);

    CexWithdrawal withdraw(CexWithdrawalRequest request);

    CexWithdrawal getWithdrawal(String withdrawalId);

    /** Total balance per asset. */
    Map<String, BigDecimal> getBalances();
}
