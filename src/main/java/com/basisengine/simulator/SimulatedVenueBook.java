package com.basisengine.simulator;

import com.basisengine.domain.model.PositionKey;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Balances held by every simulated venue, shared so a simulated withdrawal from one venue can
 * credit another. Also holds the mark prices used to fill orders and price swaps (default 1).
 */
public class SimulatedVenueBook {

    private final Map<PositionKey, BigDecimal> balances = new ConcurrentHashMap<>();
    private final Map<String, String> venueByAddress = new ConcurrentHashMap<>();
    private final Map<String, BigDecimal> markPrices = new ConcurrentHashMap<>();

    public void registerAddress(String address, String venue) {
        if (address != null) {
            venueByAddress.put(address, venue);
        }
    }

    public Optional<String> venueForAddress(String address) {
        return Optional.ofNullable(address).map(venueByAddress::get);
    }

    public void setMarkPrice(String asset, BigDecimal price) {
        markPrices.put(asset, price);
    }

    public BigDecimal markPrice(String asset) {
        return markPrices.getOrDefault(asset, BigDecimal.ONE);
    }

    /** Amount of {@code assetOut} bought with {@code amountIn} of {@code assetIn} at mark prices. */
    public BigDecimal convert(String assetIn, BigDecimal amountIn, String assetOut) {
        return amountIn.multiply(markPrice(assetIn)).divide(markPrice(assetOut), MathContext.DECIMAL64);
    }

    public void seed(String venue, Map<String, BigDecimal> initial) {
        initial.forEach((asset, amount) -> balances.put(new PositionKey(venue, asset), amount));
    }

    public BigDecimal balance(String venue, String asset) {
        return balances.getOrDefault(new PositionKey(venue, asset), BigDecimal.ZERO);
    }

    public void adjust(String venue, String asset, BigDecimal signedAmount) {
        balances.merge(new PositionKey(venue, asset), signedAmount, BigDecimal::add);
    }

    public Map<String, BigDecimal> balancesOf(String venue) {
        Map<String, BigDecimal> result = new TreeMap<>();
        balances.forEach((key, amount) -> {
            if (key.venue().equals(venue)) {
                result.put(key.asset(), amount);
            }
        });
        return result;
    }
}
