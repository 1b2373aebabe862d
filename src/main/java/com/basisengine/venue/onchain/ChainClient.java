package com.basisengine.venue.onchain;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;

/**
 * Access to one chain account through a signing relayer. Failures are reported as
 * {@link com.basisengine.exception.VenueApiException}.
 */
public interface ChainClient {

    /**
     * Signs and broadcasts the transaction.
     *
     * @return the transaction hash
     */
    String broadcast(ChainTransaction transaction);

    /** Receipt of a mined transaction; empty while it is still in the mempool or unknown. */
    Optional<ChainReceipt> getReceipt(String txHash);

    long latestBlock();

    /** Wallet balance per asset. */
    Map<String, BigDecimal> getBalances();
}
