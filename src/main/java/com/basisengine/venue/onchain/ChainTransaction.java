package com.basisengine.venue.onchain;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Unsigned transaction intent handed to the relayer, which builds, signs and broadcasts it.
 * {@code reference} is the instruction id and lets the relayer reject a second broadcast.
 */
@Value
@Builder
@Jacksonized
public class ChainTransaction {

    String reference;
    ChainOperation operation;
    String asset;

    /** Signed for trades, absolute otherwise. */
    BigDecimal amount;

    /** SWAP: asset paid in. */
    String assetIn;

    BigDecimal slippageTolerance;

    /** TRANSFER: destination address. */
    String toAddress;

    BigDecimal feeBps;

    BigDecimal leverage;

    String atomicGroupId;
}
