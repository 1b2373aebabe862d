package com.basisengine.venue.onchain;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class ChainReceipt {

    String txHash;
    long blockNumber;

    /** False when the transaction was mined but reverted. */
    boolean success;

    long gasUsed;

    /** Gas fee in the chain's native asset. */
    BigDecimal fee;

    String feeAsset;

    /** Amount actually moved: received amount for swaps, principal for loans and transfers. */
    BigDecimal realizedAmount;

    BigDecimal realizedPrice;
    String revertReason;
}
