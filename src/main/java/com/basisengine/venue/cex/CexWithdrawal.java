package com.basisengine.venue.cex;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class CexWithdrawal {

    String withdrawalId;
    String clientWithdrawalId;
    String asset;
    BigDecimal amount;
    String address;
    CexWithdrawalStatus status;
    BigDecimal fee;

    /** Chain tx hash once the exchange has broadcast the withdrawal. */
    String txHash;

    String failureReason;
}
