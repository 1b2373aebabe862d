package com.basisengine.venue.cex;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class CexWithdrawalRequest {

    /** Instruction id; makes a repeated withdrawal request idempotent. */
    String clientWithdrawalId;

    String asset;
    BigDecimal amount;
    String address;
}
