package com.basisengine.venue.cex;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class CexOrder {

    String orderId;
    String clientOrderId;
    String symbol;
    CexOrderSide side;
    CexOrderStatus status;
    BigDecimal quantity;
    BigDecimal filledQuantity;
    BigDecimal averagePrice;
    BigDecimal fee;
    String feeAsset;

    /** Exchange reject code, e.g. INSUFFICIENT_BALANCE. */
    String rejectCode;

    String rejectReason;

    public boolean hasFill() {
        return filledQuantity != null && filledQuantity.signum() > 0;
    }
}
