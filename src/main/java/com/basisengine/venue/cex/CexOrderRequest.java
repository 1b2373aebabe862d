package com.basisengine.venue.cex;

import com.basisengine.domain.enums.OrderType;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Order submission payload. {@code clientOrderId} is the instruction id, so the exchange rejects
 * or returns the existing order when the same instruction is submitted twice.
 */
@Value
@Builder
@Jacksonized
public class CexOrderRequest {

    String clientOrderId;
    String symbol;
    CexOrderSide side;
    OrderType type;
    BigDecimal quantity;

    /** LIMIT only. */
    BigDecimal price;

    BigDecimal leverage;
}
