package com.basisengine.exception;

import java.math.BigDecimal;
import lombok.Getter;

/**
 * The venue rejected the instruction for good (insufficient balance, invalid symbol, reverted
 * transaction). Never retried.
 */
@Getter
public class TerminalVenueException extends BaseException {

    /** Order id or tx hash when the venue accepted the request before failing it. */
    private final String venueRef;

    /** Fee charged despite the failure, e.g. gas burnt by a reverted transaction. */
    private final BigDecimal fee;
    private final String feeAsset;

    public TerminalVenueException(ErrorCode errorCode, String message) {
        this(errorCode, message, null, null, null, null);
    }

    public TerminalVenueException(ErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, null, null, null, cause);
    }

    public TerminalVenueException(
            ErrorCode errorCode, String message, String venueRef, BigDecimal fee, Throwable cause) {
        this(errorCode, message, venueRef, fee, null, cause);
    }

    public TerminalVenueException(
            ErrorCode errorCode, String message, String venueRef, BigDecimal fee, String feeAsset, Throwable cause) {
        super(errorCode, message, cause);
        this.venueRef = venueRef;
        this.fee = fee;
        this.feeAsset = feeAsset;
    }
}
