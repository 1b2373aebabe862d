package com.basisengine.exception;

import lombok.Getter;

/**
 * Raw error from a venue client, before the adapter classifies it as transient or terminal.
 * {@code venueCode} is the venue's own error identifier when the response carried one.
 */
@Getter
public class VenueApiException extends BaseException {

    private final String venue;
    private final int httpStatus;
    private final String venueCode;
    private final boolean retryable;

    public VenueApiException(String venue, int httpStatus, String venueCode, String message, boolean retryable) {
        this(venue, httpStatus, venueCode, message, retryable, null);
    }

    public VenueApiException(
            String venue, int httpStatus, String venueCode, String message, boolean retryable, Throwable cause) {
        super(retryable ? ErrorCode.VENUE_UNAVAILABLE : ErrorCode.ORDER_REJECTED, message, cause);
        this.venue = venue;
        this.httpStatus = httpStatus;
        this.venueCode = venueCode;
        this.retryable = retryable;
    }
}
