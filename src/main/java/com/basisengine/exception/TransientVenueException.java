package com.basisengine.exception;

/**
 * A venue call failed in a way that may succeed on retry (timeouts, 5xx, rate limits).
 * Only thrown before anything irreversible was submitted.
 */
public class TransientVenueException extends BaseException {

    public TransientVenueException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public TransientVenueException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
