package com.basisengine.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Root of the engine's exceptions. The {@link ErrorCode} decides how a failure is handled:
 * its {@link ErrorKind} separates retryable venue errors from terminal ones and from failures
 * that halt a venue.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message) {
        this(errorCode, message, Map.of(), null);
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details) {
        this(errorCode, message, details, null);
    }

    protected BaseException(ErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, Map.of(), cause);
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = details != null ? Map.copyOf(details) : Map.of();
    }

    public ErrorKind getKind() {
        return errorCode.getKind();
    }
}
