package com.basisengine.exception;

/**
 * Error taxonomy of the execution engine. Only SYSTEM_FAILURE and unrecoverable GROUP_ABORT
 * interrupt submission to a venue; everything else is contained in the instruction's result.
 */
public enum ErrorKind {
    VALIDATION,
    UNROUTABLE,
    TRANSIENT,
    TERMINAL,
    GROUP_ABORT,
    DRIFT,
    SYSTEM_FAILURE
}
