package com.pgfga.reconciler.exception;

/**
 * Base type for every failure raised by the reconciler.
 */
public class ReconcilerException extends RuntimeException {

    public ReconcilerException(String message) {
        super(message);
    }

    public ReconcilerException(String message, Throwable cause) {
        super(message, cause);
    }
}
