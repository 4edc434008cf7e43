package com.pgfga.reconciler.exception;

/**
 * Required connection or directory settings are missing or malformed.
 */
public class InvalidConfigurationException extends ReconcilerException {

    public InvalidConfigurationException(String message) {
        super(message);
    }
}
