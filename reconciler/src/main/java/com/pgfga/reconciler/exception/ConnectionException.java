package com.pgfga.reconciler.exception;

import lombok.Getter;

/**
 * The engine could not be reached or rejected the connection parameters.
 * Aborts the run.
 */
@Getter
public class ConnectionException extends ReconcilerException {

    private final String database;

    public ConnectionException(String database, String message, Throwable cause) {
        super(message, cause);
        this.database = database;
    }
}
