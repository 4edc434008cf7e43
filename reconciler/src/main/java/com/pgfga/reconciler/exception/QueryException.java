package com.pgfga.reconciler.exception;

import lombok.Getter;

/**
 * A single statement failed. Carries the statement text and the database it ran against,
 * never the bound parameter values.
 */
@Getter
public class QueryException extends ReconcilerException {

    private final String database;
    private final String statement;

    public QueryException(String database, String statement, Throwable cause) {
        super("Statement failed on database '" + database + "': "
                + (cause != null ? cause.getMessage() : "unknown error"), cause);
        this.database = database;
        this.statement = statement;
    }
}
