package com.pgfga.reconciler.exception;

/**
 * The directory could not be reached or rejected a search.
 */
public class DirectoryException extends ReconcilerException {

    public DirectoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
