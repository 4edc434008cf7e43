package com.pgfga.reconciler.model.result;

public enum ObjectType {
    ROLE,
    GRANT,
    DATABASE,
    EXTENSION
}
