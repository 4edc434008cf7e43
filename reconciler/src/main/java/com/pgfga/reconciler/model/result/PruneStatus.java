package com.pgfga.reconciler.model.result;

public enum PruneStatus {
    PRUNED,
    SKIPPED,
    FAILED
}
