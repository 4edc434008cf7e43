package com.pgfga.reconciler.model.result;

import lombok.Builder;
import lombok.Value;

/**
 * Summary of one reconciliation pass.
 */
@Value
@Builder
public class ReconciliationReport {

    boolean changed;

    /**
     * True when the pass was skipped because the target is a standby.
     */
    boolean standby;

    @Builder.Default
    PruneResult roles = PruneResult.empty();

    @Builder.Default
    PruneResult databases = PruneResult.empty();

    @Builder.Default
    PruneResult extensions = PruneResult.empty();

    public boolean hasFailures() {
        return roles.hasFailures() || databases.hasFailures() || extensions.hasFailures();
    }

    public static ReconciliationReport standbySkipped() {
        return ReconciliationReport.builder().standby(true).build();
    }
}
