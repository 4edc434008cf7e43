package com.pgfga.reconciler.model.result;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcomes of one strictify pass, in the order the objects were visited.
 */
public class PruneResult {

    private final List<PruneOutcome> outcomes = new ArrayList<>();

    public static PruneResult empty() {
        return new PruneResult();
    }

    public PruneResult add(PruneOutcome outcome) {
        outcomes.add(outcome);
        return this;
    }

    public PruneResult addAll(PruneResult other) {
        outcomes.addAll(other.outcomes);
        return this;
    }

    public List<PruneOutcome> getOutcomes() {
        return Collections.unmodifiableList(outcomes);
    }

    /**
     * True when at least one object was revoked or dropped.
     */
    public boolean isChanged() {
        return outcomes.stream().anyMatch(o -> o.getStatus() == PruneStatus.PRUNED);
    }

    public List<PruneOutcome> getFailures() {
        return outcomes.stream().filter(o -> o.getStatus() == PruneStatus.FAILED).toList();
    }

    public boolean hasFailures() {
        return outcomes.stream().anyMatch(o -> o.getStatus() == PruneStatus.FAILED);
    }

    public long count(PruneStatus status) {
        return outcomes.stream().filter(o -> o.getStatus() == status).count();
    }

    @Override
    public String toString() {
        return String.format("pruned=%d, skipped=%d, failed=%d",
                count(PruneStatus.PRUNED), count(PruneStatus.SKIPPED), count(PruneStatus.FAILED));
    }
}
