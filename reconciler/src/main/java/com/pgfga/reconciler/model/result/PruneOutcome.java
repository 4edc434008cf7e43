package com.pgfga.reconciler.model.result;

import lombok.Builder;
import lombok.Value;

/**
 * What happened to one undeclared object during a strictify pass.
 * {@code name} is {@code role/grantee} for grants and {@code database/extension} for extensions.
 */
@Value
@Builder
public class PruneOutcome {

    ObjectType objectType;
    String name;
    PruneStatus status;
    String reason;

    public static PruneOutcome pruned(ObjectType type, String name) {
        return new PruneOutcome(type, name, PruneStatus.PRUNED, null);
    }

    public static PruneOutcome skipped(ObjectType type, String name, String reason) {
        return new PruneOutcome(type, name, PruneStatus.SKIPPED, reason);
    }

    public static PruneOutcome failed(ObjectType type, String name, String reason) {
        return new PruneOutcome(type, name, PruneStatus.FAILED, reason);
    }
}
