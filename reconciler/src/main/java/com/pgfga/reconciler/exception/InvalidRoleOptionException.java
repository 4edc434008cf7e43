package com.pgfga.reconciler.exception;

import lombok.Getter;

import java.util.Set;
import java.util.TreeSet;

/**
 * Raised after the recognized options of a role were applied, naming the ones that were not.
 */
@Getter
public class InvalidRoleOptionException extends ReconcilerException {

    private final String role;
    private final Set<String> invalidOptions;

    public InvalidRoleOptionException(String role, Set<String> invalidOptions) {
        super("Invalid or conflicting role options for role '" + role + "': " + new TreeSet<>(invalidOptions));
        this.role = role;
        this.invalidOptions = Set.copyOf(invalidOptions);
    }
}
