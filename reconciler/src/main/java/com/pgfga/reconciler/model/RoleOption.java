package com.pgfga.reconciler.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Locale;
import java.util.Optional;

/**
 * Role capabilities that can be enforced, each with the {@code pg_roles} column that reflects it
 * and the value that column must have once the option is in effect.
 */
@Getter
@RequiredArgsConstructor
public enum RoleOption {
    SUPERUSER("rolsuper", true),
    NOSUPERUSER("rolsuper", false),

    CREATEDB("rolcreatedb", true),
    NOCREATEDB("rolcreatedb", false),

    CREATEROLE("rolcreaterole", true),
    NOCREATEROLE("rolcreaterole", false),

    INHERIT("rolinherit", true),
    NOINHERIT("rolinherit", false),

    LOGIN("rolcanlogin", true),
    NOLOGIN("rolcanlogin", false),

    REPLICATION("rolreplication", true),
    NOREPLICATION("rolreplication", false),

    BYPASSRLS("rolbypassrls", true),
    NOBYPASSRLS("rolbypassrls", false);

    private final String catalogColumn;
    private final boolean expected;

    /**
     * Condition on {@code pg_roles} that holds when the option is already in effect.
     */
    public String predicate() {
        return expected ? catalogColumn : "NOT " + catalogColumn;
    }

    /**
     * Keyword used in {@code ALTER ROLE ... WITH}.
     */
    public String keyword() {
        return name();
    }

    /**
     * The option that sets the same column to the other value, e.g. NOLOGIN for LOGIN.
     */
    public RoleOption opposite() {
        for (RoleOption option : values()) {
            if (option.catalogColumn.equals(catalogColumn) && option.expected != expected) {
                return option;
            }
        }
        throw new IllegalStateException("No opposite for " + this);
    }

    public static Optional<RoleOption> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace("_", "").replace(" ", "");
        for (RoleOption option : values()) {
            if (option.name().equals(normalized)) {
                return Optional.of(option);
            }
        }
        return Optional.empty();
    }
}
