package com.pgfga.reconciler.catalog;

import org.postgresql.core.Utils;

import java.sql.SQLException;

/**
 * Quoting for the parts of a statement that cannot be bound as parameters: object names, and
 * values inside utility statements the engine does not parameterize.
 */
public final class SqlQuoting {

    private SqlQuoting() {
    }

    /**
     * Quotes an object name as a case-sensitive identifier.
     *
     * @throws IllegalArgumentException for empty names or names containing a NUL character
     */
    public static String identifier(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Identifier must not be empty");
        }
        try {
            return Utils.escapeIdentifier(null, name).toString();
        } catch (SQLException e) {
            throw new IllegalArgumentException("Invalid identifier: " + e.getMessage(), e);
        }
    }

    /**
     * Quotes a value as a string literal, assuming {@code standard_conforming_strings} is on.
     */
    public static String literal(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Literal must not be null");
        }
        try {
            return "'" + Utils.escapeLiteral(null, value, true) + "'";
        } catch (SQLException e) {
            throw new IllegalArgumentException("Invalid literal: " + e.getMessage(), e);
        }
    }
}
