package com.pgfga.reconciler.service;

import java.util.Set;

/**
 * Engine-owned objects that pruning never touches, whatever the tracked state says.
 */
public final class ProtectedObjects {

    public static final Set<String> ROLES = Set.of(
            "aq_administrator_role",
            "enterprisedb",
            "postgres",
            "pg_monitor",
            "pg_read_all_settings",
            "pg_read_all_stats",
            "pg_stat_scan_tables",
            "pg_signal_backend",
            "pg_read_server_files",
            "pg_write_server_files",
            "pg_execute_server_program",
            "pg_database_owner",
            "pg_read_all_data",
            "pg_write_all_data",
            "pg_checkpoint",
            "pg_create_subscription",
            "pg_maintain",
            "pg_use_reserved_connections"
    );

    public static final Set<String> DATABASES = Set.of("postgres", "template0", "template1");

    public static final Set<String> EXTENSIONS = Set.of("plpgsql");

    // Names starting with pg_ are reserved for predefined roles
    private static final String RESERVED_ROLE_PREFIX = "pg_";

    private ProtectedObjects() {
    }

    public static boolean isProtectedRole(String role) {
        return ROLES.contains(role) || role.startsWith(RESERVED_ROLE_PREFIX);
    }

    public static boolean isProtectedDatabase(String database) {
        return DATABASES.contains(database);
    }

    public static boolean isProtectedExtension(String extension) {
        return EXTENSIONS.contains(extension);
    }
}
