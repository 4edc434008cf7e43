package com.pgfga.reconciler.catalog;

import com.pgfga.reconciler.model.RoleOption;

import static com.pgfga.reconciler.catalog.SqlQuoting.identifier;
import static com.pgfga.reconciler.catalog.SqlQuoting.literal;

/**
 * Every SQL text the reconciler sends. Catalog lookups bind their values; DDL is assembled from
 * quoted identifiers only.
 */
public final class CatalogStatements {

    private CatalogStatements() {
    }

    // Cluster state

    public static final String IS_IN_RECOVERY =
            "SELECT pg_is_in_recovery() AS recovery";

    // Roles

    public static final String ROLE_EXISTS =
            "SELECT rolname FROM pg_roles WHERE rolname = ?";

    public static final String ROLE_EXISTS_NOT_CURRENT_USER =
            "SELECT rolname FROM pg_roles WHERE rolname = ? AND rolname != CURRENT_USER";

    public static final String ALL_ROLES =
            "SELECT rolname FROM pg_roles ORDER BY rolname";

    public static final String GRANT_EXISTS =
            "SELECT granted.rolname AS granted_role, grantee.rolname AS grantee_role "
                    + "FROM pg_auth_members auth "
                    + "JOIN pg_roles granted ON auth.roleid = granted.oid "
                    + "JOIN pg_roles grantee ON auth.member = grantee.oid "
                    + "WHERE granted.rolname = ? AND grantee.rolname = ?";

    public static final String ROLE_GRANTEES =
            "SELECT r.rolname AS grantee FROM pg_roles r "
                    + "JOIN pg_auth_members a ON r.oid = a.member "
                    + "WHERE a.roleid = (SELECT oid FROM pg_roles WHERE rolname = ?) "
                    + "ORDER BY r.rolname";

    public static String roleHasOption(RoleOption option) {
        return "SELECT rolname FROM pg_roles WHERE rolname = ? AND " + option.predicate();
    }

    // Databases

    public static final String DATABASE_EXISTS =
            "SELECT datname FROM pg_database WHERE datname = ?";

    public static final String DATABASE_OWNED_BY =
            "SELECT datname FROM pg_database db JOIN pg_roles rol ON db.datdba = rol.oid "
                    + "WHERE datname = ? AND rolname = ?";

    public static final String CONNECTABLE_DATABASE_OWNERS =
            "SELECT db.datname, o.rolname AS owner FROM pg_database db "
                    + "JOIN pg_roles o ON db.datdba = o.oid "
                    + "WHERE db.datallowconn ORDER BY db.datname";

    public static final String ALL_DATABASES =
            "SELECT datname FROM pg_database ORDER BY datname";

    /**
     * Schemas holding at least one table the given role cannot SELECT yet.
     */
    public static final String SCHEMAS_WITHOUT_SELECT_GRANT =
            "SELECT DISTINCT schemaname FROM pg_tables "
                    + "WHERE schemaname NOT IN ('pg_catalog', 'information_schema') "
                    + "AND schemaname || '.' || tablename NOT IN ("
                    + "SELECT table_schema || '.' || table_name FROM information_schema.role_table_grants "
                    + "WHERE grantee = ? AND privilege_type = 'SELECT') "
                    + "ORDER BY schemaname";

    // Extensions

    public static final String EXTENSION_EXISTS =
            "SELECT extname FROM pg_extension WHERE extname = ?";

    public static final String EXTENSION_VERSION_DIFFERS =
            "SELECT extname FROM pg_extension WHERE extname = ? AND extversion != ?";

    public static final String ALL_EXTENSIONS =
            "SELECT extname FROM pg_extension ORDER BY extname";

    // Credentials

    public static final String PASSWORD_DIFFERS =
            "SELECT usename FROM pg_shadow WHERE usename = ? AND COALESCE(passwd, '') != ?";

    public static final String PASSWORD_IS_SET =
            "SELECT usename FROM pg_shadow WHERE usename = ? AND passwd IS NOT NULL AND usename != CURRENT_USER";

    public static final String EXPIRY_DIFFERS =
            "SELECT rolname FROM pg_roles WHERE rolname = ? AND rolvaliduntil IS DISTINCT FROM CAST(? AS timestamptz)";

    // Replication slots

    public static final String SLOT_EXISTS =
            "SELECT EXISTS (SELECT 1 FROM pg_replication_slots WHERE slot_name = ?) AS exists";

    public static final String CREATE_PHYSICAL_SLOT =
            "SELECT pg_create_physical_replication_slot(?)";

    public static final String DROP_SLOT =
            "SELECT pg_drop_replication_slot(?)";

    public static final String ALL_SLOTS =
            "SELECT slot_name FROM pg_replication_slots ORDER BY slot_name";

    // DDL

    public static String createRole(String role) {
        return "CREATE ROLE " + identifier(role);
    }

    public static String alterRole(String role, RoleOption option) {
        return "ALTER ROLE " + identifier(role) + " WITH " + option.keyword();
    }

    public static String grantRole(String role, String grantee) {
        return "GRANT " + identifier(role) + " TO " + identifier(grantee);
    }

    public static String revokeRole(String role, String grantee) {
        return "REVOKE " + identifier(role) + " FROM " + identifier(grantee);
    }

    public static String reassignOwned(String role, String newOwner) {
        return "REASSIGN OWNED BY " + identifier(role) + " TO " + identifier(newOwner);
    }

    public static String dropRole(String role) {
        return "DROP ROLE " + identifier(role);
    }

    public static String createDatabase(String database) {
        return "CREATE DATABASE " + identifier(database);
    }

    public static String alterDatabaseOwner(String database, String owner) {
        return "ALTER DATABASE " + identifier(database) + " OWNER TO " + identifier(owner);
    }

    public static String dropDatabase(String database) {
        return "DROP DATABASE " + identifier(database);
    }

    public static String grantSelectOnAllTables(String schema, String role) {
        return "GRANT SELECT ON ALL TABLES IN SCHEMA " + identifier(schema) + " TO " + identifier(role);
    }

    public static String createExtension(String extension, String schema, String version) {
        StringBuilder statement = new StringBuilder("CREATE EXTENSION IF NOT EXISTS ").append(identifier(extension));
        if (schema != null && !schema.isBlank()) {
            statement.append(" SCHEMA ").append(identifier(schema));
        }
        if (version != null && !version.isBlank()) {
            statement.append(" VERSION ").append(literal(version));
        }
        return statement.toString();
    }

    public static String dropExtension(String extension) {
        return "DROP EXTENSION IF EXISTS " + identifier(extension);
    }

    public static String setPassword(String user, String hashedPassword) {
        return "ALTER USER " + identifier(user) + " WITH ENCRYPTED PASSWORD " + literal(hashedPassword);
    }

    public static String resetPassword(String user) {
        return "ALTER USER " + identifier(user) + " WITH PASSWORD NULL";
    }

    public static String setValidUntil(String role, String validUntil) {
        return "ALTER ROLE " + identifier(role) + " VALID UNTIL " + literal(validUntil);
    }
}
