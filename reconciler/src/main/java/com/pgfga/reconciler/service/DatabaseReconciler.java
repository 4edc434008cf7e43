package com.pgfga.reconciler.service;

import com.pgfga.reconciler.catalog.CatalogQueryExecutor;
import com.pgfga.reconciler.catalog.CatalogStatements;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static com.pgfga.reconciler.catalog.CatalogQueryExecutor.NO_PARAMETERS;

/**
 * Idempotent create/alter of databases and their extensions.
 *
 * Every managed database gets an owner role, membership of that owner for the operational
 * role, and a {@code <database>_readonly} role that can SELECT every table in the database.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DatabaseReconciler {

    public static final String READONLY_SUFFIX = "_readonly";

    /**
     * NAMEDATALEN - 1: longer identifiers are silently truncated by the engine.
     */
    public static final int MAX_IDENTIFIER_BYTES = 63;

    private final RoleReconciler roleReconciler;

    @Value("${pgfga.postgres.operational-role:opex}")
    private String operationalRole;

    @Value("${pgfga.postgres.readonly-role:readonly}")
    private String readonlyGroup;

    /**
     * Name of the read-only companion role of a database.
     *
     * @throws IllegalArgumentException when the suffixed name would exceed the identifier limit
     */
    public static String readOnlyRoleName(String database) {
        String name = database + READONLY_SUFFIX;
        if (name.getBytes(StandardCharsets.UTF_8).length > MAX_IDENTIFIER_BYTES) {
            throw new IllegalArgumentException("Database name '" + database + "' is too long: '" + name
                    + "' exceeds " + MAX_IDENTIFIER_BYTES + " bytes");
        }
        return name;
    }

    public boolean ensureDatabase(ReconciliationSession session, String database, String owner) {
        String ownerName = owner == null || owner.isBlank() ? database : owner;
        String readOnlyRole = readOnlyRoleName(database);

        session.trackDatabase(database);

        CatalogQueryExecutor catalog = session.getCatalog();
        String maintenance = session.getMaintenanceDatabase();
        boolean changed = roleReconciler.ensureRole(session, ownerName);

        if (!catalog.exists(maintenance, CatalogStatements.DATABASE_EXISTS, List.of(database))) {
            catalog.execute(maintenance, CatalogStatements.createDatabase(database), NO_PARAMETERS);
            log.info("Created database '{}'", database);
            changed = true;
        }

        if (!catalog.exists(maintenance, CatalogStatements.DATABASE_OWNED_BY, List.of(database, ownerName))) {
            catalog.execute(maintenance, CatalogStatements.alterDatabaseOwner(database, ownerName), NO_PARAMETERS);
            log.info("Altered database owner on '{}' to '{}'", database, ownerName);
            changed = true;
        }

        if (!ownerName.equals(operationalRole) && roleReconciler.grantRole(session, operationalRole, ownerName)) {
            changed = true;
        }
        if (roleReconciler.grantRole(session, readonlyGroup, readOnlyRole)) {
            changed = true;
        }

        List<String> schemas = catalog.column(database, CatalogStatements.SCHEMAS_WITHOUT_SELECT_GRANT,
                List.of(readOnlyRole), "schemaname");
        for (String schema : schemas) {
            catalog.execute(database, CatalogStatements.grantSelectOnAllTables(schema, readOnlyRole), NO_PARAMETERS);
            log.info("Granted SELECT on all tables in schema '{}' of '{}' to '{}'", schema, database, readOnlyRole);
            changed = true;
        }
        return changed;
    }

    public boolean dropDatabase(ReconciliationSession session, String database) {
        if (!session.getStrictOptions().isDatabases()) {
            log.info("Not dropping database '{}' (strict databases mode is disabled)", database);
            return false;
        }
        if (ProtectedObjects.isProtectedDatabase(database)) {
            log.warn("Not dropping protected database '{}'", database);
            return false;
        }

        CatalogQueryExecutor catalog = session.getCatalog();
        String maintenance = session.getMaintenanceDatabase();
        if (!catalog.exists(maintenance, CatalogStatements.DATABASE_EXISTS, List.of(database))) {
            return false;
        }

        // our own open session would block the drop
        catalog.release(database);
        catalog.execute(maintenance, CatalogStatements.dropDatabase(database), NO_PARAMETERS);
        log.info("Dropped database '{}'", database);
        return true;
    }

    /**
     * Creates the extension when missing. When a version is requested and the installed one
     * differs, the extension is dropped first (subject to strict extensions mode) and recreated.
     */
    public boolean ensureExtension(ReconciliationSession session, String extension, String database,
                                   String schema, String version) {
        session.trackExtension(database, extension);

        CatalogQueryExecutor catalog = session.getCatalog();
        boolean changed = false;

        if (version != null && !version.isBlank()
                && catalog.exists(database, CatalogStatements.EXTENSION_VERSION_DIFFERS, List.of(extension, version))) {
            log.info("Extension '{}' on '{}' is not at version {}, recreating", extension, database, version);
            if (dropExtension(session, extension, database)) {
                changed = true;
            }
        }

        if (!catalog.exists(database, CatalogStatements.EXTENSION_EXISTS, List.of(extension))) {
            catalog.execute(database, CatalogStatements.createExtension(extension, schema, version), NO_PARAMETERS);
            log.info("Created extension '{}' on '{}'", extension, database);
            changed = true;
        }
        return changed;
    }

    public boolean dropExtension(ReconciliationSession session, String extension, String database) {
        if (!session.getStrictOptions().isExtensions()) {
            log.info("Not dropping extension '{}' from '{}' (strict extensions mode is disabled)", extension, database);
            return false;
        }

        CatalogQueryExecutor catalog = session.getCatalog();
        if (!catalog.exists(session.getMaintenanceDatabase(), CatalogStatements.DATABASE_EXISTS, List.of(database))) {
            return false;
        }
        if (!catalog.exists(database, CatalogStatements.EXTENSION_EXISTS, List.of(extension))) {
            return false;
        }

        catalog.execute(database, CatalogStatements.dropExtension(extension), NO_PARAMETERS);
        log.info("Dropped extension '{}' from '{}'", extension, database);
        return true;
    }
}
