package com.pgfga.reconciler.service;

import com.pgfga.reconciler.catalog.CatalogQueryExecutor;
import com.pgfga.reconciler.catalog.CatalogStatements;
import com.pgfga.reconciler.exception.ConnectionException;
import com.pgfga.reconciler.exception.QueryException;
import com.pgfga.reconciler.model.result.ObjectType;
import com.pgfga.reconciler.model.result.PruneOutcome;
import com.pgfga.reconciler.model.result.PruneResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.pgfga.reconciler.catalog.CatalogQueryExecutor.NO_PARAMETERS;

/**
 * Removes roles, grants, databases and extensions that exist in the catalog but were not
 * declared during the session. Protected objects are never touched.
 *
 * A failure on one object is recorded in the result and the pass moves on to the next object.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StrictPruner {

    private final RoleReconciler roleReconciler;
    private final DatabaseReconciler databaseReconciler;

    public PruneResult strictifyRoles(ReconciliationSession session) {
        PruneResult result = PruneResult.empty();
        if (!session.getStrictOptions().isUsers()) {
            log.info("Strict users mode disabled, not pruning roles and grants");
            return result;
        }

        for (Map.Entry<String, Set<String>> entry : session.getRoleGrants().entrySet()) {
            revokeUndeclaredGrants(session, entry.getKey(), entry.getValue(), result);
        }

        Set<String> declared = session.getTrackedRoles();
        List<String> existing;
        try {
            existing = session.getCatalog().column(session.getMaintenanceDatabase(),
                    CatalogStatements.ALL_ROLES, NO_PARAMETERS, "rolname");
        } catch (QueryException | ConnectionException e) {
            log.error("Cannot list roles: {}", e.getMessage());
            return result.add(PruneOutcome.failed(ObjectType.ROLE, "*", e.getMessage()));
        }

        for (String role : existing) {
            if (declared.contains(role) || ProtectedObjects.isProtectedRole(role)) {
                continue;
            }
            try {
                if (roleReconciler.dropRole(session, role)) {
                    result.add(PruneOutcome.pruned(ObjectType.ROLE, role));
                } else {
                    result.add(PruneOutcome.skipped(ObjectType.ROLE, role, "missing or current user"));
                }
            } catch (QueryException | ConnectionException e) {
                log.error("Failed to drop role '{}': {}", role, e.getMessage());
                result.add(PruneOutcome.failed(ObjectType.ROLE, role, e.getMessage()));
            }
        }

        log.info("Role pruning finished: {}", result);
        return result;
    }

    private void revokeUndeclaredGrants(ReconciliationSession session, String role, Set<String> declaredGrantees,
                                        PruneResult result) {
        List<String> grantees;
        try {
            grantees = roleReconciler.grantees(session, role);
        } catch (QueryException | ConnectionException e) {
            log.error("Cannot list members of role '{}': {}", role, e.getMessage());
            result.add(PruneOutcome.failed(ObjectType.GRANT, role + "/*", e.getMessage()));
            return;
        }

        for (String grantee : grantees) {
            if (declaredGrantees.contains(grantee)) {
                continue;
            }
            String name = role + "/" + grantee;
            try {
                if (roleReconciler.revokeRole(session, grantee, role)) {
                    result.add(PruneOutcome.pruned(ObjectType.GRANT, name));
                } else {
                    result.add(PruneOutcome.skipped(ObjectType.GRANT, name, "missing or current user"));
                }
            } catch (QueryException | ConnectionException e) {
                log.error("Failed to revoke '{}' from '{}': {}", role, grantee, e.getMessage());
                result.add(PruneOutcome.failed(ObjectType.GRANT, name, e.getMessage()));
            }
        }
    }

    public PruneResult strictifyDatabases(ReconciliationSession session) {
        PruneResult result = PruneResult.empty();
        if (!session.getStrictOptions().isDatabases()) {
            log.info("Strict databases mode disabled, not pruning databases");
            return result;
        }

        List<String> existing;
        try {
            existing = session.getCatalog().column(session.getMaintenanceDatabase(),
                    CatalogStatements.ALL_DATABASES, NO_PARAMETERS, "datname");
        } catch (QueryException | ConnectionException e) {
            log.error("Cannot list databases: {}", e.getMessage());
            return result.add(PruneOutcome.failed(ObjectType.DATABASE, "*", e.getMessage()));
        }

        Set<String> declared = session.getDatabases();
        for (String database : existing) {
            if (declared.contains(database) || ProtectedObjects.isProtectedDatabase(database)) {
                continue;
            }
            try {
                if (databaseReconciler.dropDatabase(session, database)) {
                    result.add(PruneOutcome.pruned(ObjectType.DATABASE, database));
                } else {
                    result.add(PruneOutcome.skipped(ObjectType.DATABASE, database, "no longer exists"));
                }
            } catch (QueryException | ConnectionException e) {
                log.error("Failed to drop database '{}': {}", database, e.getMessage());
                result.add(PruneOutcome.failed(ObjectType.DATABASE, database, e.getMessage()));
            }
        }

        log.info("Database pruning finished: {}", result);
        return result;
    }

    /**
     * Visits only databases declared in this session; extensions in unmanaged databases are left alone.
     */
    public PruneResult strictifyExtensions(ReconciliationSession session) {
        PruneResult result = PruneResult.empty();
        if (!session.getStrictOptions().isExtensions()) {
            log.info("Strict extensions mode disabled, not pruning extensions");
            return result;
        }

        CatalogQueryExecutor catalog = session.getCatalog();
        for (String database : session.getDatabases()) {
            List<String> existing;
            try {
                existing = catalog.column(database, CatalogStatements.ALL_EXTENSIONS, NO_PARAMETERS, "extname");
            } catch (QueryException | ConnectionException e) {
                log.error("Cannot list extensions of '{}': {}", database, e.getMessage());
                result.add(PruneOutcome.failed(ObjectType.EXTENSION, database + "/*", e.getMessage()));
                continue;
            }

            Set<String> declared = session.getExtensions(database);
            for (String extension : existing) {
                if (declared.contains(extension) || ProtectedObjects.isProtectedExtension(extension)) {
                    continue;
                }
                String name = database + "/" + extension;
                try {
                    if (databaseReconciler.dropExtension(session, extension, database)) {
                        result.add(PruneOutcome.pruned(ObjectType.EXTENSION, name));
                    } else {
                        result.add(PruneOutcome.skipped(ObjectType.EXTENSION, name, "no longer exists"));
                    }
                } catch (QueryException | ConnectionException e) {
                    log.error("Failed to drop extension '{}': {}", name, e.getMessage());
                    result.add(PruneOutcome.failed(ObjectType.EXTENSION, name, e.getMessage()));
                }
            }
        }

        log.info("Extension pruning finished: {}", result);
        return result;
    }
}
