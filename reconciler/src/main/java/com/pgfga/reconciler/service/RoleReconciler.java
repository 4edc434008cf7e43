package com.pgfga.reconciler.service;

import com.pgfga.reconciler.catalog.CatalogQueryExecutor;
import com.pgfga.reconciler.catalog.CatalogStatements;
import com.pgfga.reconciler.exception.InvalidRoleOptionException;
import com.pgfga.reconciler.model.RoleOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static com.pgfga.reconciler.catalog.CatalogQueryExecutor.NO_PARAMETERS;

/**
 * Idempotent create/alter of roles and grant/revoke of role membership.
 * Every method returns whether the catalog was changed.
 */
@Slf4j
@Service
public class RoleReconciler {

    /**
     * Creates the role if it does not exist and enforces the given options.
     *
     * Opposite pairs such as LOGIN and NOLOGIN are not applied and count as invalid.
     *
     * @throws InvalidRoleOptionException after all other options were applied, when some were not recognized
     *                                    or contradict each other
     */
    public boolean ensureRole(ReconciliationSession session, String role, Collection<String> options) {
        Set<RoleOption> recognized = EnumSet.noneOf(RoleOption.class);
        Set<String> invalid = new TreeSet<>();
        if (options != null) {
            for (String option : options) {
                RoleOption.parse(option).ifPresentOrElse(recognized::add, () -> invalid.add(option));
            }
        }

        Set<RoleOption> conflicting = EnumSet.noneOf(RoleOption.class);
        for (RoleOption option : recognized) {
            if (recognized.contains(option.opposite())) {
                conflicting.add(option);
            }
        }
        recognized.removeAll(conflicting);
        conflicting.forEach(option -> invalid.add(option.keyword()));

        boolean changed = ensureRoleOptions(session, role, recognized);

        if (!invalid.isEmpty()) {
            throw new InvalidRoleOptionException(role, invalid);
        }
        return changed;
    }

    public boolean ensureRole(ReconciliationSession session, String role) {
        return ensureRoleOptions(session, role, Set.of());
    }

    public boolean ensureRoleOptions(ReconciliationSession session, String role, Set<RoleOption> options) {
        session.trackRole(role);

        CatalogQueryExecutor catalog = session.getCatalog();
        String database = session.getMaintenanceDatabase();
        boolean changed = false;

        if (!catalog.exists(database, CatalogStatements.ROLE_EXISTS, List.of(role))) {
            catalog.execute(database, CatalogStatements.createRole(role), NO_PARAMETERS);
            log.info("Created role '{}'", role);
            changed = true;
        }

        for (RoleOption option : options) {
            if (!catalog.exists(database, CatalogStatements.roleHasOption(option), List.of(role))) {
                catalog.execute(database, CatalogStatements.alterRole(role, option), NO_PARAMETERS);
                log.info("Altered role '{}' with {}", role, option.keyword());
                changed = true;
            } else {
                log.debug("Role '{}' already has {}", role, option.keyword());
            }
        }
        return changed;
    }

    /**
     * Grants {@code role} to {@code grantee}, creating either side when missing.
     * The edge is tracked before the catalog is touched.
     */
    public boolean grantRole(ReconciliationSession session, String grantee, String role) {
        boolean changed = false;
        for (String toBeCreated : List.of(role, grantee)) {
            if (ensureRole(session, toBeCreated)) {
                changed = true;
            }
        }

        session.trackGrant(role, grantee);

        CatalogQueryExecutor catalog = session.getCatalog();
        String database = session.getMaintenanceDatabase();
        if (!catalog.exists(database, CatalogStatements.GRANT_EXISTS, List.of(role, grantee))) {
            catalog.execute(database, CatalogStatements.grantRole(role, grantee), NO_PARAMETERS);
            log.info("Granted role '{}' to '{}'", role, grantee);
            changed = true;
        }
        return changed;
    }

    /**
     * Revokes {@code role} from {@code grantee}. Does nothing when either side is missing or is
     * the session's own user. Tracked state is left alone.
     */
    public boolean revokeRole(ReconciliationSession session, String grantee, String role) {
        CatalogQueryExecutor catalog = session.getCatalog();
        String database = session.getMaintenanceDatabase();

        if (!catalog.exists(database, CatalogStatements.ROLE_EXISTS_NOT_CURRENT_USER, List.of(grantee))
                || !catalog.exists(database, CatalogStatements.ROLE_EXISTS_NOT_CURRENT_USER, List.of(role))) {
            log.debug("Not revoking '{}' from '{}': role missing or current user", role, grantee);
            return false;
        }

        catalog.execute(database, CatalogStatements.revokeRole(role, grantee), NO_PARAMETERS);
        log.info("Revoked role '{}' from '{}'", role, grantee);
        return true;
    }

    /**
     * Drops a role when strict users mode is on. Objects the role owns in each connectable
     * database are first reassigned to that database's owner, in database name order.
     */
    public boolean dropRole(ReconciliationSession session, String role) {
        if (!session.getStrictOptions().isUsers()) {
            log.info("Not dropping role '{}' (strict users mode is disabled)", role);
            return false;
        }

        CatalogQueryExecutor catalog = session.getCatalog();
        String maintenance = session.getMaintenanceDatabase();
        if (!catalog.exists(maintenance, CatalogStatements.ROLE_EXISTS_NOT_CURRENT_USER, List.of(role))) {
            log.debug("Not dropping role '{}': does not exist or is the current user", role);
            return false;
        }

        List<Map<String, Object>> owners = catalog.query(maintenance,
                CatalogStatements.CONNECTABLE_DATABASE_OWNERS, NO_PARAMETERS);
        for (Map<String, Object> row : owners) {
            String database = (String) row.get("datname");
            String owner = (String) row.get("owner");
            if (role.equals(owner)) {
                log.warn("Role '{}' owns database '{}'; dropping the role will fail until ownership moves",
                        role, database);
                continue;
            }
            catalog.execute(database, CatalogStatements.reassignOwned(role, owner), NO_PARAMETERS);
            log.debug("Reassigned objects of '{}' in database '{}' to '{}'", role, database, owner);
        }

        catalog.execute(maintenance, CatalogStatements.dropRole(role), NO_PARAMETERS);
        log.info("Dropped role '{}'", role);
        return true;
    }

    /**
     * Current members of a role, as recorded in the catalog.
     */
    public List<String> grantees(ReconciliationSession session, String role) {
        return session.getCatalog().column(session.getMaintenanceDatabase(),
                CatalogStatements.ROLE_GRANTEES, List.of(role), "grantee");
    }
}
