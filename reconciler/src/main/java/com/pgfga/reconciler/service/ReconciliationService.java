package com.pgfga.reconciler.service;

import com.pgfga.reconciler.catalog.CatalogQueryExecutor;
import com.pgfga.reconciler.directory.DirectoryMembershipResolver;
import com.pgfga.reconciler.model.RoleOption;
import com.pgfga.reconciler.model.StrictOptions;
import com.pgfga.reconciler.model.result.PruneResult;
import com.pgfga.reconciler.model.result.ReconciliationReport;
import com.pgfga.reconciler.model.spec.DatabaseSpec;
import com.pgfga.reconciler.model.spec.DesiredState;
import com.pgfga.reconciler.model.spec.Ensure;
import com.pgfga.reconciler.model.spec.ExtensionSpec;
import com.pgfga.reconciler.model.spec.LdapGroupSpec;
import com.pgfga.reconciler.model.spec.RoleSpec;
import com.pgfga.reconciler.model.spec.UserSpec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs one full reconciliation pass: roles, users, directory group members, databases with
 * their extensions, replication slots, and finally the strictify passes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReconciliationService {

    private final CatalogQueryExecutor catalog;
    private final RoleReconciler roleReconciler;
    private final DatabaseReconciler databaseReconciler;
    private final CredentialManager credentialManager;
    private final ReplicationSlotManager replicationSlotManager;
    private final StrictPruner strictPruner;
    private final DirectoryMembershipResolver directoryMembershipResolver;

    @Value("${pgfga.postgres.maintenance-database:postgres}")
    private String maintenanceDatabase;

    public ReconciliationReport reconcile(DesiredState desired, StrictOptions strictOptions) {
        return reconcile(new ReconciliationSession(catalog, strictOptions, maintenanceDatabase), desired);
    }

    public ReconciliationReport reconcile(ReconciliationSession session, DesiredState desired) {
        if (session.getCatalog().isStandby(session.getMaintenanceDatabase())) {
            log.info("Target cluster is a standby, skipping reconciliation");
            return ReconciliationReport.standbySkipped();
        }

        log.info("Starting reconciliation ({})", session.getStrictOptions());
        boolean changed = reconcileRoles(session, desired.getRoles());
        changed |= reconcileUsers(session, desired.getUsers());
        changed |= reconcileDirectoryMembers(session, desired.getRoles());
        changed |= reconcileDatabases(session, desired.getDatabases());
        changed |= reconcileReplicationSlots(session, desired.getReplicationSlots());

        PruneResult roles = strictPruner.strictifyRoles(session);
        PruneResult databases = strictPruner.strictifyDatabases(session);
        PruneResult extensions = strictPruner.strictifyExtensions(session);
        changed |= roles.isChanged() || databases.isChanged() || extensions.isChanged();

        ReconciliationReport report = ReconciliationReport.builder()
                .changed(changed)
                .roles(roles)
                .databases(databases)
                .extensions(extensions)
                .build();

        if (report.hasFailures()) {
            log.warn("Reconciliation finished with failures: roles [{}], databases [{}], extensions [{}]",
                    roles, databases, extensions);
        } else {
            log.info("Reconciliation finished, changed: {}", changed);
        }
        return report;
    }

    private boolean reconcileRoles(ReconciliationSession session, Map<String, RoleSpec> roles) {
        boolean changed = false;
        for (Map.Entry<String, RoleSpec> entry : roles.entrySet()) {
            String role = entry.getKey();
            RoleSpec spec = entry.getValue();
            if (spec.getEnsure() == Ensure.ABSENT) {
                changed |= roleReconciler.dropRole(session, role);
                continue;
            }
            changed |= roleReconciler.ensureRole(session, role, spec.getOptions());
            for (String parent : spec.getMemberof()) {
                changed |= roleReconciler.grantRole(session, role, parent);
            }
        }
        return changed;
    }

    private boolean reconcileUsers(ReconciliationSession session, Map<String, UserSpec> users) {
        boolean changed = false;
        for (Map.Entry<String, UserSpec> entry : users.entrySet()) {
            String user = entry.getKey();
            UserSpec spec = entry.getValue();
            if (spec.getEnsure() == Ensure.ABSENT) {
                changed |= roleReconciler.dropRole(session, user);
                continue;
            }

            List<String> options = new ArrayList<>(spec.getOptions());
            boolean noLogin = options.stream()
                    .map(RoleOption::parse)
                    .anyMatch(option -> option.orElse(null) == RoleOption.NOLOGIN);
            if (!noLogin) {
                options.add(RoleOption.LOGIN.keyword());
            }
            changed |= roleReconciler.ensureRole(session, user, options);
            for (String parent : spec.getMemberof()) {
                changed |= roleReconciler.grantRole(session, user, parent);
            }

            if (spec.getAuth().usesStoredPassword()) {
                if (spec.getPassword() != null && !spec.getPassword().isEmpty()) {
                    changed |= credentialManager.setPassword(session, user, spec.getPassword());
                }
            } else {
                changed |= credentialManager.resetPassword(session, user);
            }
            changed |= credentialManager.setExpiry(session, user, spec.getExpiry());
        }
        return changed;
    }

    private boolean reconcileDirectoryMembers(ReconciliationSession session, Map<String, RoleSpec> roles) {
        boolean changed = false;
        for (Map.Entry<String, RoleSpec> entry : roles.entrySet()) {
            LdapGroupSpec ldap = entry.getValue().getLdap();
            if (ldap == null || entry.getValue().getEnsure() == Ensure.ABSENT) {
                continue;
            }
            String role = entry.getKey();
            for (String member : directoryMembershipResolver.groupMembers(ldap.getBasedn(), ldap.getFilter())) {
                changed |= roleReconciler.ensureRole(session, member, ldap.getOptions());
                changed |= roleReconciler.grantRole(session, member, role);
            }
        }
        return changed;
    }

    private boolean reconcileDatabases(ReconciliationSession session, Map<String, DatabaseSpec> databases) {
        boolean changed = false;
        for (Map.Entry<String, DatabaseSpec> entry : databases.entrySet()) {
            String database = entry.getKey();
            DatabaseSpec spec = entry.getValue();
            if (spec.getEnsure() == Ensure.ABSENT) {
                continue;
            }
            changed |= databaseReconciler.ensureDatabase(session, database, spec.getOwner());
            for (Map.Entry<String, ExtensionSpec> extension : spec.getExtensions().entrySet()) {
                ExtensionSpec ext = extension.getValue();
                if (ext.getEnsure() == Ensure.ABSENT) {
                    changed |= databaseReconciler.dropExtension(session, extension.getKey(), database);
                } else {
                    changed |= databaseReconciler.ensureExtension(session, extension.getKey(), database,
                            ext.getSchema(), ext.getVersion());
                }
            }
        }

        // absent databases go after every present one is in place
        for (Map.Entry<String, DatabaseSpec> entry : databases.entrySet()) {
            if (entry.getValue().getEnsure() == Ensure.ABSENT) {
                changed |= databaseReconciler.dropDatabase(session, entry.getKey());
            }
        }
        return changed;
    }

    private boolean reconcileReplicationSlots(ReconciliationSession session, Map<String, Ensure> slots) {
        boolean changed = false;
        for (Map.Entry<String, Ensure> entry : slots.entrySet()) {
            if (entry.getValue() == Ensure.ABSENT) {
                changed |= replicationSlotManager.dropSlot(session, entry.getKey());
            } else {
                changed |= replicationSlotManager.ensureSlot(session, entry.getKey());
            }
        }
        return changed;
    }
}
