package com.pgfga.reconciler.service;

import com.pgfga.reconciler.catalog.CatalogQueryExecutor;
import com.pgfga.reconciler.model.StrictOptions;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * State of one reconciliation pass: the cluster it talks to, its strict switches, and every
 * role, grant, database and extension the pass has declared so far. The strictify passes
 * remove whatever exists in the catalog but is not recorded here.
 *
 * Owned by the caller; two sessions never share tracked state.
 */
@Getter
public class ReconciliationSession {

    private final CatalogQueryExecutor catalog;
    private final StrictOptions strictOptions;
    private final String maintenanceDatabase;

    @Getter(lombok.AccessLevel.NONE)
    private final Map<String, Set<String>> roleGrants = new LinkedHashMap<>();

    @Getter(lombok.AccessLevel.NONE)
    private final Set<String> databases = new LinkedHashSet<>();

    @Getter(lombok.AccessLevel.NONE)
    private final Map<String, Set<String>> extensions = new LinkedHashMap<>();

    public ReconciliationSession(CatalogQueryExecutor catalog, StrictOptions strictOptions, String maintenanceDatabase) {
        this.catalog = catalog;
        this.strictOptions = strictOptions != null ? strictOptions : new StrictOptions();
        this.maintenanceDatabase = maintenanceDatabase;
    }

    void trackRole(String role) {
        roleGrants.computeIfAbsent(role, r -> new LinkedHashSet<>());
    }

    void trackGrant(String role, String grantee) {
        roleGrants.computeIfAbsent(role, r -> new LinkedHashSet<>()).add(grantee);
    }

    void trackDatabase(String database) {
        databases.add(database);
    }

    void trackExtension(String database, String extension) {
        extensions.computeIfAbsent(database, d -> new LinkedHashSet<>()).add(extension);
    }

    /**
     * Declared grantees per granted role.
     */
    public Map<String, Set<String>> getRoleGrants() {
        Map<String, Set<String>> view = new LinkedHashMap<>();
        roleGrants.forEach((role, grantees) -> view.put(role, Collections.unmodifiableSet(grantees)));
        return Collections.unmodifiableMap(view);
    }

    /**
     * Every role this pass declared, either ensured directly or as one side of a grant.
     */
    public Set<String> getTrackedRoles() {
        Set<String> roles = new LinkedHashSet<>(roleGrants.keySet());
        roleGrants.values().forEach(roles::addAll);
        return Collections.unmodifiableSet(roles);
    }

    public Set<String> getDatabases() {
        return Collections.unmodifiableSet(databases);
    }

    public Set<String> getExtensions(String database) {
        return Collections.unmodifiableSet(extensions.getOrDefault(database, Set.of()));
    }
}
