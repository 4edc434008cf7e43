package com.pgfga.reconciler.service;

import com.pgfga.reconciler.catalog.CatalogQueryExecutor;
import com.pgfga.reconciler.catalog.CatalogStatements;
import com.pgfga.reconciler.exception.ConnectionException;
import com.pgfga.reconciler.exception.QueryException;
import com.pgfga.reconciler.model.RoleOption;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Stateful stand-in for a cluster catalog. Answers the lookups in {@link CatalogStatements},
 * applies the DDL it receives and records every mutating statement in order.
 */
class InMemoryCatalog extends CatalogQueryExecutor {

    static final String CURRENT_USER = "postgres";

    private static final Pattern QUOTED = Pattern.compile("\"((?:[^\"]|\"\")*)\"");
    private static final Pattern VERSION = Pattern.compile("VERSION '([^']*)'");
    private static final String DEFAULT_EXTENSION_VERSION = "1.0";

    private final Map<String, Map<String, Boolean>> roles = new TreeMap<>();
    // [granted role, grantee]
    private final Set<List<String>> grants = new LinkedHashSet<>();
    private final Map<String, String> databaseOwners = new TreeMap<>();
    private final Set<String> notConnectable = new TreeSet<>();
    private final Map<String, Map<String, String>> extensions = new HashMap<>();
    // "schema.table" per database
    private final Map<String, Set<String>> tables = new HashMap<>();
    // "schema.table|role" per database
    private final Map<String, Set<String>> selectGrants = new HashMap<>();
    private final List<String> mutations = new ArrayList<>();

    InMemoryCatalog() {
        super(null);
        addRole(CURRENT_USER);
        roles.get(CURRENT_USER).put("rolsuper", true);
        roles.get(CURRENT_USER).put("rolcanlogin", true);
        addDatabase("postgres", CURRENT_USER);
        addDatabase("template0", CURRENT_USER);
        addDatabase("template1", CURRENT_USER);
        notConnectable.add("template0");
    }

    InMemoryCatalog withRole(String role) {
        addRole(role);
        return this;
    }

    InMemoryCatalog withGrant(String role, String grantee) {
        grants.add(List.of(role, grantee));
        return this;
    }

    InMemoryCatalog withDatabase(String database, String owner) {
        addDatabase(database, owner);
        return this;
    }

    InMemoryCatalog withExtension(String database, String extension, String version) {
        extensions.get(database).put(extension, version);
        return this;
    }

    /**
     * A table in template1, so it shows up in every database created afterwards.
     */
    InMemoryCatalog withTemplateTable(String schema, String table) {
        tables.get("template1").add(schema + "." + table);
        return this;
    }

    List<String> mutations() {
        return List.copyOf(mutations);
    }

    void clearMutations() {
        mutations.clear();
    }

    Set<String> roles() {
        return Set.copyOf(roles.keySet());
    }

    Set<String> databases() {
        return Set.copyOf(databaseOwners.keySet());
    }

    String ownerOf(String database) {
        return databaseOwners.get(database);
    }

    Map<String, String> extensionsOf(String database) {
        return Map.copyOf(extensions.get(database));
    }

    boolean hasGrant(String role, String grantee) {
        return grants.contains(List.of(role, grantee));
    }

    @Override
    public List<Map<String, Object>> execute(String database, String statement, List<?> parameters) {
        if (!databaseOwners.containsKey(database)) {
            throw new ConnectionException(database, "database \"" + database + "\" does not exist", null);
        }
        if (statement.startsWith("SELECT")) {
            return lookup(database, statement, parameters);
        }
        apply(database, statement);
        mutations.add(statement);
        return null;
    }

    @Override
    public void release(String database) {
    }

    private List<Map<String, Object>> lookup(String database, String statement, List<?> parameters) {
        if (statement.equals(CatalogStatements.IS_IN_RECOVERY)) {
            return List.of(Map.of("recovery", false));
        }
        if (statement.equals(CatalogStatements.ROLE_EXISTS)) {
            return rowIf(roles.containsKey(param(parameters, 0)), "rolname", param(parameters, 0));
        }
        if (statement.equals(CatalogStatements.ROLE_EXISTS_NOT_CURRENT_USER)) {
            String role = param(parameters, 0);
            return rowIf(roles.containsKey(role) && !CURRENT_USER.equals(role), "rolname", role);
        }
        if (statement.equals(CatalogStatements.ALL_ROLES)) {
            return rows("rolname", roles.keySet());
        }
        if (statement.equals(CatalogStatements.GRANT_EXISTS)) {
            return rowIf(hasGrant(param(parameters, 0), param(parameters, 1)), "granted_role", param(parameters, 0));
        }
        if (statement.equals(CatalogStatements.ROLE_GRANTEES)) {
            String role = param(parameters, 0);
            return rows("grantee", grants.stream()
                    .filter(grant -> grant.get(0).equals(role))
                    .map(grant -> grant.get(1))
                    .collect(Collectors.toCollection(TreeSet::new)));
        }
        for (RoleOption option : RoleOption.values()) {
            if (statement.equals(CatalogStatements.roleHasOption(option))) {
                Map<String, Boolean> attributes = roles.get(param(parameters, 0));
                boolean holds = attributes != null
                        && attributes.get(option.getCatalogColumn()) == option.isExpected();
                return rowIf(holds, "rolname", param(parameters, 0));
            }
        }
        if (statement.equals(CatalogStatements.DATABASE_EXISTS)) {
            return rowIf(databaseOwners.containsKey(param(parameters, 0)), "datname", param(parameters, 0));
        }
        if (statement.equals(CatalogStatements.DATABASE_OWNED_BY)) {
            String name = param(parameters, 0);
            return rowIf(param(parameters, 1).equals(databaseOwners.get(name)), "datname", name);
        }
        if (statement.equals(CatalogStatements.CONNECTABLE_DATABASE_OWNERS)) {
            List<Map<String, Object>> rows = new ArrayList<>();
            databaseOwners.forEach((name, owner) -> {
                if (!notConnectable.contains(name)) {
                    rows.add(Map.of("datname", name, "owner", owner));
                }
            });
            return rows;
        }
        if (statement.equals(CatalogStatements.ALL_DATABASES)) {
            return rows("datname", databaseOwners.keySet());
        }
        if (statement.equals(CatalogStatements.SCHEMAS_WITHOUT_SELECT_GRANT)) {
            String role = param(parameters, 0);
            Set<String> granted = selectGrants.get(database);
            return rows("schemaname", tables.get(database).stream()
                    .filter(table -> !granted.contains(table + "|" + role))
                    .map(table -> table.substring(0, table.indexOf('.')))
                    .collect(Collectors.toCollection(TreeSet::new)));
        }
        if (statement.equals(CatalogStatements.EXTENSION_EXISTS)) {
            return rowIf(extensions.get(database).containsKey(param(parameters, 0)), "extname", param(parameters, 0));
        }
        if (statement.equals(CatalogStatements.EXTENSION_VERSION_DIFFERS)) {
            String installed = extensions.get(database).get(param(parameters, 0));
            return rowIf(installed != null && !installed.equals(param(parameters, 1)), "extname", param(parameters, 0));
        }
        if (statement.equals(CatalogStatements.ALL_EXTENSIONS)) {
            return rows("extname", new TreeSet<>(extensions.get(database).keySet()));
        }
        throw new UnsupportedOperationException("Unexpected catalog query: " + statement);
    }

    private void apply(String database, String statement) {
        List<String> names = identifiers(statement);
        if (statement.startsWith("CREATE ROLE ")) {
            if (roles.containsKey(names.get(0))) {
                throw failure(database, statement, "role \"" + names.get(0) + "\" already exists");
            }
            addRole(names.get(0));
        } else if (statement.startsWith("ALTER ROLE ") && statement.contains(" WITH ")) {
            RoleOption option = RoleOption.valueOf(statement.substring(statement.lastIndexOf(' ') + 1));
            roles.get(names.get(0)).put(option.getCatalogColumn(), option.isExpected());
        } else if (statement.startsWith("GRANT SELECT ON ALL TABLES IN SCHEMA ")) {
            String prefix = names.get(0) + ".";
            tables.get(database).stream()
                    .filter(table -> table.startsWith(prefix))
                    .forEach(table -> selectGrants.get(database).add(table + "|" + names.get(1)));
        } else if (statement.startsWith("GRANT ")) {
            grants.add(List.of(names.get(0), names.get(1)));
        } else if (statement.startsWith("REVOKE ")) {
            grants.remove(List.of(names.get(0), names.get(1)));
        } else if (statement.startsWith("REASSIGN OWNED BY ")) {
            databaseOwners.replaceAll((name, owner) -> owner.equals(names.get(0)) ? names.get(1) : owner);
        } else if (statement.startsWith("DROP ROLE ")) {
            String role = names.get(0);
            if (databaseOwners.containsValue(role)) {
                throw failure(database, statement, "role \"" + role + "\" cannot be dropped because some objects depend on it");
            }
            roles.remove(role);
            grants.removeIf(grant -> grant.contains(role));
        } else if (statement.startsWith("CREATE DATABASE ")) {
            addDatabase(names.get(0), CURRENT_USER);
            tables.get(names.get(0)).addAll(tables.get("template1"));
        } else if (statement.startsWith("ALTER DATABASE ")) {
            databaseOwners.put(names.get(0), names.get(1));
        } else if (statement.startsWith("DROP DATABASE ")) {
            String name = names.get(0);
            databaseOwners.remove(name);
            extensions.remove(name);
            tables.remove(name);
            selectGrants.remove(name);
        } else if (statement.startsWith("CREATE EXTENSION IF NOT EXISTS ")) {
            Matcher version = VERSION.matcher(statement);
            extensions.get(database).putIfAbsent(names.get(0),
                    version.find() ? version.group(1) : DEFAULT_EXTENSION_VERSION);
        } else if (statement.startsWith("DROP EXTENSION IF EXISTS ")) {
            extensions.get(database).remove(names.get(0));
        } else {
            throw new UnsupportedOperationException("Unexpected statement: " + statement);
        }
    }

    private void addRole(String role) {
        Map<String, Boolean> attributes = new HashMap<>();
        for (RoleOption option : RoleOption.values()) {
            attributes.put(option.getCatalogColumn(), false);
        }
        attributes.put("rolinherit", true);
        roles.put(role, attributes);
    }

    private void addDatabase(String database, String owner) {
        databaseOwners.put(database, owner);
        extensions.put(database, new TreeMap<>(Map.of("plpgsql", DEFAULT_EXTENSION_VERSION)));
        tables.put(database, new TreeSet<>());
        selectGrants.put(database, new TreeSet<>());
    }

    private static QueryException failure(String database, String statement, String message) {
        return new QueryException(database, statement, new SQLException(message));
    }

    private static List<String> identifiers(String statement) {
        List<String> names = new ArrayList<>();
        Matcher matcher = QUOTED.matcher(statement);
        while (matcher.find()) {
            names.add(matcher.group(1).replace("\"\"", "\""));
        }
        return names;
    }

    private static String param(List<?> parameters, int index) {
        return (String) parameters.get(index);
    }

    private static List<Map<String, Object>> rowIf(boolean present, String column, String value) {
        return present ? List.of(Map.of(column, value)) : List.of();
    }

    private static List<Map<String, Object>> rows(String column, Set<String> values) {
        List<Map<String, Object>> rows = new ArrayList<>();
        values.forEach(value -> rows.add(Map.of(column, value)));
        return rows;
    }
}
