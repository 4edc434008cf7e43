package com.pgfga.reconciler.service;

import com.pgfga.reconciler.exception.InvalidRoleOptionException;
import com.pgfga.reconciler.model.StrictOptions;
import com.pgfga.reconciler.model.result.PruneOutcome;
import com.pgfga.reconciler.model.result.PruneResult;
import com.pgfga.reconciler.model.result.PruneStatus;
import com.pgfga.reconciler.model.result.ReconciliationReport;
import com.pgfga.reconciler.model.spec.DatabaseSpec;
import com.pgfga.reconciler.model.spec.DesiredState;
import com.pgfga.reconciler.model.spec.ExtensionSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs the real reconcilers against {@link InMemoryCatalog} and checks the statements they issue.
 */
@DisplayName("Reconciliation against a live catalog")
class ReconciliationScenarioTest {

    private InMemoryCatalog catalog;
    private RoleReconciler roleReconciler;
    private DatabaseReconciler databaseReconciler;
    private StrictPruner strictPruner;
    private ReconciliationService reconciliationService;

    @BeforeEach
    void setUp() {
        catalog = new InMemoryCatalog();
        roleReconciler = new RoleReconciler();
        databaseReconciler = new DatabaseReconciler(roleReconciler);
        ReflectionTestUtils.setField(databaseReconciler, "operationalRole", "opex");
        ReflectionTestUtils.setField(databaseReconciler, "readonlyGroup", "readonly");
        strictPruner = new StrictPruner(roleReconciler, databaseReconciler);
        reconciliationService = new ReconciliationService(catalog, roleReconciler, databaseReconciler,
                new CredentialManager(), new ReplicationSlotManager(), strictPruner, (baseDn, filter) -> List.of());
        ReflectionTestUtils.setField(reconciliationService, "maintenanceDatabase", "postgres");
    }

    private ReconciliationSession session(StrictOptions strictOptions) {
        return new ReconciliationSession(catalog, strictOptions, "postgres");
    }

    @Nested
    @DisplayName("a database with an extension on an empty cluster")
    class OrdersDatabase {

        private final DesiredState desired = DesiredState.builder()
                .databases(Map.of("orders", DatabaseSpec.builder()
                        .owner("orders_owner")
                        .extensions(Map.of("pgcrypto", ExtensionSpec.builder().build()))
                        .build()))
                .build();

        @BeforeEach
        void setUp() {
            catalog.withTemplateTable("public", "audit_log");
        }

        @Test
        @DisplayName("should create owner, database, companion roles, grants and extension in one pass")
        void shouldBuildEverythingOnFirstRun() {
            ReconciliationReport report = reconciliationService.reconcile(desired, StrictOptions.builder().build());

            assertThat(report.isChanged()).isTrue();
            assertThat(report.hasFailures()).isFalse();
            assertThat(catalog.mutations()).containsExactly(
                    "CREATE ROLE \"orders_owner\"",
                    "CREATE DATABASE \"orders\"",
                    "ALTER DATABASE \"orders\" OWNER TO \"orders_owner\"",
                    "CREATE ROLE \"opex\"",
                    "GRANT \"orders_owner\" TO \"opex\"",
                    "CREATE ROLE \"orders_readonly\"",
                    "CREATE ROLE \"readonly\"",
                    "GRANT \"orders_readonly\" TO \"readonly\"",
                    "GRANT SELECT ON ALL TABLES IN SCHEMA \"public\" TO \"orders_readonly\"",
                    "CREATE EXTENSION IF NOT EXISTS \"pgcrypto\" SCHEMA \"public\"");
            assertThat(catalog.ownerOf("orders")).isEqualTo("orders_owner");
            assertThat(catalog.extensionsOf("orders")).containsOnlyKeys("pgcrypto", "plpgsql");
        }

        @Test
        @DisplayName("should issue nothing on the second run")
        void shouldIssueNothingOnSecondRun() {
            reconciliationService.reconcile(desired, StrictOptions.builder().build());
            catalog.clearMutations();

            ReconciliationReport report = reconciliationService.reconcile(desired, StrictOptions.enabled());

            assertThat(report.isChanged()).isFalse();
            assertThat(report.hasFailures()).isFalse();
            assertThat(catalog.mutations()).isEmpty();
        }
    }

    @Nested
    @DisplayName("repeated calls")
    class RepeatedCalls {

        @Test
        @DisplayName("should report a change only on the first of two identical calls")
        void shouldBeIdempotent() {
            ReconciliationSession session = session(StrictOptions.builder().build());

            assertThat(roleReconciler.ensureRole(session, "app", List.of("LOGIN", "CREATEDB"))).isTrue();
            assertThat(roleReconciler.ensureRole(session, "app", List.of("LOGIN", "CREATEDB"))).isFalse();

            assertThat(roleReconciler.grantRole(session, "app", "opex")).isTrue();
            assertThat(roleReconciler.grantRole(session, "app", "opex")).isFalse();

            assertThat(databaseReconciler.ensureDatabase(session, "orders", null)).isTrue();
            assertThat(databaseReconciler.ensureDatabase(session, "orders", null)).isFalse();

            assertThat(databaseReconciler.ensureExtension(session, "pgcrypto", "orders", "public", null)).isTrue();
            assertThat(databaseReconciler.ensureExtension(session, "pgcrypto", "orders", "public", null)).isFalse();
        }

        @Test
        @DisplayName("should recreate an extension at the requested version, then leave it alone")
        void shouldEnforceExtensionVersion() {
            catalog.withDatabase("orders", "orders").withExtension("orders", "pgcrypto", "1.2");
            ReconciliationSession session = session(StrictOptions.builder().build());

            assertThat(databaseReconciler.ensureExtension(session, "pgcrypto", "orders", "public", "1.3")).isTrue();
            assertThat(databaseReconciler.ensureExtension(session, "pgcrypto", "orders", "public", "1.3")).isFalse();

            assertThat(catalog.mutations()).containsExactly(
                    "DROP EXTENSION IF EXISTS \"pgcrypto\"",
                    "CREATE EXTENSION IF NOT EXISTS \"pgcrypto\" SCHEMA \"public\" VERSION '1.3'");
            assertThat(catalog.extensionsOf("orders")).containsEntry("pgcrypto", "1.3");
        }

        @Test
        @DisplayName("should never flip a role between LOGIN and NOLOGIN")
        void shouldNotFlipContradictingOptions() {
            catalog.withRole("svc");
            ReconciliationSession session = session(StrictOptions.builder().build());

            for (int run = 0; run < 2; run++) {
                assertThatThrownBy(() -> roleReconciler.ensureRole(session, "svc", List.of("NOLOGIN", "LOGIN")))
                        .isInstanceOf(InvalidRoleOptionException.class);
            }

            assertThat(catalog.mutations()).isEmpty();
        }
    }

    @Nested
    @DisplayName("strict pruning")
    class StrictPruning {

        @Test
        @DisplayName("should keep grants made in the pass and remove undeclared grants and roles")
        void shouldKeepTrackedGrants() {
            catalog.withRole("opex").withRole("intruder").withRole("legacy").withRole("pg_monitor")
                    .withGrant("opex", "intruder");
            ReconciliationSession session = session(StrictOptions.builder().build());

            roleReconciler.grantRole(session, "app", "opex");
            catalog.clearMutations();

            PruneResult result = strictPruner.strictifyRoles(session);

            assertThat(catalog.mutations()).containsExactly(
                    "REVOKE \"opex\" FROM \"intruder\"",
                    "REASSIGN OWNED BY \"intruder\" TO \"postgres\"",
                    "REASSIGN OWNED BY \"intruder\" TO \"postgres\"",
                    "DROP ROLE \"intruder\"",
                    "REASSIGN OWNED BY \"legacy\" TO \"postgres\"",
                    "REASSIGN OWNED BY \"legacy\" TO \"postgres\"",
                    "DROP ROLE \"legacy\"");
            assertThat(result.count(PruneStatus.PRUNED)).isEqualTo(3);
            assertThat(result.hasFailures()).isFalse();
            assertThat(catalog.hasGrant("opex", "app")).isTrue();
            assertThat(catalog.roles()).containsExactlyInAnyOrder("app", "opex", "pg_monitor", "postgres");
        }

        @Test
        @DisplayName("should drop only the undeclared, unprotected database")
        void shouldDropOnlyUndeclaredDatabase() {
            catalog.withDatabase("orders", "postgres").withDatabase("legacy", "postgres");
            ReconciliationSession session = session(StrictOptions.enabled());
            session.trackDatabase("orders");

            PruneResult result = strictPruner.strictifyDatabases(session);

            assertThat(catalog.mutations()).containsExactly("DROP DATABASE \"legacy\"");
            assertThat(result.getOutcomes()).extracting(PruneOutcome::getName).containsExactly("legacy");
            assertThat(catalog.databases()).containsExactlyInAnyOrder("postgres", "template0", "template1", "orders");
        }
    }
}
