package com.pgbranch.capture.capture;

import com.pgbranch.capture.catalog.CatalogInspector;
import com.pgbranch.capture.catalog.Persistence;
import com.pgbranch.capture.catalog.RelationDescriptor;
import com.pgbranch.capture.catalog.RelationId;
import com.pgbranch.capture.catalog.RelationKind;
import com.pgbranch.capture.exception.CaptureException;
import com.pgbranch.capture.exception.PreconditionException;
import com.pgbranch.capture.jdbc.DatabaseConnections;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit Tests: CaptureInstaller
 *
 * Catalog and JDBC are mocked; checks the per-relation isolation of the install pass.
 */
@ExtendWith(MockitoExtension.class)
class CaptureInstallerTest {

    @Mock DatabaseConnections connections;
    @Mock CatalogInspector inspector;
    @Mock CaptureScript script;
    @Mock JdbcTemplate jdbc;
    @Mock TransactionTemplate tx;

    SimpleMeterRegistry meterRegistry;
    CaptureInstaller installer;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        installer = new CaptureInstaller(connections, inspector, script, meterRegistry);

        lenient().when(connections.jdbc("app")).thenReturn(jdbc);
        lenient().when(connections.transactions("app")).thenReturn(tx);
        lenient().when(script.text()).thenReturn("-- install script");
        lenient().doAnswer(inv -> {
            inv.<Consumer<TransactionStatus>>getArgument(0).accept(null);
            return null;
        }).when(tx).executeWithoutResult(any());
        lenient().when(tx.execute(any())).thenAnswer(inv -> inv.<TransactionCallback<Object>>getArgument(0).doInTransaction(null));
    }

    // ─── Helpers ──────────────────────────────────────────────────────────────

    private static RelationDescriptor table(String name, long oid, List<String> primaryKey) {
        return RelationDescriptor.builder()
                .oid(oid).id(new RelationId("public", name))
                .kind(RelationKind.TABLE).persistence(Persistence.PERMANENT)
                .columns(List.of()).primaryKey(primaryKey).constraints(List.of())
                .parents(List.of()).reloptions(List.of())
                .build();
    }

    private double counted(String outcome) {
        return meterRegistry.get("capture.install.relations").tag("outcome", outcome).counter().count();
    }

    // ─── Tests ────────────────────────────────────────────────────────────────

    @Test
    @DisplayName("ensureInstalled — applies script in replica mode before touching any relation")
    void ensureInstalled_appliesScriptInReplicaMode() {
        when(inspector.listCaptureCandidates("app")).thenReturn(List.of());
        when(inspector.listBookkeepingRelations("app")).thenReturn(List.of());

        InstallReport report = installer.ensureInstalled("app");

        InOrder order = inOrder(jdbc, inspector);
        order.verify(jdbc).execute("SET LOCAL session_replication_role = replica");
        order.verify(jdbc).execute("-- install script");
        order.verify(inspector).invalidate("app");
        order.verify(inspector).listCaptureCandidates("app");
        assertThat(report.isScriptApplied()).isTrue();
        assertThat(report.getDatabase()).isEqualTo("app");
    }

    @Test
    @DisplayName("ensureInstalled — table without primary key is skipped, the rest still installed")
    void ensureInstalled_missingPrimaryKeyDoesNotAbortPass() {
        RelationId accounts = new RelationId("public", "accounts");
        RelationId events = new RelationId("public", "events");
        RelationId orders = new RelationId("public", "orders");
        when(inspector.listCaptureCandidates("app")).thenReturn(List.of(accounts, events, orders));
        when(inspector.listBookkeepingRelations("app")).thenReturn(List.of());
        when(inspector.describe("app", accounts.qualified())).thenReturn(table("accounts", 1L, List.of("id")));
        when(inspector.describe("app", events.qualified())).thenReturn(table("events", 2L, List.of()));
        when(inspector.describe("app", orders.qualified())).thenReturn(table("orders", 3L, List.of("id")));
        when(jdbc.queryForObject(contains("install_capture_for"), eq(Boolean.class), any(Object[].class)))
                .thenAnswer(inv -> !Long.valueOf(2L).equals(inv.getArgument(2)));

        InstallReport report = installer.ensureInstalled("app");

        assertThat(report.getInstalled()).containsExactly("public.accounts", "public.orders");
        assertThat(report.getSkipped()).containsOnlyKeys("public.events");
        assertThat(report.getSkipped().get("public.events")).contains("no primary key");
        verify(jdbc).queryForObject(contains("install_capture_for"), eq(Boolean.class), eq(1L));
        verify(jdbc).queryForObject(contains("install_capture_for"), eq(Boolean.class), eq(3L));
        // keyless table still goes through the function so a leftover trigger is dropped
        verify(jdbc).queryForObject(contains("install_capture_for"), eq(Boolean.class), eq(2L));
        assertThat(counted("installed")).isEqualTo(2.0);
        assertThat(counted("skipped")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("ensureInstalled — function refusing a keyed relation reports it as not capturable")
    void ensureInstalled_functionRefusalIsSkipped() {
        RelationId ledger = new RelationId("public", "ledger");
        when(inspector.listCaptureCandidates("app")).thenReturn(List.of(ledger));
        when(inspector.listBookkeepingRelations("app")).thenReturn(List.of());
        when(inspector.describe("app", ledger.qualified())).thenReturn(table("ledger", 4L, List.of("id")));
        when(jdbc.queryForObject(contains("install_capture_for"), eq(Boolean.class), any(Object[].class)))
                .thenReturn(false);

        InstallReport report = installer.ensureInstalled("app");

        assertThat(report.getInstalled()).isEmpty();
        assertThat(report.getSkipped()).containsEntry("public.ledger", "not capturable: database=app, relation=public.ledger");
    }

    @Test
    @DisplayName("ensureInstalled — unresolvable relation is reported as skipped")
    void ensureInstalled_vanishedRelationIsSkipped() {
        RelationId gone = new RelationId("public", "gone");
        when(inspector.listCaptureCandidates("app")).thenReturn(List.of(gone));
        when(inspector.listBookkeepingRelations("app")).thenReturn(List.of());
        when(inspector.describe("app", gone.qualified()))
                .thenThrow(new PreconditionException("app", gone.qualified(), "Relation not found"));

        InstallReport report = installer.ensureInstalled("app");

        assertThat(report.getInstalled()).isEmpty();
        assertThat(report.getSkipped()).containsKey("public.gone");
    }

    @Test
    @DisplayName("ensureInstalled — stray trigger on a bookkeeping relation is dropped")
    void ensureInstalled_removesStrayTriggers() {
        when(inspector.listCaptureCandidates("app")).thenReturn(List.of());
        when(inspector.listBookkeepingRelations("app")).thenReturn(List.of(new RelationId("pgbranch", "change_log")));

        InstallReport report = installer.ensureInstalled("app");

        verify(jdbc).execute("DROP TRIGGER IF EXISTS pgbranch_capture ON \"pgbranch\".\"change_log\"");
        assertThat(report.getRemoved()).containsExactly("pgbranch.change_log");
        assertThat(counted("removed")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("ensureInstalled — script failure surfaces as CaptureException naming the database")
    void ensureInstalled_scriptFailure() {
        lenient().doThrow(new DataIntegrityViolationException("boom")).when(jdbc).execute("-- install script");

        assertThatThrownBy(() -> installer.ensureInstalled("app"))
                .isInstanceOf(CaptureException.class)
                .hasMessageContaining("database=app");
        verify(inspector, never()).listCaptureCandidates(anyString());
    }

    @Test
    @DisplayName("isInstalled — requires both logs and all four event triggers")
    void isInstalled() {
        when(jdbc.queryForObject(anyString(), eq(Boolean.class), any(Object[].class))).thenReturn(true);
        when(jdbc.queryForObject(contains("pg_event_trigger"), eq(Integer.class))).thenReturn(4, 3);

        assertThat(installer.isInstalled("app")).isTrue();
        assertThat(installer.isInstalled("app")).isFalse();
    }
}
