package com.pgbranch.capture.capture;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pgbranch.capture.TestDatabases;
import com.pgbranch.capture.catalog.CatalogInspector;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration Tests: row change capture against a real PostgreSQL.
 *
 * Requires Docker; skipped otherwise.
 */
@Testcontainers(disabledWithoutDocker = true)
class ChangeCaptureIntegrationTest {

    private static final String DB = "capture_it";

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
            .withUsername("pgbranch")
            .withPassword("pgbranch");

    static TestDatabases databases;
    static CatalogInspector inspector;
    static CaptureInstaller installer;
    static ChangeLog changeLog;
    static JdbcTemplate jdbc;

    @BeforeAll
    static void setUp() {
        databases = new TestDatabases(postgres);
        databases.createDatabase(DB);
        inspector = new CatalogInspector(databases);
        installer = new CaptureInstaller(databases, inspector, new CaptureScript(), new SimpleMeterRegistry());
        changeLog = new ChangeLog(databases, new ChangeRecordMapper(new ObjectMapper()));
        jdbc = databases.jdbc(DB);

        jdbc.execute("CREATE TABLE accounts (id int PRIMARY KEY, name text, balance numeric(10,2))");
        jdbc.execute("CREATE TABLE no_key (x int, y text)");
        installer.ensureInstalled(DB);
    }

    private List<ChangeRecord> recordsFor(String relation, long afterId) {
        return changeLog.findByRelation(DB, relation).stream().filter(r -> r.getId() > afterId).toList();
    }

    // ─── Install ──────────────────────────────────────────────────────────────

    @Test
    @DisplayName("Install pass — keyed table captured, keyless table skipped")
    void installReport() {
        InstallReport report = installer.ensureInstalled(DB);

        assertThat(report.getInstalled()).contains("public.accounts");
        assertThat(report.getSkipped()).containsKey("public.no_key");
        assertThat(installer.isInstalled(DB)).isTrue();
    }

    @Test
    @DisplayName("Installing twice leaves exactly one trigger and one record per event")
    void installIsIdempotent() {
        installer.ensureInstalled(DB);
        installer.ensureInstalled(DB);

        Integer triggers = jdbc.queryForObject(
                "SELECT count(*) FROM pg_trigger WHERE tgrelid = 'accounts'::regclass AND tgname = 'pgbranch_capture'",
                Integer.class);
        assertThat(triggers).isEqualTo(1);

        long before = changeLog.latestId(DB);
        jdbc.update("INSERT INTO accounts VALUES (100, 'idem', 1.00)");
        assertThat(recordsFor("accounts", before)).hasSize(1);
    }

    @Test
    @DisplayName("Stray trigger on a bookkeeping table is removed by the next install")
    void strayTriggerRemoved() {
        jdbc.execute("CREATE TABLE pgbranch.scratch (id int PRIMARY KEY)");
        jdbc.execute("CREATE TRIGGER pgbranch_capture AFTER INSERT ON pgbranch.scratch "
                + "FOR EACH ROW EXECUTE FUNCTION pgbranch.capture()");

        InstallReport report = installer.ensureInstalled(DB);

        assertThat(report.getRemoved()).contains("pgbranch.scratch");
        Integer triggers = jdbc.queryForObject(
                "SELECT count(*) FROM pg_trigger WHERE tgrelid = 'pgbranch.scratch'::regclass", Integer.class);
        assertThat(triggers).isZero();
    }

    // ─── Capture ──────────────────────────────────────────────────────────────

    @Test
    @DisplayName("Insert then delete of one key — exactly two records, insert then delete")
    void insertThenDelete() {
        long before = changeLog.latestId(DB);

        jdbc.update("INSERT INTO accounts VALUES (1, 'a', 10.00)");
        jdbc.update("DELETE FROM accounts WHERE id = 1");

        List<ChangeRecord> records = recordsFor("accounts", before);
        assertThat(records).hasSize(2);

        ChangeRecord insert = records.get(0);
        assertThat(insert.getOperation()).isEqualTo(ChangeOperation.INSERT);
        assertThat(insert.getKey()).containsExactly(entry("id", "1"));
        assertThat(insert.getColumns()).containsOnlyKeys("id", "name", "balance");
        assertThat(insert.getColumns().get("balance").getType().getFormatted()).isEqualTo("numeric(10,2)");
        assertThat(insert.getColumns().get("balance").getValue()).isEqualTo("10.00");
        assertThat(insert.getRelation()).hasToString("public.accounts");
        assertThat(insert.getTransactionId()).isNotBlank();
        assertThat(insert.getTimestamp()).isNotNull();

        ChangeRecord delete = records.get(1);
        assertThat(delete.getOperation()).isEqualTo(ChangeOperation.DELETE);
        assertThat(delete.getKey()).containsExactly(entry("id", "1"));
        assertThat(delete.getColumns()).isEmpty();
        assertThat(delete.getId()).isGreaterThan(insert.getId());
    }

    @Test
    @DisplayName("Update that changes nothing — no record")
    void noOpUpdateSuppressed() {
        jdbc.update("INSERT INTO accounts VALUES (2, 'b', 5.00)");
        long before = changeLog.latestId(DB);

        jdbc.update("UPDATE accounts SET name = 'b', balance = 5.00 WHERE id = 2");

        assertThat(recordsFor("accounts", before)).isEmpty();
    }

    @Test
    @DisplayName("Update of one non-key column — columns hold exactly that column")
    void singleColumnUpdate() {
        jdbc.update("INSERT INTO accounts VALUES (3, 'c', 10.00)");
        long before = changeLog.latestId(DB);

        jdbc.update("UPDATE accounts SET balance = 12.50 WHERE id = 3");

        List<ChangeRecord> records = recordsFor("accounts", before);
        assertThat(records).hasSize(1);
        assertThat(records.get(0).getOperation()).isEqualTo(ChangeOperation.UPDATE);
        assertThat(records.get(0).getColumns()).containsOnlyKeys("balance");
        assertThat(records.get(0).getColumns().get("balance").getValue()).isEqualTo("12.50");
    }

    @Test
    @DisplayName("Setting a value to NULL is a change (distinct-aware comparison)")
    void nullTransitionIsCaptured() {
        jdbc.update("INSERT INTO accounts VALUES (4, 'd', 1.00)");
        long before = changeLog.latestId(DB);

        jdbc.update("UPDATE accounts SET name = NULL WHERE id = 4");

        List<ChangeRecord> records = recordsFor("accounts", before);
        assertThat(records).hasSize(1);
        assertThat(records.get(0).getColumns()).containsOnlyKeys("name");
        assertThat(records.get(0).getColumns().get("name").getValue()).isNull();
    }

    @Test
    @DisplayName("Primary key change — ordinary changed column, key is the new row's key")
    void primaryKeyChange() {
        jdbc.update("INSERT INTO accounts VALUES (5, 'e', 1.00)");
        long before = changeLog.latestId(DB);

        jdbc.update("UPDATE accounts SET id = 6 WHERE id = 5");

        List<ChangeRecord> records = recordsFor("accounts", before);
        assertThat(records).hasSize(1);
        assertThat(records.get(0).getKey()).containsExactly(entry("id", "6"));
        assertThat(records.get(0).getColumns()).containsOnlyKeys("id");
    }

    @Test
    @DisplayName("Capture forced onto a keyless table fails the write loudly")
    void keylessTableFailsLoudly() {
        jdbc.execute("CREATE TABLE forced_no_key (x int)");
        jdbc.execute("CREATE TRIGGER pgbranch_capture AFTER INSERT ON forced_no_key "
                + "FOR EACH ROW EXECUTE FUNCTION pgbranch.capture()");

        assertThatThrownBy(() -> jdbc.update("INSERT INTO forced_no_key VALUES (1)"))
                .isInstanceOf(DataAccessException.class)
                .hasMessageContaining("no primary key on");
    }

    @Test
    @DisplayName("Table that loses its primary key — trigger removed, writes keep working, reported as skipped")
    void droppedPrimaryKeyRemovesTrigger() {
        jdbc.execute("CREATE TABLE demoted (id int CONSTRAINT demoted_pkey PRIMARY KEY, note text)");
        jdbc.execute("ALTER TABLE demoted DROP CONSTRAINT demoted_pkey");
        long before = changeLog.latestId(DB);

        jdbc.update("INSERT INTO demoted VALUES (1, 'still writable')");

        assertThat(recordsFor("demoted", before)).isEmpty();
        Integer triggers = jdbc.queryForObject(
                "SELECT count(*) FROM pg_trigger WHERE tgrelid = 'demoted'::regclass AND tgname = 'pgbranch_capture'",
                Integer.class);
        assertThat(triggers).isZero();

        InstallReport report = installer.ensureInstalled(DB);

        assertThat(report.getSkipped()).containsKey("public.demoted");
        assertThat(jdbc.update("UPDATE demoted SET note = 'after install' WHERE id = 1")).isEqualTo(1);
    }

    @Test
    @DisplayName("Table created after install is captured automatically")
    void newTableCapturedByDdlHook() {
        jdbc.execute("CREATE TABLE late_arrival (id bigint PRIMARY KEY, note text)");
        long before = changeLog.latestId(DB);

        jdbc.update("INSERT INTO late_arrival VALUES (1, 'hello')");

        assertThat(recordsFor("late_arrival", before)).hasSize(1);
    }

    @Test
    @DisplayName("findAfter pages in id order")
    void findAfterPages() {
        long before = changeLog.latestId(DB);
        jdbc.update("INSERT INTO accounts VALUES (20, 'p', 1.00), (21, 'q', 2.00), (22, 'r', 3.00)");

        List<ChangeRecord> firstPage = changeLog.findAfter(DB, before, 2);
        List<ChangeRecord> secondPage = changeLog.findAfter(DB, firstPage.get(1).getId(), 2);

        assertThat(firstPage).extracting(r -> r.getKey().get("id")).containsExactly("20", "21");
        assertThat(secondPage).extracting(r -> r.getKey().get("id")).containsExactly("22");
        assertThat(changeLog.findById(DB, firstPage.get(0).getId())).isPresent();
        assertThat(changeLog.findById(DB, Long.MAX_VALUE)).isEmpty();
    }
}
