package com.pgbranch.capture.capture;

import com.pgbranch.capture.CaptureNames;
import com.pgbranch.capture.catalog.CatalogInspector;
import com.pgbranch.capture.catalog.RelationDescriptor;
import com.pgbranch.capture.catalog.RelationId;
import com.pgbranch.capture.exception.CaptureException;
import com.pgbranch.capture.exception.PreconditionException;
import com.pgbranch.capture.jdbc.DatabaseConnections;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Change Capture installer
 *
 * Applies the install script to a database and puts the capture trigger on every table that qualifies.
 * Safe to run any number of times: the script is idempotent and each trigger is dropped and recreated.
 *
 * The script runs with {@code session_replication_role = replica}, which keeps the event triggers it
 * creates from auditing the installer's own DDL. A table without a primary key is skipped with a WARN;
 * it never aborts the pass for the other tables.
 */
@Slf4j
@Service
public class CaptureInstaller {

    private static final int EXPECTED_EVENT_TRIGGERS = 4;

    private final DatabaseConnections connections;
    private final CatalogInspector inspector;
    private final CaptureScript script;

    private final Counter installedCounter;
    private final Counter skippedCounter;
    private final Counter removedCounter;

    public CaptureInstaller(DatabaseConnections connections,
                            CatalogInspector inspector,
                            CaptureScript script,
                            MeterRegistry meterRegistry) {
        this.connections = connections;
        this.inspector = inspector;
        this.script = script;

        this.installedCounter = relationCounter(meterRegistry, "installed");
        this.skippedCounter   = relationCounter(meterRegistry, "skipped");
        this.removedCounter   = relationCounter(meterRegistry, "removed");
    }

    private static Counter relationCounter(MeterRegistry registry, String outcome) {
        return Counter.builder("capture.install.relations").tag("outcome", outcome).register(registry);
    }

    // ─── Install ──────────────────────────────────────────────────────────────

    public InstallReport ensureInstalled(String database) {
        log.info("Ensuring capture installed: database={}", database);

        applyScript(database);
        inspector.invalidate(database);

        List<String> installed = new ArrayList<>();
        Map<String, String> skipped = new LinkedHashMap<>();
        List<String> removed = new ArrayList<>();

        for (RelationId relation : inspector.listCaptureCandidates(database)) {
            try {
                installFor(database, relation);
                installed.add(relation.toString());
                installedCounter.increment();
            } catch (PreconditionException e) {
                log.warn("Capture skipped: database={}, relation={}, reason={}",
                        database, relation, e.getMessage());
                skipped.put(relation.toString(), e.getMessage());
                skippedCounter.increment();
            }
        }

        for (RelationId relation : inspector.listBookkeepingRelations(database)) {
            connections.jdbc(database).execute(
                    "DROP TRIGGER IF EXISTS " + CaptureNames.CAPTURE_TRIGGER + " ON " + relation.qualified());
            log.warn("Stray capture trigger removed: database={}, relation={}", database, relation);
            removed.add(relation.toString());
            removedCounter.increment();
        }

        log.info("Capture installed: database={}, installed={}, skipped={}, removed={}",
                database, installed.size(), skipped.size(), removed.size());

        return InstallReport.builder()
                .database(database)
                .scriptApplied(true)
                .installed(List.copyOf(installed))
                .skipped(Collections.unmodifiableMap(skipped))
                .removed(List.copyOf(removed))
                .build();
    }

    public boolean isInstalled(String database) {
        JdbcTemplate jdbc = connections.jdbc(database);
        Boolean logs = jdbc.queryForObject(
                "SELECT to_regclass(?) IS NOT NULL AND to_regclass(?) IS NOT NULL",
                Boolean.class, CaptureNames.CHANGE_LOG, CaptureNames.DDL_LOG);
        if (!Boolean.TRUE.equals(logs)) {
            return false;
        }
        Integer triggers = jdbc.queryForObject(
                "SELECT count(*) FROM pg_event_trigger WHERE evtname LIKE 'pgbranch\\_%' AND evtenabled <> 'D'",
                Integer.class);
        return triggers != null && triggers >= EXPECTED_EVENT_TRIGGERS;
    }

    // ─── Helpers ──────────────────────────────────────────────────────────────

    private void applyScript(String database) {
        JdbcTemplate jdbc = connections.jdbc(database);
        TransactionTemplate tx = connections.transactions(database);
        try {
            tx.executeWithoutResult(status -> {
                jdbc.execute("SET LOCAL session_replication_role = replica");
                jdbc.execute(script.text());
            });
        } catch (DataAccessException e) {
            throw new CaptureException("Failed to apply install script: database=" + database, e);
        }
    }

    /**
     * Runs the install function, which also drops a capture trigger left on a table that lost its key.
     */
    private void installFor(String database, RelationId relation) {
        RelationDescriptor descriptor = inspector.describe(database, relation.qualified());
        Boolean installed;
        try {
            installed = connections.transactions(database).execute(status ->
                    connections.jdbc(database).queryForObject(
                            "SELECT " + CaptureNames.INSTALL_FUNCTION + "(CAST(? AS oid)::regclass)",
                            Boolean.class, descriptor.getOid()));
        } catch (DataAccessException e) {
            throw new CaptureException("Failed to install capture trigger: database=" + database
                    + ", relation=" + relation, e);
        }
        if (!descriptor.hasPrimaryKey()) {
            throw new PreconditionException(database, relation.toString(), "no primary key");
        }
        if (!Boolean.TRUE.equals(installed)) {
            throw new PreconditionException(database, relation.toString(), "not capturable");
        }
        log.debug("Capture trigger installed: database={}, relation={}", database, relation);
    }
}
