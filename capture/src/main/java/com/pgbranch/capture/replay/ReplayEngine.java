package com.pgbranch.capture.replay;

import com.pgbranch.capture.capture.ChangeLog;
import com.pgbranch.capture.capture.ChangeOperation;
import com.pgbranch.capture.capture.ChangeRecord;
import com.pgbranch.capture.catalog.CatalogInspector;
import com.pgbranch.capture.catalog.RelationDescriptor;
import com.pgbranch.capture.catalog.RelationId;
import com.pgbranch.capture.exception.PreconditionException;
import com.pgbranch.capture.exception.ReplayException;
import com.pgbranch.capture.exception.ReplayMismatchException;
import com.pgbranch.capture.jdbc.DatabaseConnections;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Replay Engine
 *
 * Re-applies captured row changes to a target database, one record per transaction.
 * Replay reads only the record and the target's current catalog; the source relation is never consulted,
 * so the target can be a clone that has since diverged. A record whose table was dropped on the source is
 * applied to the table of the name logged at capture time. An update or delete that finds no row with the
 * record's key is a mismatch. Failures propagate and are never retried.
 */
@Slf4j
@Service
public class ReplayEngine {

    private final DatabaseConnections connections;
    private final ChangeLog changeLog;
    private final CatalogInspector inspector;
    private final ReplayStatementBuilder statementBuilder;
    private final MeterRegistry meterRegistry;

    public ReplayEngine(DatabaseConnections connections,
                        ChangeLog changeLog,
                        CatalogInspector inspector,
                        ReplayStatementBuilder statementBuilder,
                        MeterRegistry meterRegistry) {
        this.connections = connections;
        this.changeLog = changeLog;
        this.inspector = inspector;
        this.statementBuilder = statementBuilder;
        this.meterRegistry = meterRegistry;
    }

    public ReplayResult replay(String sourceDatabase, long recordId, String targetDatabase) {
        ChangeRecord record = changeLog.findById(sourceDatabase, recordId)
                .orElseThrow(() -> new ReplayException(recordId,
                        "Change record not found in database " + sourceDatabase));
        return apply(record, targetDatabase);
    }

    /**
     * Replay records with id greater than {@code afterId}, in id order. Stops at the first failure.
     */
    public List<ReplayResult> replayAfter(String sourceDatabase, long afterId, String targetDatabase, int limit) {
        List<ReplayResult> results = new ArrayList<>();
        for (ChangeRecord record : changeLog.findAfter(sourceDatabase, afterId, limit)) {
            results.add(apply(record, targetDatabase));
        }
        log.info("Replay batch finished: source={}, target={}, afterId={}, replayed={}",
                sourceDatabase, targetDatabase, afterId, results.size());
        return results;
    }

    // ─── Apply ────────────────────────────────────────────────────────────────

    private ReplayResult apply(ChangeRecord record, String targetDatabase) {
        long recordId = record.getId();
        Optional<RelationId> relation = record.target();
        if (relation.isEmpty()) {
            count("mismatch");
            throw new ReplayMismatchException(recordId, record.relationName(),
                    "Relation no longer exists on the source and its name was not logged");
        }

        RelationDescriptor target;
        try {
            target = inspector.describe(targetDatabase, relation.get().qualified());
        } catch (PreconditionException e) {
            count("mismatch");
            throw new ReplayMismatchException(recordId, record.relationName(),
                    "Target relation not found in database " + targetDatabase, e);
        }

        Optional<ReplayStatement> built;
        try {
            built = statementBuilder.build(record, target);
        } catch (ReplayMismatchException e) {
            count("mismatch");
            throw e;
        }

        if (built.isEmpty()) {
            count("skipped");
            log.debug("Replay skipped, nothing to apply: recordId={}, relation={}", recordId, target.getId());
            return result(record, false, 0, null);
        }

        ReplayStatement statement = built.get();
        int rows;
        try {
            rows = connections.transactions(targetDatabase).execute(status ->
                    connections.jdbc(targetDatabase).update(statement.getSql(), ps -> {
                        List<String> params = statement.getParameters();
                        for (int i = 0; i < params.size(); i++) {
                            ps.setString(i + 1, params.get(i));
                        }
                    }));
        } catch (DataAccessException e) {
            if (isSchemaMismatch(e)) {
                count("mismatch");
                throw new ReplayMismatchException(recordId, target.getId().toString(),
                        "Target rejected statement: " + e.getMostSpecificCause().getMessage(), e);
            }
            count("failed");
            throw new ReplayException(recordId, "Replay failed on " + target.getId() + " in database "
                    + targetDatabase + ": " + e.getMostSpecificCause().getMessage(), e);
        }

        if (rows == 0 && record.getOperation() != ChangeOperation.INSERT) {
            count("mismatch");
            throw new ReplayMismatchException(recordId, target.getId().toString(),
                    "No row with key " + record.getKey() + " in database " + targetDatabase);
        }

        count("applied");
        log.info("Change replayed: recordId={}, op={}, relation={}, target={}, rows={}",
                recordId, record.getOperation(), target.getId(), targetDatabase, rows);
        return result(record, true, rows, statement.getSql());
    }

    /** Grammar, undefined object/column and datatype mismatch errors (SQLSTATE class 42). */
    static boolean isSchemaMismatch(DataAccessException e) {
        Throwable cause = e.getMostSpecificCause();
        if (cause instanceof SQLException sql) {
            String state = sql.getSQLState();
            return state != null && state.startsWith("42");
        }
        return e instanceof org.springframework.jdbc.BadSqlGrammarException;
    }

    private ReplayResult result(ChangeRecord record, boolean applied, int rows, String sql) {
        return ReplayResult.builder()
                .recordId(record.getId())
                .relation(record.relationName())
                .operation(record.getOperation())
                .applied(applied)
                .rowsAffected(rows)
                .sql(sql)
                .build();
    }

    private void count(String outcome) {
        Counter.builder("replay.records").tag("outcome", outcome).register(meterRegistry).increment();
    }
}
