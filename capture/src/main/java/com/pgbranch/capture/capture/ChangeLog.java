package com.pgbranch.capture.capture;

import com.pgbranch.capture.CaptureNames;
import com.pgbranch.capture.jdbc.DatabaseConnections;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Read side of {@code pgbranch.change_log}. The log is append-only; nothing here writes to it.
 */
@Component
@RequiredArgsConstructor
public class ChangeLog {

    private static final String SELECT = """
            SELECT l.id, l.rel::oid AS rel_oid, l.rel::text AS rel_text, n.nspname, c.relname,
                   l.schema_name AS logged_schema, l.table_name AS logged_table,
                   l.op, l.key::text AS key, l.cols::text AS cols, l.tx::text AS tx, l.ts
            FROM pgbranch.change_log l
            LEFT JOIN pg_class c ON c.oid = l.rel
            LEFT JOIN pg_namespace n ON n.oid = c.relnamespace
            """;

    private final DatabaseConnections connections;
    private final ChangeRecordMapper mapper;

    public Optional<ChangeRecord> findById(String database, long id) {
        return connections.jdbc(database)
                .query(SELECT + " WHERE l.id = ?", mapper, id)
                .stream().findFirst();
    }

    public List<ChangeRecord> findAfter(String database, long afterId, int limit) {
        return connections.jdbc(database)
                .query(SELECT + " WHERE l.id > ? ORDER BY l.id LIMIT ?", mapper, afterId, limit);
    }

    public List<ChangeRecord> findByRelation(String database, String relation) {
        return connections.jdbc(database)
                .query(SELECT + " WHERE l.rel = to_regclass(?) ORDER BY l.id", mapper, relation);
    }

    public long latestId(String database) {
        Long id = connections.jdbc(database)
                .queryForObject("SELECT coalesce(max(id), 0) FROM " + CaptureNames.CHANGE_LOG, Long.class);
        return id == null ? 0 : id;
    }
}
