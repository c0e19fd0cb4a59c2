package com.pgbranch.capture.audit;

import com.pgbranch.capture.CaptureNames;
import com.pgbranch.capture.jdbc.DatabaseConnections;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Read side of {@code pgbranch.ddl_log}.
 */
@Component
@RequiredArgsConstructor
public class DdlAuditLog {

    private static final String SELECT = """
            SELECT id, ts, username, dbname, tx::text AS tx, command_tag, object_type, schema_name,
                   object_identity, phase, sql_text, pre_def, post_def
            FROM pgbranch.ddl_log
            """;

    private static final RowMapper<DdlRecord> MAPPER = (rs, rowNum) -> {
        OffsetDateTime ts = rs.getObject("ts", OffsetDateTime.class);
        return DdlRecord.builder()
                .id(rs.getLong("id"))
                .timestamp(ts != null ? ts.toInstant() : null)
                .username(rs.getString("username"))
                .database(rs.getString("dbname"))
                .transactionId(rs.getString("tx"))
                .commandTag(rs.getString("command_tag"))
                .objectType(rs.getString("object_type"))
                .schemaName(rs.getString("schema_name"))
                .objectIdentity(rs.getString("object_identity"))
                .phase(DdlPhase.fromText(rs.getString("phase")))
                .sqlText(rs.getString("sql_text"))
                .preDefinition(rs.getString("pre_def"))
                .postDefinition(rs.getString("post_def"))
                .build();
    };

    private final DatabaseConnections connections;

    public List<DdlRecord> findAfter(String database, long afterId, int limit) {
        return connections.jdbc(database)
                .query(SELECT + " WHERE id > ? ORDER BY id LIMIT ?", MAPPER, afterId, limit);
    }

    public List<DdlRecord> findByObjectIdentity(String database, String objectIdentity) {
        return connections.jdbc(database)
                .query(SELECT + " WHERE object_identity = ? ORDER BY id", MAPPER, objectIdentity);
    }

    public long latestId(String database) {
        Long id = connections.jdbc(database)
                .queryForObject("SELECT coalesce(max(id), 0) FROM " + CaptureNames.DDL_LOG, Long.class);
        return id == null ? 0 : id;
    }
}
