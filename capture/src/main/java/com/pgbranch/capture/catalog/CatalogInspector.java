package com.pgbranch.capture.catalog;

import com.pgbranch.capture.CaptureNames;
import com.pgbranch.capture.exception.PreconditionException;
import com.pgbranch.capture.jdbc.DatabaseConnections;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Catalog Inspector
 *
 * Read-only metadata queries against one database of the managed server.
 * Descriptors are cached per (database, relation); a cached entry is reused only while the
 * database's DDL audit log still has the row count and highest id it was read at. Databases without the
 * audit log installed are never cached, since nothing would tell us their schema changed.
 */
@Slf4j
@Component
public class CatalogInspector {

    private static final String RELATION_SQL = """
            SELECT c.oid, n.nspname, c.relname, c.relkind, c.relpersistence,
                   CASE WHEN c.relkind = 'p' THEN pg_get_partkeydef(c.oid) END AS partkey,
                   CASE WHEN c.relispartition THEN pg_get_expr(c.relpartbound, c.oid) END AS partbound,
                   c.reloptions, t.spcname
            FROM pg_class c
            JOIN pg_namespace n ON n.oid = c.relnamespace
            LEFT JOIN pg_tablespace t ON t.oid = c.reltablespace
            WHERE c.oid = to_regclass(?)
            """;

    private static final String COLUMNS_SQL = """
            SELECT a.attname, a.attnum, format_type(a.atttypid, a.atttypmod) AS typ,
                   a.atttypid, a.atttypmod, a.attnotnull, a.attidentity, a.attgenerated,
                   pg_get_expr(d.adbin, d.adrelid) AS default_expr,
                   CASE WHEN a.attcollation <> t.typcollation THEN co.collname END AS collation
            FROM pg_attribute a
            JOIN pg_type t ON t.oid = a.atttypid
            LEFT JOIN pg_attrdef d ON d.adrelid = a.attrelid AND d.adnum = a.attnum
            LEFT JOIN pg_collation co ON co.oid = a.attcollation
            WHERE a.attrelid = CAST(? AS oid) AND a.attnum > 0 AND NOT a.attisdropped
            ORDER BY a.attnum
            """;

    private static final String PRIMARY_KEY_SQL = """
            SELECT a.attname
            FROM pg_index i
            CROSS JOIN LATERAL unnest(i.indkey) WITH ORDINALITY AS k(attnum, ord)
            JOIN pg_attribute a ON a.attrelid = i.indrelid AND a.attnum = k.attnum
            WHERE i.indrelid = CAST(? AS oid) AND i.indisprimary
            ORDER BY k.ord
            """;

    private static final String CONSTRAINTS_SQL = """
            SELECT conname, contype, pg_get_constraintdef(oid, true) AS def, conindid
            FROM pg_constraint
            WHERE conrelid = CAST(? AS oid) AND contype <> 'n'
            ORDER BY conindid, conname
            """;

    private static final String PARENTS_SQL = """
            SELECT n.nspname, c.relname
            FROM pg_inherits i
            JOIN pg_class c ON c.oid = i.inhparent
            JOIN pg_namespace n ON n.oid = c.relnamespace
            WHERE i.inhrelid = CAST(? AS oid)
            ORDER BY i.inhseqno
            """;

    private static final String CANDIDATES_SQL = """
            SELECT n.nspname, c.relname
            FROM pg_class c
            JOIN pg_namespace n ON n.oid = c.relnamespace
            WHERE c.relkind IN ('r', 'p')
              AND NOT c.relispartition
              AND c.relpersistence <> 't'
              AND n.nspname NOT IN ('pg_catalog', 'information_schema', 'pg_toast', 'pgbranch')
              AND n.nspname NOT LIKE 'pg_temp%'
              AND n.nspname NOT LIKE 'pg_toast_temp%'
            ORDER BY n.nspname, c.relname
            """;

    private static final String STRAY_TRIGGERS_SQL = """
            SELECT n.nspname, c.relname
            FROM pg_trigger t
            JOIN pg_class c ON c.oid = t.tgrelid
            JOIN pg_namespace n ON n.oid = c.relnamespace
            WHERE t.tgname = ?
              AND n.nspname IN ('pg_catalog', 'information_schema', 'pg_toast', 'pgbranch')
            ORDER BY n.nspname, c.relname
            """;

    private final DatabaseConnections connections;
    private final Map<String, CachedDescriptor> cache = new ConcurrentHashMap<>();

    public CatalogInspector(DatabaseConnections connections) {
        this.connections = connections;
    }

    // ─── Relation Descriptors ─────────────────────────────────────────────────

    /**
     * Describe a table or partitioned table.
     *
     * @param relation any name {@code to_regclass} accepts, e.g. {@code accounts} or {@code "My Schema".t}
     * @throws PreconditionException when the name does not resolve to a table
     */
    public RelationDescriptor describe(String database, String relation) {
        JdbcTemplate jdbc = connections.jdbc(database);
        DdlMark mark = ddlMark(jdbc);
        String cacheKey = database + '\u0000' + relation;

        CachedDescriptor cached = cache.get(cacheKey);
        if (cached != null && mark != null && cached.mark.equals(mark)) {
            return cached.descriptor;
        }

        RelationDescriptor descriptor = load(jdbc, database, relation);
        if (mark != null) {
            cache.put(cacheKey, new CachedDescriptor(descriptor, mark));
        } else {
            cache.remove(cacheKey);
        }
        log.debug("Relation described: database={}, relation={}, columns={}, mark={}",
                database, descriptor.getId(), descriptor.getColumns().size(), mark);
        return descriptor;
    }

    public void invalidate(String database) {
        String prefix = database + '\u0000';
        cache.keySet().removeIf(k -> k.startsWith(prefix));
    }

    private RelationDescriptor load(JdbcTemplate jdbc, String database, String relation) {
        List<RelationDescriptor.RelationDescriptorBuilder> found;
        try {
            found = jdbc.query(RELATION_SQL, (rs, i) -> relationHeader(rs), relation);
        } catch (DataAccessException e) {
            throw new PreconditionException(database, relation, "Relation cannot be resolved", e);
        }
        if (found.isEmpty()) {
            throw new PreconditionException(database, relation, "Relation not found");
        }

        RelationDescriptor header = found.get(0).build();
        if (header.getKind() == null) {
            throw new PreconditionException(database, relation, "Relation is not a table");
        }
        long oid = header.getOid();

        List<ColumnDescriptor> columns = jdbc.query(COLUMNS_SQL, (rs, i) -> ColumnDescriptor.builder()
                .name(rs.getString("attname"))
                .attnum(rs.getInt("attnum"))
                .type(TypeDescriptor.of(rs.getString("typ"), rs.getLong("atttypid"), rs.getInt("atttypmod")))
                .notNull(rs.getBoolean("attnotnull"))
                .identity(IdentityMode.fromCode(rs.getString("attidentity")))
                .generated("s".equals(rs.getString("attgenerated")))
                .defaultExpression(rs.getString("default_expr"))
                .collation(rs.getString("collation"))
                .build(), oid);

        List<String> primaryKey = jdbc.queryForList(PRIMARY_KEY_SQL, String.class, oid);

        List<ConstraintDescriptor> constraints = jdbc.query(CONSTRAINTS_SQL, (rs, i) -> ConstraintDescriptor.builder()
                .name(rs.getString("conname"))
                .type(rs.getString("contype"))
                .definition(rs.getString("def"))
                .indexOid(rs.getLong("conindid"))
                .build(), oid);

        List<RelationId> parents = jdbc.query(PARENTS_SQL,
                (rs, i) -> new RelationId(rs.getString("nspname"), rs.getString("relname")), oid);

        return found.get(0)
                .columns(List.copyOf(columns))
                .primaryKey(List.copyOf(primaryKey))
                .constraints(List.copyOf(constraints))
                .parents(List.copyOf(parents))
                .build();
    }

    private RelationDescriptor.RelationDescriptorBuilder relationHeader(ResultSet rs) throws SQLException {
        return RelationDescriptor.builder()
                .oid(rs.getLong("oid"))
                .id(new RelationId(rs.getString("nspname"), rs.getString("relname")))
                .kind(RelationKind.fromCode(rs.getString("relkind")))
                .persistence(Persistence.fromCode(rs.getString("relpersistence")))
                .partitionKey(rs.getString("partkey"))
                .partitionBound(rs.getString("partbound"))
                .reloptions(textArray(rs.getArray("reloptions")))
                .tablespace(rs.getString("spcname"))
                .columns(List.of())
                .primaryKey(List.of())
                .constraints(List.of())
                .parents(List.of());
    }

    private static List<String> textArray(Array array) throws SQLException {
        if (array == null) {
            return List.of();
        }
        return List.copyOf(Arrays.asList((String[]) array.getArray()));
    }

    // ─── Relation Listings ────────────────────────────────────────────────────

    /** Ordinary and partitioned tables eligible for capture; partitions are covered by their parent. */
    public List<RelationId> listCaptureCandidates(String database) {
        return connections.jdbc(database).query(CANDIDATES_SQL,
                (rs, i) -> new RelationId(rs.getString("nspname"), rs.getString("relname")));
    }

    /** Bookkeeping relations that carry a capture trigger they should never have. */
    public List<RelationId> listBookkeepingRelations(String database) {
        return connections.jdbc(database).query(STRAY_TRIGGERS_SQL,
                (rs, i) -> new RelationId(rs.getString("nspname"), rs.getString("relname")),
                CaptureNames.CAPTURE_TRIGGER);
    }

    // ─── Helpers ──────────────────────────────────────────────────────────────

    /**
     * Row count and highest id of the DDL audit log, or null when the log is not installed.
     * Ids are handed out before commit, so a DDL committing late can land below the highest id
     * already seen; the count still moves.
     */
    private DdlMark ddlMark(JdbcTemplate jdbc) {
        Boolean installed = jdbc.queryForObject(
                "SELECT to_regclass(?) IS NOT NULL", Boolean.class, CaptureNames.DDL_LOG);
        if (!Boolean.TRUE.equals(installed)) {
            return null;
        }
        return jdbc.queryForObject(
                "SELECT count(*) AS entries, coalesce(max(id), 0) AS max_id FROM " + CaptureNames.DDL_LOG,
                (rs, i) -> new DdlMark(rs.getLong("entries"), rs.getLong("max_id")));
    }

    @EqualsAndHashCode
    @ToString
    private static final class DdlMark {
        private final long entries;
        private final long maxId;

        private DdlMark(long entries, long maxId) {
            this.entries = entries;
            this.maxId = maxId;
        }
    }

    private static final class CachedDescriptor {
        private final RelationDescriptor descriptor;
        private final DdlMark mark;

        private CachedDescriptor(RelationDescriptor descriptor, DdlMark mark) {
            this.descriptor = descriptor;
            this.mark = mark;
        }
    }

    // Used by tests to observe cache behaviour.
    int cachedCount() {
        return cache.size();
    }
}
