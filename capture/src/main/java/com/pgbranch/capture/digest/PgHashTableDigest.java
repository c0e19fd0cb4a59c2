package com.pgbranch.capture.digest;

import com.pgbranch.capture.catalog.CatalogInspector;
import com.pgbranch.capture.catalog.RelationDescriptor;
import com.pgbranch.capture.exception.PreconditionException;
import com.pgbranch.capture.jdbc.DatabaseConnections;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Digest through the server-side hashing function ({@code fn(regclass, int) returns text}).
 *
 * The function walks the table with a cursor, so the engine must treat it as VOLATILE and
 * PARALLEL UNSAFE. A function declared STABLE/IMMUTABLE or parallel safe is refused before it is called.
 */
@Slf4j
@Component
public class PgHashTableDigest implements TableDigest {

    private static final Pattern FUNCTION_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_$]*(\\.[A-Za-z_][A-Za-z0-9_$]*)?");

    private static final String DECLARATION_SQL = """
            SELECT p.provolatile, p.proparallel
            FROM pg_proc p
            JOIN pg_namespace n ON n.oid = p.pronamespace
            WHERE p.proname = ? AND p.pronargs = 2
            """;

    private final DatabaseConnections connections;
    private final CatalogInspector inspector;
    private final String function;

    public PgHashTableDigest(DatabaseConnections connections,
                             CatalogInspector inspector,
                             @Value("${pgbranch.digest.function:vkar_hash_table}") String function) {
        if (!FUNCTION_NAME.matcher(function).matches()) {
            throw new IllegalArgumentException("Invalid digest function name: " + function);
        }
        this.connections = connections;
        this.inspector = inspector;
        this.function = function;
    }

    @Override
    public String digest(String database, String relation, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        RelationDescriptor descriptor = inspector.describe(database, relation);
        JdbcTemplate jdbc = connections.jdbc(database);
        verifyDeclaration(jdbc, database, relation);

        String hash = jdbc.queryForObject(
                "SELECT " + function + "(CAST(? AS oid)::regclass, ?)::text",
                String.class, descriptor.getOid(), batchSize);
        log.info("Table digested: database={}, relation={}, batchSize={}", database, descriptor.getId(), batchSize);
        return hash;
    }

    void verifyDeclaration(JdbcTemplate jdbc, String database, String relation) {
        String[] parts = function.split("\\.", 2);
        List<String[]> declarations = parts.length == 2
                ? jdbc.query(DECLARATION_SQL + " AND n.nspname = ?",
                        (rs, i) -> new String[]{rs.getString(1), rs.getString(2)}, parts[1], parts[0])
                : jdbc.query(DECLARATION_SQL + " AND pg_function_is_visible(p.oid)",
                        (rs, i) -> new String[]{rs.getString(1), rs.getString(2)}, parts[0]);

        if (declarations.isEmpty()) {
            throw new PreconditionException(database, relation, "Digest function " + function + " is not installed");
        }
        for (String[] declaration : declarations) {
            if (!"v".equals(declaration[0]) || !"u".equals(declaration[1])) {
                throw new PreconditionException(database, relation, "Digest function " + function
                        + " must be VOLATILE and PARALLEL UNSAFE (provolatile=" + declaration[0]
                        + ", proparallel=" + declaration[1] + ")");
            }
        }
    }
}
