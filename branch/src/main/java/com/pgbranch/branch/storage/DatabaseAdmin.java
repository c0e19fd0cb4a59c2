package com.pgbranch.branch.storage;

import com.pgbranch.branch.exception.BranchException;
import com.pgbranch.branch.jdbc.ServerDatabaseConnections;
import com.pgbranch.capture.catalog.RelationId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Optional;

/**
 * Server-level administration, issued through the maintenance database.
 *
 * Database names are always quoted, so any name the engine accepts round-trips unchanged.
 */
@Slf4j
@Component
public class DatabaseAdmin {

    private final ServerDatabaseConnections connections;
    private final String maintenanceDatabase;
    private final String dataDirectoryOverride;
    private final long lockKey;

    public DatabaseAdmin(ServerDatabaseConnections connections,
                         @Value("${pgbranch.server.maintenance-database:postgres}") String maintenanceDatabase,
                         @Value("${pgbranch.clone.data-directory:}") String dataDirectoryOverride,
                         @Value("${pgbranch.clone.lock-key:12345}") long lockKey) {
        this.connections = connections;
        this.maintenanceDatabase = maintenanceDatabase;
        this.dataDirectoryOverride = dataDirectoryOverride;
        this.lockKey = lockKey;
    }

    // ─── Lookup ───────────────────────────────────────────────────────────────

    public Optional<Long> findOid(String database) {
        List<Long> oids = admin().queryForList(
                "SELECT oid::bigint FROM pg_database WHERE datname = ?", Long.class, database);
        return oids.stream().findFirst();
    }

    public long oid(String database) {
        return findOid(database).orElseThrow(() -> new BranchException("Database not found: " + database));
    }

    public boolean exists(String database) {
        return findOid(database).isPresent();
    }

    public List<ServerDatabase> listDatabases() {
        return admin().query("SELECT oid::bigint AS oid, datname FROM pg_database ORDER BY datname",
                (rs, i) -> new ServerDatabase(rs.getLong("oid"), rs.getString("datname")));
    }

    public Path dataDirectory() {
        if (!dataDirectoryOverride.isBlank()) {
            return Path.of(dataDirectoryOverride);
        }
        return Path.of(admin().queryForObject("SHOW data_directory", String.class));
    }

    // ─── Create / Drop ────────────────────────────────────────────────────────

    /**
     * An empty database whose directory can be overwritten file-by-file. Callers look up the oid
     * themselves, so that a failed lookup can still drop what was created.
     */
    public void createEmpty(String database) {
        admin().execute("CREATE DATABASE " + RelationId.quote(database) + " STRATEGY = FILE_COPY");
        log.info("Database created: database={}", database);
    }

    public void createFromTemplate(String database, String template) {
        admin().execute("CREATE DATABASE " + RelationId.quote(database)
                + " TEMPLATE " + RelationId.quote(template) + " STRATEGY = FILE_COPY");
        log.info("Database created from template: database={}, template={}", database, template);
    }

    /** Terminates every session on the database, then drops it. No-op when it does not exist. */
    public void drop(String database) {
        int terminated = terminateSessions(database);
        admin().execute("DROP DATABASE IF EXISTS " + RelationId.quote(database));
        connections.forget(database);
        log.info("Database dropped: database={}, terminatedSessions={}", database, terminated);
    }

    public int terminateSessions(String database) {
        Integer terminated = admin().queryForObject(
                "SELECT count(*)::int FROM (SELECT pg_terminate_backend(pid) FROM pg_stat_activity "
                        + "WHERE datname = ? AND pid <> pg_backend_pid()) t",
                Integer.class, database);
        return terminated == null ? 0 : terminated;
    }

    // ─── Write Lock ───────────────────────────────────────────────────────────

    /**
     * Checkpoint the database and hold the clone advisory lock on a dedicated session until closed.
     * Cooperating writers take the same lock; anything else is not stopped by it.
     */
    public WriteLock lockForCopy(String database) {
        Connection connection = null;
        try {
            connection = connections.dataSource(database).getConnection();
            connection.setAutoCommit(true);
            try (Statement statement = connection.createStatement()) {
                statement.execute("CHECKPOINT");
                statement.execute("SELECT pg_advisory_lock(" + lockKey + ")");
            }
            log.debug("Write lock held: database={}, key={}", database, lockKey);
            return new WriteLock(database, connection, lockKey);
        } catch (SQLException e) {
            closeAfterFailure(connection, database, e);
            throw new BranchException("Cannot lock database for copy: " + database, e);
        }
    }

    private static void closeAfterFailure(Connection connection, String database, SQLException failure) {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            failure.addSuppressed(e);
            log.warn("Closing lock session failed: database={}", database, e);
        }
    }

    private JdbcTemplate admin() {
        return connections.jdbc(maintenanceDatabase);
    }

    /** Session holding the advisory lock; closing it unlocks and disconnects. */
    public static final class WriteLock implements AutoCloseable {

        private final String database;
        private final Connection connection;
        private final long key;

        private WriteLock(String database, Connection connection, long key) {
            this.database = database;
            this.connection = connection;
            this.key = key;
        }

        @Override
        public void close() {
            try (Connection c = connection; Statement statement = c.createStatement()) {
                statement.execute("SELECT pg_advisory_unlock(" + key + ")");
            } catch (SQLException e) {
                throw new BranchException("Cannot release write lock: " + database, e);
            }
            log.debug("Write lock released: database={}", database);
        }
    }
}
