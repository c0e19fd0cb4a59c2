package com.pgbranch.branch.jdbc;

import com.pgbranch.capture.jdbc.DatabaseConnections;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Connections to any database of the managed server, built from {@code pgbranch.server.*}.
 *
 * Non-pooling: every call opens and closes its own session, so nothing lingers on a database
 * that is about to be cloned or dropped. One DataSource per database is kept so a
 * TransactionTemplate and the JdbcTemplate used inside it bind to the same connection.
 */
@Slf4j
@Component
public class ServerDatabaseConnections implements DatabaseConnections {

    static final String DATABASE_TOKEN = "{database}";

    private final String urlTemplate;
    private final String user;
    private final String password;
    private final Map<String, DataSource> dataSources = new ConcurrentHashMap<>();

    public ServerDatabaseConnections(
            @Value("${pgbranch.server.url-template:jdbc:postgresql://localhost:5432/{database}}") String urlTemplate,
            @Value("${pgbranch.server.user:postgres}") String user,
            @Value("${pgbranch.server.password:}") String password) {
        if (!urlTemplate.contains(DATABASE_TOKEN)) {
            throw new IllegalArgumentException("pgbranch.server.url-template must contain " + DATABASE_TOKEN
                    + ": " + urlTemplate);
        }
        this.urlTemplate = urlTemplate;
        this.user = user;
        this.password = password;
    }

    @Override
    public JdbcTemplate jdbc(String database) {
        return new JdbcTemplate(dataSource(database));
    }

    @Override
    public TransactionTemplate transactions(String database) {
        return new TransactionTemplate(new DataSourceTransactionManager(dataSource(database)));
    }

    public DataSource dataSource(String database) {
        return dataSources.computeIfAbsent(database, db -> {
            log.debug("Opening data source: database={}", db);
            return new DriverManagerDataSource(url(db), user, password);
        });
    }

    String url(String database) {
        return urlTemplate.replace(DATABASE_TOKEN, database);
    }

    /** Forget a database's data source, e.g. after it was dropped. */
    public void forget(String database) {
        dataSources.remove(database);
    }
}
