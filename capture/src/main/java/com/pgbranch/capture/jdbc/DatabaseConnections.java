package com.pgbranch.capture.jdbc;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Per-database JDBC access on the managed server.
 * Capture, audit and replay never hold a connection beyond a single call.
 */
public interface DatabaseConnections {

    JdbcTemplate jdbc(String database);

    TransactionTemplate transactions(String database);
}
