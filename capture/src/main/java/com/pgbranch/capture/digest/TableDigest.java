package com.pgbranch.capture.digest;

/**
 * Content digest of one table, computed on the server.
 */
public interface TableDigest {

    String digest(String database, String relation, int batchSize);
}
