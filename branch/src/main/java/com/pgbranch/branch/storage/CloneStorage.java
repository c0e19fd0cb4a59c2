package com.pgbranch.branch.storage;

/**
 * Produces a new, independent database from an existing one.
 *
 * Implementations must leave nothing behind on failure or interruption: a half-made target is
 * dropped before the {@link com.pgbranch.branch.exception.CloneException} propagates.
 */
public interface CloneStorage {

    ClonedDatabase clone(String source, String target);
}
