package com.pgbranch.branch.storage;

import com.pgbranch.branch.exception.BranchException;

import java.nio.charset.StandardCharsets;

/**
 * Database name limits of the engine. A longer name is silently truncated by {@code CREATE DATABASE},
 * after which the requested name no longer resolves.
 */
public final class DatabaseNames {

    /** NAMEDATALEN - 1 of a default server build. */
    public static final int MAX_BYTES = 63;

    private DatabaseNames() {
    }

    public static boolean fits(String name) {
        return name != null && !name.isEmpty() && name.getBytes(StandardCharsets.UTF_8).length <= MAX_BYTES;
    }

    /**
     * @throws BranchException when the name is empty or longer than {@link #MAX_BYTES} bytes
     */
    public static String require(String name) {
        if (!fits(name)) {
            throw new BranchException("Database name must be 1 to " + MAX_BYTES + " bytes: " + name);
        }
        return name;
    }
}
