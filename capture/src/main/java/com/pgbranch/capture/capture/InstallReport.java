package com.pgbranch.capture.capture;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one install pass over a database.
 */
@Getter
@Builder
@ToString
public class InstallReport {

    private final String database;
    private final boolean scriptApplied;

    /** Relations whose capture trigger was (re)created. */
    private final List<String> installed;

    /** Relations left uncaptured, with the reason. */
    private final Map<String, String> skipped;

    /** Bookkeeping relations a stray capture trigger was removed from. */
    private final List<String> removed;
}
