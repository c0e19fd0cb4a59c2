package com.pgbranch.branch.storage;

import lombok.extern.slf4j.Slf4j;

/**
 * Cleanup shared by the clone storages: once the target database exists, any failure drops it again.
 */
@Slf4j
final class HalfMadeClones {

    private HalfMadeClones() {
    }

    static void discard(DatabaseAdmin admin, String target, RuntimeException failure) {
        try {
            admin.drop(target);
            log.warn("Half-made clone dropped: target={}, reason={}", target, failure.getMessage());
        } catch (RuntimeException e) {
            failure.addSuppressed(e);
            log.error("Cannot drop half-made clone: target={}", target, e);
        }
    }
}
