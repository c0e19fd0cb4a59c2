package com.pgbranch.branch.storage;

import com.pgbranch.branch.exception.CloneException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Clones through the engine with {@code CREATE DATABASE ... TEMPLATE}. Needs no access to the
 * data directory, but requires that nobody else is connected to the source while it runs.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "pgbranch.clone.strategy", havingValue = "template")
public class TemplateCloneStorage implements CloneStorage {

    private final DatabaseAdmin admin;

    public TemplateCloneStorage(DatabaseAdmin admin) {
        this.admin = admin;
    }

    @Override
    public ClonedDatabase clone(String source, String target) {
        if (admin.exists(target)) {
            throw new CloneException(target, "Target database already exists");
        }
        int terminated = admin.terminateSessions(source);
        try {
            admin.createFromTemplate(target, source);
        } catch (DataAccessException e) {
            throw new CloneException(target, "Template clone of " + source + " failed", e);
        }

        long oid;
        try {
            oid = admin.oid(target);
            if (Thread.currentThread().isInterrupted()) {
                throw new CloneException(target, "Clone interrupted");
            }
        } catch (RuntimeException e) {
            HalfMadeClones.discard(admin, target, e);
            throw e instanceof CloneException ? e : new CloneException(target, "Clone failed: " + e.getMessage(), e);
        }

        log.info("Database cloned from template: source={}, target={}, oid={}, terminatedSessions={}",
                source, target, oid, terminated);
        return new ClonedDatabase(target, oid, null);
    }
}
