package com.pgbranch.branch.storage;

import lombok.Getter;
import lombok.ToString;

import java.nio.file.Path;
import java.util.Optional;

/** Result of a successful clone. */
@Getter
@ToString
public class ClonedDatabase {

    private final String name;
    private final long oid;
    private final Path storagePath;

    public ClonedDatabase(String name, long oid, Path storagePath) {
        this.name = name;
        this.oid = oid;
        this.storagePath = storagePath;
    }

    /** Directory written by the clone, when the clone was made at file level. */
    public Optional<Path> storagePath() {
        return Optional.ofNullable(storagePath);
    }
}
