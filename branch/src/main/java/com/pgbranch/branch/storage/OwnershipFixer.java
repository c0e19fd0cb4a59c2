package com.pgbranch.branch.storage;

import java.nio.file.Path;

/** Hands cloned storage over to the operating identity the database engine runs as. */
public interface OwnershipFixer {

    void fixOwnership(Path path);
}
