package com.pgbranch.branch.exception;

import lombok.Getter;

/**
 * Clone storage or ownership adjustment failed. The half-made target has already been removed
 * by the time this is thrown.
 */
@Getter
public class CloneException extends BranchException {

    private static final long serialVersionUID = 1L;

    private final String database;

    public CloneException(String database, String reason) {
        super(reason + ": database=" + database);
        this.database = database;
    }

    public CloneException(String database, String reason, Throwable cause) {
        super(reason + ": database=" + database, cause);
        this.database = database;
    }
}
