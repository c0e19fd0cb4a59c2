package com.pgbranch.branch.exception;

/**
 * Base class for orchestration failures. Messages name the database or operation involved.
 */
public class BranchException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public BranchException(String message) {
        super(message);
    }

    public BranchException(String message, Throwable cause) {
        super(message, cause);
    }
}
