package com.pgbranch.capture.exception;

import lombok.Getter;

/**
 * The target relation's current shape no longer matches a change record.
 * Never retried.
 */
@Getter
public class ReplayMismatchException extends ReplayException {

    private static final long serialVersionUID = 1L;

    private final String relation;

    public ReplayMismatchException(long recordId, String relation, String message) {
        super(recordId, message + ", relation=" + relation);
        this.relation = relation;
    }

    public ReplayMismatchException(long recordId, String relation, String message, Throwable cause) {
        super(recordId, message + ", relation=" + relation, cause);
        this.relation = relation;
    }
}
