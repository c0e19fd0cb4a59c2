package com.pgbranch.capture.exception;

import lombok.Getter;

/**
 * A relation cannot be captured, resolved or digested as asked:
 * no primary key, unknown relation, or an engine function declared with the wrong volatility.
 */
@Getter
public class PreconditionException extends CaptureException {

    private static final long serialVersionUID = 1L;

    private final String database;
    private final String relation;

    public PreconditionException(String database, String relation, String reason) {
        super(String.format("%s: database=%s, relation=%s", reason, database, relation));
        this.database = database;
        this.relation = relation;
    }

    public PreconditionException(String database, String relation, String reason, Throwable cause) {
        super(String.format("%s: database=%s, relation=%s", reason, database, relation), cause);
        this.database = database;
        this.relation = relation;
    }
}
