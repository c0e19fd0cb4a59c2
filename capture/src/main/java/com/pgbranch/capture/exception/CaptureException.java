package com.pgbranch.capture.exception;

/**
 * Base class for failures raised by capture, audit and replay.
 * Messages always name the database, relation or record involved.
 */
public class CaptureException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public CaptureException(String message) {
        super(message);
    }

    public CaptureException(String message, Throwable cause) {
        super(message, cause);
    }
}
