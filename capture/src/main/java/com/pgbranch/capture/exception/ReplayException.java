package com.pgbranch.capture.exception;

import lombok.Getter;

@Getter
public class ReplayException extends CaptureException {

    private static final long serialVersionUID = 1L;

    private final long recordId;

    public ReplayException(long recordId, String message) {
        super(message + ": recordId=" + recordId);
        this.recordId = recordId;
    }

    public ReplayException(long recordId, String message, Throwable cause) {
        super(message + ": recordId=" + recordId, cause);
        this.recordId = recordId;
    }
}
