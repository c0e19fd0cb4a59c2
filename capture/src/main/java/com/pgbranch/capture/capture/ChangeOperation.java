package com.pgbranch.capture.capture;

public enum ChangeOperation {
    INSERT("I"),
    UPDATE("U"),
    DELETE("D");

    private final String code;

    ChangeOperation(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static ChangeOperation fromCode(String code) {
        for (ChangeOperation op : values()) {
            if (op.code.equals(code)) return op;
        }
        throw new IllegalArgumentException("Unknown change operation: " + code);
    }
}
