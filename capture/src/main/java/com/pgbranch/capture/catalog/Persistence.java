package com.pgbranch.capture.catalog;

public enum Persistence {
    PERMANENT,
    UNLOGGED,
    TEMPORARY;

    /** Maps {@code pg_class.relpersistence}. */
    public static Persistence fromCode(String code) {
        if ("u".equals(code)) return UNLOGGED;
        if ("t".equals(code)) return TEMPORARY;
        return PERMANENT;
    }
}
