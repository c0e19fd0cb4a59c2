package com.pgbranch.capture.catalog;

public enum RelationKind {
    TABLE,
    PARTITIONED_TABLE;

    /** Maps {@code pg_class.relkind}; null for kinds that are not tables. */
    public static RelationKind fromCode(String code) {
        if ("r".equals(code)) return TABLE;
        if ("p".equals(code)) return PARTITIONED_TABLE;
        return null;
    }
}
