package com.pgbranch.capture.diff;

import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Statements that bring the left database to the right one's schema and rows.
 * DDL runs first; DML is written against the schema the DDL produces.
 */
@Getter
@ToString
public class DatabaseDiff {

    public static final String DDL_HEADER = "-- DDL";
    public static final String DML_HEADER = "-- DML";

    private final String left;
    private final String right;
    private final List<String> ddl;
    private final List<String> dml;

    public DatabaseDiff(String left, String right, List<String> ddl, List<String> dml) {
        this.left = left;
        this.right = right;
        this.ddl = List.copyOf(ddl);
        this.dml = List.copyOf(dml);
    }

    public boolean isEmpty() {
        return ddl.isEmpty() && dml.isEmpty();
    }

    /** Both sections under their headers, one statement per line. */
    public String toSql() {
        StringBuilder sb = new StringBuilder(DDL_HEADER).append('\n');
        ddl.forEach(s -> sb.append(s).append('\n'));
        sb.append(DML_HEADER).append('\n');
        dml.forEach(s -> sb.append(s).append('\n'));
        return sb.toString();
    }
}
