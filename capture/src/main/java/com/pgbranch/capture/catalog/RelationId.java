package com.pgbranch.capture.catalog;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Schema-qualified relation name as stored in the catalog (unquoted).
 */
@Getter
@EqualsAndHashCode
public final class RelationId {

    private final String schema;
    private final String name;

    public RelationId(String schema, String name) {
        if (schema == null || name == null) {
            throw new IllegalArgumentException("Relation schema and name are required");
        }
        this.schema = schema;
        this.name = name;
    }

    /** Fully quoted form, safe to splice into generated SQL. */
    public String qualified() {
        return quote(schema) + "." + quote(name);
    }

    public static String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    @Override
    public String toString() {
        return schema + "." + name;
    }
}
