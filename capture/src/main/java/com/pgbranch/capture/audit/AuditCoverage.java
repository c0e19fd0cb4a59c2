package com.pgbranch.capture.audit;

import java.util.Locale;
import java.util.Set;

/**
 * What the audit keeps for a given command and object kind.
 */
public enum AuditCoverage {

    /** Definition rebuilt from the catalog by the table renderer. */
    FULL_DEFINITION,

    /** Definition text from the engine's own getter (views, functions, indexes). */
    ENGINE_DEFINITION,

    /** Only the issued statement text. */
    STATEMENT_TEXT,

    /** Nothing is recorded at command end. */
    NOT_CAPTURED;

    static final Set<String> TABLE_TYPES = Set.of("table", "partitioned table", "table partition");

    static final Set<String> ENGINE_DEFINED_TYPES =
            Set.of("view", "materialized view", "function", "procedure", "index");

    static final Set<String> TABLE_CREATE_TAGS = Set.of("CREATE TABLE", "CREATE TABLE AS", "SELECT INTO");

    public static AuditCoverage classify(String commandTag, String objectType) {
        String tag = commandTag == null ? "" : commandTag.toUpperCase(Locale.ROOT);
        String type = objectType == null ? null : objectType.toLowerCase(Locale.ROOT);

        if (type != null && TABLE_TYPES.contains(type)) {
            return TABLE_CREATE_TAGS.contains(tag) ? FULL_DEFINITION : STATEMENT_TEXT;
        }
        if (tag.startsWith("DROP ")) {
            return NOT_CAPTURED;
        }
        if (type != null && ENGINE_DEFINED_TYPES.contains(type)) {
            return ENGINE_DEFINITION;
        }
        return STATEMENT_TEXT;
    }

    static boolean isTableType(String objectType) {
        return objectType != null && TABLE_TYPES.contains(objectType.toLowerCase(Locale.ROOT));
    }
}
