package com.pgbranch.capture.audit;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Known classes of schema change the audit deliberately records only partially, or not at all.
 * These are not errors; they are kept stable so a widening shows up in tests.
 */
public enum AuditGap {

    /** Drops of views, functions, indexes and other non-table objects leave no end record. */
    NON_TABLE_DROP,

    /** ALTERs and rewrites of tables keep the statement text, not a rebuilt definition. */
    INCREMENTAL_ALTER,

    /** DDL issued from inside a function: the recorded statement is the outer call, not the DDL. */
    DYNAMIC_DDL;

    private static final Pattern LEADING_NOISE = Pattern.compile("^(\\s+|--[^\\n]*\\n|/\\*.*?\\*/)+", Pattern.DOTALL);

    public static Optional<AuditGap> detect(DdlRecord record) {
        String tag = record.getCommandTag() == null ? "" : record.getCommandTag().toUpperCase(Locale.ROOT);

        if (record.getSqlText() != null && !"TABLE REWRITE".equals(tag) && !issuedDirectly(tag, record.getSqlText())) {
            return Optional.of(DYNAMIC_DDL);
        }
        if (record.getPhase() == DdlPhase.START && record.getObjectIdentity() == null && targetsResolvableKind(tag)) {
            return Optional.of(DYNAMIC_DDL);
        }
        if (tag.startsWith("DROP ") && !AuditCoverage.isTableType(record.getObjectType())) {
            return Optional.of(NON_TABLE_DROP);
        }
        if (AuditCoverage.isTableType(record.getObjectType())
                && (tag.startsWith("ALTER ") || "TABLE REWRITE".equals(tag))) {
            return Optional.of(INCREMENTAL_ALTER);
        }
        return Optional.empty();
    }

    private static boolean targetsResolvableKind(String tag) {
        String[] words = tag.split(" ", 2);
        if (words.length < 2) {
            return false;
        }
        String kind = words[1].toLowerCase(Locale.ROOT);
        return AuditCoverage.ENGINE_DEFINED_TYPES.contains(kind) || "table".equals(kind);
    }

    /** True when the statement text starts with the command tag's verb, e.g. CREATE for CREATE VIEW. */
    static boolean issuedDirectly(String commandTag, String sqlText) {
        String verb = commandTag.split(" ", 2)[0];
        String statement = LEADING_NOISE.matcher(sqlText).replaceFirst("").toUpperCase(Locale.ROOT);
        return verb.isEmpty() || statement.startsWith(verb);
    }
}
