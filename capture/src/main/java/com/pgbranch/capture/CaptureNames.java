package com.pgbranch.capture;

import java.util.Set;

/**
 * Names shared between the install script and the Java side.
 * Keep in sync with {@code db/pgbranch/capture.sql}.
 */
public final class CaptureNames {

    private CaptureNames() {}

    public static final String SCHEMA = "pgbranch";

    public static final String INSTALL_SCRIPT = "db/pgbranch/capture.sql";

    public static final String CAPTURE_TRIGGER = "pgbranch_capture";

    public static final String CHANGE_LOG = SCHEMA + ".change_log";
    public static final String DDL_LOG    = SCHEMA + ".ddl_log";

    public static final String RENDER_FUNCTION  = SCHEMA + ".render_create_table";
    public static final String INSTALL_FUNCTION = SCHEMA + ".install_capture_for";

    /** Schemas never captured or audited. */
    public static final Set<String> BOOKKEEPING_SCHEMAS =
            Set.of("pg_catalog", "information_schema", "pg_toast", SCHEMA);

    public static boolean isBookkeepingSchema(String schema) {
        return schema != null && (BOOKKEEPING_SCHEMAS.contains(schema) || schema.startsWith("pg_temp"));
    }
}
