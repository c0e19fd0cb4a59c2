package com.pgbranch.capture.catalog;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
public class ColumnDescriptor {

    private final String name;
    private final int attnum;
    private final TypeDescriptor type;
    private final boolean notNull;
    private final IdentityMode identity;

    /** Stored generated column; never written directly. */
    private final boolean generated;

    /** Default or generation expression as the engine prints it. */
    private final String defaultExpression;

    /** Collation name when it differs from the type's default. */
    private final String collation;

    public boolean isIdentityAlways() {
        return identity == IdentityMode.ALWAYS;
    }
}
