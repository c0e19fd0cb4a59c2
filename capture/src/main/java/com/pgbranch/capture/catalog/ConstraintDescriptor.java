package com.pgbranch.capture.catalog;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
public class ConstraintDescriptor {

    private final String name;

    /** {@code pg_constraint.contype}: p, u, c, f, x. */
    private final String type;

    /** Output of {@code pg_get_constraintdef}. */
    private final String definition;

    /** Supporting index oid, 0 when none. */
    private final long indexOid;
}
