package com.pgbranch.capture.catalog;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Optional;

/**
 * Immutable snapshot of a relation's catalog shape.
 * Built once per relation by {@link CatalogInspector} and reused until DDL is audited on its database.
 */
@Getter
@Builder
@ToString
public class RelationDescriptor {

    private final long oid;
    private final RelationId id;
    private final RelationKind kind;
    private final Persistence persistence;
    private final List<ColumnDescriptor> columns;

    /** Primary key columns in index key order. */
    private final List<String> primaryKey;

    private final List<ConstraintDescriptor> constraints;
    private final List<RelationId> parents;
    private final String partitionKey;
    private final String partitionBound;
    private final List<String> reloptions;
    private final String tablespace;

    public Optional<ColumnDescriptor> column(String name) {
        return columns.stream().filter(c -> c.getName().equals(name)).findFirst();
    }

    public boolean hasPrimaryKey() {
        return !primaryKey.isEmpty();
    }

    public boolean isPartition() {
        return partitionBound != null;
    }
}
