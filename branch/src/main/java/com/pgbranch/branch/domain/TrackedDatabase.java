package com.pgbranch.branch.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * A database the service knows the lineage of.
 *
 * Rows are never deleted: a dropped database keeps its row with status {@code DROPPED}, so a child's
 * {@code parent} always points at something. A row with no parent is a lineage root.
 */
@Entity
@Table(name = "tracked_databases", schema = "pgbranch", indexes = {
    @Index(name = "idx_tracked_databases_datname", columnList = "datname"),
    @Index(name = "idx_tracked_databases_parent", columnList = "parent")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
public class TrackedDatabase {

    public enum Type {
        SOURCE,
        BRANCH,
        SNAPSHOT,
        RESTORE
    }

    public enum Status {
        ACTIVE,
        DROPPED
    }

    /** Engine oid of the database at the time it was tracked. */
    @Id
    @Column(name = "oid")
    private Long oid;

    @Column(name = "datname", nullable = false)
    private String datname;

    @Column(name = "parent")
    private Long parent;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 20)
    private Type type;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private Status status;

    public boolean isRoot() {
        return parent == null;
    }

    public boolean isActive() {
        return status == Status.ACTIVE;
    }
}
