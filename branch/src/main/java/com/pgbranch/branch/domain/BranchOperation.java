package com.pgbranch.branch.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Duration;
import java.time.Instant;

/**
 * One orchestrated branch, snapshot, restore or delete, persisted after every step so a running
 * operation can be watched from another session.
 */
@Entity
@Table(name = "branch_operations", schema = "pgbranch", indexes = {
    @Index(name = "idx_branch_operations_status", columnList = "status")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
public class BranchOperation {

    public enum Operation {
        BRANCH,
        SNAPSHOT,
        RESTORE,
        DELETE
    }

    public enum Status {
        PENDING,
        RUNNING,
        SUCCEEDED,
        FAILED
    }

    public enum Step {
        PENDING,
        DROPPING,
        ENSURING_SOURCE_CAPTURE,
        CLONING,
        FIXING_OWNERSHIP,
        ENSURING_TARGET_CAPTURE,
        SUCCEEDED,
        FAILED
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "old_oid")
    private Long oldOid;

    @Column(name = "new_oid")
    private Long newOid;

    /** Name of the database this operation produces or removes. */
    @Column(name = "datname", nullable = false)
    private String datname;

    @Enumerated(EnumType.STRING)
    @Column(name = "operation", nullable = false, length = 20)
    private Operation operation;

    @Enumerated(EnumType.STRING)
    @Column(name = "step", nullable = false, length = 40)
    private Step step;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private Status status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(name = "error_description", columnDefinition = "text")
    private String errorDescription;

    public boolean isTerminal() {
        return status == Status.SUCCEEDED || status == Status.FAILED;
    }

    public Duration elapsed() {
        if (startedAt == null || finishedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, finishedAt);
    }
}
