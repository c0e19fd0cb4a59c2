package com.pgbranch.branch.service;

import com.pgbranch.branch.domain.BranchOperation;
import com.pgbranch.branch.domain.BranchOperation.Operation;
import com.pgbranch.branch.domain.BranchOperation.Step;
import com.pgbranch.branch.domain.TrackedDatabase;
import com.pgbranch.branch.exception.BranchException;
import com.pgbranch.branch.repository.BranchOperationRepository;
import com.pgbranch.branch.repository.TrackedDatabaseRepository;
import com.pgbranch.branch.storage.CloneStorage;
import com.pgbranch.branch.storage.ClonedDatabase;
import com.pgbranch.branch.storage.DatabaseAdmin;
import com.pgbranch.branch.storage.DatabaseNames;
import com.pgbranch.branch.storage.OwnershipFixer;
import com.pgbranch.capture.capture.CaptureInstaller;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Branch/Snapshot Orchestrator
 *
 * Drives one database clone through its steps:
 *   [ensure source capture] → [clone storage] → [fix ownership] → [ensure target capture]
 *
 * Restore runs a DROPPING step first; delete runs only that step.
 *
 * Every transition is saved (and committed) before the step runs, so the operation's row always
 * shows the step in progress. A failing step moves the operation straight to FAILED with
 * {@code "<step>: <message>"}; completed steps are not rolled back. The clone's TrackedDatabase
 * row is only written once clone storage has succeeded.
 */
@Slf4j
@Service
public class BranchOrchestrator {

    private static final List<Step> CLONE_STEPS = List.of(
            Step.ENSURING_SOURCE_CAPTURE, Step.CLONING, Step.FIXING_OWNERSHIP, Step.ENSURING_TARGET_CAPTURE);

    private static final DateTimeFormatter SNAPSHOT_SUFFIX = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final BranchOperationRepository operations;
    private final TrackedDatabaseRepository trackedDatabases;
    private final DatabaseAdmin admin;
    private final CloneStorage cloneStorage;
    private final OwnershipFixer ownershipFixer;
    private final CaptureInstaller captureInstaller;
    private final ExecutorService executor;
    private final Clock clock;

    // Metrics
    private final Counter operationsStarted;
    private final Counter operationsSucceeded;
    private final Counter operationsFailed;
    private final Timer operationDuration;

    public BranchOrchestrator(
            BranchOperationRepository operations,
            TrackedDatabaseRepository trackedDatabases,
            DatabaseAdmin admin,
            CloneStorage cloneStorage,
            OwnershipFixer ownershipFixer,
            CaptureInstaller captureInstaller,
            @Qualifier("branchExecutor") ExecutorService executor,
            Clock clock,
            MeterRegistry meterRegistry) {
        this.operations = operations;
        this.trackedDatabases = trackedDatabases;
        this.admin = admin;
        this.cloneStorage = cloneStorage;
        this.ownershipFixer = ownershipFixer;
        this.captureInstaller = captureInstaller;
        this.executor = executor;
        this.clock = clock;

        this.operationsStarted   = Counter.builder("branch.operations.started").register(meterRegistry);
        this.operationsSucceeded = Counter.builder("branch.operations.succeeded").register(meterRegistry);
        this.operationsFailed    = Counter.builder("branch.operations.failed").register(meterRegistry);
        this.operationDuration   = Timer.builder("branch.duration").register(meterRegistry);
    }

    // ─── Operations ───────────────────────────────────────────────────────────

    /**
     * @throws BranchException when the target name does not fit the engine's name limit
     */
    public BranchOperation branch(String source, String target) {
        DatabaseNames.require(target);
        return execute(new Plan(Operation.BRANCH, source, target, TrackedDatabase.Type.BRANCH, CLONE_STEPS));
    }

    /** Runs {@link #branch} on the orchestrator's executor. Cancelling with interruption fails the operation. */
    public Future<BranchOperation> submitBranch(String source, String target) {
        DatabaseNames.require(target);
        return executor.submit(() -> branch(source, target));
    }

    public BranchOperation snapshot(String source) {
        String name = "snapshot_" + source + "_" + LocalDateTime.now(clock).format(SNAPSHOT_SUFFIX);
        if (!DatabaseNames.fits(name)) {
            throw new BranchException("Snapshot name exceeds " + DatabaseNames.MAX_BYTES + " bytes: " + name);
        }
        return execute(new Plan(Operation.SNAPSHOT, source, name, TrackedDatabase.Type.SNAPSHOT, CLONE_STEPS));
    }

    /**
     * Replace {@code database} with a fresh clone of {@code snapshot}.
     *
     * @throws BranchException when the snapshot is not a tracked, active, non-root database
     */
    public BranchOperation restore(String database, String snapshot) {
        if (database.equals(snapshot)) {
            throw new BranchException("Cannot restore a snapshot onto itself: " + snapshot);
        }
        DatabaseNames.require(database);
        TrackedDatabase tracked = trackedDatabases
                .findFirstByDatnameAndStatus(snapshot, TrackedDatabase.Status.ACTIVE)
                .filter(t -> !t.isRoot())
                .orElseThrow(() -> new BranchException("Not a tracked snapshot: " + snapshot));
        log.info("Restore requested: database={}, snapshot={}, snapshotOid={}", database, snapshot, tracked.getOid());

        List<Step> steps = new ArrayList<>();
        steps.add(Step.DROPPING);
        steps.addAll(CLONE_STEPS);
        return execute(new Plan(Operation.RESTORE, snapshot, database, TrackedDatabase.Type.RESTORE, steps));
    }

    /**
     * Drop a tracked, non-root database. Its row stays, marked DROPPED, so lineage never dangles.
     *
     * @throws BranchException when the name is not a tracked, active, non-root database
     */
    public BranchOperation deleteSnapshot(String name) {
        trackedDatabases.findFirstByDatnameAndStatus(name, TrackedDatabase.Status.ACTIVE)
                .filter(t -> !t.isRoot())
                .orElseThrow(() -> new BranchException("Not a tracked snapshot or branch: " + name));
        return execute(new Plan(Operation.DELETE, null, name, null, List.of(Step.DROPPING)));
    }

    // ─── Step Execution ───────────────────────────────────────────────────────

    private BranchOperation execute(Plan plan) {
        Instant now = clock.instant();
        BranchOperation operation = operations.save(BranchOperation.builder()
                .datname(plan.target)
                .operation(plan.operation)
                .step(Step.PENDING)
                .status(BranchOperation.Status.PENDING)
                .createdAt(now)
                .build());
        operationsStarted.increment();

        log.info("Branch operation started: operationId={}, operation={}, source={}, target={}",
                operation.getId(), plan.operation, plan.source, plan.target);

        operation.setStatus(BranchOperation.Status.RUNNING);
        operation.setStartedAt(clock.instant());

        Run run = new Run(plan, operation);
        for (Step step : plan.steps) {
            run.operation.setStep(step);
            run.operation = operations.save(run.operation);
            try {
                executeStep(run, step);
            } catch (RuntimeException e) {
                return fail(run.operation, step, e);
            }
            log.info("Branch step executed: operationId={}, step={}", run.operation.getId(), step);
        }
        return complete(run.operation);
    }

    private void executeStep(Run run, Step step) {
        Plan plan = run.plan;
        switch (step) {
            case DROPPING -> dropExisting(plan.target);
            case ENSURING_SOURCE_CAPTURE -> {
                run.source = trackSource(plan.source);
                run.operation.setOldOid(run.source.getOid());
                captureInstaller.ensureInstalled(plan.source);
            }
            case CLONING -> {
                if (Thread.currentThread().isInterrupted()) {
                    throw new BranchException("Cancelled before cloning: " + plan.target);
                }
                ClonedDatabase clone = cloneStorage.clone(plan.source, plan.target);
                run.clone = clone;
                run.operation.setNewOid(clone.getOid());
                trackedDatabases.save(TrackedDatabase.builder()
                        .oid(clone.getOid())
                        .datname(clone.getName())
                        .parent(run.source.getOid())
                        .createdAt(clock.instant())
                        .type(plan.type)
                        .status(TrackedDatabase.Status.ACTIVE)
                        .build());
            }
            case FIXING_OWNERSHIP -> run.clone.storagePath().ifPresentOrElse(
                    ownershipFixer::fixOwnership,
                    () -> log.info("Ownership fix skipped, clone has no storage path: operationId={}, target={}",
                            run.operation.getId(), plan.target));
            case ENSURING_TARGET_CAPTURE -> captureInstaller.ensureInstalled(plan.target);
            default -> throw new IllegalArgumentException("Unknown branch step: " + step);
        }
    }

    // ─── Step Helpers ─────────────────────────────────────────────────────────

    /** The source's tracking row, registering it as a lineage root when it is not tracked yet. */
    private TrackedDatabase trackSource(String source) {
        long oid = admin.oid(source);
        return trackedDatabases.findById(oid)
                .filter(TrackedDatabase::isActive)
                .orElseGet(() -> {
                    log.info("Registering source database: database={}, oid={}", source, oid);
                    return trackedDatabases.save(TrackedDatabase.builder()
                            .oid(oid)
                            .datname(source)
                            .createdAt(clock.instant())
                            .type(TrackedDatabase.Type.SOURCE)
                            .status(TrackedDatabase.Status.ACTIVE)
                            .build());
                });
    }

    private void dropExisting(String database) {
        if (admin.exists(database)) {
            admin.drop(database);
        } else {
            log.info("Nothing to drop: database={}", database);
        }
        for (TrackedDatabase tracked : trackedDatabases.findByDatnameAndStatus(database, TrackedDatabase.Status.ACTIVE)) {
            tracked.setStatus(TrackedDatabase.Status.DROPPED);
            trackedDatabases.save(tracked);
        }
    }

    private BranchOperation complete(BranchOperation operation) {
        operation.setStep(Step.SUCCEEDED);
        operation.setStatus(BranchOperation.Status.SUCCEEDED);
        operation.setFinishedAt(clock.instant());
        BranchOperation saved = operations.save(operation);

        operationsSucceeded.increment();
        operationDuration.record(saved.elapsed());

        log.info("Branch operation SUCCEEDED: operationId={}, operation={}, target={}, durationMs={}",
                saved.getId(), saved.getOperation(), saved.getDatname(), saved.elapsed().toMillis());
        return saved;
    }

    private BranchOperation fail(BranchOperation operation, Step step, RuntimeException cause) {
        // The metadata write must go through even when the failure was an interruption.
        boolean interrupted = Thread.interrupted();
        try {
            operation.setStep(Step.FAILED);
            operation.setStatus(BranchOperation.Status.FAILED);
            operation.setFinishedAt(clock.instant());
            operation.setErrorDescription(step.name() + ": " + cause.getMessage());
            BranchOperation saved = operations.save(operation);

            operationsFailed.increment();
            operationDuration.record(saved.elapsed());

            log.error("Branch operation FAILED: operationId={}, operation={}, target={}, step={}",
                    saved.getId(), saved.getOperation(), saved.getDatname(), step, cause);
            return saved;
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    // ─── Plan ─────────────────────────────────────────────────────────────────

    private static final class Plan {
        private final Operation operation;
        private final String source;
        private final String target;
        private final TrackedDatabase.Type type;
        private final List<Step> steps;

        private Plan(Operation operation, String source, String target, TrackedDatabase.Type type, List<Step> steps) {
            this.operation = operation;
            this.source = source;
            this.target = target;
            this.type = type;
            this.steps = List.copyOf(steps);
        }
    }

    /** Mutable state carried from one step to the next. */
    private static final class Run {
        private final Plan plan;
        private BranchOperation operation;
        private TrackedDatabase source;
        private ClonedDatabase clone;

        private Run(Plan plan, BranchOperation operation) {
            this.plan = plan;
            this.operation = operation;
        }
    }
}
