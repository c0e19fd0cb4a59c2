package com.pgbranch.branch.cli;

import com.pgbranch.branch.domain.BranchOperation;
import com.pgbranch.branch.service.BranchOrchestrator;
import com.pgbranch.branch.service.BranchQueryService;
import com.pgbranch.branch.service.DatabaseListing;
import com.pgbranch.branch.service.LineageNode;
import com.pgbranch.branch.storage.DatabaseNames;
import com.pgbranch.capture.audit.DdlAuditLog;
import com.pgbranch.capture.audit.DdlRecord;
import com.pgbranch.capture.audit.SchemaRenderer;
import com.pgbranch.capture.capture.CaptureInstaller;
import com.pgbranch.capture.capture.InstallReport;
import com.pgbranch.capture.diff.LogicalDiff;
import com.pgbranch.capture.digest.TableDigest;
import com.pgbranch.capture.replay.ReplayEngine;
import com.pgbranch.capture.replay.ReplayResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.io.PrintWriter;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * {@code pgbranch <command> [args]}
 *
 * Exit status: 0 on success, 1 when the operation failed, 2 on a usage error.
 */
@Slf4j
@Component
public class BranchCommandLine {

    public static final int OK = 0;
    public static final int FAILED = 1;
    public static final int USAGE = 2;

    private static final String USAGE_LINE = "pgbranch <command> [args]";
    private static final String COMMANDS = String.join(System.lineSeparator(),
            "Commands:",
            "  databases                              list server databases with tracking info",
            "  branch <source> <target>               clone source into a new branch",
            "  snapshot <source>                      clone source into a timestamped snapshot",
            "  snapshots                              list lineage roots and their clones",
            "  restore <database> <snapshot>          replace database with a clone of snapshot",
            "  delete-snapshot <name>                 drop a tracked snapshot or branch",
            "  operations [--status S]                list orchestrated operations",
            "  install <database>                     install change capture and DDL audit",
            "  replay <source> <recordId> <target>    apply one captured change to target",
            "  render <database> <relation>           print a table's CREATE statement",
            "  audit <database> [--after id]          list audited schema changes",
            "  digest <database> <relation>           hash a table's contents",
            "  diff <left> <right>                    print DDL and DML turning left into right",
            "  version                                print the build version");

    private final BranchOrchestrator orchestrator;
    private final BranchQueryService queries;
    private final CaptureInstaller captureInstaller;
    private final ReplayEngine replayEngine;
    private final SchemaRenderer schemaRenderer;
    private final DdlAuditLog auditLog;
    private final TableDigest tableDigest;
    private final LogicalDiff logicalDiff;
    private final String version;
    private final Options options = buildOptions();

    public BranchCommandLine(BranchOrchestrator orchestrator,
                             BranchQueryService queries,
                             CaptureInstaller captureInstaller,
                             ReplayEngine replayEngine,
                             SchemaRenderer schemaRenderer,
                             DdlAuditLog auditLog,
                             TableDigest tableDigest,
                             LogicalDiff logicalDiff,
                             @Value("${pgbranch.version:unknown}") String version) {
        this.orchestrator = orchestrator;
        this.queries = queries;
        this.captureInstaller = captureInstaller;
        this.replayEngine = replayEngine;
        this.schemaRenderer = schemaRenderer;
        this.auditLog = auditLog;
        this.tableDigest = tableDigest;
        this.logicalDiff = logicalDiff;
        this.version = version;
    }

    private static Options buildOptions() {
        return new Options()
                .addOption(Option.builder().longOpt("after").hasArg().argName("id")
                        .desc("audit: only records after this id").build())
                .addOption(Option.builder().longOpt("limit").hasArg().argName("n")
                        .desc("audit: maximum number of records (default 100)").build())
                .addOption(Option.builder().longOpt("batch-size").hasArg().argName("n")
                        .desc("digest: rows hashed per batch (default 1000)").build())
                .addOption(Option.builder().longOpt("status").hasArg().argName("status")
                        .desc("operations: PENDING, RUNNING, SUCCEEDED or FAILED").build())
                .addOption(Option.builder("h").longOpt("help").desc("print this help").build());
    }

    public int run(String... args) {
        return run(args, System.out, System.err);
    }

    public int run(String[] args, PrintStream out, PrintStream err) {
        CommandLine line;
        try {
            line = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            err.println(e.getMessage());
            printHelp(err);
            return USAGE;
        }

        List<String> positional = line.getArgList();
        if (line.hasOption("help") || positional.isEmpty()) {
            printHelp(line.hasOption("help") ? out : err);
            return line.hasOption("help") ? OK : USAGE;
        }

        String command = positional.get(0);
        List<String> params = positional.subList(1, positional.size());
        try {
            return dispatch(command, params, line, out, err);
        } catch (UsageException e) {
            err.println(e.getMessage());
            printHelp(err);
            return USAGE;
        } catch (RuntimeException e) {
            log.debug("Command failed: command={}", command, e);
            err.println(e.getMessage());
            return FAILED;
        }
    }

    // ─── Commands ─────────────────────────────────────────────────────────────

    private int dispatch(String command, List<String> params, CommandLine line, PrintStream out, PrintStream err) {
        switch (command) {
            case "databases" -> {
                expect(command, params, 0);
                queries.listDatabases().forEach(db -> out.println(formatListing(db)));
                return OK;
            }
            case "branch" -> {
                expect(command, params, 2);
                return report(orchestrator.branch(params.get(0), databaseName(params.get(1))), out, err);
            }
            case "snapshot" -> {
                expect(command, params, 1);
                return report(orchestrator.snapshot(params.get(0)), out, err);
            }
            case "snapshots" -> {
                expect(command, params, 0);
                queries.listSnapshots().forEach(root -> printTree(root, 0, out));
                return OK;
            }
            case "restore" -> {
                expect(command, params, 2);
                return report(orchestrator.restore(databaseName(params.get(0)), params.get(1)), out, err);
            }
            case "delete-snapshot" -> {
                expect(command, params, 1);
                return report(orchestrator.deleteSnapshot(params.get(0)), out, err);
            }
            case "operations" -> {
                expect(command, params, 0);
                List<BranchOperation> found = line.hasOption("status")
                        ? queries.listOperations(parseStatus(line.getOptionValue("status")))
                        : queries.listOperations();
                found.forEach(op -> out.println(formatOperation(op)));
                return OK;
            }
            case "install" -> {
                expect(command, params, 1);
                printInstall(captureInstaller.ensureInstalled(params.get(0)), out);
                return OK;
            }
            case "replay" -> {
                expect(command, params, 3);
                ReplayResult result = replayEngine.replay(
                        params.get(0), parseLong("recordId", params.get(1)), params.get(2));
                out.println("record " + result.getRecordId() + " " + result.getOperation() + " "
                        + result.getRelation() + ": "
                        + (result.isApplied() ? "applied, rows=" + result.getRowsAffected() : "nothing to apply"));
                return OK;
            }
            case "render" -> {
                expect(command, params, 2);
                out.println(schemaRenderer.render(params.get(0), params.get(1)) + ";");
                return OK;
            }
            case "audit" -> {
                expect(command, params, 1);
                long after = line.hasOption("after") ? parseLong("after", line.getOptionValue("after")) : 0L;
                if (after < 0) {
                    throw new UsageException("after must not be negative: " + after);
                }
                int limit = line.hasOption("limit") ? parseInt("limit", line.getOptionValue("limit"), 1) : 100;
                auditLog.findAfter(params.get(0), after, limit).forEach(r -> out.println(formatAudit(r)));
                return OK;
            }
            case "digest" -> {
                expect(command, params, 2);
                int batchSize = line.hasOption("batch-size")
                        ? parseInt("batch-size", line.getOptionValue("batch-size"), 1) : 1000;
                out.println(tableDigest.digest(params.get(0), params.get(1), batchSize));
                return OK;
            }
            case "diff" -> {
                expect(command, params, 2);
                out.print(logicalDiff.diff(params.get(0), params.get(1)).toSql());
                return OK;
            }
            case "version" -> {
                expect(command, params, 0);
                out.println("pgbranch " + version);
                return OK;
            }
            default -> throw new UsageException("Unknown command: " + command);
        }
    }

    private static int report(BranchOperation operation, PrintStream out, PrintStream err) {
        if (operation.getStatus() == BranchOperation.Status.SUCCEEDED) {
            out.println(formatOperation(operation));
            return OK;
        }
        err.println(operation.getErrorDescription());
        return FAILED;
    }

    // ─── Formatting ───────────────────────────────────────────────────────────

    static String formatListing(DatabaseListing db) {
        return db.tracked()
                .map(t -> String.format("%-10d %-40s %-9s parent=%s", db.getOid(), db.getName(), t.getType(),
                        t.getParent() == null ? "-" : t.getParent()))
                .orElse(String.format("%-10d %-40s %s", db.getOid(), db.getName(), "untracked"));
    }

    static String formatOperation(BranchOperation op) {
        StringBuilder sb = new StringBuilder()
                .append("operation ").append(op.getId())
                .append(' ').append(op.getOperation())
                .append(' ').append(op.getDatname())
                .append(' ').append(op.getStatus());
        if (op.getStatus() == BranchOperation.Status.RUNNING) {
            sb.append(" step=").append(op.getStep());
        }
        if (op.getNewOid() != null) {
            sb.append(" oid=").append(op.getNewOid());
        }
        if (op.getErrorDescription() != null) {
            sb.append(" error=\"").append(op.getErrorDescription()).append('"');
        }
        return sb.toString();
    }

    static String formatAudit(DdlRecord r) {
        return r.getId() + " " + r.getPhase().name().toLowerCase(Locale.ROOT)
                + " " + r.getCommandTag()
                + " " + (r.getObjectIdentity() == null ? "?" : r.getObjectIdentity())
                + " coverage=" + r.coverage()
                + r.gap().map(g -> " gap=" + g).orElse("");
    }

    private static void printTree(LineageNode node, int depth, PrintStream out) {
        out.println("  ".repeat(depth) + node.displayName()
                + " [" + node.getDatabase().getType() + ", oid=" + node.getDatabase().getOid()
                + (node.getDatabase().isActive() ? "" : ", dropped") + "]");
        node.getChildren().forEach(child -> printTree(child, depth + 1, out));
    }

    private static void printInstall(InstallReport report, PrintStream out) {
        out.println("capture installed on " + report.getDatabase() + ": " + report.getInstalled().size()
                + " relation(s)");
        for (Map.Entry<String, String> skipped : report.getSkipped().entrySet()) {
            out.println("  skipped " + skipped.getKey() + ": " + skipped.getValue());
        }
        report.getRemoved().forEach(r -> out.println("  removed stray trigger from " + r));
    }

    private void printHelp(PrintStream stream) {
        PrintWriter writer = new PrintWriter(stream);
        new HelpFormatter().printHelp(writer, HelpFormatter.DEFAULT_WIDTH, USAGE_LINE, COMMANDS, options,
                HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null);
        writer.flush();
    }

    // ─── Argument Checks ──────────────────────────────────────────────────────

    private static void expect(String command, List<String> params, int count) {
        if (params.size() != count) {
            throw new UsageException(command + " takes " + count + " argument(s), got " + params.size());
        }
    }

    private static long parseLong(String name, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new UsageException(name + " must be a number: " + value);
        }
    }

    private static int parseInt(String name, String value, int min) {
        int parsed;
        try {
            parsed = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new UsageException(name + " must be a number between " + min + " and " + Integer.MAX_VALUE
                    + ": " + value);
        }
        if (parsed < min) {
            throw new UsageException(name + " must be at least " + min + ": " + value);
        }
        return parsed;
    }

    private static String databaseName(String name) {
        if (!DatabaseNames.fits(name)) {
            throw new UsageException("Database name must be 1 to " + DatabaseNames.MAX_BYTES + " bytes: " + name);
        }
        return name;
    }

    private static BranchOperation.Status parseStatus(String value) {
        try {
            return BranchOperation.Status.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new UsageException("Unknown status: " + value);
        }
    }

    private static final class UsageException extends RuntimeException {
        private static final long serialVersionUID = 1L;

        private UsageException(String message) {
            super(message);
        }
    }
}
