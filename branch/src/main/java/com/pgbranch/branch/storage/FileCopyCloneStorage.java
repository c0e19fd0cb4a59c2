package com.pgbranch.branch.storage;

import com.pgbranch.branch.exception.CloneException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Clones at file level: an empty target database is created, then its directory under
 * {@code <data_directory>/base/<oid>} is replaced by a copy-on-write copy of the source's.
 *
 * The source is checkpointed and the clone advisory lock held for the duration of the copy.
 * The service must run on the database host with access to the data directory.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "pgbranch.clone.strategy", havingValue = "file-copy", matchIfMissing = true)
public class FileCopyCloneStorage implements CloneStorage {

    static final String RELCACHE_INIT_FILE = "pg_internal.init";

    private final DatabaseAdmin admin;
    private final List<String> copyCommand;

    public FileCopyCloneStorage(DatabaseAdmin admin,
                                @Value("${pgbranch.clone.copy-command:cp -cR}") String copyCommand) {
        this.admin = admin;
        this.copyCommand = List.copyOf(Arrays.asList(copyCommand.trim().split("\\s+")));
    }

    @Override
    public ClonedDatabase clone(String source, String target) {
        if (admin.exists(target)) {
            throw new CloneException(target, "Target database already exists");
        }
        long sourceOid = admin.oid(source);
        Path base = admin.dataDirectory().resolve("base");

        try {
            admin.createEmpty(target);
        } catch (DataAccessException e) {
            throw new CloneException(target, "Cannot create target database", e);
        }

        long targetOid;
        Path targetPath;
        try {
            targetOid = admin.oid(target);
            targetPath = base.resolve(Long.toString(targetOid));
            try (DatabaseAdmin.WriteLock lock = admin.lockForCopy(source)) {
                copyDirectory(target, base.resolve(Long.toString(sourceOid)), targetPath);
            }
        } catch (RuntimeException e) {
            HalfMadeClones.discard(admin, target, e);
            throw e instanceof CloneException ? e : new CloneException(target, "Clone failed: " + e.getMessage(), e);
        }

        log.info("Database cloned: source={}, target={}, oid={}, path={}", source, target, targetOid, targetPath);
        return new ClonedDatabase(target, targetOid, targetPath);
    }

    private void copyDirectory(String target, Path sourcePath, Path targetPath) {
        if (!Files.isDirectory(sourcePath)) {
            throw new CloneException(target, "Source directory not found: " + sourcePath);
        }
        if (!Files.isDirectory(targetPath)) {
            throw new CloneException(target, "Target directory not found: " + targetPath);
        }

        try {
            deleteTree(targetPath);
        } catch (IOException e) {
            throw new CloneException(target, "Cannot clear target directory " + targetPath, e);
        }

        List<String> command = new ArrayList<>(copyCommand);
        command.add(sourcePath + "/");
        command.add(targetPath.toString());
        runCopy(target, command);

        try {
            if (!Files.deleteIfExists(targetPath.resolve(RELCACHE_INIT_FILE))) {
                log.warn("No relation cache init file in clone: path={}", targetPath);
            }
        } catch (IOException e) {
            throw new CloneException(target, "Cannot remove " + RELCACHE_INIT_FILE, e);
        }
    }

    /**
     * Output goes to a file rather than a pipe, so a chatty copy tool cannot stall on a full buffer.
     */
    private void runCopy(String target, List<String> command) {
        log.debug("Copying database files: command={}", command);
        Path output;
        try {
            output = Files.createTempFile("pgbranch-copy", ".log");
        } catch (IOException e) {
            throw new CloneException(target, "Cannot create copy log file", e);
        }
        try {
            Process process;
            try {
                process = new ProcessBuilder(command)
                        .redirectErrorStream(true)
                        .redirectOutput(output.toFile())
                        .start();
            } catch (IOException e) {
                throw new CloneException(target, "Cannot start copy command " + command, e);
            }
            int exit;
            try {
                exit = process.waitFor();
            } catch (InterruptedException e) {
                process.destroyForcibly();
                process.onExit().join();
                Thread.currentThread().interrupt();
                throw new CloneException(target, "Clone interrupted", e);
            }
            if (exit != 0) {
                throw new CloneException(target, "Copy command exited with " + exit + ": " + readOutput(output));
            }
        } finally {
            try {
                Files.deleteIfExists(output);
            } catch (IOException e) {
                log.warn("Cannot remove copy log file: path={}", output, e);
            }
        }
    }

    private static String readOutput(Path output) {
        try {
            return Files.readString(output, StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            return "(output unreadable: " + e.getMessage() + ")";
        }
    }

    static void deleteTree(Path root) throws IOException {
        if (!Files.exists(root)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(root)) {
            for (Path path : (Iterable<Path>) paths.sorted(Comparator.reverseOrder())::iterator) {
                Files.delete(path);
            }
        }
    }
}
