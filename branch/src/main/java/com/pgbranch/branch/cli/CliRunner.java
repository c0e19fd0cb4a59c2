package com.pgbranch.branch.cli;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * Runs the command line once the context is up and reports its exit status to SpringApplication.exit.
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "pgbranch.cli.enabled", havingValue = "true", matchIfMissing = true)
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final BranchCommandLine commandLine;
    private volatile int exitCode;

    @Override
    public void run(String... args) {
        exitCode = commandLine.run(commandArguments(args));
    }

    /** Drops Spring property overrides such as {@code --pgbranch.clone.strategy=template}. */
    static String[] commandArguments(String... args) {
        return Arrays.stream(args)
                .filter(arg -> !(arg.startsWith("--") && arg.contains("=") && arg.substring(0, arg.indexOf('=')).contains(".")))
                .toArray(String[]::new);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
