package com.claudeye.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.util.Arrays;

/**
 * Top-level CLI command. {@code serve} is handled before picocli and starts the HTTP API.
 */
@Command(
        name = "claudeye",
        mixinStandardHelpOptions = true,
        version = "Claudeye 0.1.0",
        description = "Evaluation cache and work queue for Claude Code session transcripts",
        subcommands = {
                CacheClearCommand.class,
                ScanCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class ClaudeyeCommand implements Runnable {

    /** Argument that starts the HTTP API instead of running a CLI command. */
    public static final String SERVE = "serve";

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }

    public static boolean isServeMode(String... args) {
        return Arrays.asList(args).contains(SERVE);
    }
}
