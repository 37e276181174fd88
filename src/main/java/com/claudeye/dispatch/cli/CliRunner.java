package com.claudeye.dispatch.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Runs the picocli command tree once the Spring context is up and hands its
 * exit code back to {@link org.springframework.boot.SpringApplication#exit}.
 * In serve mode the web server owns the process and no command runs.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    private final ClaudeyeCommand rootCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(ClaudeyeCommand rootCommand, IFactory factory) {
        this.rootCommand = rootCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        if (ClaudeyeCommand.isServeMode(args)) {
            log.debug("Serve mode, skipping CLI dispatch");
            return;
        }
        exitCode = new CommandLine(rootCommand, factory).execute(args);
        log.debug("Command {} exited with {}", String.join(" ", args), exitCode);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
