package com.claudeye.dispatch.cli;

import com.claudeye.core.processing.ItemOutcome;
import com.claudeye.core.scheduler.BackgroundScanner;
import com.claudeye.core.scheduler.ScanResult;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * CLI command: claudeye scan
 * <p>
 * Runs one background scan, waits for the work it enqueued and prints a summary.
 */
@Command(name = "scan", mixinStandardHelpOptions = true,
        description = "Evaluate every session that has no cached result")
@Component
public class ScanCommand implements Callable<Integer> {

    @Option(names = "--timeout", description = "Seconds to wait for enqueued work (default: ${DEFAULT-VALUE})",
            defaultValue = "600")
    int timeoutSeconds;

    private final BackgroundScanner scanner;

    public ScanCommand(BackgroundScanner scanner) {
        this.scanner = scanner;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        long start = System.currentTimeMillis();
        ScanResult result = scanner.scanAndEnqueue();
        ConsoleOutput.info("Scanned " + result.sessionsScanned() + " session(s), "
                + result.enqueuedCount() + " item(s) to evaluate");

        try {
            CompletableFuture.allOf(result.enqueued().stream()
                            .map(f -> f.handle((value, error) -> null))
                            .toArray(CompletableFuture[]::new))
                    .get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            ConsoleOutput.error("Timed out after " + timeoutSeconds + "s waiting for enqueued work");
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.error("Interrupted");
            return 1;
        } catch (ExecutionException e) {
            ConsoleOutput.error("Scan failed: " + e.getCause().getMessage());
            return 1;
        }

        int succeeded = 0;
        int failed = 0;
        for (CompletableFuture<?> future : result.enqueued()) {
            if (!future.isCompletedExceptionally()
                    && future.join() instanceof ItemOutcome<?> outcome && outcome.ok()) {
                succeeded++;
            } else {
                failed++;
            }
        }
        ConsoleOutput.scanSummary(result.sessionsScanned(), result.enqueuedCount(), succeeded, failed,
                System.currentTimeMillis() - start);
        return failed > 0 ? 1 : 0;
    }
}
