package com.claudeye.core.scheduler;

import com.claudeye.core.cache.CacheKind;
import com.claudeye.core.cache.CacheManager;
import com.claudeye.core.evals.EnrichRunResult;
import com.claudeye.core.evals.EvalRegistry;
import com.claudeye.core.evals.EvalRunResult;
import com.claudeye.core.evals.EvalsModuleLoader;
import com.claudeye.core.evals.RegisteredEnricher;
import com.claudeye.core.evals.RegisteredEval;
import com.claudeye.core.metrics.ClaudeyeMetrics;
import com.claudeye.core.processing.SessionItemProcessor;
import com.claudeye.core.transcript.SessionCatalog;
import com.claudeye.core.transcript.SessionRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Finds session-scoped evals and enrichments with no valid cached result and
 * enqueues them at {@link Priority#LOW}, so everything gets evaluated
 * eventually without holding up interactive requests.
 * <p>
 * Sessions are visited newest first in batches of {@value #BATCH_SIZE}; the
 * scan stops early when its thread is interrupted.
 */
@Service
public class BackgroundScanner {

    private static final Logger log = LoggerFactory.getLogger(BackgroundScanner.class);

    static final int BATCH_SIZE = 5;

    private final WorkScheduler scheduler;
    private final SessionCatalog catalog;
    private final EvalsModuleLoader moduleLoader;
    private final EvalRegistry registry;
    private final CacheManager cache;
    private final SessionItemProcessor processor;
    private final QueueProperties properties;
    private final ClaudeyeMetrics metrics;

    private ScheduledExecutorService timer;

    public BackgroundScanner(WorkScheduler scheduler,
                             SessionCatalog catalog,
                             EvalsModuleLoader moduleLoader,
                             EvalRegistry registry,
                             CacheManager cache,
                             SessionItemProcessor processor,
                             QueueProperties properties,
                             @Autowired(required = false) ClaudeyeMetrics metrics) {
        this.scheduler = scheduler;
        this.catalog = catalog;
        this.moduleLoader = moduleLoader;
        this.registry = registry;
        this.cache = cache;
        this.processor = processor;
        this.properties = properties;
        this.metrics = metrics;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (properties.getIntervalSeconds() > 0) {
            startBackgroundProcessor(properties.getIntervalSeconds());
        }
    }

    /** Never throws; a failed scan is logged and reports what it managed to enqueue. */
    public ScanResult scanAndEnqueue() {
        try {
            moduleLoader.ensureLoaded();
            if (!registry.hasEvals() && !registry.hasEnrichers()) {
                return ScanResult.EMPTY;
            }
            scheduler.recordScan(System.currentTimeMillis());

            List<RegisteredEval> evals = registry.sessionScopedEvals();
            List<RegisteredEnricher> enrichers = registry.sessionScopedEnrichers();
            List<String> evalHashes = evals.stream().map(e -> cache.hasher().hashItemCode(e.fn())).toList();
            List<String> enrichHashes = enrichers.stream().map(e -> cache.hasher().hashItemCode(e.fn())).toList();

            List<SessionRef> sessions = catalog.listSessions();
            int max = properties.getMaxSessions();
            if (max > 0 && sessions.size() > max) {
                sessions = sessions.subList(0, max);
            }

            var enqueued = new ArrayList<CompletableFuture<?>>();
            int scanned = 0;
            for (int i = 0; i < sessions.size(); i += BATCH_SIZE) {
                if (Thread.currentThread().isInterrupted()) {
                    log.info("Scan interrupted after {} session(s)", scanned);
                    break;
                }
                for (SessionRef session : sessions.subList(i, Math.min(i + BATCH_SIZE, sessions.size()))) {
                    enqueueUncached(session, evals, evalHashes, enrichers, enrichHashes, enqueued);
                    scanned++;
                }
                Thread.yield();
            }

            if (!enqueued.isEmpty()) {
                log.info("Scan enqueued {} item(s) across {} session(s)", enqueued.size(), scanned);
            } else {
                log.debug("Scan found nothing to do across {} session(s)", scanned);
            }
            if (metrics != null) metrics.recordScanEnqueued(enqueued.size());
            return new ScanResult(scanned, List.copyOf(enqueued));
        } catch (RuntimeException e) {
            log.error("Background scan failed: {}", e.getMessage(), e);
            return ScanResult.EMPTY;
        }
    }

    private void enqueueUncached(SessionRef session,
                                 List<RegisteredEval> evals, List<String> evalHashes,
                                 List<RegisteredEnricher> enrichers, List<String> enrichHashes,
                                 List<CompletableFuture<?>> enqueued) {
        String project = session.projectName();
        String sessionId = session.sessionId();
        String contentHash = cache.hasher().hashSessionFile(project, sessionId);
        if (contentHash.isEmpty()) {
            return;
        }
        for (int j = 0; j < evals.size(); j++) {
            String name = evals.get(j).name();
            boolean cached = cache.getPerItem(CacheKind.EVALS, project, sessionId, name, evalHashes.get(j),
                    contentHash, EvalRunResult.class).isPresent();
            if (!cached) {
                enqueued.add(scheduler.schedule(WorkType.EVAL, project, sessionId, name,
                        () -> processor.processSessionEval(project, sessionId, name, false),
                        ScheduleOptions.low()));
            }
        }
        for (int j = 0; j < enrichers.size(); j++) {
            String name = enrichers.get(j).name();
            boolean cached = cache.getPerItem(CacheKind.ENRICHMENTS, project, sessionId, name,
                    enrichHashes.get(j), contentHash, EnrichRunResult.class).isPresent();
            if (!cached) {
                enqueued.add(scheduler.schedule(WorkType.ENRICHMENT, project, sessionId, name,
                        () -> processor.processSessionEnrichment(project, sessionId, name, false),
                        ScheduleOptions.low()));
            }
        }
    }

    /**
     * Starts the periodic scan. The first scan runs one interval after start
     * and each run schedules the next. Calling this while running does nothing.
     */
    public synchronized void startBackgroundProcessor(int intervalSeconds) {
        if (timer != null) {
            return;
        }
        log.info("Starting background processor (interval: {}s)", intervalSeconds);
        timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "claudeye-scanner");
            t.setDaemon(true);
            return t;
        });
        scheduler.setBackgroundRunning(true);
        scheduleNext(timer, intervalSeconds);
    }

    private void scheduleNext(ScheduledExecutorService current, int intervalSeconds) {
        current.schedule(() -> {
            scanAndEnqueue();
            synchronized (this) {
                if (timer == current && !current.isShutdown()) {
                    scheduleNext(current, intervalSeconds);
                }
            }
        }, intervalSeconds, TimeUnit.SECONDS);
    }

    @PreDestroy
    public synchronized void stopBackgroundProcessor() {
        if (timer == null) {
            return;
        }
        timer.shutdownNow();
        timer = null;
        scheduler.setBackgroundRunning(false);
        log.info("Background processor stopped");
    }

    public synchronized boolean isRunning() {
        return timer != null;
    }
}
