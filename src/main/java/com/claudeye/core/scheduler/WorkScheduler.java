package com.claudeye.core.scheduler;

import com.claudeye.core.logging.MdcContext;
import com.claudeye.core.metrics.ClaudeyeMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Process-wide priority work queue with bounded concurrency.
 * <p>
 * Work is identified by {@code "{type}:{project}/{session}/{item}"}. While a key
 * is pending or running, further requests for it share the same future and the
 * task runs once; a more urgent request promotes the pending entry instead of
 * adding a duplicate. A forced refresh waits for the in-flight run to settle
 * and then schedules a fresh one, so a key never runs twice at the same time.
 * <p>
 * At most {@code concurrency} tasks run at once. The rest wait ordered by
 * priority, then enqueue order. All bookkeeping happens under one lock; tasks
 * themselves run on a fixed pool outside it. A future is completed only after
 * the bookkeeping for its run is done and the queue has been drained.
 * <p>
 * Nothing persists: a restart starts with an empty queue.
 */
@Service
public class WorkScheduler {

    private static final Logger log = LoggerFactory.getLogger(WorkScheduler.class);

    static final int COMPLETED_MAX = 200;
    static final int MAX_ERRORS = 50;
    static final int RECENT_ERRORS = 10;
    static final Duration ALERT_DEBOUNCE = Duration.ofMillis(500);

    private final int concurrency;
    private final Duration historyTtl;
    private final List<SessionSettledListener> listeners;
    private final ClaudeyeMetrics metrics;
    private final Clock clock;
    private final ExecutorService workers;
    private final Debouncer settleDebouncer;

    private final Object lock = new Object();
    private final List<QueueEntry> pending = new ArrayList<>();
    private final Map<String, QueueEntry> pendingByKey = new HashMap<>();
    private final Map<String, ProcessingEntry> processing = new LinkedHashMap<>();
    private final Map<String, CompletableFuture<Object>> inFlight = new HashMap<>();
    private final Deque<CompletedEntry> completed = new ArrayDeque<>();
    private final Deque<QueueError> errors = new ArrayDeque<>();
    private int activeWorkers;
    private long sequence;
    private boolean shutDown;

    private volatile long scannedAt;
    private volatile boolean backgroundRunning;

    @Autowired
    public WorkScheduler(QueueProperties properties,
                         ObjectProvider<SessionSettledListener> listeners,
                         @Autowired(required = false) ClaudeyeMetrics metrics) {
        this(properties.effectiveConcurrency(),
                Duration.ofSeconds(properties.effectiveHistoryTtlSeconds()),
                listeners.orderedStream().toList(),
                metrics,
                Clock.systemUTC(),
                ALERT_DEBOUNCE);
    }

    WorkScheduler(int concurrency, Duration historyTtl, List<SessionSettledListener> listeners,
                  ClaudeyeMetrics metrics, Clock clock, Duration settleDebounce) {
        this.concurrency = concurrency > 0 ? concurrency : QueueProperties.DEFAULT_CONCURRENCY;
        this.historyTtl = historyTtl;
        this.listeners = List.copyOf(listeners);
        this.metrics = metrics;
        this.clock = clock;
        this.workers = Executors.newFixedThreadPool(this.concurrency, namedDaemonThreads("claudeye-queue-"));
        this.settleDebouncer = new Debouncer(settleDebounce, "claudeye-queue-settle");
        log.info("Work queue ready (concurrency={}, history TTL={}s)", this.concurrency, historyTtl.toSeconds());
    }

    public static String key(WorkType type, String projectName, String sessionId, String itemName) {
        return type.label() + ":" + projectName + "/" + sessionId + "/" + itemName;
    }

    public int concurrency() {
        return concurrency;
    }

    /**
     * Schedules a unit of work, or joins the run already pending or in flight
     * for the same key.
     *
     * @return completes with the task's result, or exceptionally with what it threw
     */
    @SuppressWarnings("unchecked")
    public <T> CompletableFuture<T> schedule(WorkType type, String projectName, String sessionId,
                                             String itemName, WorkTask<T> task, ScheduleOptions options) {
        String key = key(type, projectName, sessionId, itemName);
        QueueEntry toStart = null;
        CompletableFuture<Object> future;

        synchronized (lock) {
            if (shutDown) {
                return CompletableFuture.failedFuture(new RejectedExecutionException("Work queue is shut down: " + key));
            }
            CompletableFuture<Object> existing = inFlight.get(key);
            if (existing != null && !options.forceRefresh()) {
                QueueEntry waiting = pendingByKey.get(key);
                if (waiting != null && options.priority() < waiting.priority()) {
                    waiting.upgradePriority(options.priority());
                    pending.sort(QueueEntry.ORDER);
                    log.debug("Promoted {} to {}", key, Priority.label(options.priority()));
                    if (metrics != null) metrics.recordPriorityUpgrade();
                }
                log.debug("Coalesced request for {}", key);
                if (metrics != null) metrics.recordCoalesced(type.label());
                return (CompletableFuture<T>) existing;
            }

            if (existing != null) {
                log.debug("Force refresh of {} chained after the in-flight run", key);
                ScheduleOptions rerun = new ScheduleOptions(options.priority(), false);
                return existing
                        .handle((result, error) -> null)
                        .thenCompose(ignored -> schedule(type, projectName, sessionId, itemName, task, rerun));
            }

            future = new CompletableFuture<>();
            QueueEntry entry = new QueueEntry(key, type, projectName, sessionId, itemName,
                    options.priority(), clock.millis(), sequence++, task, future);
            inFlight.put(key, future);

            if (activeWorkers < concurrency) {
                markStartedLocked(entry);
                toStart = entry;
            } else {
                insertSortedLocked(entry);
                log.debug("Queued {} at {} ({} pending)", key, Priority.label(entry.priority()), pending.size());
            }
        }

        if (toStart != null) {
            submit(toStart);
        }
        return (CompletableFuture<T>) (CompletableFuture<?>) future;
    }

    public QueueStatus getStatus() {
        synchronized (lock) {
            pruneCompletedLocked();
            List<QueueError> allErrors = new ArrayList<>(errors);
            int from = Math.max(0, allErrors.size() - RECENT_ERRORS);
            return new QueueStatus(
                    pending.stream().map(QueueEntry::snapshot).toList(),
                    List.copyOf(processing.values()),
                    List.copyOf(completed),
                    scannedAt,
                    backgroundRunning,
                    List.copyOf(allErrors.subList(from, allErrors.size())));
        }
    }

    void recordScan(long scannedAtMillis) {
        this.scannedAt = scannedAtMillis;
    }

    void setBackgroundRunning(boolean running) {
        this.backgroundRunning = running;
    }

    /** Binary search for the slot after every entry that sorts before or equal to this one. */
    private void insertSortedLocked(QueueEntry entry) {
        int lo = 0;
        int hi = pending.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (QueueEntry.ORDER.compare(pending.get(mid), entry) <= 0) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        pending.add(lo, entry);
        pendingByKey.put(entry.key(), entry);
    }

    private void markStartedLocked(QueueEntry entry) {
        activeWorkers++;
        processing.put(entry.key(), new ProcessingEntry(entry.key(), entry.type(), entry.projectName(),
                entry.sessionId(), entry.itemName(), entry.priority(), clock.millis()));
    }

    private void submit(QueueEntry entry) {
        try {
            workers.execute(() -> run(entry));
        } catch (RejectedExecutionException e) {
            log.warn("Work queue rejected {}: workers are shut down", entry.key());
            synchronized (lock) {
                activeWorkers--;
                processing.remove(entry.key());
                inFlight.remove(entry.key(), entry.future());
            }
            entry.future().completeExceptionally(e);
        }
    }

    private void run(QueueEntry entry) {
        MdcContext.setWorkItem(entry.type().label(), entry.projectName(), entry.sessionId(), entry.itemName());
        long start = clock.millis();
        try {
            Object result = entry.task().call();
            settle(entry, start, null);
            entry.future().complete(result);
        } catch (Exception e) {
            settle(entry, start, e);
            entry.future().completeExceptionally(e);
        } catch (Error e) {
            settle(entry, start, e);
            entry.future().completeExceptionally(e);
            throw e;
        } finally {
            MdcContext.clear();
        }
    }

    private void settle(QueueEntry entry, long start, Throwable failure) {
        long now = clock.millis();
        long duration = now - start;
        boolean success = failure == null;
        String message = success ? null : describe(failure);
        List<QueueEntry> next;

        synchronized (lock) {
            activeWorkers--;
            processing.remove(entry.key());
            inFlight.remove(entry.key(), entry.future());

            pruneCompletedLocked();
            completed.addFirst(new CompletedEntry(entry.key(), entry.type(), entry.projectName(),
                    entry.sessionId(), entry.itemName(), now, duration, success, message));
            while (completed.size() > COMPLETED_MAX) {
                completed.removeLast();
            }
            if (!success) {
                errors.addLast(new QueueError(entry.key(), message, now));
                while (errors.size() > MAX_ERRORS) {
                    errors.removeFirst();
                }
            }
            next = drainLocked();
        }

        if (success) {
            log.debug("Completed {} in {}ms", entry.key(), duration);
            notifySettled(entry.projectName(), entry.sessionId());
        } else {
            log.warn("Task {} failed after {}ms: {}", entry.key(), duration, message);
        }
        if (metrics != null) metrics.recordTaskDuration(entry.type().label(), success, duration);
        next.forEach(this::submit);
    }

    private List<QueueEntry> drainLocked() {
        List<QueueEntry> started = new ArrayList<>();
        while (activeWorkers < concurrency && !pending.isEmpty()) {
            QueueEntry head = pending.remove(0);
            pendingByKey.remove(head.key());
            markStartedLocked(head);
            started.add(head);
        }
        return started;
    }

    private void pruneCompletedLocked() {
        long cutoff = clock.millis() - historyTtl.toMillis();
        completed.removeIf(e -> e.completedAt() <= cutoff);
    }

    private void notifySettled(String projectName, String sessionId) {
        if (listeners.isEmpty()) {
            return;
        }
        settleDebouncer.trigger(projectName + "/" + sessionId, () -> {
            for (SessionSettledListener listener : listeners) {
                try {
                    listener.onSessionSettled(projectName, sessionId);
                } catch (RuntimeException e) {
                    log.warn("Session listener failed for {}/{}: {}", projectName, sessionId, e.getMessage(), e);
                }
            }
        });
    }

    /**
     * Stops the workers. Work that has not started yet fails with a
     * {@link RejectedExecutionException}, as does anything scheduled afterwards.
     */
    @PreDestroy
    public void shutdown() {
        List<QueueEntry> abandoned;
        synchronized (lock) {
            shutDown = true;
            abandoned = new ArrayList<>(pending);
            pending.clear();
            pendingByKey.clear();
            abandoned.forEach(entry -> inFlight.remove(entry.key(), entry.future()));
        }
        if (!abandoned.isEmpty()) {
            log.info("Work queue shutting down, dropping {} pending task(s)", abandoned.size());
        }
        abandoned.forEach(entry -> entry.future().completeExceptionally(
                new RejectedExecutionException("Work queue shut down before " + entry.key() + " started")));
        settleDebouncer.close();
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Queue workers did not stop within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.toString();
    }

    private static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
