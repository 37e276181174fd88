package com.claudeye.core.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Per-key trailing debounce: each trigger cancels the pending run for its key
 * and re-arms the timer, so a burst runs the action once after it goes quiet.
 */
final class Debouncer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Debouncer.class);

    private final Duration delay;
    private final ScheduledExecutorService timer;
    private final Map<String, Slot> pending = new ConcurrentHashMap<>();

    Debouncer(Duration delay, String threadName) {
        this.delay = delay;
        this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        });
    }

    void trigger(String key, Runnable action) {
        pending.compute(key, (k, existing) -> {
            if (existing != null && existing.future != null) {
                existing.future.cancel(false);
            }
            Slot slot = new Slot();
            slot.future = timer.schedule(() -> run(k, slot, action), delay.toMillis(), TimeUnit.MILLISECONDS);
            return slot;
        });
    }

    private void run(String key, Slot slot, Runnable action) {
        pending.remove(key, slot);
        try {
            action.run();
        } catch (RuntimeException e) {
            log.warn("Debounced action for {} failed: {}", key, e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        timer.shutdownNow();
        pending.clear();
    }

    private static final class Slot {
        volatile ScheduledFuture<?> future;
    }
}
