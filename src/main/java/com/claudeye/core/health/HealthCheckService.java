package com.claudeye.core.health;

import com.claudeye.core.cache.CacheManager;
import com.claudeye.core.cache.CacheProperties;
import com.claudeye.core.scheduler.WorkScheduler;
import com.claudeye.core.transcript.TranscriptProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private final CacheManager cacheManager;
    private final CacheProperties cacheProperties;
    private final TranscriptProperties transcriptProperties;
    private final WorkScheduler workScheduler;

    public HealthCheckService(
            @Autowired(required = false) CacheManager cacheManager,
            CacheProperties cacheProperties,
            TranscriptProperties transcriptProperties,
            @Autowired(required = false) WorkScheduler workScheduler) {
        this.cacheManager = cacheManager;
        this.cacheProperties = cacheProperties;
        this.transcriptProperties = transcriptProperties;
        this.workScheduler = workScheduler;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkProjects());
        results.add(checkCache());
        results.add(checkQueue());
        return results;
    }

    private HealthStatus checkProjects() {
        Path projects = transcriptProperties.resolvePath();
        if (Files.isDirectory(projects) && Files.isReadable(projects)) {
            return new HealthStatus("projects", HealthStatus.Status.UP,
                    "Projects directory readable", Map.of("path", projects.toString()));
        }
        return new HealthStatus("projects", HealthStatus.Status.DOWN,
                "Projects directory not found: " + projects, Map.of("path", projects.toString()));
    }

    private HealthStatus checkCache() {
        if (cacheManager == null) {
            return new HealthStatus("cache", HealthStatus.Status.DOWN,
                    "Cache manager not available", Map.of());
        }
        if (!cacheManager.isEnabled()) {
            return new HealthStatus("cache", HealthStatus.Status.DEGRADED,
                    "Caching disabled (CLAUDEYE_CACHE=off)", Map.of());
        }
        Path root = cacheProperties.resolveRoot();
        Path existing = root;
        while (existing != null && !Files.exists(existing)) {
            existing = existing.getParent();
        }
        if (existing != null && Files.isWritable(existing)) {
            return new HealthStatus("cache", HealthStatus.Status.UP,
                    "Cache directory writable", Map.of("path", root.toString()));
        }
        return new HealthStatus("cache", HealthStatus.Status.DEGRADED,
                "Cache directory not writable, results will not persist", Map.of("path", root.toString()));
    }

    private HealthStatus checkQueue() {
        if (workScheduler == null) {
            return new HealthStatus("queue", HealthStatus.Status.DOWN,
                    "Work queue not available", Map.of());
        }
        var status = workScheduler.getStatus();
        return new HealthStatus("queue", HealthStatus.Status.UP,
                status.processing().size() + " processing, " + status.pending().size() + " pending",
                Map.of("concurrency", String.valueOf(workScheduler.concurrency()),
                        "backgroundRunning", String.valueOf(status.backgroundRunning())));
    }
}
