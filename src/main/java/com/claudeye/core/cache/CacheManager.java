package com.claudeye.core.cache;

import com.claudeye.core.metrics.ClaudeyeMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Validating front of the {@link CacheStore}.
 * <p>
 * Whole-result entries ({@code {kind}/{project}/{sessionKey}}) are valid only
 * while the transcript hash, the evaluation module hash and the set of
 * registered item names are all unchanged. Per-item entries
 * ({@code {kind}/{project}/{sessionKey}/items/{item}}) are validated against
 * the item's own code hash and the transcript hash the caller supplies.
 * <p>
 * Nothing here throws: lookup failures are misses and write failures are dropped.
 * The enabled switch is read once at construction and never changes afterwards.
 */
@Service
public class CacheManager {

    private static final Logger log = LoggerFactory.getLogger(CacheManager.class);

    private final CacheStore store;
    private final ContentHasher hasher;
    private final ClaudeyeMetrics metrics;
    private final boolean enabled;

    public CacheManager(CacheProperties properties,
                        CacheStore store,
                        ContentHasher hasher,
                        @Autowired(required = false) ClaudeyeMetrics metrics) {
        this.store = store;
        this.hasher = hasher;
        this.metrics = metrics;
        this.enabled = properties.isEnabled();
        if (!enabled) {
            log.info("Result cache disabled (claudeye.cache.mode=off)");
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    public ContentHasher hasher() {
        return hasher;
    }

    public <T> Optional<CacheEntry<T>> getWholeResult(CacheKind kind, String projectName, String sessionKey,
                                                      Collection<String> registeredNames, Class<T> valueType) {
        return getWholeResult(kind, projectName, sessionKey, registeredNames, valueType, null);
    }

    /**
     * @param overrideHash content hash to validate against instead of hashing
     *                     {@code {project}/{sessionKey}.jsonl}; may be null
     */
    public <T> Optional<CacheEntry<T>> getWholeResult(CacheKind kind, String projectName, String sessionKey,
                                                      Collection<String> registeredNames, Class<T> valueType,
                                                      String overrideHash) {
        if (!enabled) {
            return Optional.empty();
        }
        Optional<CacheEntry<T>> result = Optional.empty();
        try {
            result = store.<T>get(wholeKey(kind, projectName, sessionKey), valueType)
                    .filter(entry -> {
                        String contentHash = overrideHash != null
                                ? overrideHash
                                : hasher.hashSessionFile(projectName, sessionKey);
                        return isValidWhole(entry.meta(), contentHash, hasher.hashModule(), registeredNames);
                    });
        } catch (RuntimeException e) {
            log.debug("Whole-result lookup failed for {}/{}: {}", projectName, sessionKey, e.getMessage());
            result = Optional.empty();
        }
        recordLookup(kind, "whole", result.isPresent());
        return result;
    }

    public <T> void setWholeResult(CacheKind kind, String projectName, String sessionKey, T value,
                                   Collection<String> registeredNames) {
        setWholeResult(kind, projectName, sessionKey, value, registeredNames, null);
    }

    public <T> void setWholeResult(CacheKind kind, String projectName, String sessionKey, T value,
                                   Collection<String> registeredNames, String overrideHash) {
        if (!enabled) {
            return;
        }
        try {
            String contentHash = overrideHash != null
                    ? overrideHash
                    : hasher.hashSessionFile(projectName, sessionKey);
            if (contentHash.isEmpty()) {
                log.debug("Not caching {} for {}/{}: transcript hash unavailable", kind.segment(), projectName, sessionKey);
                return;
            }
            CacheMeta meta = new CacheMeta(Instant.now().toString(), contentHash, hasher.hashModule(),
                    List.copyOf(registeredNames), null);
            store.set(wholeKey(kind, projectName, sessionKey), value, meta);
        } catch (RuntimeException e) {
            log.warn("Failed to cache {} for {}/{}: {}", kind.segment(), projectName, sessionKey, e.getMessage());
        }
    }

    public <T> Optional<CacheEntry<T>> getPerItem(CacheKind kind, String projectName, String sessionKey,
                                                  String itemName, String itemCodeHash, String contentHash,
                                                  Class<T> valueType) {
        if (!enabled || contentHash == null || contentHash.isEmpty()) {
            return Optional.empty();
        }
        Optional<CacheEntry<T>> result;
        try {
            result = store.<T>get(itemKey(kind, projectName, sessionKey, itemName), valueType)
                    .filter(entry -> contentHash.equals(entry.meta().contentHash())
                            && Objects.equals(itemCodeHash, entry.meta().itemCodeHash()));
        } catch (RuntimeException e) {
            log.debug("Per-item lookup failed for {}/{}/{}: {}", projectName, sessionKey, itemName, e.getMessage());
            result = Optional.empty();
        }
        recordLookup(kind, "item", result.isPresent());
        return result;
    }

    public <T> void setPerItem(CacheKind kind, String projectName, String sessionKey, String itemName,
                               String itemCodeHash, T value, String contentHash) {
        if (!enabled || contentHash == null || contentHash.isEmpty()) {
            return;
        }
        try {
            CacheMeta meta = new CacheMeta(Instant.now().toString(), contentHash, hasher.hashModule(),
                    List.of(itemName), itemCodeHash);
            store.set(itemKey(kind, projectName, sessionKey, itemName), value, meta);
        } catch (RuntimeException e) {
            log.warn("Failed to cache {} item {} for {}/{}: {}",
                    kind.segment(), itemName, projectName, sessionKey, e.getMessage());
        }
    }

    /** Drops every cached result of one kind for a project. */
    public void invalidateProject(CacheKind kind, String projectName) {
        store.invalidateByPrefix(kind.segment() + "/" + projectName + "/");
    }

    public void clearAll() {
        store.clearAll();
    }

    public void close() {
        store.close();
    }

    static String wholeKey(CacheKind kind, String projectName, String sessionKey) {
        return kind.segment() + "/" + projectName + "/" + sessionKey;
    }

    static String itemKey(CacheKind kind, String projectName, String sessionKey, String itemName) {
        return wholeKey(kind, projectName, sessionKey) + "/items/"
                + URLEncoder.encode(itemName, StandardCharsets.UTF_8);
    }

    private static boolean isValidWhole(CacheMeta meta, String contentHash, String moduleHash,
                                        Collection<String> registeredNames) {
        if (contentHash.isEmpty() || !contentHash.equals(meta.contentHash())) {
            return false;
        }
        if (!Objects.equals(moduleHash, meta.evalsModuleHash())) {
            return false;
        }
        List<String> cached = meta.registeredNames().stream().sorted().toList();
        List<String> current = registeredNames.stream().sorted().toList();
        return cached.equals(current);
    }

    private void recordLookup(CacheKind kind, String granularity, boolean hit) {
        log.debug("Cache {} {} lookup: {}", kind.segment(), granularity, hit ? "hit" : "miss");
        if (metrics != null) {
            metrics.recordCacheLookup(kind.segment(), granularity, hit);
        }
    }
}
