package com.claudeye.core.cache;

import java.util.Optional;

/**
 * Key/value storage behind {@link CacheManager}. Keys are slash-separated
 * paths such as {@code evals/my-project/1234-abcd}.
 * <p>
 * Implementations must not throw from any method: read failures are misses
 * and write failures are dropped.
 */
public interface CacheStore extends AutoCloseable {

    <T> Optional<CacheEntry<T>> get(String key, Class<T> valueType);

    /** Stores (or overwrites) the entry for {@code key}. */
    <T> void set(String key, T value, CacheMeta meta);

    /** Removes one entry; a missing key is not an error. */
    void invalidate(String key);

    /**
     * Removes every entry whose key starts with {@code prefix}. A prefix ending
     * in {@code /} drops a whole directory level, e.g. every session of a project.
     */
    void invalidateByPrefix(String prefix);

    /** Removes all entries, including the storage directory itself. */
    void clearAll();

    @Override
    void close();
}
