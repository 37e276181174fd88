package com.claudeye.core.cache;

/**
 * A cached value together with the metadata used to validate it.
 * Entries are replaced wholesale on every write, never updated in place.
 */
public record CacheEntry<T>(T value, CacheMeta meta) {}
