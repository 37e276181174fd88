package com.claudeye.core.cache;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Validation data stored next to every cached value.
 *
 * @param cachedAt        ISO-8601 instant the value was written
 * @param contentHash     hash of the transcript the value was computed from
 * @param evalsModuleHash hash of the evaluation module at write time (whole-result entries)
 * @param registeredNames item names registered at write time (whole-result entries)
 * @param itemCodeHash    hash of the single item's code (per-item entries only, otherwise null)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CacheMeta(
    String cachedAt,
    String contentHash,
    String evalsModuleHash,
    List<String> registeredNames,
    String itemCodeHash
) {
    public CacheMeta {
        registeredNames = registeredNames == null ? List.of() : List.copyOf(registeredNames);
    }
}
