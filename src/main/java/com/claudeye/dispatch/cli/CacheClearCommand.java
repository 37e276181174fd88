package com.claudeye.dispatch.cli;

import com.claudeye.core.cache.CacheProperties;
import com.claudeye.core.cache.LocalCacheStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: claudeye cache-clear
 * <p>
 * Removes the whole cache directory, for every projects root.
 */
@Command(name = "cache-clear", mixinStandardHelpOptions = true, description = "Delete all cached results")
@Component
public class CacheClearCommand implements Runnable {

    private final CacheProperties cacheProperties;

    public CacheClearCommand(CacheProperties cacheProperties) {
        this.cacheProperties = cacheProperties;
    }

    @Override
    public void run() {
        var root = cacheProperties.resolveRoot();
        new LocalCacheStore(root).clearAll();
        ConsoleOutput.success("Cache cleared: " + root);
    }
}
