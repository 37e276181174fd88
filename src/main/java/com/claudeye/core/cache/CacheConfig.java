package com.claudeye.core.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the disk store under {@code {cache root}/{projects path hash}} so two
 * projects roots never share entries.
 */
@Configuration
public class CacheConfig {

    private static final Logger log = LoggerFactory.getLogger(CacheConfig.class);

    @Bean
    public CacheStore cacheStore(CacheProperties properties, ContentHasher hasher) {
        var root = properties.resolveRoot().resolve(hasher.hashDirectoryPath());
        log.info("Result cache directory: {}", root);
        return new LocalCacheStore(root);
    }
}
