package com.claudeye.core.cache;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

@Component
@ConfigurationProperties(prefix = "claudeye.cache")
public class CacheProperties {

    /** {@code off} disables caching; anything else (or nothing) enables it. */
    private String mode = "on";
    private String path = "";

    public String getMode() { return mode; }
    public void setMode(String mode) { this.mode = mode; }
    public String getPath() { return path; }
    public void setPath(String path) { this.path = path; }

    public boolean isEnabled() {
        return mode == null || !"off".equals(mode.trim());
    }

    /**
     * Root directory of the on-disk cache before per-projects-path namespacing.
     * Defaults to {@code ~/.claudeye/cache}.
     */
    public Path resolveRoot() {
        Path resolved = (path == null || path.isBlank())
                ? Path.of(System.getProperty("user.home"), ".claudeye", "cache")
                : Path.of(path);
        return resolved.toAbsolutePath().normalize();
    }
}
