package com.claudeye.core.transcript;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Location of the Claude Code projects directory ({@code CLAUDE_PROJECTS_PATH}).
 */
@Component
@ConfigurationProperties(prefix = "claudeye.projects")
public class TranscriptProperties {

    private String path = "";

    public String getPath() { return path; }
    public void setPath(String path) { this.path = path; }

    /**
     * Returns the absolute projects directory, falling back to
     * {@code ~/.claude/projects} when no path is configured.
     */
    public Path resolvePath() {
        Path resolved = (path == null || path.isBlank())
                ? Path.of(System.getProperty("user.home"), ".claude", "projects")
                : Path.of(path);
        return resolved.toAbsolutePath().normalize();
    }
}
