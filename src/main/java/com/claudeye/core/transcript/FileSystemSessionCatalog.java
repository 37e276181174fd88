package com.claudeye.core.transcript;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Lists {@code {projects}/{project}/{sessionId}.jsonl} files. Subagent logs
 * ({@code agent-*.jsonl}) and files without a session UUID in their name are ignored.
 */
@Component
public class FileSystemSessionCatalog implements SessionCatalog {

    private static final Logger log = LoggerFactory.getLogger(FileSystemSessionCatalog.class);
    private static final Pattern SESSION_FILE = Pattern.compile(
            "([0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12})\\.jsonl");

    private final TranscriptProperties properties;

    public FileSystemSessionCatalog(TranscriptProperties properties) {
        this.properties = properties;
    }

    @Override
    public List<SessionRef> listSessions() {
        Path root = properties.resolvePath();
        if (!Files.isDirectory(root)) {
            log.debug("Projects directory {} does not exist", root);
            return List.of();
        }
        var sessions = new ArrayList<SessionRef>();
        try (Stream<Path> projects = Files.list(root)) {
            for (Path project : projects.filter(Files::isDirectory).toList()) {
                collectSessions(project, sessions);
            }
        } catch (IOException e) {
            log.warn("Failed to list projects in {}: {}", root, e.getMessage());
        }
        sessions.sort(Comparator.comparing(SessionRef::lastModified).reversed());
        return sessions;
    }

    private void collectSessions(Path projectDir, List<SessionRef> out) {
        String projectName = projectDir.getFileName().toString();
        try (Stream<Path> files = Files.list(projectDir)) {
            for (Path file : files.filter(Files::isRegularFile).toList()) {
                String name = file.getFileName().toString();
                if (name.startsWith("agent-")) {
                    continue;
                }
                var matcher = SESSION_FILE.matcher(name);
                if (!matcher.matches()) {
                    continue;
                }
                try {
                    out.add(new SessionRef(projectName, matcher.group(1),
                            Files.getLastModifiedTime(file).toInstant()));
                } catch (IOException e) {
                    log.debug("Skipping {}: {}", file, e.getMessage());
                }
            }
        } catch (IOException e) {
            log.warn("Failed to list sessions in {}: {}", projectDir, e.getMessage());
        }
    }
}
