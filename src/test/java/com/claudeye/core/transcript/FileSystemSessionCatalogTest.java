package com.claudeye.core.transcript;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileSystemSessionCatalogTest {

    private static final String OLD = "11111111-1111-1111-1111-111111111111";
    private static final String NEW = "22222222-2222-2222-2222-222222222222";

    @TempDir
    Path tempDir;

    private FileSystemSessionCatalog catalogAt(Path root) {
        TranscriptProperties properties = new TranscriptProperties();
        properties.setPath(root.toString());
        return new FileSystemSessionCatalog(properties);
    }

    private void touch(String relative, long mtime) throws Exception {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "{}\n");
        Files.setLastModifiedTime(file, FileTime.fromMillis(mtime));
    }

    @Test
    @DisplayName("lists sessions across projects, newest first")
    void newestFirst() throws Exception {
        touch("alpha/" + OLD + ".jsonl", 1_000_000L);
        touch("beta/" + NEW + ".jsonl", 2_000_000L);

        List<SessionRef> sessions = catalogAt(tempDir).listSessions();

        assertEquals(2, sessions.size());
        assertEquals(NEW, sessions.get(0).sessionId());
        assertEquals("beta", sessions.get(0).projectName());
        assertEquals(OLD, sessions.get(1).sessionId());
    }

    @Test
    @DisplayName("ignores subagent logs and files without a session id")
    void ignoresNonSessions() throws Exception {
        touch("alpha/" + OLD + ".jsonl", 1_000_000L);
        touch("alpha/agent-abc.jsonl", 1_000_000L);
        touch("alpha/notes.jsonl", 1_000_000L);
        touch("alpha/" + NEW + ".txt", 1_000_000L);
        touch("alpha/" + OLD + "/subagents/agent-x.jsonl", 1_000_000L);

        List<SessionRef> sessions = catalogAt(tempDir).listSessions();

        assertEquals(1, sessions.size());
        assertEquals(OLD, sessions.get(0).sessionId());
    }

    @Test
    @DisplayName("missing projects directory yields no sessions")
    void missingRoot() {
        assertTrue(catalogAt(tempDir.resolve("missing")).listSessions().isEmpty());
    }
}
