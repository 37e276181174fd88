package com.claudeye.core.transcript;

import com.claudeye.core.evals.LogStats;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.FileNotFoundException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonlSessionLogLoaderTest {

    @TempDir
    Path tempDir;

    private JsonlSessionLogLoader loader;

    @BeforeEach
    void setUp() {
        TranscriptProperties properties = new TranscriptProperties();
        properties.setPath(tempDir.toString());
        loader = new JsonlSessionLogLoader(properties);
    }

    private void write(String relative, String... lines) throws Exception {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, String.join("\n", lines) + "\n");
    }

    @Test
    @DisplayName("parses entries and skips blank or malformed lines")
    void skipsBadLines() throws Exception {
        write("proj/sess.jsonl",
                "{\"type\":\"user\",\"timestamp\":\"2026-01-01T00:00:00Z\"}",
                "",
                "not json at all",
                "[1,2,3]",
                "{\"type\":\"assistant\",\"timestamp\":\"2026-01-01T00:01:30Z\"}");

        SessionLog sessionLog = loader.load("proj", "sess");

        assertEquals(2, sessionLog.entries().size());
        assertEquals(4, sessionLog.rawLines().size());
        assertEquals("1m 30s", sessionLog.stats().duration());
    }

    @Test
    @DisplayName("stats count messages, tool calls, subagents and models")
    void computesStats() throws Exception {
        write("proj/sess.jsonl",
                "{\"type\":\"queue-operation\"}",
                "{\"type\":\"user\"}",
                "{\"type\":\"assistant\",\"message\":{\"model\":\"claude-opus\",\"content\":["
                        + "{\"type\":\"tool_use\",\"name\":\"Read\"},"
                        + "{\"type\":\"tool_use\",\"name\":\"Task\"},"
                        + "{\"type\":\"text\",\"text\":\"hi\"}]}}",
                "{\"type\":\"assistant\",\"message\":{\"model\":\"claude-haiku\",\"content\":["
                        + "{\"type\":\"tool_use\",\"name\":\"Bash\"}]}}",
                "{\"type\":\"assistant\",\"message\":{\"model\":\"claude-opus\",\"content\":[]}}");

        LogStats stats = loader.load("proj", "sess").stats();

        assertEquals(1, stats.turnCount());
        assertEquals(1, stats.userCount());
        assertEquals(3, stats.assistantCount());
        assertEquals(2, stats.toolCallCount());
        assertEquals(1, stats.subagentCount());
        assertEquals(List.of("claude-opus", "claude-haiku"), stats.models());
        assertEquals("", stats.duration());
    }

    @Test
    @DisplayName("missing session file is reported")
    void missingSession() {
        assertThrows(NoSuchFileException.class, () -> loader.load("proj", "nope"));
    }

    @Test
    @DisplayName("subagent logs are found in any of the known locations")
    void subagentLocations() throws Exception {
        write("proj/agent-flat.jsonl", "{\"type\":\"user\"}");
        write("proj/sess/agent-nested.jsonl", "{\"type\":\"user\"}", "{\"type\":\"user\"}");
        write("proj/sess/subagents/agent-deep.jsonl", "{\"type\":\"assistant\"}");

        assertEquals(1, loader.loadSubagent("proj", "sess", "flat").stats().userCount());
        assertEquals(2, loader.loadSubagent("proj", "sess", "nested").stats().userCount());
        assertEquals(1, loader.loadSubagent("proj", "sess", "deep").stats().assistantCount());
        assertThrows(FileNotFoundException.class, () -> loader.loadSubagent("proj", "sess", "ghost"));
    }

    @Test
    @DisplayName("durations are formatted like the dashboard shows them")
    void formatsDuration() {
        assertEquals("500ms", JsonlSessionLogLoader.formatDuration(500));
        assertEquals("1.5s", JsonlSessionLogLoader.formatDuration(1500));
        assertEquals("1m 2s", JsonlSessionLogLoader.formatDuration(61_500));
        assertEquals("2h 5m", JsonlSessionLogLoader.formatDuration(7_500_000));
    }
}
