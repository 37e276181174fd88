package com.claudeye.core.transcript;

import com.claudeye.core.evals.LogStats;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;

/**
 * Loads Claude Code JSONL transcripts from the projects directory.
 * Lines that are blank or not valid JSON are skipped.
 */
@Component
public class JsonlSessionLogLoader implements SessionLogLoader {

    private static final Logger log = LoggerFactory.getLogger(JsonlSessionLogLoader.class);

    private final TranscriptProperties properties;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public JsonlSessionLogLoader(TranscriptProperties properties) {
        this.properties = properties;
    }

    @Override
    public SessionLog load(String projectName, String sessionId) throws IOException {
        return read(properties.resolvePath().resolve(projectName).resolve(sessionId + ".jsonl"));
    }

    @Override
    public SessionLog loadSubagent(String projectName, String sessionId, String agentId) throws IOException {
        Path file = SubagentFiles.locate(properties.resolvePath(), projectName, sessionId, agentId)
                .orElseThrow(() -> new FileNotFoundException(
                        "Subagent log agent-" + agentId + " not found for session " + sessionId));
        return read(file);
    }

    SessionLog read(Path file) throws IOException {
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        var rawLines = new ArrayList<String>(lines.size());
        var entries = new ArrayList<JsonNode>(lines.size());
        int skipped = 0;
        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            rawLines.add(line);
            try {
                JsonNode node = objectMapper.readTree(line);
                if (node != null && node.isObject()) {
                    entries.add(node);
                } else {
                    skipped++;
                }
            } catch (JsonProcessingException e) {
                skipped++;
            }
        }
        if (skipped > 0) {
            log.debug("Skipped {} unparseable line(s) in {}", skipped, file);
        }
        return new SessionLog(entries, rawLines, computeStats(entries));
    }

    static LogStats computeStats(List<JsonNode> entries) {
        int user = 0, assistant = 0, toolCalls = 0, subagents = 0, turns = 0;
        var models = new LinkedHashSet<String>();
        for (JsonNode entry : entries) {
            String type = entry.path("type").asText("");
            switch (type) {
                case "user" -> user++;
                case "queue-operation" -> turns++;
                case "assistant" -> {
                    assistant++;
                    JsonNode message = entry.path("message");
                    for (JsonNode block : message.path("content")) {
                        if (!"tool_use".equals(block.path("type").asText())) {
                            continue;
                        }
                        if ("Task".equals(block.path("name").asText())) {
                            subagents++;
                        } else {
                            toolCalls++;
                        }
                    }
                    String model = message.path("model").asText("");
                    if (!model.isEmpty()) {
                        models.add(model);
                    }
                }
                default -> { }
            }
        }
        return new LogStats(turns, user, assistant, toolCalls, subagents, duration(entries), List.copyOf(models));
    }

    private static String duration(List<JsonNode> entries) {
        if (entries.size() < 2) {
            return "";
        }
        try {
            Instant first = Instant.parse(entries.get(0).path("timestamp").asText());
            Instant last = Instant.parse(entries.get(entries.size() - 1).path("timestamp").asText());
            return formatDuration(Duration.between(first, last).toMillis());
        } catch (DateTimeParseException e) {
            return "";
        }
    }

    static String formatDuration(long ms) {
        if (ms < 1000) {
            return ms + "ms";
        }
        double seconds = ms / 1000.0;
        if (seconds < 60) {
            return String.format(Locale.ROOT, "%.1fs", seconds);
        }
        long totalMinutes = (long) (seconds / 60);
        if (totalMinutes >= 60) {
            return (totalMinutes / 60) + "h " + (totalMinutes % 60) + "m";
        }
        return totalMinutes + "m " + Math.round(seconds % 60) + "s";
    }
}
