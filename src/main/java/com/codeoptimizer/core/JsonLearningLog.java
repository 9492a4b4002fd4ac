package com.codeoptimizer.core;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.codeoptimizer.api.LearningEntry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Learning log stored as one JSON object per line.
 */
public class JsonLearningLog implements LearningLog {
    private final Path file;
    private final ObjectMapper mapper = new ObjectMapper();

    public JsonLearningLog(Path file) {
        this.file = file;
    }

    public Path getFile() {
        return file;
    }

    @Override
    public synchronized void append(List<LearningEntry> entries) throws IOException {
        if (entries.isEmpty()) {
            return;
        }

        StringBuilder lines = new StringBuilder();
        for (LearningEntry entry : entries) {
            Map<String, Object> json = new LinkedHashMap<>();
            json.put("type", entry.getType());
            json.put("description", entry.getDescription());
            json.put("succeeded", entry.isSucceeded());
            json.put("reason", entry.getReason());
            json.put("timestamp", entry.getTimestamp() != null ? entry.getTimestamp().toString() : null);
            lines.append(mapper.writeValueAsString(json)).append('\n');
        }

        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, lines, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }

    @Override
    public synchronized List<LearningEntry> readAll() throws IOException {
        List<LearningEntry> entries = new ArrayList<>();
        if (!Files.exists(file)) {
            return entries;
        }

        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            if (line.isBlank()) {
                continue;
            }
            JsonNode node = mapper.readTree(line);
            entries.add(new LearningEntry(
                    _text(node, "type"),
                    _text(node, "description"),
                    node.path("succeeded").asBoolean(false),
                    _text(node, "reason"),
                    _timestamp(_text(node, "timestamp"))));
        }
        return entries;
    }

    private static String _text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static Instant _timestamp(String value) throws IOException {
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new IOException("Invalid timestamp in learning log: " + value, e);
        }
    }
}
