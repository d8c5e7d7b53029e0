package io.leasekeep.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.leasekeep.util.Hashing;
import io.leasekeep.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class AuditLogger {
    private final Path auditFile;
    private final String namespace;
    private final Clock clock;
    private String previousHash;

    public AuditLogger(Path auditFile, String namespace, Clock clock) {
        this.auditFile = auditFile;
        this.namespace = namespace == null || namespace.isBlank() ? "default" : namespace.trim();
        this.clock = clock;
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.ofEpochMilli(clock.millis()).toString());
        row.put("namespace", namespace);
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("details", event.details());
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    public synchronized List<JsonNode> tail(int limit) {
        int safeLimit = Math.max(1, limit);
        try {
            List<String> lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
            List<JsonNode> out = new ArrayList<>();
            for (int i = Math.max(0, lines.size() - safeLimit); i < lines.size(); i++) {
                String line = lines.get(i);
                if (line != null && !line.isBlank()) {
                    out.add(Jsons.compact().readTree(line));
                }
            }
            return out;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log", e);
        }
    }

    private String loadLastHash() {
        try {
            String last = "";
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            return Jsons.compact().readTree(last).path("hash").asText("");
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log tail: " + auditFile, e);
        }
    }

    public record AuditEvent(
            String action,
            String actor,
            String resource,
            String result,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String actor, String resource, String result, Map<String, Object> details) {
            return new AuditEvent(action, actor, resource, result, details == null ? Map.of() : details);
        }
    }
}
