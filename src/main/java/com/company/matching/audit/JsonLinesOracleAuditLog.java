package com.company.matching.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * Newline-delimited JSON audit log. Each line is {@code {"prompt": ..., "response": ...}}.
 * The file and its parent directories are created on first write; existing content is never rewritten.
 */
public class JsonLinesOracleAuditLog implements OracleAuditLog {
    private static final Logger log = LoggerFactory.getLogger(JsonLinesOracleAuditLog.class);

    public static final Path DEFAULT_PATH = Path.of("data", "llm_match_logs.jsonl");

    private final Path path;
    private final ObjectMapper objectMapper;

    public JsonLinesOracleAuditLog() {
        this(DEFAULT_PATH);
    }

    public JsonLinesOracleAuditLog(Path path) {
        this.path = Objects.requireNonNull(path, "path is required");
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public synchronized void append(OracleAuditEntry entry) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            String line = objectMapper.writeValueAsString(entry) + "\n";
            try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE)) {
                writer.write(line);
            }
            log.debug("Audit entry appended to {}", path);
        } catch (IOException e) {
            throw new AuditLogException("Could not append to audit log " + path, e);
        }
    }

    public Path getPath() {
        return path;
    }
}
