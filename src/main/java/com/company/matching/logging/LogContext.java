package com.company.matching.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forRun(runId)) {
 *     log.info("pipeline.started registryEntities={}", count);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a whole pipeline run.
     */
    public static LogContext forRun(String runId) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("operation", "match");
        return ctx;
    }

    /**
     * Creates a log context for the review of one candidate by the decision oracle.
     */
    public static LogContext forReview(int position, String webMentionId, String registryNumber) {
        LogContext ctx = new LogContext();
        ctx.put("reviewPosition", Integer.toString(position));
        ctx.put("webMentionId", webMentionId);
        ctx.put("registryNumber", registryNumber);
        ctx.put("operation", "review");
        return ctx;
    }

    /**
     * Generates a unique run ID.
     */
    public static String generateRunId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
