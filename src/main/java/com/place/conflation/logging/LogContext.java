package com.place.conflation.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forRun(runId)) {
 *     log.info("pipeline.completed places={}", places.size());
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a whole conflation run.
     */
    public static LogContext forRun(String runId) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("operation", "conflate");
        return ctx;
    }

    /**
     * Creates a log context for one pipeline stage (normalize, match, resolve).
     */
    public static LogContext forStage(String stage) {
        LogContext ctx = new LogContext();
        ctx.put("stage", stage);
        return ctx;
    }

    /**
     * Creates a log context for the attribute decisions of one matched place.
     */
    public static LogContext forPlace(String placeKey) {
        LogContext ctx = new LogContext();
        ctx.put("placeKey", placeKey);
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
