package com.entity.linking.logging;

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
 * try (LogContext ctx = LogContext.forLinking(correlationId, "Apple")) {
 *     log.info("entity.linked canonicalName={} confidence={}", name, confidence);
 * } // MDC entries are cleared here
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a single-mention linking operation.
     */
    public static LogContext forLinking(String correlationId, String mention) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("mention", mention);
        ctx.put("operation", "link");
        return ctx;
    }

    /**
     * Creates a log context for a batch pipeline run.
     */
    public static LogContext forBatch(String batchId) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put("operation", "batch");
        return ctx;
    }

    /**
     * Creates a log context for one chunk of a batch stage.
     */
    public static LogContext forChunk(String stage, int chunkIndex) {
        LogContext ctx = new LogContext();
        ctx.put("stage", stage);
        ctx.put("chunk", Integer.toString(chunkIndex));
        return ctx;
    }

    /**
     * Generates a unique correlation ID.
     */
    public static String generateCorrelationId() {
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
