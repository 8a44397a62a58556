package com.entity.reconciliation.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and automatically removes them on close.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forReconcile(correlationId, "asset", key, "merge")) {
 *     log.info("reconcile.completed key={} status={}", key, status);
 * } // MDC entries are automatically cleared
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a merge or visit of two observations.
     */
    public static LogContext forReconcile(String correlationId, String modelType, String key, String mode) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("modelType", modelType);
        ctx.put("modelKey", key);
        ctx.put("operation", mode);
        return ctx;
    }

    /**
     * Creates a log context for decoding an envelope.
     */
    public static LogContext forDecode(String correlationId, String format) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("codecFormat", format);
        ctx.put("operation", "decode");
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
