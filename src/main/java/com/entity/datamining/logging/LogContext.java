package com.entity.datamining.logging;

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
 * try (LogContext ctx = LogContext.forRequest(correlationId, "fetch")) {
 *     log.info("fetch.local entityType={} entityId={} field={}", type, id, field);
 * } // MDC entries are cleared here
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a routed request.
     */
    public static LogContext forRequest(String correlationId, String requestType) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("requestType", requestType);
        ctx.put("operation", "request");
        return ctx;
    }

    /**
     * Creates a log context for a background enrichment task.
     */
    public static LogContext forTask(String entityType, String field, String referenceId) {
        LogContext ctx = new LogContext();
        ctx.put("entityType", entityType);
        ctx.put("field", field);
        ctx.put("referenceId", referenceId);
        ctx.put("operation", "enrich");
        return ctx;
    }

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
