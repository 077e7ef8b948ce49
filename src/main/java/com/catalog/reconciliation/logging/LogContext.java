package com.catalog.reconciliation.logging;

import com.catalog.reconciliation.core.model.Provider;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forPipeline(LogContext.generateRunId())) {
 *     log.info("pipeline.completed items={}", count);
 * }
 * </pre>
 *
 * MDC is thread-local: work handed to another thread does not inherit these keys.
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for one pipeline run.
     */
    public static LogContext forPipeline(String runId) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("operation", "pipeline");
        return ctx;
    }

    /**
     * Creates a log context for a snapshot resync of one provider.
     */
    public static LogContext forResync(Provider provider) {
        LogContext ctx = new LogContext();
        ctx.put("provider", provider.id());
        ctx.put("operation", "resync");
        return ctx;
    }

    /**
     * Creates a log context for a fetch of one provider within a run.
     */
    public static LogContext forFetch(String runId, Provider provider) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("provider", provider.id());
        ctx.put("operation", "fetch");
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
