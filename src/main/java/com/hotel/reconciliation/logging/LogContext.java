package com.hotel.reconciliation.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper. Keys added through a context are removed when it closes.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forRun(runId)) {
 *     log.info("reconciliation.started runId={}", runId);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a whole reconciliation run.
     */
    public static LogContext forRun(String runId) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("operation", "reconcile");
        return ctx;
    }

    /**
     * Creates a log context for one pipeline stage; nest it inside {@link #forRun}.
     */
    public static LogContext forStage(String stage) {
        LogContext ctx = new LogContext();
        ctx.put("stage", stage);
        return ctx;
    }

    public static String generateRunId() {
        return UUID.randomUUID().toString();
    }

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
