package com.diagnosis.correlation.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper for structured logging.
 * Adds key-value pairs to the SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forCorrelation(runId)) {
 *     log.info("graph.built entities={}", count);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    public static final String RUN_ID = "runId";
    public static final String OPERATION = "operation";

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forCorrelation(String runId) {
        return forOperation(runId, "correlate");
    }

    public static LogContext forValidation(String runId) {
        return forOperation(runId, "validate");
    }

    public static LogContext forPlanning(String runId, String strategy) {
        return forOperation(runId, "plan").with("strategy", strategy);
    }

    public static LogContext forReport(String runId, String format) {
        return forOperation(runId, "report").with("format", format);
    }

    private static LogContext forOperation(String runId, String operation) {
        LogContext ctx = new LogContext();
        ctx.put(RUN_ID, runId);
        ctx.put(OPERATION, operation);
        return ctx;
    }

    /**
     * Generates a unique run id.
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
