package com.catalog.crossmatch.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper. Keys added through it are removed on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forRun(runId)) {
 *     log.info("crossmatch.run.started targets={}", n);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    public static final String RUN_ID = "runId";
    public static final String ROUND = "round";
    public static final String STAGE = "stage";

    private final List<String> keys = new ArrayList<>();
    private final List<String> previousValues = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forRun(String runId) {
        LogContext ctx = new LogContext();
        ctx.put(RUN_ID, runId);
        ctx.put(STAGE, "setup");
        return ctx;
    }

    /**
     * Context for one round; replaces the stage of an enclosing run context until closed.
     */
    public static LogContext forRound(int round) {
        LogContext ctx = new LogContext();
        ctx.put(ROUND, Integer.toString(round));
        ctx.put(STAGE, "matching");
        return ctx;
    }

    public static LogContext forStage(String stage) {
        LogContext ctx = new LogContext();
        ctx.put(STAGE, stage);
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
        String previous = MDC.get(key);
        keys.add(key);
        previousValues.add(previous);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (int i = keys.size() - 1; i >= 0; i--) {
            String previous = previousValues.get(i);
            if (previous != null) {
                MDC.put(keys.get(i), previous);
            } else {
                MDC.remove(keys.get(i));
            }
        }
        keys.clear();
        previousValues.clear();
    }
}
