package com.stockpipe.core;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Captures a single pipeline run's step timings and counters.
 */
public final class RunTelemetry {
    public static final String STEP_VERIFY_WINDOW = "VERIFY_WINDOW";
    public static final String STEP_FETCH_METADATA = "FETCH_METADATA";
    public static final String STEP_FETCH_PRICES = "FETCH_PRICES";
    public static final String STEP_BACKUP_VERIFY = "BACKUP_VERIFY";
    public static final String STEP_SCORE_SELECT = "SCORE_SELECT";
    public static final String STEP_ARCHIVE_WRITE = "ARCHIVE_WRITE";
    public static final String STEP_PUBLISH_MANIFEST = "PUBLISH_MANIFEST";

    private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_INSTANT;

    private final String runId;
    private final String executionMode;
    private final String trigger;
    private final Instant startedAt;
    private Instant finishedAt;
    private int errorsTotal;

    private final Map<String, StepStat> steps = new LinkedHashMap<>();
    private final Map<String, Deque<Long>> stepStartsNanos = new HashMap<>();

    public RunTelemetry(String runId, String executionMode, String trigger, Instant startedAt) {
        this.runId = blankTo(runId, "run");
        this.executionMode = blankTo(executionMode, "IDLE");
        this.trigger = blankTo(trigger, "manual");
        this.startedAt = startedAt == null ? Instant.now() : startedAt;
        this.finishedAt = null;
        this.errorsTotal = 0;
    }

    public synchronized Instant startedAt() {
        return startedAt;
    }

    public synchronized void startStep(String name) {
        String key = sanitizeStepName(name);
        steps.putIfAbsent(key, new StepStat(key));
        stepStartsNanos.computeIfAbsent(key, ignored -> new ArrayDeque<>()).push(System.nanoTime());
    }

    public synchronized long endStep(String name, long itemsIn, long itemsOut, long errorCount) {
        return endStep(name, itemsIn, itemsOut, errorCount, "");
    }

    /**
     * Closes the innermost open timing of {@code name} and returns its elapsed milliseconds.
     */
    public synchronized long endStep(
            String name,
            long itemsIn,
            long itemsOut,
            long errorCount,
            String optionalNote
    ) {
        String key = sanitizeStepName(name);
        StepStat stat = steps.computeIfAbsent(key, StepStat::new);
        long startedNanos = 0L;
        Deque<Long> stack = stepStartsNanos.get(key);
        if (stack != null && !stack.isEmpty()) {
            startedNanos = stack.pop();
        }
        long elapsedMs = startedNanos <= 0L
                ? 0L
                : Math.max(0L, (System.nanoTime() - startedNanos) / 1_000_000L);
        stat.elapsedMs += elapsedMs;
        stat.itemsIn += Math.max(0L, itemsIn);
        stat.itemsOut += Math.max(0L, itemsOut);
        stat.errorCount += Math.max(0L, errorCount);
        appendNote(stat, optionalNote);
        if (errorCount > 0L) {
            errorsTotal += (int) Math.max(0L, errorCount);
        }
        return elapsedMs;
    }

    public synchronized int errorsTotal() {
        return errorsTotal;
    }

    public synchronized void finish() {
        if (finishedAt == null) {
            finishedAt = Instant.now();
        }
    }

    public synchronized long totalElapsedMs() {
        Instant end = finishedAt == null ? Instant.now() : finishedAt;
        return Math.max(0L, Duration.between(startedAt, end).toMillis());
    }

    public synchronized List<StepRecord> stepRecords() {
        List<StepRecord> out = new ArrayList<>();
        for (StepStat stat : steps.values()) {
            out.add(new StepRecord(
                    stat.name,
                    stat.elapsedMs,
                    stat.itemsIn,
                    stat.itemsOut,
                    stat.errorCount,
                    stat.optionalNote
            ));
        }
        return out;
    }

    public synchronized String getSummary() {
        Instant end = finishedAt == null ? Instant.now() : finishedAt;
        StringBuilder sb = new StringBuilder();
        sb.append("run_id=").append(runId).append('\n');
        sb.append("execution_mode=").append(executionMode).append('\n');
        sb.append("trigger=").append(trigger).append('\n');
        sb.append("started_at=").append(ISO.format(startedAt)).append('\n');
        sb.append("finished_at=").append(ISO.format(end)).append('\n');
        sb.append("total_elapsed_ms=").append(Math.max(0L, Duration.between(startedAt, end).toMillis())).append('\n');
        sb.append("errors_total=").append(errorsTotal).append('\n');
        sb.append("steps:\n");
        for (StepStat stat : steps.values()) {
            sb.append(String.format(
                    Locale.US,
                    "  %s elapsed_ms=%d in=%d out=%d err=%d",
                    stat.name,
                    stat.elapsedMs,
                    stat.itemsIn,
                    stat.itemsOut,
                    stat.errorCount
            ));
            if (stat.optionalNote != null && !stat.optionalNote.isBlank()) {
                sb.append(" note=").append(stat.optionalNote.trim());
            }
            sb.append('\n');
        }
        return sb.toString().trim();
    }

    private void appendNote(StepStat stat, String optionalNote) {
        if (optionalNote == null || optionalNote.trim().isEmpty()) {
            return;
        }
        String note = optionalNote.trim();
        if (stat.optionalNote.isEmpty()) {
            stat.optionalNote = note;
        } else if (!stat.optionalNote.contains(note)) {
            stat.optionalNote = stat.optionalNote + "; " + note;
        }
    }

    private String sanitizeStepName(String name) {
        String step = name == null ? "" : name.trim();
        return step.isEmpty() ? "UNKNOWN_STEP" : step.toUpperCase(Locale.ROOT);
    }

    private static String blankTo(String value, String fallback) {
        String text = value == null ? "" : value.trim();
        return text.isEmpty() ? fallback : text;
    }

    private static final class StepStat {
        private final String name;
        private long elapsedMs;
        private long itemsIn;
        private long itemsOut;
        private long errorCount;
        private String optionalNote;

        private StepStat(String name) {
            this.name = name;
            this.elapsedMs = 0L;
            this.itemsIn = 0L;
            this.itemsOut = 0L;
            this.errorCount = 0L;
            this.optionalNote = "";
        }
    }

    public record StepRecord(
            String name,
            long elapsedMs,
            long itemsIn,
            long itemsOut,
            long errorCount,
            String optionalNote
    ) {
    }
}
