package com.stockpipe.core;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one pipeline step, with free-form evidence for the run report.
 */
public record StepResult(
        String step,
        StepStatus status,
        String reason,
        Map<String, Object> evidence,
        long elapsedMs
) {
    public StepResult {
        step = step == null ? "UNKNOWN_STEP" : step;
        status = status == null ? StepStatus.FAILED : status;
        reason = reason == null ? "" : reason;
        Map<String, Object> copy = evidence == null ? Map.of() : new LinkedHashMap<>(evidence);
        copy.values().removeIf(v -> v == null);
        evidence = Map.copyOf(copy);
        elapsedMs = Math.max(0L, elapsedMs);
    }

    public static StepResult success(String step, String reason, Map<String, Object> evidence) {
        return new StepResult(step, StepStatus.SUCCESS, reason, evidence, 0L);
    }

    public static StepResult degraded(String step, String reason, Map<String, Object> evidence) {
        return new StepResult(step, StepStatus.DEGRADED, reason, evidence, 0L);
    }

    public static StepResult partial(String step, String reason, Map<String, Object> evidence) {
        return new StepResult(step, StepStatus.PARTIAL, reason, evidence, 0L);
    }

    public static StepResult failed(String step, String reason, Map<String, Object> evidence) {
        return new StepResult(step, StepStatus.FAILED, reason, evidence, 0L);
    }

    public static StepResult skipped(String step, String reason) {
        return new StepResult(step, StepStatus.SKIPPED, reason, Map.of(), 0L);
    }

    public static StepResult aborted(String step, String reason) {
        return new StepResult(step, StepStatus.ABORTED, reason, Map.of(), 0L);
    }

    public StepResult withElapsedMs(long elapsed) {
        return new StepResult(step, status, reason, evidence, elapsed);
    }
}
