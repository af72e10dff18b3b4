package com.stockpipe.jp.schedule;

import java.time.LocalDate;

/**
 * Trigger-surface overrides, passed in as plain values.
 */
public record ModeOverrides(ExecutionMode forcedMode, LocalDate forcedReferenceDate) {
    private static final ModeOverrides NONE = new ModeOverrides(null, null);

    public static ModeOverrides none() {
        return NONE;
    }

    public static ModeOverrides force(ExecutionMode mode) {
        return new ModeOverrides(mode, null);
    }

    public static ModeOverrides force(ExecutionMode mode, LocalDate referenceDate) {
        return new ModeOverrides(mode, referenceDate);
    }
}
