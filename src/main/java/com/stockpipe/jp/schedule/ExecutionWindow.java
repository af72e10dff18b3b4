package com.stockpipe.jp.schedule;

import java.time.LocalDate;
import java.time.ZonedDateTime;

/**
 * Derived session for one invocation. Not persisted.
 */
public record ExecutionWindow(
        LocalDate referenceDate,
        ExecutionMode mode,
        ZonedDateTime windowStart,
        ZonedDateTime windowEnd,
        boolean forced
) {
    public ExecutionWindow {
        if (referenceDate == null || mode == null) {
            throw new IllegalArgumentException("referenceDate and mode are required");
        }
    }
}
