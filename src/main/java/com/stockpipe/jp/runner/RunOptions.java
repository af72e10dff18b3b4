package com.stockpipe.jp.runner;

/**
 * @param skipCalendarCheck allow without consulting the trading calendar
 * @param trigger           free-form label of what started the run (schedule, manual, retry)
 */
public record RunOptions(boolean skipCalendarCheck, String trigger) {
    public RunOptions {
        trigger = trigger == null || trigger.isBlank() ? "manual" : trigger.trim();
    }

    public static RunOptions defaults() {
        return new RunOptions(false, "schedule");
    }
}
