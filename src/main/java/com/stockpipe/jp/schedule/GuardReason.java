package com.stockpipe.jp.schedule;

public enum GuardReason {
    TRADING_DAY(true),
    CHECK_SKIPPED(true),
    IDLE(false),
    NON_TRADING_DAY(false),
    SKIP_DATE(false),
    CALENDAR_UNAVAILABLE(false);

    private final boolean allows;

    GuardReason(boolean allows) {
        this.allows = allows;
    }

    public boolean allows() {
        return allows;
    }
}
