package com.stockpipe.jp.schedule;

import java.util.Locale;

public enum ExecutionMode {
    AFTERNOON_REFRESH,
    EVENING_SELECT,
    IDLE;

    /**
     * Whether the mode may supersede the live selection artifact.
     */
    public boolean isDestructive() {
        return this == EVENING_SELECT;
    }

    public static ExecutionMode parse(String raw) {
        String text = raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        switch (text) {
            case "AFTERNOON":
            case "REFRESH":
            case "AFTERNOON_REFRESH":
                return AFTERNOON_REFRESH;
            case "EVENING":
            case "SELECT":
            case "EVENING_SELECT":
                return EVENING_SELECT;
            case "IDLE":
                return IDLE;
            default:
                throw new IllegalArgumentException("unknown execution mode: " + raw);
        }
    }
}
