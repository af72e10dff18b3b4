package com.stockpipe.jp.recommend;

import java.util.Locale;

public enum Confidence {
    LOW,
    MEDIUM,
    HIGH;

    public boolean atLeast(Confidence other) {
        return other == null || compareTo(other) >= 0;
    }

    public static Confidence lower(Confidence a, Confidence b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    public static Confidence parse(String raw) {
        try {
            return valueOf(raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown confidence: " + raw, e);
        }
    }
}
