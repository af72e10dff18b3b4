package com.stockpipe.jp.calendar;

/**
 * Exchange holiday division as published by the calendar API.
 */
public enum HolidayClass {
    TRADING("1"),
    NON_TRADING("0"),
    SPECIAL_NON_TRADING("2"),
    UNKNOWN("");

    private final String code;

    HolidayClass(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public boolean isTrading() {
        return this == TRADING;
    }

    public static HolidayClass fromCode(String raw) {
        String text = raw == null ? "" : raw.trim();
        for (HolidayClass value : values()) {
            if (value != UNKNOWN && value.code.equals(text)) {
                return value;
            }
        }
        return UNKNOWN;
    }
}
