package com.stockpipe.jp.error;

import java.time.LocalDate;

/**
 * The trading calendar could not answer for a date. Never equivalent to "not a trading day".
 */
public class CalendarUnavailableException extends ProviderException {
    private final LocalDate date;

    public CalendarUnavailableException(LocalDate date, String message) {
        super(message);
        this.date = date;
    }

    public CalendarUnavailableException(LocalDate date, String message, Throwable cause) {
        super(message, cause);
        this.date = date;
    }

    public LocalDate date() {
        return date;
    }
}
