package com.stockpipe.jp.calendar;

import com.stockpipe.jp.error.CalendarUnavailableException;

import java.time.LocalDate;

/**
 * Authoritative source of exchange trading days.
 */
public interface TradingCalendarOracle {

    /**
     * @throws CalendarUnavailableException when the calendar cannot answer for {@code date};
     *                                      implementations must never guess a trading day instead
     */
    TradingDayRecord query(LocalDate date) throws CalendarUnavailableException;
}
