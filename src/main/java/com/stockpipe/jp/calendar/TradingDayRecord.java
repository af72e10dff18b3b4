package com.stockpipe.jp.calendar;

import java.time.LocalDate;

public record TradingDayRecord(LocalDate date, boolean isTradingDay, HolidayClass holidayClass) {
    public TradingDayRecord {
        if (date == null) {
            throw new IllegalArgumentException("date is required");
        }
        holidayClass = holidayClass == null ? HolidayClass.UNKNOWN : holidayClass;
    }

    public static TradingDayRecord of(LocalDate date, HolidayClass holidayClass) {
        return new TradingDayRecord(date, holidayClass != null && holidayClass.isTrading(), holidayClass);
    }
}
