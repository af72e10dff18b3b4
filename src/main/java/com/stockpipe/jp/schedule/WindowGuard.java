package com.stockpipe.jp.schedule;

import com.stockpipe.jp.calendar.HolidayClass;
import com.stockpipe.jp.calendar.TradingCalendarOracle;
import com.stockpipe.jp.calendar.TradingDayRecord;
import com.stockpipe.jp.error.CalendarUnavailableException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;

/**
 * Decides whether the trading calendar permits the selected mode to run.
 *
 * <p>The checked date follows the mode's consumption horizon: a refresh checks its own reference
 * date, a selection checks the next calendar day because tonight's picks are consumed in the next
 * session. Any failure to obtain an answer denies.
 */
public final class WindowGuard {
    private static final Logger LOG = LogManager.getLogger(WindowGuard.class);

    private final TradingCalendarOracle oracle;
    private final Set<LocalDate> skipDates;

    public WindowGuard(TradingCalendarOracle oracle, Collection<LocalDate> skipDates) {
        if (oracle == null) {
            throw new IllegalArgumentException("oracle is required");
        }
        this.oracle = oracle;
        this.skipDates = skipDates == null ? Set.of() : Set.copyOf(new TreeSet<>(skipDates));
    }

    public static LocalDate dateToCheck(ExecutionWindow window) {
        if (window.mode() == ExecutionMode.EVENING_SELECT) {
            return window.referenceDate().plusDays(1);
        }
        return window.referenceDate();
    }

    public GuardDecision evaluate(ExecutionWindow window) {
        return evaluate(window, false);
    }

    public GuardDecision evaluate(ExecutionWindow window, boolean skipCalendarCheck) {
        if (window == null || window.mode() == ExecutionMode.IDLE) {
            return new GuardDecision(GuardReason.IDLE, null, HolidayClass.UNKNOWN, "outside all execution windows");
        }
        LocalDate checked = dateToCheck(window);
        if (skipCalendarCheck) {
            LOG.warn("calendar check skipped by flag for mode={} checked={}", window.mode(), checked);
            return new GuardDecision(GuardReason.CHECK_SKIPPED, checked, HolidayClass.UNKNOWN, "skip flag set");
        }
        if (skipDates.contains(checked)) {
            return new GuardDecision(GuardReason.SKIP_DATE, checked, HolidayClass.UNKNOWN, "configured skip date");
        }

        TradingDayRecord record;
        try {
            record = oracle.query(checked);
        } catch (CalendarUnavailableException e) {
            LOG.warn("calendar unavailable for {}: {}", checked, e.getMessage());
            return new GuardDecision(GuardReason.CALENDAR_UNAVAILABLE, checked, HolidayClass.UNKNOWN, e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("calendar oracle failed for {}", checked, e);
            return new GuardDecision(GuardReason.CALENDAR_UNAVAILABLE, checked, HolidayClass.UNKNOWN,
                    e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        if (record == null || !checked.equals(record.date()) || record.holidayClass() == HolidayClass.UNKNOWN) {
            return new GuardDecision(GuardReason.CALENDAR_UNAVAILABLE, checked, HolidayClass.UNKNOWN,
                    "no usable calendar entry");
        }
        if (!record.isTradingDay()) {
            return new GuardDecision(GuardReason.NON_TRADING_DAY, checked, record.holidayClass(), "");
        }
        return new GuardDecision(GuardReason.TRADING_DAY, checked, record.holidayClass(), "");
    }
}
