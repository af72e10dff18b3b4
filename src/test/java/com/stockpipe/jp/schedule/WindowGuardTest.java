package com.stockpipe.jp.schedule;

import com.stockpipe.jp.calendar.HolidayClass;
import com.stockpipe.jp.calendar.TradingCalendarOracle;
import com.stockpipe.jp.calendar.TradingDayRecord;
import com.stockpipe.jp.error.CalendarUnavailableException;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WindowGuardTest {
    private static final LocalDate THURSDAY = LocalDate.of(2024, 5, 9);
    private static final LocalDate FRIDAY = LocalDate.of(2024, 5, 10);
    private static final LocalDate SATURDAY = LocalDate.of(2024, 5, 11);

    @Test
    void eveningBeforeWeekend_shouldDenyBecauseNextDayIsClosed() {
        StubOracle oracle = weekOracle();
        WindowGuard guard = new WindowGuard(oracle, List.of());

        GuardDecision decision = guard.evaluate(window(ExecutionMode.EVENING_SELECT, FRIDAY));

        assertFalse(decision.allowed());
        assertEquals(GuardReason.NON_TRADING_DAY, decision.reason());
        assertEquals(SATURDAY, decision.checkedDate());
        assertEquals(List.of(SATURDAY), oracle.queried);
    }

    @Test
    void afternoonRefresh_shouldCheckItsOwnDate() {
        StubOracle oracle = weekOracle();
        WindowGuard guard = new WindowGuard(oracle, List.of());

        GuardDecision decision = guard.evaluate(window(ExecutionMode.AFTERNOON_REFRESH, FRIDAY));

        assertTrue(decision.allowed());
        assertEquals(GuardReason.TRADING_DAY, decision.reason());
        assertEquals(List.of(FRIDAY), oracle.queried);
    }

    @Test
    void eveningSelect_shouldNeverQueryTheReferenceDate() {
        StubOracle oracle = weekOracle();
        WindowGuard guard = new WindowGuard(oracle, List.of());

        GuardDecision decision = guard.evaluate(window(ExecutionMode.EVENING_SELECT, THURSDAY));

        assertTrue(decision.allowed());
        assertEquals(List.of(FRIDAY), oracle.queried);
    }

    @Test
    void oracleFailure_shouldFailClosed() {
        StubOracle oracle = weekOracle();
        oracle.failure = new CalendarUnavailableException(FRIDAY, "HTTP 503");
        WindowGuard guard = new WindowGuard(oracle, List.of());

        GuardDecision decision = guard.evaluate(window(ExecutionMode.AFTERNOON_REFRESH, FRIDAY));

        assertFalse(decision.allowed());
        assertEquals(GuardReason.CALENDAR_UNAVAILABLE, decision.reason());
    }

    @Test
    void unusableAnswers_shouldFailClosed() {
        StubOracle wrongDate = new StubOracle();
        wrongDate.answerFor = date -> TradingDayRecord.of(date.minusDays(1), HolidayClass.TRADING);
        StubOracle unknown = new StubOracle();
        unknown.answerFor = date -> TradingDayRecord.of(date, HolidayClass.UNKNOWN);
        StubOracle crashing = new StubOracle();
        crashing.answerFor = date -> {
            throw new IllegalStateException("bug");
        };

        ExecutionWindow refresh = window(ExecutionMode.AFTERNOON_REFRESH, FRIDAY);
        assertEquals(GuardReason.CALENDAR_UNAVAILABLE, new WindowGuard(wrongDate, List.of()).evaluate(refresh).reason());
        assertEquals(GuardReason.CALENDAR_UNAVAILABLE, new WindowGuard(unknown, List.of()).evaluate(refresh).reason());
        assertEquals(GuardReason.CALENDAR_UNAVAILABLE, new WindowGuard(crashing, List.of()).evaluate(refresh).reason());
    }

    @Test
    void specialNonTradingDay_shouldDeny() {
        StubOracle oracle = new StubOracle();
        oracle.classes.put(FRIDAY, HolidayClass.SPECIAL_NON_TRADING);

        GuardDecision decision = new WindowGuard(oracle, List.of())
                .evaluate(window(ExecutionMode.AFTERNOON_REFRESH, FRIDAY));

        assertEquals(GuardReason.NON_TRADING_DAY, decision.reason());
        assertEquals(HolidayClass.SPECIAL_NON_TRADING, decision.holidayClass());
    }

    @Test
    void skipDate_shouldDenyWithoutQueryingOracle() {
        StubOracle oracle = weekOracle();
        WindowGuard guard = new WindowGuard(oracle, List.of(FRIDAY));

        GuardDecision refresh = guard.evaluate(window(ExecutionMode.AFTERNOON_REFRESH, FRIDAY));
        GuardDecision evening = guard.evaluate(window(ExecutionMode.EVENING_SELECT, THURSDAY));

        assertEquals(GuardReason.SKIP_DATE, refresh.reason());
        assertEquals(GuardReason.SKIP_DATE, evening.reason());
        assertTrue(oracle.queried.isEmpty());
    }

    @Test
    void skipFlag_shouldAllowWithoutQueryingOracle() {
        StubOracle oracle = weekOracle();
        WindowGuard guard = new WindowGuard(oracle, List.of());

        GuardDecision decision = guard.evaluate(window(ExecutionMode.EVENING_SELECT, FRIDAY), true);

        assertTrue(decision.allowed());
        assertEquals(GuardReason.CHECK_SKIPPED, decision.reason());
        assertTrue(oracle.queried.isEmpty());
    }

    @Test
    void idle_shouldDenyWithoutQueryingOracle() {
        StubOracle oracle = weekOracle();

        GuardDecision decision = new WindowGuard(oracle, List.of()).evaluate(window(ExecutionMode.IDLE, FRIDAY));

        assertEquals(GuardReason.IDLE, decision.reason());
        assertFalse(decision.allowed());
        assertTrue(oracle.queried.isEmpty());
    }

    private static ExecutionWindow window(ExecutionMode mode, LocalDate reference) {
        ZonedDateTime at = reference.atTime(17, 0).atZone(ZoneId.of("Asia/Tokyo"));
        return new ExecutionWindow(reference, mode, at, at, false);
    }

    private static StubOracle weekOracle() {
        StubOracle oracle = new StubOracle();
        oracle.classes.put(THURSDAY, HolidayClass.TRADING);
        oracle.classes.put(FRIDAY, HolidayClass.TRADING);
        oracle.classes.put(SATURDAY, HolidayClass.NON_TRADING);
        return oracle;
    }

    private interface Answer {
        TradingDayRecord answer(LocalDate date);
    }

    private static final class StubOracle implements TradingCalendarOracle {
        final Map<LocalDate, HolidayClass> classes = new HashMap<>();
        final List<LocalDate> queried = new ArrayList<>();
        CalendarUnavailableException failure;
        Answer answerFor;

        @Override
        public TradingDayRecord query(LocalDate date) throws CalendarUnavailableException {
            queried.add(date);
            if (failure != null) {
                throw failure;
            }
            if (answerFor != null) {
                return answerFor.answer(date);
            }
            HolidayClass holidayClass = classes.get(date);
            if (holidayClass == null) {
                throw new CalendarUnavailableException(date, "no entry");
            }
            return TradingDayRecord.of(date, holidayClass);
        }
    }
}
