package com.stockpipe.jp.schedule;

import com.stockpipe.jp.config.Config;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * 模块说明：ExecutionModeSelector（class）。
 * 主要职责：根据当前时刻（交易所时区）和覆盖参数，判定本次调用属于午后刷新、夜间选股还是空闲。
 * 使用建议：纯函数，不做任何 I/O；午夜后仍处于选股时段的时刻归属前一日（26:00 记法）。
 */
public final class ExecutionModeSelector {
    private final ZoneId zone;
    private final LocalTime refreshStart;
    private final LocalTime selectStart;
    private final LocalTime selectEnd;

    public ExecutionModeSelector(ZoneId zone, LocalTime refreshStart, LocalTime selectStart, LocalTime selectEnd) {
        if (zone == null || refreshStart == null || selectStart == null || selectEnd == null) {
            throw new IllegalArgumentException("zone and session boundaries are required");
        }
        if (!refreshStart.isBefore(selectStart)) {
            throw new IllegalArgumentException("refresh session must start before the selection session: "
                    + refreshStart + " >= " + selectStart);
        }
        if (wrapsMidnight(selectStart, selectEnd) && selectEnd.isAfter(refreshStart)) {
            throw new IllegalArgumentException("selection session overlaps the next refresh session");
        }
        this.zone = zone;
        this.refreshStart = refreshStart;
        this.selectStart = selectStart;
        this.selectEnd = selectEnd;
    }

    public static ExecutionModeSelector fromConfig(Config config) {
        return new ExecutionModeSelector(
                config.getZone("app.zone"),
                config.getLocalTime("schedule.refresh.start"),
                config.getLocalTime("schedule.select.start"),
                config.getLocalTime("schedule.select.end")
        );
    }

    public ZoneId zone() {
        return zone;
    }

    public ExecutionWindow select(Instant now, ModeOverrides overrides) {
        if (now == null) {
            throw new IllegalArgumentException("now is required");
        }
        ModeOverrides effective = overrides == null ? ModeOverrides.none() : overrides;
        ZonedDateTime local = now.atZone(zone);
        LocalDate today = local.toLocalDate();
        LocalTime time = local.toLocalTime();

        if (effective.forcedMode() != null) {
            LocalDate reference = effective.forcedReferenceDate() != null
                    ? effective.forcedReferenceDate()
                    : sessionDate(today, time);
            return windowFor(effective.forcedMode(), reference, local, true);
        }

        ExecutionMode mode;
        LocalDate reference;
        if (!time.isBefore(refreshStart) && time.isBefore(selectStart)) {
            mode = ExecutionMode.AFTERNOON_REFRESH;
            reference = today;
        } else if (inSelection(time)) {
            mode = ExecutionMode.EVENING_SELECT;
            reference = sessionDate(today, time);
        } else {
            mode = ExecutionMode.IDLE;
            reference = sessionDate(today, time);
        }
        if (effective.forcedReferenceDate() != null) {
            reference = effective.forcedReferenceDate();
        }
        return windowFor(mode, reference, local, effective.forcedReferenceDate() != null);
    }

    private ExecutionWindow windowFor(ExecutionMode mode, LocalDate reference, ZonedDateTime now, boolean forced) {
        switch (mode) {
            case AFTERNOON_REFRESH:
                return new ExecutionWindow(
                        reference,
                        mode,
                        reference.atTime(refreshStart).atZone(zone),
                        reference.atTime(selectStart).atZone(zone),
                        forced
                );
            case EVENING_SELECT:
                LocalDate endDay = wrapsMidnight(selectStart, selectEnd) ? reference.plusDays(1) : reference;
                return new ExecutionWindow(
                        reference,
                        mode,
                        reference.atTime(selectStart).atZone(zone),
                        endDay.atTime(selectEnd).atZone(zone),
                        forced
                );
            default:
                return new ExecutionWindow(reference, ExecutionMode.IDLE, now, now, forced);
        }
    }

    private boolean inSelection(LocalTime time) {
        if (wrapsMidnight(selectStart, selectEnd)) {
            return !time.isBefore(selectStart) || time.isBefore(selectEnd);
        }
        return !time.isBefore(selectStart) && time.isBefore(selectEnd);
    }

    /**
     * Times after midnight that still belong to the previous evening's session map to the previous day.
     */
    private LocalDate sessionDate(LocalDate today, LocalTime time) {
        if (wrapsMidnight(selectStart, selectEnd) && time.isBefore(selectEnd)) {
            return today.minusDays(1);
        }
        return today;
    }

    private static boolean wrapsMidnight(LocalTime start, LocalTime end) {
        return !end.isAfter(start);
    }
}
