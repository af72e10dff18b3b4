package com.stockpipe.jp.schedule;

import com.stockpipe.jp.calendar.HolidayClass;

import java.time.LocalDate;

public record GuardDecision(
        GuardReason reason,
        LocalDate checkedDate,
        HolidayClass holidayClass,
        String message
) {
    public GuardDecision {
        if (reason == null) {
            throw new IllegalArgumentException("reason is required");
        }
        holidayClass = holidayClass == null ? HolidayClass.UNKNOWN : holidayClass;
        message = message == null ? "" : message;
    }

    public boolean allowed() {
        return reason.allows();
    }

    public String describe() {
        String base = (allowed() ? "allow" : "deny") + ":" + reason.name();
        if (checkedDate != null) {
            base = base + " checked=" + checkedDate;
        }
        return message.isEmpty() ? base : base + " (" + message + ")";
    }
}
