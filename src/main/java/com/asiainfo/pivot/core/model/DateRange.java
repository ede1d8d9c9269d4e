package com.asiainfo.pivot.core.model;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * 闭区间日期范围 [start, end]
 */
public record DateRange(LocalDate start, LocalDate end) {

    public DateRange {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Date range bounds must not be null");
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Date range end " + end + " is before start " + start);
        }
    }

    public static DateRange of(LocalDate start, LocalDate end) {
        return new DateRange(start, end);
    }

    /**
     * 区间内天数，至少为 1
     */
    public long numDays() {
        return Math.max(1, ChronoUnit.DAYS.between(start, end) + 1);
    }

    public boolean contains(LocalDate date) {
        return date != null && !date.isBefore(start) && !date.isAfter(end);
    }
}
