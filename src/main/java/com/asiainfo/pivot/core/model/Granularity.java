package com.asiainfo.pivot.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;

/**
 * 趋势查询的时间粒度，周从周一开始 (与相对日期预设一致)
 */
public enum Granularity {
    DAILY("daily", "DAY"),
    WEEKLY("weekly", "WEEK(MONDAY)"),
    MONTHLY("monthly", "MONTH");

    private final String code;
    private final String datePart;

    Granularity(String code, String datePart) {
        this.code = code;
        this.datePart = datePart;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /**
     * DATE_TRUNC 的日期部分
     */
    public String datePart() {
        return datePart;
    }

    /**
     * 未知或为空时按天
     */
    @JsonCreator
    public static Granularity from(String value) {
        if (value == null) {
            return DAILY;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Granularity g : values()) {
            if (g.code.equals(normalized)) {
                return g;
            }
        }
        return DAILY;
    }

    public LocalDate truncate(LocalDate date) {
        if (date == null) {
            return null;
        }
        return switch (this) {
            case DAILY -> date;
            case WEEKLY -> date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            case MONTHLY -> date.withDayOfMonth(1);
        };
    }
}
