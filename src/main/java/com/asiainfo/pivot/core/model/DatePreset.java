package com.asiainfo.pivot.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;

/**
 * 相对日期预设，按参考日期解析为绝对区间。周从周一开始，last_N_days 包含当天。
 */
public enum DatePreset {
    TODAY("today"),
    YESTERDAY("yesterday"),
    LAST_7_DAYS("last_7_days"),
    LAST_14_DAYS("last_14_days"),
    LAST_30_DAYS("last_30_days"),
    LAST_90_DAYS("last_90_days"),
    THIS_WEEK("this_week"),
    LAST_WEEK("last_week"),
    THIS_MONTH("this_month"),
    LAST_MONTH("last_month"),
    THIS_QUARTER("this_quarter"),
    LAST_QUARTER("last_quarter"),
    THIS_YEAR("this_year"),
    LAST_YEAR("last_year"),
    YEAR_TO_DATE("year_to_date"),
    MONTH_TO_DATE("month_to_date"),
    QUARTER_TO_DATE("quarter_to_date"),
    WEEK_TO_DATE("week_to_date");

    private final String id;

    DatePreset(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    @JsonCreator
    public static DatePreset fromId(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (DatePreset preset : values()) {
            if (preset.id.equals(normalized)) {
                return preset;
            }
        }
        throw new IllegalArgumentException("Unknown date preset: " + value);
    }

    public DateRange resolve(LocalDate today) {
        LocalDate monday = today.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        LocalDate quarterStart = quarterStart(today);
        return switch (this) {
            case TODAY -> DateRange.of(today, today);
            case YESTERDAY -> DateRange.of(today.minusDays(1), today.minusDays(1));
            case LAST_7_DAYS -> DateRange.of(today.minusDays(6), today);
            case LAST_14_DAYS -> DateRange.of(today.minusDays(13), today);
            case LAST_30_DAYS -> DateRange.of(today.minusDays(29), today);
            case LAST_90_DAYS -> DateRange.of(today.minusDays(89), today);
            case THIS_WEEK, WEEK_TO_DATE -> DateRange.of(monday, today);
            case LAST_WEEK -> DateRange.of(monday.minusWeeks(1), monday.minusDays(1));
            case THIS_MONTH, MONTH_TO_DATE -> DateRange.of(today.withDayOfMonth(1), today);
            case LAST_MONTH -> {
                LocalDate firstOfLastMonth = today.withDayOfMonth(1).minusMonths(1);
                yield DateRange.of(firstOfLastMonth, firstOfLastMonth.with(TemporalAdjusters.lastDayOfMonth()));
            }
            case THIS_QUARTER, QUARTER_TO_DATE -> DateRange.of(quarterStart, today);
            case LAST_QUARTER -> {
                LocalDate lastQuarterStart = quarterStart.minusMonths(3);
                yield DateRange.of(lastQuarterStart, quarterStart.minusDays(1));
            }
            case THIS_YEAR, YEAR_TO_DATE -> DateRange.of(today.withDayOfYear(1), today);
            case LAST_YEAR -> {
                LocalDate firstOfLastYear = today.withDayOfYear(1).minusYears(1);
                yield DateRange.of(firstOfLastYear, firstOfLastYear.with(TemporalAdjusters.lastDayOfYear()));
            }
        };
    }

    private static LocalDate quarterStart(LocalDate date) {
        int firstMonth = ((date.getMonthValue() - 1) / 3) * 3 + 1;
        return LocalDate.of(date.getYear(), firstMonth, 1);
    }
}
