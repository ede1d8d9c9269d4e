package com.asiainfo.pivot.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.List;

/**
 * 自定义维度的一条规则，按类型使用不同字段：
 * metric_bucket 用 min/max/equals，date_range 用 startDate/endDate，metric_condition 用 conditions。
 */
public record CustomDimensionRule(
    String label,
    Double min,
    Double max,
    @JsonProperty("equals") Double equalTo,
    @JsonAlias("start_date") LocalDate startDate,
    @JsonAlias("end_date") LocalDate endDate,
    List<MetricCondition> conditions
) {
    public CustomDimensionRule {
        label = label == null ? "Unknown" : label;
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    public static CustomDimensionRule bucket(String label, Double min, Double max) {
        return new CustomDimensionRule(label, min, max, null, null, null, null);
    }

    public static CustomDimensionRule dateRange(String label, LocalDate start, LocalDate end) {
        return new CustomDimensionRule(label, null, null, null, start, end, null);
    }

    public static CustomDimensionRule condition(String label, List<MetricCondition> conditions) {
        return new CustomDimensionRule(label, null, null, null, null, null, conditions);
    }

    /**
     * 至少声明了一个边界的 bucket 才可能命中
     */
    public boolean matchesBucket(Double value) {
        if (min == null && max == null && equalTo == null) {
            return false;
        }
        if (value == null) {
            return false;
        }
        if (min != null && value < min) {
            return false;
        }
        if (max != null && value > max) {
            return false;
        }
        return equalTo == null || value.doubleValue() == equalTo;
    }

    public boolean matchesDate(LocalDate date) {
        if (startDate == null || endDate == null || date == null) {
            return false;
        }
        return !date.isBefore(startDate) && !date.isAfter(endDate);
    }

    public boolean matchesConditions(Double value) {
        for (MetricCondition condition : conditions) {
            if (!condition.matches(value)) {
                return false;
            }
        }
        return true;
    }
}
