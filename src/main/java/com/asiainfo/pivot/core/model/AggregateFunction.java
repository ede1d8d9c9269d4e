package com.asiainfo.pivot.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * 取数时使用的聚合函数
 */
public enum AggregateFunction {
    SUM,
    COUNT,
    COUNT_DISTINCT,
    AVG,
    MIN,
    MAX;

    @JsonCreator
    public static AggregateFunction from(String value) {
        if (value == null) {
            return SUM;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace(' ', '_');
        if ("DISTINCT".equals(normalized) || "COUNTDISTINCT".equals(normalized)) {
            return COUNT_DISTINCT;
        }
        return valueOf(normalized);
    }

    public String toSql(String column) {
        return switch (this) {
            case COUNT_DISTINCT -> "COUNT(DISTINCT " + column + ")";
            default -> name() + "(" + column + ")";
        };
    }
}
