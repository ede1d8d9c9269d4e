package com.asiainfo.pivot.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CustomAggregation {
    SUM("sum"),
    AVG("avg"),
    MAX("max"),
    MIN("min"),
    COUNT("count"),
    AVG_PER_DAY("avg_per_day");

    private final String code;

    CustomAggregation(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static CustomAggregation from(String value) {
        String normalized = value == null ? "sum" : value.trim().toLowerCase(Locale.ROOT);
        for (CustomAggregation agg : values()) {
            if (agg.code.equals(normalized)) {
                return agg;
            }
        }
        throw new IllegalArgumentException("Unknown aggregation type: " + value);
    }
}
