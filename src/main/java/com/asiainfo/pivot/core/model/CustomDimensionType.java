package com.asiainfo.pivot.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CustomDimensionType {
    DATE_RANGE("date_range"),
    METRIC_BUCKET("metric_bucket"),
    METRIC_CONDITION("metric_condition");

    private final String code;

    CustomDimensionType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static CustomDimensionType from(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        for (CustomDimensionType type : values()) {
            if (type.code.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown custom dimension type: " + value);
    }
}
