package com.asiainfo.pivot.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

public enum DataType {
    STRING,
    INTEGER,
    FLOAT,
    BOOLEAN,
    DATE;

    @JsonCreator
    public static DataType from(String value) {
        if (value == null) {
            return STRING;
        }
        return switch (value.trim().toUpperCase(Locale.ROOT)) {
            case "INTEGER", "INT", "INT64", "LONG" -> INTEGER;
            case "FLOAT", "FLOAT64", "DOUBLE", "NUMERIC", "BIGNUMERIC" -> FLOAT;
            case "BOOLEAN", "BOOL" -> BOOLEAN;
            case "DATE", "TIMESTAMP", "DATETIME" -> DATE;
            default -> STRING;
        };
    }

    public boolean isNumeric() {
        return this == INTEGER || this == FLOAT || this == BOOLEAN;
    }
}
