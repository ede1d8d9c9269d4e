package com.asiainfo.pivot.core.generator;

public record SortKey(String column, boolean descending) {

    public static SortKey asc(String column) {
        return new SortKey(column, false);
    }

    public static SortKey desc(String column) {
        return new SortKey(column, true);
    }
}
