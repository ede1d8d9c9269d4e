package com.asiainfo.pivot.core.generator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * WHERE 条件，多个谓词之间取 AND
 *
 * @param columns     COMPOSITE_IN 时为多列，其余为单列
 * @param values      已按维度类型转换好的值 (String / Long / Double / Boolean / LocalDate)
 * @param includeNull IN 列表之外再 OR 上 IS NULL
 */
public record FetchPredicate(List<String> columns, Operator operator, List<Object> values, boolean includeNull) {

    public enum Operator {
        IN,
        GTE,
        LTE,
        IS_NOT_NULL,
        COMPOSITE_IN
    }

    public FetchPredicate {
        if (columns == null || columns.isEmpty()) {
            throw new IllegalArgumentException("Predicate needs at least one column");
        }
        columns = List.copyOf(columns);
        // 允许 null 元素
        values = values == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(values));
    }

    public static FetchPredicate in(String column, List<Object> values, boolean includeNull) {
        return new FetchPredicate(List.of(column), Operator.IN, values, includeNull);
    }

    public static FetchPredicate gte(String column, Object value) {
        return new FetchPredicate(List.of(column), Operator.GTE, List.of(value), false);
    }

    public static FetchPredicate lte(String column, Object value) {
        return new FetchPredicate(List.of(column), Operator.LTE, List.of(value), false);
    }

    public static FetchPredicate isNotNull(String column) {
        return new FetchPredicate(List.of(column), Operator.IS_NOT_NULL, List.of(), false);
    }

    /**
     * 多列拼接后的复合值匹配，值形如 "US - mobile"，NULL 以 __NULL__ 表示
     */
    public static FetchPredicate compositeIn(List<String> columns, List<String> compositeValues) {
        return new FetchPredicate(columns, Operator.COMPOSITE_IN, new ArrayList<>(compositeValues), false);
    }

    public String column() {
        return columns.get(0);
    }
}
