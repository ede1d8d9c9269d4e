package com.asiainfo.pivot.core.generator;

import com.asiainfo.pivot.core.model.AggregateFunction;
import com.asiainfo.pivot.core.model.Granularity;

/**
 * 选择列：维度列原样输出，聚合列按 function(column) 输出，日期截断列按 DATE_TRUNC(column, part) 输出，均以 alias 命名
 */
public record SelectColumn(Kind kind, AggregateFunction function, String column, String alias, Granularity granularity) {

    public enum Kind {
        DIMENSION,
        AGGREGATE,
        DATE_TRUNC
    }

    public SelectColumn {
        if (column == null || column.isBlank()) {
            throw new IllegalArgumentException("Select column must not be blank");
        }
        alias = alias == null || alias.isBlank() ? column : alias;
        if (kind == Kind.AGGREGATE && function == null) {
            throw new IllegalArgumentException("Aggregate column " + alias + " needs a function");
        }
        if (kind == Kind.DATE_TRUNC && granularity == null) {
            granularity = Granularity.DAILY;
        }
    }

    public static SelectColumn dimension(String column, String alias) {
        return new SelectColumn(Kind.DIMENSION, null, column, alias, null);
    }

    public static SelectColumn aggregate(AggregateFunction function, String column, String alias) {
        return new SelectColumn(Kind.AGGREGATE, function, column, alias, null);
    }

    public static SelectColumn dateTrunc(String column, String alias, Granularity granularity) {
        return new SelectColumn(Kind.DATE_TRUNC, null, column, alias, granularity);
    }

    public boolean isAggregate() {
        return kind == Kind.AGGREGATE;
    }

    public boolean isDateTrunc() {
        return kind == Kind.DATE_TRUNC;
    }
}
