package com.asiainfo.pivot.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * metric_condition 类型自定义维度支持的比较运算
 */
public enum ConditionOperator {
    GT(">"),
    GTE(">="),
    LT("<"),
    LTE("<="),
    EQ("="),
    NE("!="),
    BETWEEN("between"),
    IS_NULL("is_null"),
    IS_NOT_NULL("is_not_null");

    private final String symbol;

    ConditionOperator(String symbol) {
        this.symbol = symbol;
    }

    @JsonValue
    public String symbol() {
        return symbol;
    }

    @JsonCreator
    public static ConditionOperator fromSymbol(String value) {
        if (value == null) {
            return GT;
        }
        String normalized = value.trim();
        if ("<>".equals(normalized)) {
            return NE;
        }
        if ("==".equals(normalized)) {
            return EQ;
        }
        for (ConditionOperator op : values()) {
            if (op.symbol.equalsIgnoreCase(normalized)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown condition operator: " + value);
    }

    public boolean requiresValue() {
        return this != IS_NULL && this != IS_NOT_NULL;
    }

    /**
     * @param actual   行上的指标值，可能为 null
     * @param value    条件值
     * @param valueMax between 的上界
     */
    public boolean test(Double actual, double value, Double valueMax) {
        if (this == IS_NULL) {
            return actual == null;
        }
        if (this == IS_NOT_NULL) {
            return actual != null;
        }
        if (actual == null) {
            return false;
        }
        double v = actual;
        return switch (this) {
            case GT -> v > value;
            case GTE -> v >= value;
            case LT -> v < value;
            case LTE -> v <= value;
            case EQ -> v == value;
            case NE -> v != value;
            case BETWEEN -> valueMax == null || (v >= value && v <= valueMax);
            default -> false;
        };
    }
}
