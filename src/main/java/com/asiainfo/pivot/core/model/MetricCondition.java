package com.asiainfo.pivot.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;

public record MetricCondition(
    ConditionOperator operator,
    Double value,
    @JsonAlias("value_max") Double valueMax
) {
    public MetricCondition {
        operator = operator == null ? ConditionOperator.GT : operator;
    }

    /**
     * 比较类条件缺少 value 时视为不约束
     */
    public boolean matches(Double actual) {
        if (operator.requiresValue() && value == null) {
            return true;
        }
        return operator.test(actual, value == null ? 0 : value, valueMax);
    }
}
