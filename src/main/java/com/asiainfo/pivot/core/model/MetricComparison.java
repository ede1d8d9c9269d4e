package com.asiainfo.pivot.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 单个指标当前值与基线值的对比
 */
public record MetricComparison(
    double baseline,
    double current,
    double ratio,
    @JsonProperty("is_inflated") boolean inflated
) {
}
