package com.asiainfo.pivot.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * 透视合计与 date 基线 rollup 合计的对比
 * 没有可用基线时 hasBaseline 为 false，comparisons 为空。
 */
public record BaselineComparison(
    @JsonProperty("has_baseline") boolean hasBaseline,
    Map<String, MetricComparison> comparisons,
    @JsonProperty("any_inflated") boolean anyInflated
) {
    public BaselineComparison {
        comparisons = comparisons == null ? Map.of() : Map.copyOf(comparisons);
    }

    public static BaselineComparison unavailable() {
        return new BaselineComparison(false, Map.of(), false);
    }
}
