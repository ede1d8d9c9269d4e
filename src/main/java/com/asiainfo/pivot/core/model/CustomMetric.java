package com.asiainfo.pivot.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.util.List;

/**
 * 用户自定义指标：对 sourceMetric 在剔除 excludeDimensions 后的维度组合上重聚合
 */
public record CustomMetric(
    @JsonAlias("metric_id") String id,
    String name,
    @JsonAlias("source_metric") String sourceMetric,
    @JsonAlias("aggregation_type") CustomAggregation aggregationType,
    @JsonAlias("exclude_dimensions") List<String> excludeDimensions
) {
    public CustomMetric {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Custom metric id must not be blank");
        }
        name = name == null ? id : name;
        aggregationType = aggregationType == null ? CustomAggregation.SUM : aggregationType;
        excludeDimensions = excludeDimensions == null ? List.of() : List.copyOf(excludeDimensions);
    }
}
