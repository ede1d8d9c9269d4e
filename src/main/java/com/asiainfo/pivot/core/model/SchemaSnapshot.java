package com.asiainfo.pivot.core.model;

import com.asiainfo.pivot.core.PivotConstants;
import com.fasterxml.jackson.annotation.JsonAlias;

import java.util.List;

/**
 * 一张事实表的 schema 快照：维度、指标及用户自定义维度/指标
 */
public record SchemaSnapshot(
    String table,
    @JsonAlias("table_path") String tablePath,
    List<DimensionDef> dimensions,
    List<MetricDef> metrics,
    @JsonAlias("custom_dimensions") List<CustomDimension> customDimensions,
    @JsonAlias("custom_metrics") List<CustomMetric> customMetrics,
    @JsonAlias("child_dimension") String childDimension
) {
    public SchemaSnapshot {
        if (table == null || table.isBlank()) {
            throw new IllegalArgumentException("Schema table must not be blank");
        }
        tablePath = tablePath == null || tablePath.isBlank() ? table : tablePath;
        dimensions = dimensions == null ? List.of() : List.copyOf(dimensions);
        metrics = metrics == null ? List.of() : List.copyOf(metrics);
        customDimensions = customDimensions == null ? List.of() : List.copyOf(customDimensions);
        customMetrics = customMetrics == null ? List.of() : List.copyOf(customMetrics);
        childDimension = childDimension == null || childDimension.isBlank()
                ? PivotConstants.DEFAULT_CHILD_DIMENSION : childDimension;
    }
}
