package com.asiainfo.pivot.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * 指标定义
 * volume 指标可加、物理存储在 rollup 中；其余类别为派生指标，取数后按公式计算，从不落表。
 */
public record MetricDef(
    @JsonAlias("metric_id") String id,
    String category,                                  // volume / conversion / rate ...
    String formula,                                   // 派生指标公式，如 {clicks} / {queries}
    @JsonAlias("depends_on") List<String> dependsOn,  // 声明的依赖，编译时以公式 AST 为准
    AggregateFunction aggregation,                    // 原始表聚合函数，仅 volume 指标
    String column                                     // 原始表列名，仅 volume 指标
) {
    public static final String VOLUME = "volume";

    public MetricDef {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Metric id must not be blank");
        }
        category = category == null || category.isBlank() ? VOLUME : category;
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
        if (VOLUME.equals(category)) {
            aggregation = aggregation == null ? AggregateFunction.SUM : aggregation;
            column = column == null || column.isBlank() ? id : column;
        }
    }

    /**
     * 快捷工厂：volume 指标
     */
    public static MetricDef volume(String id, AggregateFunction aggregation, String column) {
        return new MetricDef(id, VOLUME, null, List.of(), aggregation, column);
    }

    /**
     * 快捷工厂：派生指标
     */
    public static MetricDef derived(String id, String category, String formula) {
        return new MetricDef(id, category, formula, List.of(), null, null);
    }

    @JsonIgnore
    public boolean isVolume() {
        return VOLUME.equals(category);
    }
}
