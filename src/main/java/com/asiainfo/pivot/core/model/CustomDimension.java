package com.asiainfo.pivot.core.model;

import com.asiainfo.pivot.core.PivotConstants;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * 用户自定义维度：在取数之后按规则给每行打标签
 */
public record CustomDimension(
    String id,
    String name,
    @JsonAlias("dimension_type") CustomDimensionType type,
    @JsonAlias({"source_metric", "metric"}) String sourceMetric,
    @JsonAlias("values_json") List<CustomDimensionRule> values
) {
    public CustomDimension {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Custom dimension id must not be blank");
        }
        name = name == null ? id : name;
        type = type == null ? CustomDimensionType.DATE_RANGE : type;
        values = values == null ? List.of() : List.copyOf(values);
    }

    /**
     * 结果集中的列名，与维度列表中的写法一致：custom_{id}
     */
    @JsonIgnore
    public String columnName() {
        return PivotConstants.CUSTOM_DIMENSION_PREFIX + id;
    }
}
