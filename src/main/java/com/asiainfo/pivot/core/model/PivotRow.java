package com.asiainfo.pivot.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 透视表中展示的一行
 */
public record PivotRow(
    @JsonProperty("dimension_value") String dimensionValue,
    Map<String, Double> metrics,
    @JsonProperty("percentage_of_total") double percentageOfTotal,
    @JsonProperty("has_children") boolean hasChildren
) {
    public PivotRow {
        metrics = metrics == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
    }
}
