package com.asiainfo.pivot.core.model;

import com.asiainfo.pivot.core.SafeMath;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 引擎内部的一行聚合结果：维度值 + 指标值
 * 可变，后处理阶段会就地写入派生指标与自定义维度列。
 */
public class MetricRow {

    private final LinkedHashMap<String, Object> dimensions;
    private final LinkedHashMap<String, Double> metrics;

    public MetricRow() {
        this(new LinkedHashMap<>(), new LinkedHashMap<>());
    }

    public MetricRow(Map<String, Object> dimensions, Map<String, Double> metrics) {
        this.dimensions = new LinkedHashMap<>(dimensions);
        this.metrics = new LinkedHashMap<>(metrics);
    }

    /**
     * 从存储层返回的一条记录构建行，dimensionColumns 之外的列都视为指标
     */
    public static MetricRow fromRecord(Map<String, Object> record, Collection<String> dimensionColumns) {
        MetricRow row = new MetricRow();
        for (String dim : dimensionColumns) {
            row.dimensions.put(dim, record.get(dim));
        }
        for (Map.Entry<String, Object> entry : record.entrySet()) {
            if (!dimensionColumns.contains(entry.getKey())) {
                Double value = SafeMath.toDouble(entry.getValue());
                row.metrics.put(entry.getKey(), value == null ? 0.0 : SafeMath.sanitize(value));
            }
        }
        return row;
    }

    public Object dimension(String id) {
        return dimensions.get(id);
    }

    public MetricRow putDimension(String id, Object value) {
        dimensions.put(id, value);
        return this;
    }

    public boolean hasMetric(String id) {
        return metrics.containsKey(id);
    }

    public Double metric(String id) {
        return metrics.get(id);
    }

    public double metricOrZero(String id) {
        return SafeMath.sanitize(metrics.get(id));
    }

    public MetricRow putMetric(String id, Double value) {
        metrics.put(id, value);
        return this;
    }

    public Map<String, Object> dimensions() {
        return dimensions;
    }

    public Map<String, Double> metrics() {
        return metrics;
    }

    /**
     * 指定维度上的取值组合，用作分组键
     */
    public List<Object> keyOf(List<String> dims) {
        return dims.stream().map(dimensions::get).toList();
    }

    public MetricRow copy() {
        return new MetricRow(dimensions, metrics);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MetricRow other)) return false;
        return dimensions.equals(other.dimensions) && metrics.equals(other.metrics);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dimensions, metrics);
    }

    @Override
    public String toString() {
        return "MetricRow{dimensions=" + dimensions + ", metrics=" + metrics + '}';
    }
}
