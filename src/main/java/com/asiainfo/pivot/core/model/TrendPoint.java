package com.asiainfo.pivot.core.model;

import java.util.Map;

/**
 * 趋势序列中的一个点，date 为截断后的周期起始日 (ISO 格式)
 */
public record TrendPoint(String date, Map<String, Double> metrics) {
    public TrendPoint {
        metrics = metrics == null ? Map.of() : Map.copyOf(metrics);
    }
}
