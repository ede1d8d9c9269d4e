package com.asiainfo.pivot.core.postprocess;

import com.asiainfo.pivot.core.SafeMath;
import com.asiainfo.pivot.core.model.CustomAggregation;
import com.asiainfo.pivot.core.model.CustomMetric;
import com.asiainfo.pivot.core.model.MetricRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 自定义指标后处理
 * avg_per_day 按区间天数平均；其余按 (当前维度 - 排除维度) 分组聚合，再把组内结果回填到组内每一行，行数不变。
 */
public class CustomMetricProcessor {

    private static final Logger log = LoggerFactory.getLogger(CustomMetricProcessor.class);

    private final long numDays;

    /**
     * @param numDays 过滤条件解析出的区间天数，小于 1 时按 1 处理
     */
    public CustomMetricProcessor(long numDays) {
        this.numDays = Math.max(1, numDays);
    }

    public long numDays() {
        return numDays;
    }

    public List<MetricRow> apply(List<MetricRow> rows, CustomMetric def, List<String> currentDims) {
        if (rows.isEmpty()) {
            return rows;
        }
        String source = def.sourceMetric();
        if (source == null || rows.stream().noneMatch(r -> r.hasMetric(source))) {
            log.warn("Source metric '{}' not found for custom metric '{}'", source, def.name());
            return rows;
        }

        if (def.aggregationType() == CustomAggregation.AVG_PER_DAY) {
            for (MetricRow row : rows) {
                row.putMetric(def.id(), SafeMath.safeDivide(row.metricOrZero(source), numDays));
            }
            log.debug("Applied avg_per_day for '{}': divided {} by {} days", def.name(), source, numDays);
            return rows;
        }

        List<String> groupDims = new ArrayList<>();
        for (String dim : currentDims) {
            if (!def.excludeDimensions().contains(dim)) {
                groupDims.add(dim);
            }
        }
        if (new LinkedHashSet<>(groupDims).equals(new LinkedHashSet<>(currentDims))) {
            // 没有排除任何维度，直接复制来源列
            for (MetricRow row : rows) {
                row.putMetric(def.id(), row.metric(source));
            }
            return rows;
        }

        Map<List<Object>, List<Double>> groups = new HashMap<>();
        for (MetricRow row : rows) {
            groups.computeIfAbsent(row.keyOf(groupDims), k -> new ArrayList<>()).add(row.metric(source));
        }
        Map<List<Object>, Double> aggregated = new HashMap<>();
        groups.forEach((key, values) -> aggregated.put(key, aggregate(values, def.aggregationType())));
        for (MetricRow row : rows) {
            row.putMetric(def.id(), aggregated.get(row.keyOf(groupDims)));
        }
        log.debug("Re-aggregated custom metric '{}' ({}) over {} into {} groups",
                def.name(), def.aggregationType().code(), groupDims, groups.size());
        return rows;
    }

    /**
     * 空值不参与计算；count 为非空值个数
     */
    static double aggregate(List<Double> values, CustomAggregation type) {
        List<Double> present = values.stream().filter(Objects::nonNull).toList();
        return switch (type) {
            case COUNT -> present.size();
            case AVG -> present.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
            case MAX -> present.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
            case MIN -> present.stream().mapToDouble(Double::doubleValue).min().orElse(0.0);
            default -> present.stream().mapToDouble(Double::doubleValue).sum();
        };
    }
}
