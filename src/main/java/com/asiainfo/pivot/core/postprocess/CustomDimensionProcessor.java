package com.asiainfo.pivot.core.postprocess;

import com.asiainfo.pivot.core.PivotConstants;
import com.asiainfo.pivot.core.SafeMath;
import com.asiainfo.pivot.core.model.CustomDimension;
import com.asiainfo.pivot.core.model.CustomDimensionRule;
import com.asiainfo.pivot.core.model.CustomDimensionType;
import com.asiainfo.pivot.core.model.MetricRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 自定义维度后处理：在已分组的数据上逐行打标签，按需再以标签重新分组求和
 */
public class CustomDimensionProcessor {

    private static final Logger log = LoggerFactory.getLogger(CustomDimensionProcessor.class);

    /**
     * 打标签并按标签重新聚合，结果行只保留新维度列
     */
    public CustomDimensionResult apply(List<MetricRow> rows, CustomDimension def, List<String> existingDims) {
        return apply(rows, def, existingDims, true);
    }

    /**
     * @param regroup 为 false 时只追加标签列，行数不变
     */
    public CustomDimensionResult apply(List<MetricRow> rows, CustomDimension def, List<String> existingDims,
                                       boolean regroup) {
        String column = def.columnName();
        if (rows.isEmpty()) {
            return new CustomDimensionResult(rows, column);
        }

        List<MetricRow> labelled = new ArrayList<>(rows.size());
        if (def.type() == CustomDimensionType.DATE_RANGE) {
            if (!rows.get(0).dimensions().containsKey(PivotConstants.DATE_DIMENSION)) {
                log.warn("Date column not found for custom dimension '{}'", def.name());
                return new CustomDimensionResult(rows, null);
            }
            for (MetricRow row : rows) {
                labelled.add(row.copy().putDimension(column, dateLabel(toDate(row.dimension(PivotConstants.DATE_DIMENSION)), def.values())));
            }
        } else {
            String source = def.sourceMetric();
            if (source == null || !rows.get(0).hasMetric(source)) {
                log.warn("Source metric '{}' not found for custom dimension '{}'", source, def.name());
                return new CustomDimensionResult(rows, null);
            }
            List<CustomDimensionRule> ordered = def.type() == CustomDimensionType.METRIC_BUCKET
                    ? sortByMinDescending(def.values())
                    : def.values();
            for (MetricRow row : rows) {
                Double value = row.metric(source);
                String label = def.type() == CustomDimensionType.METRIC_BUCKET
                        ? bucketLabel(value, ordered)
                        : conditionLabel(value, ordered);
                labelled.add(row.copy().putDimension(column, label));
            }
        }
        log.debug("Applied custom dimension '{}' ({}) to {} rows", def.name(), def.type().code(), labelled.size());

        if (!regroup) {
            return new CustomDimensionResult(labelled, column);
        }
        return new CustomDimensionResult(regroupByLabel(labelled, column, existingDims), column);
    }

    /**
     * 按 min 降序，无 min 的规则排在最后，同 min 保持原顺序
     */
    static List<CustomDimensionRule> sortByMinDescending(List<CustomDimensionRule> rules) {
        List<CustomDimensionRule> sorted = new ArrayList<>(rules);
        sorted.sort(Comparator.comparingDouble(
                (CustomDimensionRule r) -> r.min() == null ? Double.NEGATIVE_INFINITY : r.min()).reversed());
        return sorted;
    }

    static String bucketLabel(Double value, List<CustomDimensionRule> sortedRules) {
        for (CustomDimensionRule rule : sortedRules) {
            if (rule.matchesBucket(value)) {
                return rule.label();
            }
        }
        return PivotConstants.OTHER_LABEL;
    }

    static String dateLabel(LocalDate date, List<CustomDimensionRule> rules) {
        for (CustomDimensionRule rule : rules) {
            if (rule.matchesDate(date)) {
                return rule.label();
            }
        }
        return PivotConstants.OTHER_LABEL;
    }

    static String conditionLabel(Double value, List<CustomDimensionRule> rules) {
        for (CustomDimensionRule rule : rules) {
            if (rule.matchesConditions(value)) {
                return rule.label();
            }
        }
        return PivotConstants.OTHER_LABEL;
    }

    /**
     * 以标签为唯一分组键对所有指标列求和，原有维度列丢弃
     */
    private List<MetricRow> regroupByLabel(List<MetricRow> rows, String column, List<String> existingDims) {
        Map<String, MetricRow> groups = new TreeMap<>();
        for (MetricRow row : rows) {
            String label = (String) row.dimension(column);
            MetricRow group = groups.computeIfAbsent(label, k -> new MetricRow().putDimension(column, k));
            row.metrics().forEach((id, value) -> {
                double current = group.hasMetric(id) ? group.metricOrZero(id) : 0.0;
                group.putMetric(id, current + SafeMath.sanitize(value));
            });
        }
        log.debug("Re-aggregated {} rows over {} into {} buckets", rows.size(), existingDims, groups.size());
        return new ArrayList<>(groups.values());
    }

    private static LocalDate toDate(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof LocalDate date) {
            return date;
        }
        String text = value.toString();
        try {
            return LocalDate.parse(text.length() > 10 ? text.substring(0, 10) : text);
        } catch (DateTimeParseException e) {
            log.warn("Unparseable date value '{}', treated as unmatched", text);
            return null;
        }
    }
}
