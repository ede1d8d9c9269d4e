package com.asiainfo.pivot.core.engine;

import com.asiainfo.pivot.core.PivotConstants;
import com.asiainfo.pivot.core.SafeMath;
import com.asiainfo.pivot.core.model.MetricRow;
import com.asiainfo.pivot.core.model.PivotRow;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 把聚合结果整理为透视表行
 */
public class PivotRowBuilder {

    private final AggregationEngine engine;

    public PivotRowBuilder(AggregationEngine engine) {
        this.engine = engine;
    }

    /**
     * 复合维度值："US - mobile"；NULL 显示为 __NULL__，空串原样保留；无维度时为 All
     */
    public static String dimensionValue(MetricRow row, List<String> dims) {
        if (dims.isEmpty()) {
            return PivotConstants.ALL_LABEL;
        }
        List<String> parts = new ArrayList<>(dims.size());
        for (String dim : dims) {
            Object value = row.dimension(dim);
            parts.add(value == null ? PivotConstants.NULL_MARKER : String.valueOf(value));
        }
        return String.join(PivotConstants.COMPOSITE_SEPARATOR, parts);
    }

    /**
     * @param displayMetrics 输出到每行的指标，另各附一个 _pct 占比 (保留两位小数)
     */
    public List<PivotRow> buildRows(List<MetricRow> rows, List<String> dims, List<String> displayMetrics) {
        Map<String, Double> totals = engine.totals(rows);
        List<PivotRow> result = new ArrayList<>(rows.size());
        for (MetricRow row : rows) {
            Map<String, Double> metrics = new LinkedHashMap<>();
            for (String id : displayMetrics) {
                if (row.hasMetric(id)) {
                    metrics.put(id, row.metricOrZero(id));
                }
            }
            for (String id : displayMetrics) {
                if (row.hasMetric(id)) {
                    double total = totals.getOrDefault(id, 0.0);
                    metrics.put(id + PivotConstants.PCT_SUFFIX, SafeMath.round2(SafeMath.percentage(row.metricOrZero(id), total)));
                }
            }
            result.add(new PivotRow(dimensionValue(row, dims), metrics,
                    engine.percentageOfTotal(row, totals), !dims.isEmpty()));
        }
        return result;
    }

    /**
     * 合计行，所有占比恒为 100
     */
    public PivotRow buildTotal(MetricRow total, List<String> displayMetrics) {
        Map<String, Double> metrics = new LinkedHashMap<>();
        for (String id : displayMetrics) {
            if (total.hasMetric(id)) {
                metrics.put(id, total.metricOrZero(id));
            }
        }
        for (String id : displayMetrics) {
            if (total.hasMetric(id)) {
                metrics.put(id + PivotConstants.PCT_SUFFIX, 100.0);
            }
        }
        return new PivotRow(PivotConstants.TOTAL_LABEL, metrics, 100.0, false);
    }
}
