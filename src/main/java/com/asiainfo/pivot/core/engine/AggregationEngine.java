package com.asiainfo.pivot.core.engine;

import com.asiainfo.pivot.core.PivotConstants;
import com.asiainfo.pivot.core.SafeMath;
import com.asiainfo.pivot.core.generator.FetchSpecBuilder;
import com.asiainfo.pivot.core.generator.FetchTarget;
import com.asiainfo.pivot.core.generator.GroupedFetchSpec;
import com.asiainfo.pivot.core.model.DateRange;
import com.asiainfo.pivot.core.model.FilterSpec;
import com.asiainfo.pivot.core.model.Granularity;
import com.asiainfo.pivot.core.model.MetricRow;
import com.asiainfo.pivot.core.parser.MetricCatalog;
import com.asiainfo.pivot.infra.store.TabularStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 聚合引擎：一次分组取数，随后计算派生指标、合计与占比
 */
public class AggregationEngine {

    private static final Logger log = LoggerFactory.getLogger(AggregationEngine.class);

    private final MetricCatalog catalog;
    private final FetchSpecBuilder fetchSpecBuilder;
    private final TabularStore store;

    public AggregationEngine(MetricCatalog catalog, FetchSpecBuilder fetchSpecBuilder, TabularStore store) {
        this.catalog = catalog;
        this.fetchSpecBuilder = fetchSpecBuilder;
        this.store = store;
    }

    public MetricCatalog catalog() {
        return catalog;
    }

    /**
     * 按 dims 分组取回请求指标依赖的 volume 指标，并计算派生指标。
     * needsReaggregation 时仍只按 dims 分组，由存储端跨日期求和，不在内存中按日期展开。
     */
    public List<MetricRow> aggregate(List<String> dims, Collection<String> metrics, FilterSpec filters,
                                     FetchTarget target, Integer limit, int offset, List<String> dimensionValues) {
        List<String> volumes = catalog.requiredVolumeMetrics(metrics);
        GroupedFetchSpec spec = fetchSpecBuilder.pivot(target, dims, volumes, filters, limit, offset, dimensionValues);
        List<Map<String, Object>> records = store.execute(spec);

        List<MetricRow> rows = new ArrayList<>(records.size());
        for (Map<String, Object> record : records) {
            rows.add(MetricRow.fromRecord(record, dims));
        }
        computeDerivedMetrics(rows, metrics);
        log.debug("Aggregated {} rows from {} (rollup={}, reaggregate={})",
                rows.size(), target.tablePath(), target.rollup(), target.needsReaggregation());
        return rows;
    }

    /**
     * 按粒度截断日期后的时间序列，每行只有 date 一个维度，按日期升序
     */
    public List<MetricRow> trends(Collection<String> metrics, FilterSpec filters, FetchTarget target,
                                  Granularity granularity) {
        List<String> volumes = catalog.requiredVolumeMetrics(metrics);
        List<Map<String, Object>> records = store.execute(
                fetchSpecBuilder.trends(target, volumes, filters, granularity));
        List<String> dims = List.of(PivotConstants.DATE_DIMENSION);
        List<MetricRow> rows = new ArrayList<>(records.size());
        for (Map<String, Object> record : records) {
            rows.add(MetricRow.fromRecord(record, dims));
        }
        computeDerivedMetrics(rows, metrics);
        log.debug("Trends {} on {}: {} points", granularity.code(), target.tablePath(), rows.size());
        return rows;
    }

    /**
     * 按依赖顺序计算派生指标。单个指标失败时该行取 0，同一指标只告警一次。
     */
    public void computeDerivedMetrics(List<MetricRow> rows, Collection<String> metrics) {
        List<String> order = catalog.derivedClosure(metrics);
        if (order.isEmpty()) {
            return;
        }
        Set<String> failed = new LinkedHashSet<>();
        for (MetricRow row : rows) {
            for (String id : order) {
                try {
                    row.putMetric(id, SafeMath.sanitize(catalog.evaluate(id, row::metric)));
                } catch (RuntimeException e) {
                    row.putMetric(id, 0.0);
                    if (failed.add(id)) {
                        log.warn("Failed to compute metric {}: {}", id, e.getMessage());
                    }
                }
            }
        }
    }

    /**
     * 各指标列在全部返回行上的合计
     */
    public Map<String, Double> totals(List<MetricRow> rows) {
        Map<String, Double> totals = new LinkedHashMap<>();
        for (MetricRow row : rows) {
            row.metrics().forEach((id, value) -> totals.merge(id, SafeMath.sanitize(value), Double::sum));
        }
        return totals;
    }

    /**
     * 主指标 (目录顺序中第一个在行内且合计大于 0 的指标) 的行占比
     */
    public double percentageOfTotal(MetricRow row, Map<String, Double> totals) {
        for (String id : catalog.ids()) {
            Double total = totals.get(id);
            if (row.hasMetric(id) && total != null && total > 0) {
                return SafeMath.percentage(row.metricOrZero(id), total);
            }
        }
        return 0.0;
    }

    /**
     * 合计行：各列求和，派生指标再用合计后的 volume 重新计算 (比率的和没有意义)
     */
    public MetricRow totalRow(List<MetricRow> rows, Collection<String> metrics) {
        MetricRow total = new MetricRow(Map.of(), totals(rows));
        if (!rows.isEmpty()) {
            computeDerivedMetrics(List.of(total), metrics);
        }
        return total;
    }

    /**
     * 分组组合数；没有维度时只有一行
     */
    public long totalCount(List<String> dims, FilterSpec filters, FetchTarget target) {
        if (dims.isEmpty()) {
            return 1;
        }
        List<Map<String, Object>> result = store.execute(fetchSpecBuilder.totalCount(target, dims, filters));
        if (result.isEmpty()) {
            return 0;
        }
        Double count = SafeMath.toDouble(result.get(0).get(GroupedFetchSpec.TOTAL_COUNT));
        return count == null ? 0 : count.longValue();
    }

    /**
     * 过滤条件下数据实际覆盖的日期范围，无数据时为空
     */
    public Optional<DateRange> dataDateRange(FilterSpec filters, FetchTarget target) {
        List<Map<String, Object>> result = store.execute(fetchSpecBuilder.dateRange(target, filters));
        if (result.isEmpty()) {
            return Optional.empty();
        }
        LocalDate min = toDate(result.get(0).get(FetchSpecBuilder.MIN_DATE));
        LocalDate max = toDate(result.get(0).get(FetchSpecBuilder.MAX_DATE));
        if (min == null || max == null || max.isBefore(min)) {
            return Optional.empty();
        }
        return Optional.of(DateRange.of(min, max));
    }

    /**
     * 维度取值列表，NULL 不返回
     */
    public List<String> dimensionValues(String dimension, FilterSpec filters, FetchTarget target,
                                        int limit, String sortMetric) {
        List<Map<String, Object>> result = store.execute(
                fetchSpecBuilder.dimensionValues(target, dimension, filters, limit, sortMetric));
        List<String> values = new ArrayList<>();
        for (Map<String, Object> record : result) {
            Object value = record.get(FetchSpecBuilder.VALUE);
            if (value != null) {
                values.add(String.valueOf(value));
            }
        }
        return values;
    }

    private static LocalDate toDate(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof LocalDate date) {
            return date;
        }
        return LocalDate.parse(value.toString().substring(0, Math.min(10, value.toString().length())));
    }
}
