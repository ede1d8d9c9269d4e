package com.asiainfo.pivot.core.generator;

import com.asiainfo.pivot.core.PivotConstants;
import com.asiainfo.pivot.core.model.AggregateFunction;
import com.asiainfo.pivot.core.model.DataType;
import com.asiainfo.pivot.core.model.DimensionDef;
import com.asiainfo.pivot.core.model.FilterSpec;
import com.asiainfo.pivot.core.model.Granularity;
import com.asiainfo.pivot.core.model.MetricDef;
import com.asiainfo.pivot.core.parser.MetricCatalog;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 根据路由结果和过滤条件构造结构化的取数请求
 * rollup 表按维度ID存列、按指标ID存预聚合值；原始表按 DimensionDef.columnName 取列、按指标定义的聚合函数计算。
 */
public class FetchSpecBuilder {

    public static final String MIN_DATE = "min_date";
    public static final String MAX_DATE = "max_date";
    public static final String VALUE = "value";
    public static final String SORT_METRIC = "sort_metric";

    private final MetricCatalog catalog;
    private final Map<String, DimensionDef> dimensions;
    private final LocalDate today;

    public FetchSpecBuilder(MetricCatalog catalog, Map<String, DimensionDef> dimensions, LocalDate today) {
        this.catalog = catalog;
        this.dimensions = dimensions;
        this.today = today;
    }

    /**
     * 主查询：按 dims 分组，volume 指标聚合。
     * 给定 dimensionValues 时只取这些复合值对应的行，此时不分页、按维度排序。
     */
    public GroupedFetchSpec pivot(FetchTarget target, List<String> dims, List<String> volumeMetrics,
                                  FilterSpec filters, Integer limit, int offset, List<String> dimensionValues) {
        List<SelectColumn> select = new ArrayList<>();
        List<String> groupBy = new ArrayList<>();
        for (String dim : dims) {
            String column = column(target, dim);
            select.add(SelectColumn.dimension(column, dim));
            groupBy.add(column);
        }
        for (String metricId : volumeMetrics) {
            select.add(metricColumn(target, catalog.get(metricId)));
        }

        List<FetchPredicate> predicates = predicates(target, filters);
        List<SortKey> orderBy = new ArrayList<>();
        boolean restricted = dimensionValues != null && !dimensionValues.isEmpty() && !dims.isEmpty();
        if (restricted) {
            predicates.add(dimensionValuesPredicate(target, dims, dimensionValues));
            dims.forEach(d -> orderBy.add(SortKey.asc(d)));
            return new GroupedFetchSpec(FetchKind.PIVOT, target.tablePath(), select, groupBy, predicates,
                    orderBy, null, 0, false);
        }

        if (!volumeMetrics.isEmpty()) {
            orderBy.add(SortKey.desc(volumeMetrics.get(0)));
        }
        // 维度升序作为次序键，保证分页稳定
        dims.forEach(d -> orderBy.add(SortKey.asc(d)));
        return new GroupedFetchSpec(FetchKind.PIVOT, target.tablePath(), select, groupBy, predicates,
                orderBy, limit, offset, false);
    }

    /**
     * 分组组合总数，调用方需保证 dims 非空
     */
    public GroupedFetchSpec totalCount(FetchTarget target, List<String> dims, FilterSpec filters) {
        if (dims.isEmpty()) {
            throw new IllegalArgumentException("Total count needs at least one dimension");
        }
        List<String> groupBy = dims.stream().map(d -> column(target, d)).toList();
        List<SelectColumn> select = List.of(SelectColumn.aggregate(AggregateFunction.COUNT, "*", GroupedFetchSpec.TOTAL_COUNT));
        return new GroupedFetchSpec(FetchKind.COUNT, target.tablePath(), select, groupBy,
                predicates(target, filters), List.of(), null, 0, true);
    }

    /**
     * 趋势：日期按粒度截断后分组，按日期升序，不分页
     */
    public GroupedFetchSpec trends(FetchTarget target, List<String> volumeMetrics, FilterSpec filters,
                                   Granularity granularity) {
        String dateColumn = column(target, PivotConstants.DATE_DIMENSION);
        List<SelectColumn> select = new ArrayList<>();
        select.add(SelectColumn.dateTrunc(dateColumn, PivotConstants.DATE_DIMENSION, granularity));
        for (String metricId : volumeMetrics) {
            select.add(metricColumn(target, catalog.get(metricId)));
        }
        return new GroupedFetchSpec(FetchKind.TRENDS, target.tablePath(), select,
                List.of(PivotConstants.DATE_DIMENSION), predicates(target, filters),
                List.of(SortKey.asc(PivotConstants.DATE_DIMENSION)), null, 0, false);
    }

    /**
     * 过滤条件下数据实际覆盖的日期范围
     */
    public GroupedFetchSpec dateRange(FetchTarget target, FilterSpec filters) {
        String dateColumn = column(target, PivotConstants.DATE_DIMENSION);
        List<SelectColumn> select = List.of(
                SelectColumn.aggregate(AggregateFunction.MIN, dateColumn, MIN_DATE),
                SelectColumn.aggregate(AggregateFunction.MAX, dateColumn, MAX_DATE));
        return new GroupedFetchSpec(FetchKind.DATE_RANGE, target.tablePath(), select, List.of(),
                predicates(target, filters), List.of(), null, 0, false);
    }

    /**
     * 维度的取值列表。rollup 上给了排序指标时按指标降序，否则按值升序。
     */
    public GroupedFetchSpec dimensionValues(FetchTarget target, String dimension, FilterSpec filters,
                                            int limit, String sortMetric) {
        String column = column(target, dimension);
        List<SelectColumn> select = new ArrayList<>();
        select.add(SelectColumn.dimension(column, VALUE));
        List<FetchPredicate> predicates = predicates(target, filters);
        predicates.add(FetchPredicate.isNotNull(column));

        List<SortKey> orderBy = new ArrayList<>();
        if (target.rollup() && sortMetric != null) {
            select.add(SelectColumn.aggregate(AggregateFunction.SUM, sortMetric, SORT_METRIC));
            orderBy.add(SortKey.desc(SORT_METRIC));
        }
        orderBy.add(SortKey.asc(VALUE));
        return new GroupedFetchSpec(FetchKind.DIMENSION_VALUES, target.tablePath(), select, List.of(column),
                predicates, orderBy, limit, 0, false);
    }

    /**
     * 日期区间与维度过滤。__NULL__ 转为 IS NULL 并与 IN 列表取或，空列表忽略。
     */
    public List<FetchPredicate> predicates(FetchTarget target, FilterSpec filters) {
        List<FetchPredicate> predicates = new ArrayList<>();
        String dateColumn = column(target, PivotConstants.DATE_DIMENSION);
        LocalDate start = filters.resolvedStart(today);
        LocalDate end = filters.resolvedEnd(today);
        if (start != null) {
            predicates.add(FetchPredicate.gte(dateColumn, start));
        }
        if (end != null) {
            predicates.add(FetchPredicate.lte(dateColumn, end));
        }
        for (Map.Entry<String, List<String>> entry : filters.dimensionFilters().entrySet()) {
            if (entry.getValue().isEmpty()) {
                continue;
            }
            predicates.add(inPredicate(target, entry.getKey(), entry.getValue()));
        }
        return predicates;
    }

    private FetchPredicate inPredicate(FetchTarget target, String dimension, List<String> rawValues) {
        DimensionDef def = dimensionDef(dimension);
        boolean includeNull = false;
        List<Object> values = new ArrayList<>();
        for (String raw : rawValues) {
            if (PivotConstants.NULL_MARKER.equals(raw)) {
                includeNull = true;
            } else {
                values.add(def.dataType() == DataType.DATE ? LocalDate.parse(raw.trim()) : def.coerce(raw));
            }
        }
        return FetchPredicate.in(column(target, dimension), values, includeNull);
    }

    private FetchPredicate dimensionValuesPredicate(FetchTarget target, List<String> dims, List<String> values) {
        if (dims.size() == 1) {
            return inPredicate(target, dims.get(0), values);
        }
        List<String> columns = dims.stream().map(d -> column(target, d)).toList();
        return FetchPredicate.compositeIn(columns, values);
    }

    private SelectColumn metricColumn(FetchTarget target, MetricDef metric) {
        if (!metric.isVolume()) {
            throw new IllegalArgumentException("Only volume metrics are fetched, got " + metric.id());
        }
        // rollup 中存的是预聚合值，只能求和；原始表上用完整的聚合定义
        if (target.rollup()) {
            return SelectColumn.aggregate(AggregateFunction.SUM, metric.id(), metric.id());
        }
        return SelectColumn.aggregate(metric.aggregation(), metric.column(), metric.id());
    }

    String column(FetchTarget target, String dimension) {
        if (target.rollup()) {
            return dimension;
        }
        return dimensionDef(dimension).columnName();
    }

    private DimensionDef dimensionDef(String dimension) {
        DimensionDef def = dimensions.get(dimension);
        if (def != null) {
            return def;
        }
        return PivotConstants.DATE_DIMENSION.equals(dimension)
                ? DimensionDef.of(dimension, DataType.DATE)
                : DimensionDef.of(dimension, DataType.STRING);
    }
}
