package com.asiainfo.pivot.application;

import com.asiainfo.pivot.config.PivotConfig;
import com.asiainfo.pivot.core.PivotConstants;
import com.asiainfo.pivot.core.engine.AggregationEngine;
import com.asiainfo.pivot.core.engine.PivotRowBuilder;
import com.asiainfo.pivot.core.exception.RoutingUnavailableException;
import com.asiainfo.pivot.core.generator.FetchSpecBuilder;
import com.asiainfo.pivot.core.generator.FetchTarget;
import com.asiainfo.pivot.core.model.BaselineComparison;
import com.asiainfo.pivot.core.model.CustomAggregation;
import com.asiainfo.pivot.core.model.CustomDimension;
import com.asiainfo.pivot.core.model.CustomDimensionType;
import com.asiainfo.pivot.core.model.CustomMetric;
import com.asiainfo.pivot.core.model.DateRange;
import com.asiainfo.pivot.core.model.FilterSpec;
import com.asiainfo.pivot.core.model.Granularity;
import com.asiainfo.pivot.core.model.MetricComparison;
import com.asiainfo.pivot.core.model.MetricRow;
import com.asiainfo.pivot.core.model.PivotError;
import com.asiainfo.pivot.core.model.PivotRequest;
import com.asiainfo.pivot.core.model.PivotResult;
import com.asiainfo.pivot.core.model.PivotRow;
import com.asiainfo.pivot.core.model.Rollup;
import com.asiainfo.pivot.core.model.TrendPoint;
import com.asiainfo.pivot.core.parser.MetricCatalog;
import com.asiainfo.pivot.core.postprocess.CustomDimensionProcessor;
import com.asiainfo.pivot.core.postprocess.CustomDimensionResult;
import com.asiainfo.pivot.core.postprocess.CustomMetricProcessor;
import com.asiainfo.pivot.core.router.QueryRouter;
import com.asiainfo.pivot.core.router.RollupCandidate;
import com.asiainfo.pivot.core.router.RollupCatalog;
import com.asiainfo.pivot.core.router.RollupRecommendation;
import com.asiainfo.pivot.core.router.RouteDecision;
import com.asiainfo.pivot.infra.persistence.MetadataRepository;
import com.asiainfo.pivot.infra.persistence.RollupCatalogStore;
import com.asiainfo.pivot.infra.persistence.SchemaContext;
import com.asiainfo.pivot.infra.store.TabularStore;
import com.asiainfo.pivot.infra.store.TimedTabularStore;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
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
 * 透视查询入口
 * 每次请求读取最新的 schema 与 rollup 快照，组装路由、聚合与后处理组件；组件本身不持有共享状态。
 */
@ApplicationScoped
public class PivotService {

    private static final Logger log = LoggerFactory.getLogger(PivotService.class);

    private final MetadataRepository metadata;
    private final RollupCatalogStore rollupStore;
    private final TabularStore store;
    private final PivotConfig config;
    private final MeterRegistry registry;
    private final Clock clock;

    @Inject
    public PivotService(MetadataRepository metadata, RollupCatalogStore rollupStore, TabularStore store,
                        PivotConfig config, MeterRegistry registry) {
        this(metadata, rollupStore, store, config, registry, Clock.systemDefaultZone());
    }

    public PivotService(MetadataRepository metadata, RollupCatalogStore rollupStore, TabularStore store,
                        PivotConfig config, MeterRegistry registry, Clock clock) {
        this.metadata = metadata;
        this.rollupStore = rollupStore;
        this.store = new TimedTabularStore(store, registry);
        this.config = config;
        this.registry = registry;
        this.clock = clock;
    }

    // ==================== 路由 ====================

    public RouteDecision route(String table, List<String> dims, List<String> metrics,
                               Collection<String> filterDims, boolean requireRollup) {
        SchemaContext ctx = metadata.context(table);
        RouteDecision decision = router(table, ctx).route(dims, metrics, filterDims, requireRollup);
        countDecision(decision);
        return decision;
    }

    public List<RollupCandidate> findSuitableRollups(String table, List<String> dims, List<String> metrics,
                                                     Collection<String> filterDims) {
        return router(table, metadata.context(table)).findSuitableRollups(dims, metrics, filterDims);
    }

    public Optional<Rollup> findBaselineRollup(String table) {
        return router(table, metadata.context(table)).findBaselineRollup();
    }

    public List<RollupRecommendation> recommendRollups(String table, List<List<String>> dimensionCombinations) {
        return router(table, metadata.context(table)).recommendRollups(dimensionCombinations);
    }

    // ==================== 透视数据 ====================

    public PivotResult getPivotData(PivotRequest request) {
        SchemaContext ctx = metadata.context(request.table());
        MetricCatalog catalog = ctx.catalog();
        LocalDate today = LocalDate.now(clock);
        FilterSpec filters = request.filters();

        // 维度列表中的 custom_xxx 等价于 customDimensionId
        String customDimensionId = request.customDimensionId();
        List<String> dims = new ArrayList<>();
        for (String dim : request.dimensions()) {
            if (dim.startsWith(PivotConstants.CUSTOM_DIMENSION_PREFIX) && !ctx.dimensions().containsKey(dim)) {
                customDimensionId = customDimensionId == null
                        ? dim.substring(PivotConstants.CUSTOM_DIMENSION_PREFIX.length())
                        : customDimensionId;
            } else {
                dims.add(dim);
            }
        }
        validateDimensions(ctx, dims);

        CustomDimension customDim = customDimensionId == null ? null : ctx.customDimension(customDimensionId);
        List<CustomMetric> customMetrics = request.customMetricIds().stream().map(ctx::customMetric).toList();

        List<String> metrics = resolveMetrics(catalog, request.metrics());
        Set<String> queryMetrics = new LinkedHashSet<>(metrics);
        if (customDim != null && customDim.type() != CustomDimensionType.DATE_RANGE
                && customDim.sourceMetric() != null && catalog.contains(customDim.sourceMetric())) {
            queryMetrics.add(customDim.sourceMetric());
        }
        for (CustomMetric cm : customMetrics) {
            if (cm.sourceMetric() != null && catalog.contains(cm.sourceMetric())) {
                queryMetrics.add(cm.sourceMetric());
            }
        }

        List<String> fetchDims = new ArrayList<>(dims);
        if (customDim != null && customDim.type() == CustomDimensionType.DATE_RANGE
                && !fetchDims.contains(PivotConstants.DATE_DIMENSION)) {
            fetchDims.add(PivotConstants.DATE_DIMENSION);
        }

        boolean requireRollup = request.requireRollup() != null ? request.requireRollup() : config.isRequireRollup();
        QueryRouter router = router(request.table(), ctx);
        Set<String> filterDims = filters.filterDimensions();
        RouteDecision decision;
        try {
            decision = routeOrFail(router, fetchDims, queryMetrics, filterDims, requireRollup);
        } catch (RoutingUnavailableException e) {
            log.warn("Pivot rejected for {}: {}", request.table(), e.getMessage());
            return PivotResult.failed(rollupRequired(e), ctx.availableDimensions());
        }
        log.info("Pivot routing: dims={}, filters={}, use_rollup={}, reason={}",
                fetchDims, filterDims, decision.useRollup(), decision.reason());

        FetchTarget target = FetchTarget.of(decision, ctx.snapshot().tablePath());
        AggregationEngine engine = engine(ctx, today);
        int limit = config.effectiveLimit(request.limit());

        // 自定义维度要先在全部分组上打标签，分页放到重新分组之后
        boolean bucketed = customDim != null;
        List<MetricRow> rows = engine.aggregate(fetchDims, queryMetrics, filters, target,
                bucketed ? null : limit,
                bucketed ? 0 : request.offset(),
                bucketed ? List.of() : request.dimensionValues());

        List<String> rowDims = fetchDims;
        long bucketCount = -1;
        if (bucketed) {
            CustomDimensionResult result = new CustomDimensionProcessor().apply(rows, customDim, fetchDims);
            if (result.applied()) {
                rows = result.rows();
                rowDims = List.of(result.columnName());
                engine.computeDerivedMetrics(rows, queryMetrics);
            }
            bucketCount = rows.size();
            rows = paginate(rows, request.offset(), limit);
        }

        if (!customMetrics.isEmpty()) {
            CustomMetricProcessor processor = new CustomMetricProcessor(numDays(customMetrics, filters, engine, target, today));
            for (CustomMetric cm : customMetrics) {
                rows = processor.apply(rows, cm, rowDims);
            }
        }

        List<String> displayMetrics = new ArrayList<>(metrics);
        customMetrics.forEach(cm -> displayMetrics.add(cm.id()));

        PivotRowBuilder rowBuilder = new PivotRowBuilder(engine);
        List<PivotRow> pivotRows = rowBuilder.buildRows(rows, rowDims, displayMetrics);
        PivotRow total = rowBuilder.buildTotal(engine.totalRow(rows, queryMetrics), displayMetrics);

        long totalCount;
        if (request.skipCount()) {
            totalCount = rows.size();
        } else if (bucketCount >= 0) {
            totalCount = bucketCount;
        } else {
            totalCount = engine.totalCount(fetchDims, filters, target);
        }
        BaselineComparison baseline = null;
        if (request.compareBaseline()) {
            baseline = compareWithBaseline(router, engine, fetchDims, metrics, filters, target);
        }
        return new PivotResult(pivotRows, total, ctx.availableDimensions(), totalCount, null, baseline);
    }

    /**
     * 下钻：在父维度取值的过滤下按子维度 (默认 search_term) 展开
     */
    public PivotResult getPivotChildren(String table, String dimension, String value, FilterSpec filters,
                                        Integer limit, Integer offset) {
        SchemaContext ctx = metadata.context(table);
        FilterSpec childFilters = filters == null ? FilterSpec.none() : filters;
        if (dimension != null && value != null) {
            childFilters = childFilters.withDimensionFilter(dimension, List.of(value));
        }
        PivotRequest request = PivotRequest.builder(table)
                .dimensions(ctx.snapshot().childDimension())
                .filters(childFilters)
                .limit(limit)
                .offset(offset)
                .skipCount(true)
                .build();
        return getPivotData(request);
    }

    // ==================== 趋势与概览 ====================

    /**
     * 按粒度汇总的时间序列，包含 schema 中全部指标 (派生指标按周期重新计算)
     *
     * @throws RoutingUnavailableException 要求 rollup 且没有可用 rollup 时
     */
    public List<TrendPoint> getTrendsData(String table, FilterSpec filters, Granularity granularity) {
        SchemaContext ctx = metadata.context(table);
        FilterSpec effective = filters == null ? FilterSpec.none() : filters;
        Granularity effectiveGranularity = granularity == null ? Granularity.DAILY : granularity;
        List<String> metrics = ctx.catalog().ids();

        RouteDecision decision = routeOrFail(router(table, ctx), List.of(PivotConstants.DATE_DIMENSION), metrics,
                effective.filterDimensions(), config.isRequireRollup());
        log.info("Trends routing: granularity={}, filters={}, use_rollup={}, reason={}",
                effectiveGranularity.code(), effective.filterDimensions(), decision.useRollup(), decision.reason());

        FetchTarget target = FetchTarget.of(decision, ctx.snapshot().tablePath());
        List<MetricRow> rows = engine(ctx, LocalDate.now(clock)).trends(metrics, effective, target, effectiveGranularity);
        List<TrendPoint> points = new ArrayList<>(rows.size());
        for (MetricRow row : rows) {
            points.add(new TrendPoint(String.valueOf(row.dimension(PivotConstants.DATE_DIMENSION)), metricValues(row, metrics)));
        }
        return points;
    }

    /**
     * 过滤条件下全部指标的总体值 (KPI 卡片)
     *
     * @throws RoutingUnavailableException 要求 rollup 且没有可用 rollup 时
     */
    public Map<String, Double> getOverviewMetrics(String table, FilterSpec filters) {
        SchemaContext ctx = metadata.context(table);
        FilterSpec effective = filters == null ? FilterSpec.none() : filters;
        List<String> metrics = ctx.catalog().ids();

        RouteDecision decision = routeOrFail(router(table, ctx), List.of(), metrics,
                effective.filterDimensions(), config.isRequireRollup());
        log.info("Overview routing: filters={}, use_rollup={}, reason={}",
                effective.filterDimensions(), decision.useRollup(), decision.reason());

        FetchTarget target = FetchTarget.of(decision, ctx.snapshot().tablePath());
        List<MetricRow> rows = engine(ctx, LocalDate.now(clock))
                .aggregate(List.of(), metrics, effective, target, null, 0, List.of());
        return metricValues(rows.isEmpty() ? new MetricRow() : rows.get(0), metrics);
    }

    /**
     * 维度取值列表，路由维度为 {dimension} ∪ pivotDims ∪ 过滤维度
     */
    public List<String> getDimensionValues(String table, String dimension, FilterSpec filters, Integer limit,
                                           List<String> pivotDims, boolean requireRollup) {
        SchemaContext ctx = metadata.context(table);
        FilterSpec effective = filters == null ? FilterSpec.none() : filters;
        Set<String> allDims = new LinkedHashSet<>();
        allDims.add(dimension);
        if (pivotDims != null) {
            allDims.addAll(pivotDims);
        }
        allDims.addAll(effective.filterDimensions());
        validateDimensions(ctx, new ArrayList<>(allDims));

        QueryRouter router = router(table, ctx);
        RouteDecision decision = routeOrFail(router, new ArrayList<>(allDims), List.of(),
                effective.filterDimensions(), requireRollup);
        log.info("Dimension values routing: dim={}, all_dims={}, use_rollup={}, reason={}",
                dimension, allDims, decision.useRollup(), decision.reason());

        FetchTarget target = FetchTarget.of(decision, ctx.snapshot().tablePath());
        List<String> volumes = ctx.catalog().volumeMetricIds();
        String sortMetric = volumes.isEmpty() ? null : volumes.get(0);
        int effectiveLimit = limit == null || limit <= 0 ? 1000 : Math.min(limit, config.getMaxLimit());
        return engine(ctx, LocalDate.now(clock)).dimensionValues(dimension, effective, target, effectiveLimit, sortMetric);
    }

    // ==================== 内部方法 ====================

    private RouteDecision routeOrFail(QueryRouter router, List<String> dims, Collection<String> metrics,
                                      Collection<String> filterDims, boolean requireRollup) {
        RouteDecision decision = router.route(dims, metrics, filterDims, requireRollup);
        countDecision(decision);
        if (decision.isUnavailable()) {
            throw new RoutingUnavailableException(decision);
        }
        return decision;
    }

    /**
     * 当前各 volume 指标的全量合计与 date 基线 rollup 合计对比，比值超过 1 + 阈值视为膨胀。
     * 基线只有 date 维度，存在其它维度的过滤时无法对齐，视为没有基线。
     */
    private BaselineComparison compareWithBaseline(QueryRouter router, AggregationEngine engine, List<String> fetchDims,
                                                   List<String> metrics, FilterSpec filters, FetchTarget target) {
        Optional<Rollup> found = router.findBaselineRollup();
        if (found.isEmpty() || !filters.filterDimensions().isEmpty()) {
            log.debug("No baseline comparison: baseline={}, filters={}", found.map(Rollup::id).orElse(null),
                    filters.filterDimensions());
            return BaselineComparison.unavailable();
        }
        Rollup baseline = found.get();
        List<String> volumes = engine.catalog().requiredVolumeMetrics(metrics).stream()
                .filter(id -> baseline.storesAllVolumeMetrics() || baseline.metrics().contains(id))
                .toList();
        if (volumes.isEmpty()) {
            return BaselineComparison.unavailable();
        }

        // 分页前的全量合计
        Map<String, Double> current = engine.totals(
                engine.aggregate(fetchDims, volumes, filters, target, null, 0, List.of()));
        Map<String, Double> base = engine.totals(engine.aggregate(List.of(), volumes, filters,
                FetchTarget.rollup(baseline.tablePath(), true), null, 0, List.of()));

        Map<String, MetricComparison> comparisons = new LinkedHashMap<>();
        boolean anyInflated = false;
        for (String id : volumes) {
            double baseValue = base.getOrDefault(id, 0.0);
            if (baseValue <= 0) {
                continue;
            }
            double currentValue = current.getOrDefault(id, 0.0);
            double ratio = currentValue / baseValue;
            boolean inflated = ratio > 1 + PivotConstants.INFLATION_THRESHOLD;
            comparisons.put(id, new MetricComparison(baseValue, currentValue, ratio, inflated));
            anyInflated |= inflated;
        }
        if (anyInflated) {
            log.info("Metrics inflated against baseline {}: {}", baseline.id(),
                    comparisons.entrySet().stream().filter(e -> e.getValue().inflated()).map(Map.Entry::getKey).toList());
        }
        return new BaselineComparison(true, comparisons, anyInflated);
    }

    private static Map<String, Double> metricValues(MetricRow row, List<String> metrics) {
        Map<String, Double> values = new LinkedHashMap<>();
        for (String id : metrics) {
            values.put(id, row.metricOrZero(id));
        }
        return values;
    }

    /**
     * 诊断信息直接取自本次路由结果，与被拒绝的维度集合 (含自动补充的 date) 一致
     */
    private PivotError rollupRequired(RoutingUnavailableException e) {
        String reason = e.getDecision().reason();
        // 目录为空时路由原因里没有建表提示
        String message = reason.contains("Create a rollup") ? reason : reason + ". " + e.getUserFriendlyMessage();
        return new PivotError(message, PivotConstants.ROLLUP_REQUIRED, e.getRequiredDimensions(),
                e.getMissingMetrics(), e.getDecision().candidates());
    }

    /**
     * avg_per_day 的天数：优先用过滤条件的绝对区间，否则探测数据实际覆盖的日期范围
     */
    private long numDays(List<CustomMetric> customMetrics, FilterSpec filters, AggregationEngine engine,
                         FetchTarget target, LocalDate today) {
        Optional<DateRange> range = filters.resolveDateRange(today);
        if (range.isPresent()) {
            return range.get().numDays();
        }
        boolean needsDays = customMetrics.stream().anyMatch(cm -> cm.aggregationType() == CustomAggregation.AVG_PER_DAY);
        if (!needsDays) {
            return 1;
        }
        return engine.dataDateRange(filters, target).map(DateRange::numDays).orElse(1L);
    }

    private QueryRouter router(String table, SchemaContext ctx) {
        RollupCatalog rollups = RollupCatalog.of(rollupStore.listRollups(table));
        return new QueryRouter(ctx.catalog(), rollups, config.isStrictDistinct());
    }

    private AggregationEngine engine(SchemaContext ctx, LocalDate today) {
        FetchSpecBuilder builder = new FetchSpecBuilder(ctx.catalog(), ctx.dimensions(), today);
        return new AggregationEngine(ctx.catalog(), builder, store);
    }

    private void countDecision(RouteDecision decision) {
        String outcome = decision.useRollup() ? "rollup" : decision.isUnavailable() ? "unavailable" : "raw";
        registry.counter("pivot.route.decisions", "outcome", outcome).increment();
    }

    private static List<String> resolveMetrics(MetricCatalog catalog, List<String> requested) {
        if (requested.isEmpty()) {
            return catalog.ids();
        }
        List<String> result = new ArrayList<>();
        for (String id : requested) {
            if (!catalog.contains(id)) {
                throw new IllegalArgumentException("Unknown metric: " + id);
            }
            if (!result.contains(id)) {
                result.add(id);
            }
        }
        return result;
    }

    private static void validateDimensions(SchemaContext ctx, List<String> dims) {
        for (String dim : dims) {
            if (!ctx.dimensions().containsKey(dim) && !PivotConstants.DATE_DIMENSION.equals(dim)) {
                throw new IllegalArgumentException("Unknown dimension: " + dim);
            }
        }
    }

    private static List<MetricRow> paginate(List<MetricRow> rows, int offset, int limit) {
        int from = Math.min(Math.max(0, offset), rows.size());
        int to = Math.min(rows.size(), from + limit);
        return new ArrayList<>(rows.subList(from, to));
    }
}
