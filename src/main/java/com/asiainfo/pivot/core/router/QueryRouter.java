package com.asiainfo.pivot.core.router;

import com.asiainfo.pivot.core.PivotConstants;
import com.asiainfo.pivot.core.model.AggregateFunction;
import com.asiainfo.pivot.core.model.MetricDef;
import com.asiainfo.pivot.core.model.Rollup;
import com.asiainfo.pivot.core.parser.MetricCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * 查询路由
 * 对每个 rollup 打分并选出代价最低的一张；只读取传入的目录快照，不缓存任何决策。
 *
 * <ul>
 *   <li>150：维度完全匹配，无需重聚合</li>
 *   <li>100：只多出 date 维度，跨日期求和</li>
 *   <li>80：同上，但请求中含去重计数类指标，跨日期求和会有轻微膨胀</li>
 *   <li>-1：不可用</li>
 * </ul>
 */
public class QueryRouter {

    private static final Logger log = LoggerFactory.getLogger(QueryRouter.class);

    private final MetricCatalog metricCatalog;
    private final RollupCatalog rollupCatalog;
    private final boolean strictDistinct;

    public QueryRouter(MetricCatalog metricCatalog, RollupCatalog rollupCatalog, boolean strictDistinct) {
        this.metricCatalog = metricCatalog;
        this.rollupCatalog = rollupCatalog;
        this.strictDistinct = strictDistinct;
    }

    public QueryRouter(MetricCatalog metricCatalog, RollupCatalog rollupCatalog) {
        this(metricCatalog, rollupCatalog, false);
    }

    public RouteDecision route(Collection<String> dims, Collection<String> metrics,
                               Collection<String> filterDims, boolean requireRollup) {
        Set<String> queryDims = new LinkedHashSet<>(dims);
        Set<String> filterDimSet = new LinkedHashSet<>(filterDims);
        List<String> requiredDims = requiredDimensions(queryDims, filterDimSet);

        if (rollupCatalog.isEmpty()) {
            String reason = requireRollup ? "No rollups configured; query requires raw table" : "No rollups configured";
            log.info("Route: {} (dims={}, filters={})", reason, queryDims, filterDimSet);
            return RouteDecision.raw(reason, new ArrayList<>(metrics), requiredDims, List.of(), requireRollup);
        }

        Set<String> distinctMetrics = distinctLikeMetrics(metrics);
        List<RollupCandidate> candidates = score(queryDims, metrics, filterDimSet, distinctMetrics);

        Optional<RollupCandidate> best = candidates.stream().filter(RollupCandidate::canUse).findFirst();
        if (best.isPresent()) {
            RollupCandidate chosen = best.get();
            Rollup rollup = rollupCatalog.find(chosen.rollupId()).orElseThrow();
            RouteDecision decision = RouteDecision.useRollup(chosen, rollup.tablePath(),
                    metricsAvailable(rollup), requiredDims, candidates);
            log.info("Route: {} dims={} filters={} reaggregate={}", decision.reason(), queryDims, filterDimSet,
                    decision.needsReaggregation());
            return decision;
        }

        List<List<String>> readyDims = rollupCatalog.ready().stream().map(Rollup::dimensions).toList();
        String queryInfo = queryDims.isEmpty()
                ? " No query dimensions (totals query)."
                : " Query dimensions: " + new TreeSet<>(queryDims) + ".";
        String filterInfo = filterDimSet.isEmpty() ? "" : " Filter dimensions: " + new TreeSet<>(filterDimSet) + ".";
        String reason;
        if (requireRollup) {
            reason = "No suitable rollup found." + queryInfo + filterInfo
                    + " Required dimensions: " + requiredDims + "."
                    + " Available rollups: " + readyDims + "."
                    + " Create a rollup with dimensions " + requiredDims + " to enable this query.";
        } else {
            reason = "No suitable rollup found. Required dimensions: " + requiredDims
                    + ". Available rollups: " + readyDims + ".";
        }
        List<String> unavailable = metricsUnavailable(metrics, distinctMetrics);
        log.info("Route: no rollup for dims={} filters={}, unavailable metrics {}", queryDims, filterDimSet, unavailable);
        return RouteDecision.raw(reason, unavailable, requiredDims, candidates, requireRollup);
    }

    /**
     * 全部 rollup 的评分明细 (含非 ready)，按分数降序，同分保持注册顺序
     */
    public List<RollupCandidate> findSuitableRollups(Collection<String> dims, Collection<String> metrics,
                                                     Collection<String> filterDims) {
        return score(new LinkedHashSet<>(dims), metrics, new LinkedHashSet<>(filterDims), distinctLikeMetrics(metrics));
    }

    /**
     * 只含 date 维度的 ready rollup，用于对比指标在维度拆分后是否膨胀
     */
    public Optional<Rollup> findBaselineRollup() {
        return rollupCatalog.ready().stream()
                .filter(r -> r.dimensions().equals(List.of(PivotConstants.DATE_DIMENSION)))
                .findFirst();
    }

    /**
     * 对尚未被任何 rollup 精确覆盖的常用维度组合给出建议
     */
    public List<RollupRecommendation> recommendRollups(List<List<String>> dimensionCombinations) {
        Set<Set<String>> existing = new LinkedHashSet<>();
        for (Rollup rollup : rollupCatalog.rollups()) {
            existing.add(new TreeSet<>(rollup.dimensions()));
        }
        List<RollupRecommendation> recommendations = new ArrayList<>();
        for (List<String> combo : dimensionCombinations) {
            TreeSet<String> sorted = new TreeSet<>(combo);
            if (existing.add(sorted)) {
                recommendations.add(new RollupRecommendation("rollup_" + String.join("_", sorted),
                        List.copyOf(combo), "Frequently queried dimension combination"));
            }
        }
        return recommendations;
    }

    private List<RollupCandidate> score(Set<String> queryDims, Collection<String> metrics,
                                        Set<String> filterDims, Set<String> distinctMetrics) {
        List<String> requiredVolumes = metricCatalog.requiredVolumeMetrics(metrics);
        List<RollupCandidate> candidates = new ArrayList<>();
        for (Rollup rollup : rollupCatalog.rollups()) {
            RollupCandidate candidate = scoreRollup(rollup, queryDims, requiredVolumes, filterDims, distinctMetrics);
            log.debug("Scoring rollup '{}' dims={}: score={}, reason={}",
                    rollup.name(), rollup.dimensions(), candidate.score(), candidate.reason());
            candidates.add(candidate);
        }
        // List.sort 是稳定排序，同分时先注册的在前
        candidates.sort(Comparator.comparingInt(RollupCandidate::score).reversed());
        return candidates;
    }

    RollupCandidate scoreRollup(Rollup rollup, Set<String> queryDims, List<String> requiredVolumes,
                                Set<String> filterDims, Set<String> distinctMetrics) {
        if (!rollup.isReady()) {
            return rejected(rollup, "Rollup status is '" + rollup.status().code() + "', not 'ready'", List.of(), List.of());
        }
        Set<String> rollupDims = rollup.dimensionSet();

        List<String> missingDims = missing(queryDims, rollupDims);
        if (!missingDims.isEmpty()) {
            return rejected(rollup, "Missing dimensions: " + missingDims, missingDims, List.of());
        }
        List<String> missingFilterDims = missing(filterDims, rollupDims);
        if (!missingFilterDims.isEmpty()) {
            return rejected(rollup, "Missing filter dimensions: " + missingFilterDims, missingFilterDims, List.of());
        }

        Set<String> stored = storedVolumeMetrics(rollup);
        List<String> missingMetrics = requiredVolumes.stream().filter(m -> !stored.contains(m)).toList();
        if (!missingMetrics.isEmpty()) {
            return rejected(rollup, "Missing volume metrics: " + missingMetrics, List.of(), missingMetrics);
        }

        Set<String> extra = new TreeSet<>(rollupDims);
        extra.removeAll(queryDims);
        extra.removeAll(filterDims);
        if (extra.isEmpty()) {
            return accepted(rollup, RollupCandidate.EXACT_MATCH, false, "OK");
        }
        if (extra.equals(Set.of(PivotConstants.DATE_DIMENSION))) {
            if (!distinctMetrics.isEmpty()) {
                return accepted(rollup, RollupCandidate.DATE_REAGGREGATION_DISTINCT, true,
                        "OK (re-aggregating COUNT DISTINCT across dates - may have slight inflation)");
            }
            return accepted(rollup, RollupCandidate.DATE_REAGGREGATION, true, "OK (re-aggregating across dates)");
        }
        return rejected(rollup, "Rollup has extra dimensions: " + extra + ". Exact match required.", List.of(), List.of());
    }

    /**
     * 跨日期求和有膨胀风险的指标。
     * strictDistinct 时所有请求的 volume 指标都算，否则只算声明为 COUNT_DISTINCT 的。
     * 由 pivot.router.strict-distinct 控制，缺省 false。
     */
    Set<String> distinctLikeMetrics(Collection<String> metrics) {
        Set<String> result = new LinkedHashSet<>();
        for (String id : metrics) {
            Optional<MetricDef> def = metricCatalog.find(id);
            if (def.isEmpty() || !def.get().isVolume()) {
                continue;
            }
            if (strictDistinct || def.get().aggregation() == AggregateFunction.COUNT_DISTINCT) {
                result.add(id);
            }
        }
        return result;
    }

    private Set<String> storedVolumeMetrics(Rollup rollup) {
        if (rollup.storesAllVolumeMetrics()) {
            return new LinkedHashSet<>(metricCatalog.volumeMetricIds());
        }
        Set<String> stored = new LinkedHashSet<>();
        for (String id : rollup.metrics()) {
            if (metricCatalog.isVolume(id)) {
                stored.add(id);
            }
        }
        return stored;
    }

    /**
     * rollup 中存储的 volume 指标，加上依赖全部可由其计算的派生指标
     */
    private List<String> metricsAvailable(Rollup rollup) {
        Set<String> stored = storedVolumeMetrics(rollup);
        List<String> available = new ArrayList<>();
        for (String id : metricCatalog.ids()) {
            if (stored.contains(id)) {
                available.add(id);
            } else if (!metricCatalog.isVolume(id) && stored.containsAll(metricCatalog.requiredVolumeMetrics(List.of(id)))) {
                available.add(id);
            }
        }
        return available;
    }

    /**
     * 优先报告没有任何 ready rollup 存储的 volume 指标；都有存储时说明是维度问题，
     * 则报告去重类指标，没有则报告全部请求指标
     */
    private List<String> metricsUnavailable(Collection<String> metrics, Set<String> distinctMetrics) {
        Set<String> storedSomewhere = new LinkedHashSet<>();
        for (Rollup rollup : rollupCatalog.ready()) {
            storedSomewhere.addAll(storedVolumeMetrics(rollup));
        }
        List<String> neverStored = metricCatalog.requiredVolumeMetrics(metrics).stream()
                .filter(m -> !storedSomewhere.contains(m))
                .toList();
        if (!neverStored.isEmpty()) {
            return neverStored;
        }
        if (!distinctMetrics.isEmpty()) {
            return new ArrayList<>(distinctMetrics);
        }
        return new ArrayList<>(new LinkedHashSet<>(metrics));
    }

    private static List<String> requiredDimensions(Set<String> queryDims, Set<String> filterDims) {
        TreeSet<String> all = new TreeSet<>(queryDims);
        all.addAll(filterDims);
        return new ArrayList<>(all);
    }

    private static List<String> missing(Set<String> required, Set<String> available) {
        return required.stream().filter(d -> !available.contains(d)).sorted().toList();
    }

    private static RollupCandidate accepted(Rollup rollup, int score, boolean reaggregate, String reason) {
        return new RollupCandidate(rollup.id(), rollup.name(), rollup.dimensions(), rollup.status(),
                score, true, reaggregate, reason, List.of(), List.of());
    }

    private static RollupCandidate rejected(Rollup rollup, String reason, List<String> missingDims, List<String> missingMetrics) {
        return new RollupCandidate(rollup.id(), rollup.name(), rollup.dimensions(), rollup.status(),
                RollupCandidate.REJECTED, false, false, reason, missingDims, missingMetrics);
    }
}
