package com.asiainfo.pivot.core.router;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * 路由结果，每次查询生成一次，不可变
 *
 * @param requiredDimensions 能让某个 rollup 命中的最小维度集合 (dims ∪ filterDims，已排序)
 * @param candidates         全部 rollup 的评分明细，按分数降序
 * @param rollupRequired     调用方要求必须命中 rollup
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RouteDecision(
    @JsonProperty("use_rollup") boolean useRollup,
    @JsonProperty("rollup_id") String rollupId,
    @JsonProperty("rollup_table_path") String rollupTablePath,
    @JsonProperty("needs_reaggregation") boolean needsReaggregation,
    int score,
    String reason,
    @JsonProperty("metrics_available") List<String> metricsAvailable,
    @JsonProperty("metrics_unavailable") List<String> metricsUnavailable,
    @JsonProperty("required_dimensions") List<String> requiredDimensions,
    List<RollupCandidate> candidates,
    @JsonProperty("rollup_required") boolean rollupRequired
) {
    public RouteDecision {
        metricsAvailable = metricsAvailable == null ? List.of() : List.copyOf(metricsAvailable);
        metricsUnavailable = metricsUnavailable == null ? List.of() : List.copyOf(metricsUnavailable);
        requiredDimensions = requiredDimensions == null ? List.of() : List.copyOf(requiredDimensions);
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public static RouteDecision useRollup(RollupCandidate best, String tablePath, List<String> metricsAvailable,
                                          List<String> requiredDimensions, List<RollupCandidate> candidates) {
        return new RouteDecision(true, best.rollupId(), tablePath, best.needsReaggregation(), best.score(),
                String.format("Using rollup '%s' (score: %d)", best.displayName(), best.score()),
                metricsAvailable, List.of(), requiredDimensions, candidates, false);
    }

    public static RouteDecision raw(String reason, List<String> metricsUnavailable, List<String> requiredDimensions,
                                    List<RollupCandidate> candidates, boolean rollupRequired) {
        return new RouteDecision(false, null, null, false, RollupCandidate.REJECTED, reason,
                List.of(), metricsUnavailable, requiredDimensions, candidates, rollupRequired);
    }

    /**
     * 没有可用 rollup 且不允许回退到原始表
     */
    @JsonIgnore
    public boolean isUnavailable() {
        return !useRollup && rollupRequired;
    }
}
