package com.asiainfo.pivot.core.generator;

import com.asiainfo.pivot.core.router.RouteDecision;

/**
 * 取数目标表：命中的 rollup 或原始事实表
 */
public record FetchTarget(String tablePath, boolean rollup, boolean needsReaggregation) {

    public static FetchTarget raw(String tablePath) {
        return new FetchTarget(tablePath, false, false);
    }

    public static FetchTarget rollup(String tablePath, boolean needsReaggregation) {
        return new FetchTarget(tablePath, true, needsReaggregation);
    }

    public static FetchTarget of(RouteDecision decision, String rawTablePath) {
        if (decision.useRollup()) {
            return rollup(decision.rollupTablePath(), decision.needsReaggregation());
        }
        return raw(rawTablePath);
    }
}
