package com.asiainfo.pivot.core.router;

import com.asiainfo.pivot.core.model.RollupStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * 单个 rollup 针对一次查询的评分结果，score 为 -1 表示不可用
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record RollupCandidate(
    @JsonProperty("rollup_id") String rollupId,
    @JsonProperty("display_name") String displayName,
    List<String> dimensions,
    RollupStatus status,
    int score,
    @JsonProperty("can_use") boolean canUse,
    @JsonProperty("needs_reaggregation") boolean needsReaggregation,
    String reason,
    @JsonProperty("missing_dimensions") List<String> missingDimensions,
    @JsonProperty("missing_metrics") List<String> missingMetrics
) {
    public static final int REJECTED = -1;
    public static final int EXACT_MATCH = 150;
    public static final int DATE_REAGGREGATION = 100;
    public static final int DATE_REAGGREGATION_DISTINCT = 80;

    public RollupCandidate {
        dimensions = dimensions == null ? List.of() : List.copyOf(dimensions);
        missingDimensions = missingDimensions == null ? List.of() : List.copyOf(missingDimensions);
        missingMetrics = missingMetrics == null ? List.of() : List.copyOf(missingMetrics);
    }
}
