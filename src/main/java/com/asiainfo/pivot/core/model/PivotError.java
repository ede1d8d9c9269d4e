package com.asiainfo.pivot.core.model;

import com.asiainfo.pivot.core.router.RollupCandidate;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PivotError(
    String error,
    @JsonProperty("error_type") String errorType,
    @JsonProperty("required_dimensions") List<String> requiredDimensions,
    @JsonProperty("missing_metrics") List<String> missingMetrics,
    @JsonProperty("available_rollups") List<RollupCandidate> availableRollups
) {
}
