package com.asiainfo.pivot.core.router;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record RollupRecommendation(
    @JsonProperty("suggested_id") String suggestedId,
    List<String> dimensions,
    String reason
) {
}
