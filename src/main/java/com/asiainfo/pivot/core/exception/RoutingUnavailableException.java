package com.asiainfo.pivot.core.exception;

import com.asiainfo.pivot.core.router.RouteDecision;

import java.util.ArrayList;
import java.util.List;

/**
 * 没有任何 ready 状态的 rollup 能满足查询，且调用方要求必须走 rollup
 */
public class RoutingUnavailableException extends PivotException {

    private final RouteDecision decision;

    public RoutingUnavailableException(RouteDecision decision) {
        super(decision.reason());
        this.decision = decision;
    }

    public RouteDecision getDecision() {
        return decision;
    }

    public List<String> getRequiredDimensions() {
        return new ArrayList<>(decision.requiredDimensions());
    }

    public List<String> getMissingMetrics() {
        return new ArrayList<>(decision.metricsUnavailable());
    }

    @Override
    public String getUserFriendlyMessage() {
        return "No suitable rollup found. Create a rollup with dimensions "
                + decision.requiredDimensions() + " to enable this query.";
    }
}
