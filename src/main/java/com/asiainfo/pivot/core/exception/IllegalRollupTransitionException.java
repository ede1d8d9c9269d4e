package com.asiainfo.pivot.core.exception;

import com.asiainfo.pivot.core.model.RollupStatus;

public class IllegalRollupTransitionException extends PivotException {

    public IllegalRollupTransitionException(String rollupId, RollupStatus from, RollupStatus to) {
        super(String.format("Rollup %s cannot move from '%s' to '%s'", rollupId, from.code(), to.code()));
    }
}
