package com.asiainfo.pivot.core.postprocess;

import com.asiainfo.pivot.core.model.MetricRow;

import java.util.List;

/**
 * @param columnName 新增的维度列名；来源指标缺失而未能应用时为 null
 */
public record CustomDimensionResult(List<MetricRow> rows, String columnName) {

    public boolean applied() {
        return columnName != null;
    }
}
