package com.asiainfo.pivot.core.exception;

/**
 * 公式编译失败：语法错误、引用未知指标、循环依赖、嵌套过深
 */
public class FormulaCompileException extends PivotException {

    private final String metricId;

    public FormulaCompileException(String metricId, String message) {
        super(metricId == null ? message : "Metric " + metricId + ": " + message);
        this.metricId = metricId;
    }

    public String getMetricId() {
        return metricId;
    }
}
