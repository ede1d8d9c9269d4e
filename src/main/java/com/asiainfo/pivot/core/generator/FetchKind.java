package com.asiainfo.pivot.core.generator;

/**
 * 取数请求的用途，用于日志与耗时统计的标签
 */
public enum FetchKind {
    PIVOT,
    COUNT,
    DATE_RANGE,
    DIMENSION_VALUES,
    TRENDS;

    public String tag() {
        return name().toLowerCase();
    }
}
