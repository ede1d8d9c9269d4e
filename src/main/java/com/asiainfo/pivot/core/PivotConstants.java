package com.asiainfo.pivot.core;

public class PivotConstants {

    // 唯一允许跨其重聚合的维度
    public static final String DATE_DIMENSION = "date";

    // NULL 维度值的字面占位符，过滤与展示共用
    public static final String NULL_MARKER = "__NULL__";

    public static final String OTHER_LABEL = "Other";
    public static final String TOTAL_LABEL = "Total";
    public static final String ALL_LABEL = "All";

    // 复合维度值分隔符，如 "US - mobile"
    public static final String COMPOSITE_SEPARATOR = " - ";

    public static final String PCT_SUFFIX = "_pct";
    public static final String CUSTOM_DIMENSION_PREFIX = "custom_";
    public static final String ROLLUP_REQUIRED = "rollup_required";
    public static final String DEFAULT_CHILD_DIMENSION = "search_term";

    // 当前合计超出基线该比例即视为膨胀
    public static final double INFLATION_THRESHOLD = 0.01;

    private PivotConstants() {}
}
