package com.asiainfo.pivot.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.util.List;

/**
 * 透视查询请求
 *
 * @param metrics         需要的指标，为空表示 schema 中全部指标
 * @param requireRollup   为空时取配置 pivot.require-rollup
 * @param dimensionValues 只取这些复合维度值对应的行 (用于展开后补数)
 * @param compareBaseline 附带与 date 基线 rollup 合计的对比
 */
public record PivotRequest(
    String table,
    List<String> dimensions,
    FilterSpec filters,
    Integer limit,
    Integer offset,
    @JsonAlias("custom_dimension_id") String customDimensionId,
    @JsonAlias("custom_metric_ids") List<String> customMetricIds,
    List<String> metrics,
    @JsonAlias("require_rollup") Boolean requireRollup,
    @JsonAlias("skip_count") boolean skipCount,
    @JsonAlias("dimension_values") List<String> dimensionValues,
    @JsonAlias("compare_baseline") boolean compareBaseline
) {
    public PivotRequest {
        dimensions = dimensions == null ? List.of() : List.copyOf(dimensions);
        filters = filters == null ? FilterSpec.none() : filters;
        offset = offset == null || offset < 0 ? 0 : offset;
        customMetricIds = customMetricIds == null ? List.of() : List.copyOf(customMetricIds);
        metrics = metrics == null ? List.of() : List.copyOf(metrics);
        dimensionValues = dimensionValues == null ? List.of() : List.copyOf(dimensionValues);
    }

    public static Builder builder(String table) {
        return new Builder(table);
    }

    public static class Builder {
        private final String table;
        private List<String> dimensions = List.of();
        private FilterSpec filters = FilterSpec.none();
        private Integer limit;
        private Integer offset = 0;
        private String customDimensionId;
        private List<String> customMetricIds = List.of();
        private List<String> metrics = List.of();
        private Boolean requireRollup;
        private boolean skipCount;
        private List<String> dimensionValues = List.of();
        private boolean compareBaseline;

        private Builder(String table) {
            this.table = table;
        }

        public Builder dimensions(String... dims) {
            this.dimensions = List.of(dims);
            return this;
        }

        public Builder dimensions(List<String> dims) {
            this.dimensions = dims;
            return this;
        }

        public Builder filters(FilterSpec filters) {
            this.filters = filters;
            return this;
        }

        public Builder limit(Integer limit) {
            this.limit = limit;
            return this;
        }

        public Builder offset(Integer offset) {
            this.offset = offset;
            return this;
        }

        public Builder customDimension(String id) {
            this.customDimensionId = id;
            return this;
        }

        public Builder customMetrics(String... ids) {
            this.customMetricIds = List.of(ids);
            return this;
        }

        public Builder metrics(String... ids) {
            this.metrics = List.of(ids);
            return this;
        }

        public Builder requireRollup(Boolean requireRollup) {
            this.requireRollup = requireRollup;
            return this;
        }

        public Builder skipCount(boolean skipCount) {
            this.skipCount = skipCount;
            return this;
        }

        public Builder dimensionValues(List<String> values) {
            this.dimensionValues = values;
            return this;
        }

        public Builder compareBaseline(boolean compareBaseline) {
            this.compareBaseline = compareBaseline;
            return this;
        }

        public PivotRequest build() {
            return new PivotRequest(table, dimensions, filters, limit, offset, customDimensionId,
                    customMetricIds, metrics, requireRollup, skipCount, dimensionValues, compareBaseline);
        }
    }
}
