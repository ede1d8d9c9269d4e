package com.asiainfo.pivot.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 查询过滤条件
 * dimensionFilters 中的 __NULL__ 表示 IS NULL，与 IN 列表取或；空列表忽略。
 * 同时给出预设与绝对日期时，预设优先。
 */
public record FilterSpec(
    @JsonAlias("start_date") LocalDate startDate,
    @JsonAlias("end_date") LocalDate endDate,
    @JsonAlias("relative_date_preset") DatePreset datePreset,
    @JsonAlias("dimension_filters") Map<String, List<String>> dimensionFilters
) {
    public FilterSpec {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        if (dimensionFilters != null) {
            dimensionFilters.forEach((dim, values) -> copy.put(dim, values == null ? List.of() : List.copyOf(values)));
        }
        dimensionFilters = Collections.unmodifiableMap(copy);
    }

    public static FilterSpec none() {
        return new FilterSpec(null, null, null, null);
    }

    public static FilterSpec between(LocalDate start, LocalDate end) {
        return new FilterSpec(start, end, null, null);
    }

    public static FilterSpec preset(DatePreset preset) {
        return new FilterSpec(null, null, preset, null);
    }

    public FilterSpec withDimensionFilter(String dimension, List<String> values) {
        Map<String, List<String>> copy = new LinkedHashMap<>(dimensionFilters);
        copy.put(dimension, values);
        return new FilterSpec(startDate, endDate, datePreset, copy);
    }

    /**
     * 仅出现在 WHERE 中的维度 (值列表非空)
     */
    @JsonIgnore
    public Set<String> filterDimensions() {
        Set<String> dims = new LinkedHashSet<>();
        dimensionFilters.forEach((dim, values) -> {
            if (!values.isEmpty()) {
                dims.add(dim);
            }
        });
        return dims;
    }

    /**
     * 解析出的绝对日期下界/上界；只给一端时另一端为空
     */
    public LocalDate resolvedStart(LocalDate today) {
        return datePreset != null ? datePreset.resolve(today).start() : startDate;
    }

    public LocalDate resolvedEnd(LocalDate today) {
        return datePreset != null ? datePreset.resolve(today).end() : endDate;
    }

    /**
     * 完整的闭区间，只有两端都确定时才存在
     */
    public Optional<DateRange> resolveDateRange(LocalDate today) {
        LocalDate start = resolvedStart(today);
        LocalDate end = resolvedEnd(today);
        if (start == null || end == null || end.isBefore(start)) {
            return Optional.empty();
        }
        return Optional.of(DateRange.of(start, end));
    }
}
