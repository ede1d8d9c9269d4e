package com.asiainfo.pivot.core.model;

import com.asiainfo.pivot.core.exception.IllegalRollupTransitionException;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 预聚合表 (rollup) 定义
 * 不可变：状态迁移返回新实例，由 RollupCatalogStore 原子替换。
 */
public record Rollup(
    String id,
    String name,
    @JsonAlias("table_path") String tablePath,
    List<String> dimensions,
    List<String> metrics,          // 为空表示存储 schema 中全部 volume 指标
    RollupStatus status,
    @JsonAlias("min_date") LocalDate minDate,
    @JsonAlias("max_date") LocalDate maxDate,
    @JsonAlias("row_count") long rowCount,
    @JsonAlias("size_bytes") long sizeBytes,
    @JsonAlias("last_refresh_at") Instant lastRefreshAt,
    @JsonAlias("error_message") String errorMessage
) {
    public Rollup {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Rollup id must not be blank");
        }
        name = name == null || name.isBlank() ? id : name;
        tablePath = tablePath == null || tablePath.isBlank() ? id : tablePath;
        dimensions = dimensions == null ? List.of() : List.copyOf(dimensions);
        metrics = metrics == null ? List.of() : List.copyOf(metrics);
        status = status == null ? RollupStatus.PENDING : status;
    }

    public static Rollup pending(String id, String tablePath, List<String> dimensions) {
        return new Rollup(id, id, tablePath, dimensions, List.of(), RollupStatus.PENDING,
                null, null, 0, 0, null, null);
    }

    @JsonIgnore
    public Set<String> dimensionSet() {
        return new LinkedHashSet<>(dimensions);
    }

    @JsonIgnore
    public boolean isReady() {
        return status == RollupStatus.READY;
    }

    @JsonIgnore
    public boolean storesAllVolumeMetrics() {
        return metrics.isEmpty();
    }

    /**
     * 开始构建：首次构建进入 creating，其余进入 refreshing
     */
    public Rollup markBuilding() {
        RollupStatus target = status == RollupStatus.PENDING ? RollupStatus.CREATING : RollupStatus.REFRESHING;
        return withStatus(target, errorMessage);
    }

    public Rollup markReady(long rowCount, long sizeBytes, LocalDate minDate, LocalDate maxDate, Instant refreshedAt) {
        check(RollupStatus.READY);
        return new Rollup(id, name, tablePath, dimensions, metrics, RollupStatus.READY,
                minDate, maxDate, rowCount, sizeBytes, refreshedAt, null);
    }

    /**
     * 构建失败：保留上一次成功的统计信息
     */
    public Rollup markError(String message) {
        return withStatus(RollupStatus.ERROR, message);
    }

    public Rollup markStale() {
        return withStatus(RollupStatus.STALE, errorMessage);
    }

    private Rollup withStatus(RollupStatus target, String message) {
        check(target);
        return new Rollup(id, name, tablePath, dimensions, metrics, target,
                minDate, maxDate, rowCount, sizeBytes, lastRefreshAt, message);
    }

    private void check(RollupStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalRollupTransitionException(id, status, target);
        }
    }
}
