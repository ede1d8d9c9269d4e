package com.asiainfo.pivot.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Rollup 生命周期
 * pending -> creating/refreshing -> ready | error，ready 在源数据变化后可被标记为 stale。
 * 只有 ready 状态的 rollup 参与路由。
 */
public enum RollupStatus {
    PENDING("pending"),
    CREATING("creating"),
    READY("ready"),
    REFRESHING("refreshing"),
    ERROR("error"),
    STALE("stale");

    private final String code;

    RollupStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static RollupStatus from(String value) {
        if (value == null) {
            return PENDING;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        // 旧配置里 building 等价于 refreshing
        if ("building".equals(normalized)) {
            return REFRESHING;
        }
        for (RollupStatus status : values()) {
            if (status.code.equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown rollup status: " + value);
    }

    public Set<RollupStatus> successors() {
        return switch (this) {
            case PENDING -> EnumSet.of(CREATING, REFRESHING);
            case CREATING, REFRESHING -> EnumSet.of(READY, ERROR);
            case READY -> EnumSet.of(REFRESHING, STALE);
            case ERROR -> EnumSet.of(CREATING, REFRESHING, STALE);
            case STALE -> EnumSet.of(REFRESHING);
        };
    }

    public boolean canTransitionTo(RollupStatus target) {
        return successors().contains(target);
    }
}
