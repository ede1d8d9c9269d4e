package com.asiainfo.pivot.core.router;

import com.asiainfo.pivot.core.model.Rollup;

import java.util.List;
import java.util.Optional;

/**
 * 某张事实表下全部 rollup 的时间点快照，按注册顺序排列
 */
public record RollupCatalog(List<Rollup> rollups) {

    public RollupCatalog {
        rollups = rollups == null ? List.of() : List.copyOf(rollups);
    }

    public static RollupCatalog of(List<Rollup> rollups) {
        return new RollupCatalog(rollups);
    }

    public static RollupCatalog empty() {
        return new RollupCatalog(List.of());
    }

    public boolean isEmpty() {
        return rollups.isEmpty();
    }

    public List<Rollup> ready() {
        return rollups.stream().filter(Rollup::isReady).toList();
    }

    public Optional<Rollup> find(String id) {
        return rollups.stream().filter(r -> r.id().equals(id)).findFirst();
    }
}
