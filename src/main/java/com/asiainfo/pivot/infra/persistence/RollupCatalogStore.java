package com.asiainfo.pivot.infra.persistence;

import com.asiainfo.pivot.core.model.Rollup;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * rollup 目录存储
 * 读者拿到的是时间点快照；状态迁移由外部的刷新流程通过 update 原子地写入。
 */
public interface RollupCatalogStore {

    List<Rollup> listRollups(String table);

    /**
     * 对指定 rollup 原子地应用一次迁移，返回迁移后的实例
     */
    Rollup update(String table, String rollupId, UnaryOperator<Rollup> transition);

    void register(String table, Rollup rollup);
}
