package com.asiainfo.pivot.infra.store;

import com.asiainfo.pivot.core.generator.GroupedFetchSpec;

import java.util.List;
import java.util.Map;

/**
 * 数仓连接器：执行一次分组聚合取数，返回以 alias 为键的行
 * 实现需支持 SUM / COUNT DISTINCT，并把 __NULL__ 复合值语义与 SqlRenderer 保持一致。
 */
public interface TabularStore {

    List<Map<String, Object>> execute(GroupedFetchSpec spec);
}
