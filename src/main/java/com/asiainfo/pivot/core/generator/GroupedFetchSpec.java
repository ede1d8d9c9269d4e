package com.asiainfo.pivot.core.generator;

import org.apache.commons.codec.digest.DigestUtils;

import java.util.List;

/**
 * 一次分组聚合取数的结构化描述，由 TabularStore 的实现渲染成各自的查询语言
 *
 * @param countGroups 为 true 时只返回一行 total_count = 分组组合数
 */
public record GroupedFetchSpec(
    FetchKind kind,
    String table,
    List<SelectColumn> selectColumns,
    List<String> groupByColumns,
    List<FetchPredicate> predicates,
    List<SortKey> orderBy,
    Integer limit,
    int offset,
    boolean countGroups
) {
    public static final String TOTAL_COUNT = "total_count";

    public GroupedFetchSpec {
        if (table == null || table.isBlank()) {
            throw new IllegalArgumentException("Fetch table must not be blank");
        }
        kind = kind == null ? FetchKind.PIVOT : kind;
        selectColumns = selectColumns == null ? List.of() : List.copyOf(selectColumns);
        groupByColumns = groupByColumns == null ? List.of() : List.copyOf(groupByColumns);
        predicates = predicates == null ? List.of() : List.copyOf(predicates);
        orderBy = orderBy == null ? List.of() : List.copyOf(orderBy);
        offset = Math.max(0, offset);
    }

    public String toSql() {
        return SqlRenderer.render(this);
    }

    /**
     * 规范化 SQL 的 SHA-256，作为结果缓存的内容键
     */
    public String fingerprint() {
        return DigestUtils.sha256Hex(toSql());
    }
}
