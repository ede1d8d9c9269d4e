package com.asiainfo.pivot.infra.store;

import com.asiainfo.pivot.core.PivotConstants;
import com.asiainfo.pivot.core.generator.FetchPredicate;
import com.asiainfo.pivot.core.generator.GroupedFetchSpec;
import com.asiainfo.pivot.core.generator.SelectColumn;
import com.asiainfo.pivot.core.generator.SortKey;
import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * 内存事实表上的取数实现
 * 没有配置真实数仓连接器时作为默认 bean；也用于本地调试和测试。
 */
@ApplicationScoped
@DefaultBean
public class InMemoryTabularStore implements TabularStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTabularStore.class);

    private final Map<String, List<Map<String, Object>>> tables = new ConcurrentHashMap<>();

    /**
     * 注册 (或整体替换) 一张表的全部行
     */
    public void register(String table, List<Map<String, Object>> rows) {
        List<Map<String, Object>> copy = rows.stream()
                .map(r -> Collections.unmodifiableMap(new LinkedHashMap<>(r)))
                .collect(Collectors.toList());
        tables.put(table, List.copyOf(copy));
        log.info("Registered in-memory table {} with {} rows", table, copy.size());
    }

    public boolean contains(String table) {
        return tables.containsKey(table);
    }

    @Override
    public List<Map<String, Object>> execute(GroupedFetchSpec spec) {
        long start = System.currentTimeMillis();
        List<Map<String, Object>> source = tables.get(spec.table());
        if (source == null) {
            throw new IllegalArgumentException("Table not found: " + spec.table());
        }

        List<Map<String, Object>> filtered = source.stream()
                .filter(row -> spec.predicates().stream().allMatch(p -> test(p, row)))
                .toList();

        Map<List<Object>, List<Map<String, Object>>> groups = new LinkedHashMap<>();
        if (spec.groupByColumns().isEmpty()) {
            // 无 GROUP BY 的聚合总是返回一行
            groups.put(List.of(), filtered);
        } else {
            // GROUP BY 可以引用日期截断列的别名
            Map<String, SelectColumn> truncated = spec.selectColumns().stream()
                    .filter(SelectColumn::isDateTrunc)
                    .collect(Collectors.toMap(SelectColumn::alias, c -> c, (a, b) -> a));
            for (Map<String, Object> row : filtered) {
                List<Object> key = spec.groupByColumns().stream()
                        .map(g -> truncated.containsKey(g) ? truncate(truncated.get(g), row) : row.get(g))
                        .collect(Collectors.toList());
                groups.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
            }
        }

        if (spec.countGroups()) {
            Map<String, Object> count = new LinkedHashMap<>();
            count.put(GroupedFetchSpec.TOTAL_COUNT, spec.groupByColumns().isEmpty() ? 1L : (long) groups.size());
            return List.of(count);
        }

        List<Map<String, Object>> result = new ArrayList<>();
        for (List<Map<String, Object>> group : groups.values()) {
            Map<String, Object> out = new LinkedHashMap<>();
            for (SelectColumn col : spec.selectColumns()) {
                if (col.isAggregate()) {
                    out.put(col.alias(), aggregate(col, group));
                } else if (col.isDateTrunc()) {
                    out.put(col.alias(), group.isEmpty() ? null : truncate(col, group.get(0)));
                } else {
                    out.put(col.alias(), group.isEmpty() ? null : group.get(0).get(col.column()));
                }
            }
            result.add(out);
        }

        if (!spec.orderBy().isEmpty()) {
            result.sort(comparator(spec.orderBy()));
        }
        int from = Math.min(spec.offset(), result.size());
        int to = spec.limit() == null ? result.size() : Math.min(result.size(), from + spec.limit());
        List<Map<String, Object>> page = new ArrayList<>(result.subList(from, to));
        log.debug("In-memory {} fetch on {}: {} rows scanned, {} groups, {} returned in {} ms",
                spec.kind().tag(), spec.table(), filtered.size(), groups.size(), page.size(),
                System.currentTimeMillis() - start);
        return page;
    }

    private Object aggregate(SelectColumn col, List<Map<String, Object>> group) {
        if ("*".equals(col.column())) {
            return (long) group.size();
        }
        List<Object> values = group.stream().map(r -> r.get(col.column())).filter(Objects::nonNull).toList();
        return switch (col.function()) {
            case SUM -> values.isEmpty() ? null : values.stream().mapToDouble(InMemoryTabularStore::number).sum();
            case AVG -> values.isEmpty() ? null : values.stream().mapToDouble(InMemoryTabularStore::number).average().orElse(0);
            case COUNT -> (long) values.size();
            case COUNT_DISTINCT -> (long) new HashSet<>(values).size();
            case MIN -> values.stream().min(InMemoryTabularStore::compareValues).orElse(null);
            case MAX -> values.stream().max(InMemoryTabularStore::compareValues).orElse(null);
        };
    }

    private static LocalDate truncate(SelectColumn col, Map<String, Object> row) {
        Object value = row.get(col.column());
        return value == null ? null : col.granularity().truncate(toDate(value));
    }

    private boolean test(FetchPredicate p, Map<String, Object> row) {
        Object value = row.get(p.column());
        return switch (p.operator()) {
            case GTE -> value != null && compareValues(value, p.values().get(0)) >= 0;
            case LTE -> value != null && compareValues(value, p.values().get(0)) <= 0;
            case IS_NOT_NULL -> value != null;
            case IN -> value == null
                    ? p.includeNull()
                    : p.values().stream().anyMatch(v -> compareValues(value, v) == 0);
            case COMPOSITE_IN -> p.values().contains(composite(p.columns(), row));
        };
    }

    private static String composite(List<String> columns, Map<String, Object> row) {
        return columns.stream()
                .map(c -> row.get(c) == null ? PivotConstants.NULL_MARKER : String.valueOf(row.get(c)))
                .collect(Collectors.joining(PivotConstants.COMPOSITE_SEPARATOR));
    }

    private static Comparator<Map<String, Object>> comparator(List<SortKey> keys) {
        Comparator<Map<String, Object>> result = null;
        for (SortKey key : keys) {
            Comparator<Map<String, Object>> next = (a, b) -> {
                Object x = a.get(key.column());
                Object y = b.get(key.column());
                // NULL 总排在最后
                if (x == null || y == null) {
                    return x == null ? (y == null ? 0 : 1) : -1;
                }
                int cmp = compareValues(x, y);
                return key.descending() ? -cmp : cmp;
            };
            result = result == null ? next : result.thenComparing(next);
        }
        return result;
    }

    private static double number(Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof Boolean b) {
            return b ? 1 : 0;
        }
        return Double.parseDouble(value.toString());
    }

    /**
     * 数值按 double 比较，日期与 ISO 字符串可互相比较，其余按字符串比较
     */
    static int compareValues(Object a, Object b) {
        if (a instanceof Number && b instanceof Number) {
            return Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue());
        }
        if (a instanceof LocalDate || b instanceof LocalDate) {
            return toDate(a).compareTo(toDate(b));
        }
        if (a instanceof Boolean && b instanceof Boolean) {
            return Boolean.compare((Boolean) a, (Boolean) b);
        }
        return String.valueOf(a).compareTo(String.valueOf(b));
    }

    private static LocalDate toDate(Object value) {
        return value instanceof LocalDate d ? d : LocalDate.parse(value.toString());
    }
}
