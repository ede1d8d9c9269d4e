package com.asiainfo.pivot.core.generator;

import com.asiainfo.pivot.core.PivotConstants;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 把 GroupedFetchSpec 渲染成 BigQuery 风格 SQL
 * 输出是确定性的，同一个 spec 总得到同一段 SQL，可以直接用来算指纹。
 */
public final class SqlRenderer {

    private SqlRenderer() {}

    public static String render(GroupedFetchSpec spec) {
        if (spec.countGroups()) {
            return renderCount(spec);
        }
        StringBuilder sql = new StringBuilder();
        sql.append("SELECT ");
        sql.append(spec.selectColumns().stream().map(SqlRenderer::selectExpr).collect(Collectors.joining(", ")));
        sql.append("\nFROM `").append(spec.table()).append('`');
        appendWhere(sql, spec.predicates());
        if (!spec.groupByColumns().isEmpty()) {
            sql.append("\nGROUP BY ").append(String.join(", ", spec.groupByColumns()));
        }
        if (!spec.orderBy().isEmpty()) {
            sql.append("\nORDER BY ");
            sql.append(spec.orderBy().stream()
                    .map(k -> k.column() + (k.descending() ? " DESC" : ""))
                    .collect(Collectors.joining(", ")));
        }
        if (spec.limit() != null) {
            sql.append("\nLIMIT ").append(spec.limit());
            sql.append("\nOFFSET ").append(spec.offset());
        }
        return sql.toString();
    }

    // 分组组合数：COUNT(*) 套在分组子查询外层
    private static String renderCount(GroupedFetchSpec spec) {
        StringBuilder inner = new StringBuilder();
        inner.append("SELECT ").append(String.join(", ", spec.groupByColumns()));
        inner.append("\n  FROM `").append(spec.table()).append('`');
        appendWhere(inner, spec.predicates());
        inner.append("\n  GROUP BY ").append(String.join(", ", spec.groupByColumns()));
        return "SELECT COUNT(*) AS " + GroupedFetchSpec.TOTAL_COUNT + "\nFROM (\n  " + inner + "\n)";
    }

    private static String selectExpr(SelectColumn col) {
        String expr = switch (col.kind()) {
            case AGGREGATE -> col.function().toSql(col.column());
            case DATE_TRUNC -> "DATE_TRUNC(" + col.column() + ", " + col.granularity().datePart() + ")";
            case DIMENSION -> col.column();
        };
        return expr.equals(col.alias()) ? expr : expr + " AS " + col.alias();
    }

    private static void appendWhere(StringBuilder sql, List<FetchPredicate> predicates) {
        if (predicates.isEmpty()) {
            return;
        }
        List<String> conditions = new ArrayList<>();
        for (FetchPredicate p : predicates) {
            conditions.add(condition(p));
        }
        sql.append("\nWHERE ").append(String.join("\n  AND ", conditions));
    }

    static String condition(FetchPredicate p) {
        return switch (p.operator()) {
            case GTE -> p.column() + " >= " + literal(p.values().get(0));
            case LTE -> p.column() + " <= " + literal(p.values().get(0));
            case IS_NOT_NULL -> p.column() + " IS NOT NULL";
            case IN -> inCondition(p);
            case COMPOSITE_IN -> compositeExpr(p.columns()) + " IN (" + literals(p.values()) + ")";
        };
    }

    private static String inCondition(FetchPredicate p) {
        List<String> parts = new ArrayList<>();
        if (p.values().size() == 1) {
            parts.add(p.column() + " = " + literal(p.values().get(0)));
        } else if (!p.values().isEmpty()) {
            parts.add(p.column() + " IN (" + literals(p.values()) + ")");
        }
        if (p.includeNull()) {
            parts.add(p.column() + " IS NULL");
        }
        if (parts.isEmpty()) {
            return "FALSE";
        }
        return parts.size() == 1 ? parts.get(0) : "(" + String.join(" OR ", parts) + ")";
    }

    private static String compositeExpr(List<String> columns) {
        String casts = columns.stream()
                .map(c -> "COALESCE(CAST(" + c + " AS STRING), '" + PivotConstants.NULL_MARKER + "')")
                .collect(Collectors.joining(", '" + PivotConstants.COMPOSITE_SEPARATOR + "', "));
        return "CONCAT(" + casts + ")";
    }

    private static String literals(List<Object> values) {
        return values.stream().map(SqlRenderer::literal).collect(Collectors.joining(", "));
    }

    // 数值与布尔不加引号，字符串和日期加单引号
    static String literal(Object value) {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof LocalDate date) {
            return "'" + date + "'";
        }
        return "'" + value.toString().replace("'", "''") + "'";
    }
}
