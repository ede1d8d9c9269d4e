package com.asiainfo.pivot.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;

/**
 * 维度定义
 */
public record DimensionDef(
    @JsonAlias("dimension_id") String id,     // 维度ID，如 country
    @JsonAlias("column_name") String columnName, // 原始表列名
    @JsonAlias("data_type") DataType dataType,
    @JsonAlias("is_filterable") Boolean filterable,
    @JsonAlias("is_groupable") Boolean groupable
) {
    public DimensionDef {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Dimension id must not be blank");
        }
        columnName = columnName == null || columnName.isBlank() ? id : columnName;
        dataType = dataType == null ? DataType.STRING : dataType;
        filterable = filterable == null || filterable;
        groupable = groupable == null || groupable;
    }

    public static DimensionDef of(String id, DataType dataType) {
        return new DimensionDef(id, id, dataType, true, true);
    }

    /**
     * 把过滤值 (字符串) 按列类型转成取数谓词使用的值
     */
    public Object coerce(String raw) {
        if (raw == null) {
            return null;
        }
        try {
            return switch (dataType) {
                case INTEGER -> Long.parseLong(raw.trim());
                case FLOAT -> Double.parseDouble(raw.trim());
                case BOOLEAN -> Boolean.parseBoolean(raw.trim());
                default -> raw;
            };
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    String.format("Invalid %s value '%s' for dimension %s", dataType, raw, id), e);
        }
    }
}
