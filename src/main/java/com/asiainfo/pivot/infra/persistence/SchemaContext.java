package com.asiainfo.pivot.infra.persistence;

import com.asiainfo.pivot.core.exception.UnknownCustomDefinitionException;
import com.asiainfo.pivot.core.model.CustomDimension;
import com.asiainfo.pivot.core.model.CustomMetric;
import com.asiainfo.pivot.core.model.DimensionDef;
import com.asiainfo.pivot.core.model.SchemaSnapshot;
import com.asiainfo.pivot.core.parser.MetricCatalog;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一张表的 schema 快照及其编译产物 (指标目录、维度索引)
 */
public record SchemaContext(SchemaSnapshot snapshot, MetricCatalog catalog, Map<String, DimensionDef> dimensions) {

    public static SchemaContext compile(SchemaSnapshot snapshot) {
        Map<String, DimensionDef> dims = new LinkedHashMap<>();
        for (DimensionDef def : snapshot.dimensions()) {
            dims.put(def.id(), def);
        }
        return new SchemaContext(snapshot, new MetricCatalog(snapshot.metrics()), Map.copyOf(dims));
    }

    public CustomDimension customDimension(String id) {
        return snapshot.customDimensions().stream()
                .filter(d -> d.id().equals(id) || d.columnName().equals(id))
                .findFirst()
                .orElseThrow(() -> UnknownCustomDefinitionException.dimension(id));
    }

    public CustomMetric customMetric(String id) {
        return snapshot.customMetrics().stream()
                .filter(m -> m.id().equals(id))
                .findFirst()
                .orElseThrow(() -> UnknownCustomDefinitionException.metric(id));
    }

    /**
     * 可分组的维度ID，保持 schema 中的顺序
     */
    public List<String> availableDimensions() {
        return snapshot.dimensions().stream()
                .filter(DimensionDef::groupable)
                .map(DimensionDef::id)
                .toList();
    }
}
