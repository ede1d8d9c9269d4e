package com.asiainfo.pivot.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * getPivotData 的返回结构；路由失败时 rows 为空、total 为 null，error 携带诊断信息；baseline 仅在请求对比时给出
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PivotResult(
    List<PivotRow> rows,
    PivotRow total,
    @JsonProperty("available_dimensions") List<String> availableDimensions,
    @JsonProperty("total_count") long totalCount,
    PivotError error,
    BaselineComparison baseline
) {
    public PivotResult {
        rows = rows == null ? List.of() : List.copyOf(rows);
        availableDimensions = availableDimensions == null ? List.of() : List.copyOf(availableDimensions);
    }

    public static PivotResult failed(PivotError error, List<String> availableDimensions) {
        return new PivotResult(List.of(), null, availableDimensions, 0, error, null);
    }

    @JsonIgnore
    public boolean isError() {
        return error != null;
    }
}
