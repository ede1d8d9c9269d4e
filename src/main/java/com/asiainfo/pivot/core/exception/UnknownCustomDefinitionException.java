package com.asiainfo.pivot.core.exception;

/**
 * 请求的自定义维度 / 自定义指标不在 schema 中
 */
public class UnknownCustomDefinitionException extends PivotException {

    private final String kind;
    private final String definitionId;

    public UnknownCustomDefinitionException(String kind, String definitionId) {
        super(String.format("Unknown custom %s: %s", kind, definitionId));
        this.kind = kind;
        this.definitionId = definitionId;
    }

    public static UnknownCustomDefinitionException dimension(String id) {
        return new UnknownCustomDefinitionException("dimension", id);
    }

    public static UnknownCustomDefinitionException metric(String id) {
        return new UnknownCustomDefinitionException("metric", id);
    }

    public String getKind() {
        return kind;
    }

    public String getDefinitionId() {
        return definitionId;
    }
}
