package com.asiainfo.pivot.core.exception;

public class SchemaMissingException extends PivotException {

    private final String table;

    public SchemaMissingException(String table) {
        super("No schema configured for table: " + table);
        this.table = table;
    }

    public String getTable() {
        return table;
    }
}
