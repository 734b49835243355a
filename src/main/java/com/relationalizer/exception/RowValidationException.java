package com.relationalizer.exception;

/**
 * Raised when an emitted row would violate a NOT NULL column of its table.
 */
public class RowValidationException extends RelationalizerException {

    private static final long serialVersionUID = 1L;
    private final String documentId;
    private final String tableName;
    private final String columnName;

    public RowValidationException(String documentId, String tableName, String columnName) {
        super("Document " + documentId + ": row for table " + tableName
                + " has no value for NOT NULL column " + columnName);
        this.documentId = documentId;
        this.tableName = tableName;
        this.columnName = columnName;
    }

    public String getDocumentId() {
        return documentId;
    }

    public String getTableName() {
        return tableName;
    }

    public String getColumnName() {
        return columnName;
    }
}
