package com.spreadsheet.engine.exceptions;

/**
 * Describes why one operation of a batch was rejected.
 * For example:
 * {
 *   "index": 2, "row": 5, "column": 1,
 *   "field": "row",
 *   "message": "Row 5 does not exist"
 * }
 */
public class OperationError {
    private final int index;
    private final Integer row;
    private final Integer column;
    private final String field;
    private final String message;

    public OperationError(int index, Integer row, Integer column, String field, String message) {
        this.index = index;
        this.row = row;
        this.column = column;
        this.field = field;
        this.message = message;
    }

    public int getIndex() {
        return index;
    }

    public Integer getRow() {
        return row;
    }

    public Integer getColumn() {
        return column;
    }

    public String getField() {
        return field;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "#" + index + " " + field + ": " + message;
    }
}
