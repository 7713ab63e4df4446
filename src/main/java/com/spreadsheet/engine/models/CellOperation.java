package com.spreadsheet.engine.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One write inside a batch: set a cell's raw input, or clear the cell.
 * Positions are zero-based.
 */
public class CellOperation {
    @JsonProperty("operation")
    private OperationType type;
    private int row;
    private int column;
    @JsonProperty("raw_input")
    private String rawInput;

    // Default constructor needed for JSON (de)serialization
    public CellOperation() {
    }

    public CellOperation(OperationType type, int row, int column, String rawInput) {
        this.type = type;
        this.row = row;
        this.column = column;
        this.rawInput = rawInput;
    }

    public static CellOperation set(int row, int column, String rawInput) {
        return new CellOperation(OperationType.SET, row, column, rawInput);
    }

    public static CellOperation clear(int row, int column) {
        return new CellOperation(OperationType.CLEAR, row, column, null);
    }

    public OperationType getType() {
        return type;
    }
    public int getRow() {
        return row;
    }
    public int getColumn() {
        return column;
    }
    public String getRawInput() {
        return rawInput;
    }

    public void setType(OperationType type) {
        this.type = type;
    }
    public void setRow(int row) {
        this.row = row;
    }
    public void setColumn(int column) {
        this.column = column;
    }
    public void setRawInput(String rawInput) {
        this.rawInput = rawInput;
    }

    /**
     * A SET whose raw input is blank behaves exactly like CLEAR.
     */
    @JsonIgnore
    public boolean isClearing() {
        return type == OperationType.CLEAR || (rawInput != null && rawInput.trim().isEmpty());
    }
}
