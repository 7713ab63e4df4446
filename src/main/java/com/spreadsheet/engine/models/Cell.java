package com.spreadsheet.engine.models;

import com.spreadsheet.engine.formula.ErrorCode;

import java.math.BigDecimal;

/**
 * Represents a single spreadsheet cell.
 * Stores:
 * - its position (zero-based row and column)
 * - rawInput (literal text, or a formula starting with "=")
 * - the typed literal payload matching valueType
 * - the computed result (computedType plus number/string/error payload)
 * - a soft-delete flag; cleared cells stay in the store but read as empty
 */
public class Cell {
    private final CellPosition position;
    private CellValueType valueType = CellValueType.EMPTY;
    private String rawInput = "";

    private BigDecimal numberValue;
    private String stringValue;
    private Boolean booleanValue;

    // Cache of the evaluated result; always derivable from rawInput + referenced cells
    private ComputedType computedType = ComputedType.EMPTY;
    private BigDecimal computedNumber;
    private String computedString;
    private ErrorCode errorCode;

    private boolean deleted;

    public Cell(CellPosition position) {
        this.position = position;
    }

    public Cell(int row, int column) {
        this(CellPosition.of(row, column));
    }

    /**
     * Copy constructor, used to snapshot a sheet before a batch.
     */
    public Cell(Cell other) {
        this.position = other.position;
        this.valueType = other.valueType;
        this.rawInput = other.rawInput;
        this.numberValue = other.numberValue;
        this.stringValue = other.stringValue;
        this.booleanValue = other.booleanValue;
        this.computedType = other.computedType;
        this.computedNumber = other.computedNumber;
        this.computedString = other.computedString;
        this.errorCode = other.errorCode;
        this.deleted = other.deleted;
    }

    public CellPosition getPosition() {
        return position;
    }
    public int getRow() {
        return position.getRow();
    }
    public int getColumn() {
        return position.getColumn();
    }
    public String getAddress() {
        return position.toAddress();
    }

    public CellValueType getValueType() {
        return valueType;
    }
    public void setValueType(CellValueType valueType) {
        this.valueType = valueType;
    }

    public String getRawInput() {
        return rawInput;
    }
    public void setRawInput(String rawInput) {
        this.rawInput = rawInput == null ? "" : rawInput;
    }

    public boolean isFormula() {
        return valueType == CellValueType.FORMULA && rawInput.startsWith("=");
    }

    public BigDecimal getNumberValue() {
        return numberValue;
    }
    public void setNumberValue(BigDecimal numberValue) {
        this.numberValue = numberValue;
    }

    public String getStringValue() {
        return stringValue;
    }
    public void setStringValue(String stringValue) {
        this.stringValue = stringValue;
    }

    public Boolean getBooleanValue() {
        return booleanValue;
    }
    public void setBooleanValue(Boolean booleanValue) {
        this.booleanValue = booleanValue;
    }

    public ComputedType getComputedType() {
        return computedType;
    }
    public void setComputedType(ComputedType computedType) {
        this.computedType = computedType;
    }

    public BigDecimal getComputedNumber() {
        return computedNumber;
    }
    public void setComputedNumber(BigDecimal computedNumber) {
        this.computedNumber = computedNumber;
    }

    public String getComputedString() {
        return computedString;
    }
    public void setComputedString(String computedString) {
        this.computedString = computedString;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
    public void setErrorCode(ErrorCode errorCode) {
        this.errorCode = errorCode;
    }

    public boolean isDeleted() {
        return deleted;
    }
    public void setDeleted(boolean deleted) {
        this.deleted = deleted;
    }

    /**
     * Resets every content and computed field to the empty state.
     */
    public void wipe() {
        valueType = CellValueType.EMPTY;
        rawInput = "";
        numberValue = null;
        stringValue = null;
        booleanValue = null;
        resetComputed();
    }

    public void resetComputed() {
        computedType = ComputedType.EMPTY;
        computedNumber = null;
        computedString = null;
        errorCode = null;
    }

    @Override
    public String toString() {
        return "Cell{" + getAddress() + ", raw='" + rawInput + "', computed=" + computedType + "}";
    }
}
