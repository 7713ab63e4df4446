package com.spreadsheet.engine.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What the user stored in a cell: EMPTY, STRING, NUMBER, BOOLEAN or FORMULA.
 */
public enum CellValueType {
    EMPTY,
    STRING,
    NUMBER,
    BOOLEAN,
    FORMULA;

    @JsonValue
    public String tag() {
        return name().toLowerCase();
    }

    /**
     * Allows case-insensitive input, e.g. "formula" -> FORMULA.
     */
    @JsonCreator
    public static CellValueType fromValue(String value) {
        return CellValueType.valueOf(value.toUpperCase());
    }
}
