package com.spreadsheet.engine.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of cell write accepted in a batch: SET or CLEAR.
 */
public enum OperationType {
    SET,
    CLEAR;

    @JsonValue
    public String tag() {
        return name().toLowerCase();
    }

    /**
     * Allows case-insensitive input, e.g. "set" -> SET.
     */
    @JsonCreator
    public static OperationType fromValue(String value) {
        return OperationType.valueOf(value.toUpperCase());
    }
}
