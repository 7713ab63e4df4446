package com.spreadsheet.engine.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Type of the cached result of a cell: EMPTY, NUMBER, STRING, BOOLEAN or ERROR.
 */
public enum ComputedType {
    EMPTY,
    NUMBER,
    STRING,
    BOOLEAN,
    ERROR;

    @JsonValue
    public String tag() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static ComputedType fromValue(String value) {
        return ComputedType.valueOf(value.toUpperCase());
    }
}
