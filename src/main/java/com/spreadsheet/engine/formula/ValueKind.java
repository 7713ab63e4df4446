package com.spreadsheet.engine.formula;

public enum ValueKind {
    NUMBER,
    STRING,
    BOOLEAN,
    EMPTY,
    ERROR
}
