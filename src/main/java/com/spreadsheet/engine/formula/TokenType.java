package com.spreadsheet.engine.formula;

public enum TokenType {
    NUMBER,
    STRING,
    IDENT,
    REF,
    OP,
    COMPARE,
    LPAREN,
    RPAREN,
    COMMA,
    COLON
}
