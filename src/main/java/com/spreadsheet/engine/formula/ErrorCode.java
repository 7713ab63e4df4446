package com.spreadsheet.engine.formula;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Stable error literals surfaced verbatim to callers.
 */
public enum ErrorCode {
    REF("#REF!"),
    VALUE("#VALUE!"),
    DIV_ZERO("#DIV/0!"),
    NOT_AVAILABLE("#N/A"),
    CYCLE("#CYCLE!");

    private final String literal;

    ErrorCode(String literal) {
        this.literal = literal;
    }

    @JsonValue
    public String getLiteral() {
        return literal;
    }

    /**
     * Parses a literal such as "#DIV/0!" back into its code.
     */
    @JsonCreator
    public static ErrorCode fromLiteral(String literal) {
        for (ErrorCode code : values()) {
            if (code.literal.equals(literal)) {
                return code;
            }
        }
        throw new IllegalArgumentException("Unknown error literal: " + literal);
    }

    @Override
    public String toString() {
        return literal;
    }
}
