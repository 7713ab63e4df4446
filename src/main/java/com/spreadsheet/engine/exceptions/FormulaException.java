package com.spreadsheet.engine.exceptions;

import com.spreadsheet.engine.formula.ErrorCode;

/**
 * Thrown while tokenizing, parsing or evaluating a formula.
 * Never escapes the formula engine: it is converted into an error result
 * carrying the same code.
 */
public class FormulaException extends RuntimeException {
    private final ErrorCode code;

    public FormulaException(ErrorCode code) {
        super(code.getLiteral());
        this.code = code;
    }

    public FormulaException(ErrorCode code, String message) {
        super(code.getLiteral() + ": " + message);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
