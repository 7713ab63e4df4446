package com.spreadsheet.engine.formula;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.spreadsheet.engine.models.ComputedType;

import java.math.BigDecimal;

/**
 * Outcome of evaluating one formula: a computed type plus the matching payload.
 * NUMBER results carry a currency-formatted computedString when one was inferred;
 * BOOLEAN results carry "TRUE" / "FALSE" as computedString.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class FormulaResult {
    private final ComputedType computedType;
    private final BigDecimal computedNumber;
    private final String computedString;
    private final ErrorCode errorCode;

    private FormulaResult(ComputedType computedType, BigDecimal computedNumber,
                          String computedString, ErrorCode errorCode) {
        this.computedType = computedType;
        this.computedNumber = computedNumber;
        this.computedString = computedString;
        this.errorCode = errorCode;
    }

    public static FormulaResult number(BigDecimal number, String currencyText) {
        return new FormulaResult(ComputedType.NUMBER, number, currencyText, null);
    }

    public static FormulaResult string(String text) {
        return new FormulaResult(ComputedType.STRING, null, text, null);
    }

    public static FormulaResult bool(boolean value) {
        return new FormulaResult(ComputedType.BOOLEAN, null, value ? "TRUE" : "FALSE", null);
    }

    public static FormulaResult empty() {
        return new FormulaResult(ComputedType.EMPTY, null, null, null);
    }

    public static FormulaResult error(ErrorCode code) {
        return new FormulaResult(ComputedType.ERROR, null, null, code);
    }

    public ComputedType getComputedType() {
        return computedType;
    }

    public BigDecimal getComputedNumber() {
        return computedNumber;
    }

    public String getComputedString() {
        return computedString;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public boolean isError() {
        return computedType == ComputedType.ERROR;
    }

    @Override
    public String toString() {
        switch (computedType) {
            case NUMBER:
                return computedString != null ? computedString : computedNumber.toPlainString();
            case ERROR:
                return errorCode.getLiteral();
            case EMPTY:
                return "<empty>";
            default:
                return computedString;
        }
    }
}
