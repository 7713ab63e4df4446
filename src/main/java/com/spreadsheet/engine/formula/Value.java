package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.exceptions.FormulaException;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Result of evaluating an expression or reading a cell.
 * Holds exactly one payload, selected by {@link #getKind()}.
 */
public final class Value {

    public static final Value EMPTY = new Value(ValueKind.EMPTY, null, null, false, null);
    public static final Value TRUE = new Value(ValueKind.BOOLEAN, null, null, true, null);
    public static final Value FALSE = new Value(ValueKind.BOOLEAN, null, null, false, null);

    private final ValueKind kind;
    private final BigDecimal number;
    private final String text;
    private final boolean bool;
    private final ErrorCode error;

    private Value(ValueKind kind, BigDecimal number, String text, boolean bool, ErrorCode error) {
        this.kind = kind;
        this.number = number;
        this.text = text;
        this.bool = bool;
        this.error = error;
    }

    public static Value number(BigDecimal number) {
        return new Value(ValueKind.NUMBER, Objects.requireNonNull(number), null, false, null);
    }

    public static Value string(String text) {
        return new Value(ValueKind.STRING, null, Objects.requireNonNull(text), false, null);
    }

    public static Value bool(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static Value error(ErrorCode code) {
        return new Value(ValueKind.ERROR, null, null, false, Objects.requireNonNull(code));
    }

    public ValueKind getKind() {
        return kind;
    }

    public boolean isError() {
        return kind == ValueKind.ERROR;
    }

    public boolean isEmpty() {
        return kind == ValueKind.EMPTY;
    }

    public BigDecimal getNumber() {
        return number;
    }

    public String getText() {
        return text;
    }

    public boolean getBoolean() {
        return bool;
    }

    public ErrorCode getError() {
        return error;
    }

    /**
     * Forces this value to a number: booleans are 1/0, empty is 0,
     * strings fail with #VALUE! and errors propagate.
     */
    public BigDecimal toNumber() {
        switch (kind) {
            case NUMBER:
                return number;
            case BOOLEAN:
                return bool ? BigDecimal.ONE : BigDecimal.ZERO;
            case EMPTY:
                return BigDecimal.ZERO;
            case STRING:
                throw new FormulaException(ErrorCode.VALUE, "text used as a number");
            case ERROR:
            default:
                throw new FormulaException(error);
        }
    }

    /**
     * Forces this value to a boolean; errors propagate.
     */
    public boolean isTruthy() {
        switch (kind) {
            case BOOLEAN:
                return bool;
            case NUMBER:
                return number.signum() != 0;
            case STRING:
                return !text.isEmpty();
            case EMPTY:
                return false;
            case ERROR:
            default:
                throw new FormulaException(error);
        }
    }

    /**
     * Kind-aware equality used by VLOOKUP: values of different kinds never match,
     * numbers compare by magnitude regardless of scale, errors match nothing.
     */
    public boolean matches(Value other) {
        if (kind != other.kind) {
            return false;
        }
        switch (kind) {
            case NUMBER:
                return number.compareTo(other.number) == 0;
            case STRING:
                return text.equals(other.text);
            case BOOLEAN:
                return bool == other.bool;
            case EMPTY:
                return true;
            case ERROR:
            default:
                return false;
        }
    }

    /**
     * Applies a comparison operator ("=", "<>", "<", "<=", ">", ">=").
     * Operands must share a kind; strings and booleans only support equality tests.
     */
    public static Value compare(Value left, Value right, String operator) {
        if (left.isError()) {
            throw new FormulaException(left.error);
        }
        if (right.isError()) {
            throw new FormulaException(right.error);
        }
        boolean equality = "=".equals(operator) || "<>".equals(operator);
        if (left.kind != right.kind) {
            throw new FormulaException(ErrorCode.VALUE, "cannot compare " + left.kind + " with " + right.kind);
        }

        int order;
        switch (left.kind) {
            case NUMBER:
                order = left.number.compareTo(right.number);
                break;
            case STRING:
            case BOOLEAN:
            case EMPTY:
                if (!equality) {
                    throw new FormulaException(ErrorCode.VALUE, "operator " + operator + " needs numbers");
                }
                order = left.matches(right) ? 0 : 1;
                break;
            default:
                throw new FormulaException(ErrorCode.VALUE);
        }

        switch (operator) {
            case "=":
                return bool(order == 0);
            case "<>":
                return bool(order != 0);
            case "<":
                return bool(order < 0);
            case "<=":
                return bool(order <= 0);
            case ">":
                return bool(order > 0);
            case ">=":
                return bool(order >= 0);
            default:
                throw new FormulaException(ErrorCode.REF, "unknown operator " + operator);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        if (kind == ValueKind.ERROR) {
            return other.kind == ValueKind.ERROR && error == other.error;
        }
        return matches(other);
    }

    @Override
    public int hashCode() {
        switch (kind) {
            case NUMBER:
                return number.stripTrailingZeros().hashCode();
            case STRING:
                return text.hashCode();
            case BOOLEAN:
                return Boolean.hashCode(bool);
            case ERROR:
                return error.hashCode();
            case EMPTY:
            default:
                return 0;
        }
    }

    @Override
    public String toString() {
        switch (kind) {
            case NUMBER:
                return number.toPlainString();
            case STRING:
                return "\"" + text + "\"";
            case BOOLEAN:
                return bool ? "TRUE" : "FALSE";
            case ERROR:
                return error.getLiteral();
            case EMPTY:
            default:
                return "<empty>";
        }
    }
}
