package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.exceptions.FormulaException;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Tree-walking interpreter over a parsed {@link Expr}.
 *
 * Evaluation is lazy: only the selected IF branch and the AND/OR arguments before
 * the deciding one are ever visited. Errors travel as {@link FormulaException};
 * a value returned from {@link #evaluate(Expr)} is never of kind ERROR.
 */
public final class FormulaEvaluator {

    // Largest |digits| accepted by ROUND
    private static final int MAX_ROUND_DIGITS = 100;

    private final CellStore store;
    private final int scale;
    private final RangeFunctions rangeFunctions;

    public FormulaEvaluator(CellStore store, int scale) {
        this.store = store;
        this.scale = scale;
        this.rangeFunctions = new RangeFunctions(store, this);
    }

    public Value evaluate(Expr expr) {
        switch (expr.kind()) {
            case NUMBER:
                return Value.number(((Expr.NumberLiteral) expr).value());
            case STRING:
                return Value.string(((Expr.StringLiteral) expr).value());
            case BOOLEAN:
                return Value.bool(((Expr.BooleanLiteral) expr).value());
            case REFERENCE:
                return propagate(ReferenceResolver.resolve(store, ((Expr.Reference) expr).position()));
            case UNARY:
                return evaluateUnary((Expr.Unary) expr);
            case BINARY:
                return evaluateBinary((Expr.Binary) expr);
            case COMPARISON:
                Expr.Comparison comparison = (Expr.Comparison) expr;
                Value left = evaluate(comparison.left());
                Value right = evaluate(comparison.right());
                return Value.compare(left, right, comparison.operator());
            case CALL:
                return evaluateCall((Expr.Call) expr);
            case RANGE:
            default:
                throw new FormulaException(ErrorCode.VALUE, "range used as a value");
        }
    }

    BigDecimal evaluateNumber(Expr expr) {
        return evaluate(expr).toNumber();
    }

    /**
     * Re-quantizes to the store's fixed scale.
     */
    BigDecimal quantize(BigDecimal value) {
        return value.setScale(scale, RoundingMode.HALF_EVEN);
    }

    static Value propagate(Value value) {
        if (value.isError()) {
            throw new FormulaException(value.getError());
        }
        return value;
    }

    private Value evaluateUnary(Expr.Unary unary) {
        BigDecimal operand = evaluateNumber(unary.operand());
        return Value.number(quantize(unary.operator() == '-' ? operand.negate() : operand));
    }

    private Value evaluateBinary(Expr.Binary binary) {
        BigDecimal left = evaluateNumber(binary.left());
        BigDecimal right = evaluateNumber(binary.right());
        switch (binary.operator()) {
            case '+':
                return Value.number(quantize(left.add(right)));
            case '-':
                return Value.number(quantize(left.subtract(right)));
            case '*':
                return Value.number(quantize(left.multiply(right)));
            case '/':
                if (right.signum() == 0) {
                    throw new FormulaException(ErrorCode.DIV_ZERO);
                }
                return Value.number(quantize(left.divide(right, MathContext.DECIMAL128)));
            default:
                throw new FormulaException(ErrorCode.REF, "unknown operator " + binary.operator());
        }
    }

    private Value evaluateCall(Expr.Call call) {
        switch (call.function()) {
            case SUM:
                return rangeFunctions.sum(call.args());
            case AVERAGE:
                return rangeFunctions.average(call.args());
            case COUNT:
                return rangeFunctions.count(call.args());
            case MIN:
                return rangeFunctions.min(call.args());
            case MAX:
                return rangeFunctions.max(call.args());
            case VLOOKUP:
                return rangeFunctions.vlookup(call.args());
            case ABS:
                return Value.number(quantize(evaluateNumber(call.args().get(0)).abs()));
            case ROUND:
                return round(call);
            case FLOOR:
                return toMultiple(call, RoundingMode.FLOOR);
            case CEILING:
                return toMultiple(call, RoundingMode.CEILING);
            case IF:
                return evaluateIf(call);
            case AND:
                for (Expr arg : call.args()) {
                    if (!evaluate(arg).isTruthy()) {
                        return Value.FALSE;
                    }
                }
                return Value.TRUE;
            case OR:
                for (Expr arg : call.args()) {
                    if (evaluate(arg).isTruthy()) {
                        return Value.TRUE;
                    }
                }
                return Value.FALSE;
            case NOT:
                return Value.bool(!evaluate(call.args().get(0)).isTruthy());
            default:
                throw new FormulaException(ErrorCode.REF, "unsupported function " + call.function());
        }
    }

    private Value evaluateIf(Expr.Call call) {
        boolean condition = evaluate(call.args().get(0)).isTruthy();
        if (condition) {
            return evaluate(call.args().get(1));
        }
        return call.args().size() > 2 ? evaluate(call.args().get(2)) : Value.FALSE;
    }

    private Value round(Expr.Call call) {
        BigDecimal value = evaluateNumber(call.args().get(0));
        int digits = call.args().size() > 1 ? integralArgument(call.args().get(1)) : 0;
        if (Math.abs(digits) > MAX_ROUND_DIGITS) {
            throw new FormulaException(ErrorCode.VALUE, "ROUND digits out of range: " + digits);
        }
        return Value.number(quantize(value.setScale(digits, RoundingMode.HALF_UP)));
    }

    private Value toMultiple(Expr.Call call, RoundingMode mode) {
        BigDecimal value = evaluateNumber(call.args().get(0));
        BigDecimal significance = call.args().size() > 1 ? evaluateNumber(call.args().get(1)) : BigDecimal.ONE;
        if (significance.signum() == 0) {
            throw new FormulaException(ErrorCode.VALUE, call.function() + " with zero significance");
        }
        // rounded straight from the exact quotient
        BigDecimal multiples = value.divide(significance, 0, mode);
        return Value.number(quantize(multiples.multiply(significance)));
    }

    /**
     * Argument that must be a whole number fitting an int, otherwise #VALUE!.
     */
    private int integralArgument(Expr expr) {
        BigDecimal number = evaluateNumber(expr);
        try {
            return number.stripTrailingZeros().intValueExact();
        } catch (ArithmeticException e) {
            throw new FormulaException(ErrorCode.VALUE, "expected a whole number, got " + number.toPlainString());
        }
    }
}
