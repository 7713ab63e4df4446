package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.exceptions.FormulaException;
import com.spreadsheet.engine.models.Cell;
import com.spreadsheet.engine.models.CellPosition;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * SUM / AVERAGE / COUNT / MIN / MAX / VLOOKUP over refs, ranges and scalar arguments.
 * Ranges are fetched in one call to the store; positions with no stored cell
 * count as 0.
 */
final class RangeFunctions {

    private final CellStore store;
    private final FormulaEvaluator evaluator;

    RangeFunctions(CellStore store, FormulaEvaluator evaluator) {
        this.store = store;
        this.evaluator = evaluator;
    }

    Value sum(List<Expr> args) {
        return Value.number(evaluator.quantize(total(collect(args))));
    }

    Value average(List<Expr> args) {
        Operands operands = collect(args);
        BigDecimal count = BigDecimal.valueOf(operands.values.size() + operands.missing);
        return Value.number(evaluator.quantize(total(operands).divide(count, MathContext.DECIMAL128)));
    }

    Value count(List<Expr> args) {
        long numeric = collect(args).values.stream()
                .filter(value -> value.getKind() == ValueKind.NUMBER)
                .count();
        return Value.number(evaluator.quantize(BigDecimal.valueOf(numeric)));
    }

    Value min(List<Expr> args) {
        return extreme(args, -1);
    }

    Value max(List<Expr> args) {
        return extreme(args, 1);
    }

    /**
     * Exact-match lookup down the first column of the range. Sorted mode is not
     * supported and always yields #VALUE!.
     */
    Value vlookup(List<Expr> args) {
        // sorted mode fails before any other argument is evaluated
        if (args.size() > 3 && evaluator.evaluate(args.get(3)).isTruthy()) {
            throw new FormulaException(ErrorCode.VALUE, "sorted VLOOKUP is not supported");
        }
        Value key = evaluator.evaluate(args.get(0));
        CellRange range = ((Expr.Range) args.get(1)).range();
        BigDecimal columnArgument = evaluator.evaluateNumber(args.get(2)).setScale(0, RoundingMode.DOWN);
        if (columnArgument.signum() <= 0 || columnArgument.compareTo(BigDecimal.valueOf(range.getWidth())) > 0) {
            throw new FormulaException(ErrorCode.REF, "column " + columnArgument + " outside " + range);
        }
        int resultColumn = range.getColumnStart() + columnArgument.intValue() - 1;

        Map<CellPosition, Cell> cells = store.findCellsInRange(
                range.getRowStart(), range.getColumnStart(), range.getRowEnd(), range.getColumnEnd());
        for (int row = range.getRowStart(); row <= range.getRowEnd(); row++) {
            Value candidate = ReferenceResolver.toValue(cells.get(CellPosition.of(row, range.getColumnStart())));
            if (candidate.matches(key)) {
                Value found = ReferenceResolver.toValue(cells.get(CellPosition.of(row, resultColumn)));
                return FormulaEvaluator.propagate(found);
            }
        }
        throw new FormulaException(ErrorCode.NOT_AVAILABLE, "no match for " + key);
    }

    private Value extreme(List<Expr> args, int direction) {
        Operands operands = collect(args);
        BigDecimal best = null;
        for (Value value : operands.values) {
            BigDecimal number = value.toNumber();
            if (best == null || number.compareTo(best) * direction > 0) {
                best = number;
            }
        }
        // unpopulated positions take part as zeros
        if (best == null || (operands.missing > 0 && BigDecimal.ZERO.compareTo(best) * direction > 0)) {
            best = BigDecimal.ZERO;
        }
        return Value.number(evaluator.quantize(best));
    }

    private static BigDecimal total(Operands operands) {
        BigDecimal total = BigDecimal.ZERO;
        for (Value value : operands.values) {
            total = total.add(value.toNumber());
        }
        return total;
    }

    /**
     * Flattens arguments into cell values. Error cells are kept as values so that
     * COUNT can skip them; numeric folds force them and propagate.
     */
    private Operands collect(List<Expr> args) {
        Operands operands = new Operands();
        for (Expr arg : args) {
            switch (arg.kind()) {
                case RANGE:
                    CellRange range = ((Expr.Range) arg).range();
                    Map<CellPosition, Cell> cells = store.findCellsInRange(
                            range.getRowStart(), range.getColumnStart(), range.getRowEnd(), range.getColumnEnd());
                    for (Cell cell : cells.values()) {
                        operands.values.add(ReferenceResolver.toValue(cell));
                    }
                    operands.missing += range.size() - cells.size();
                    break;
                case REFERENCE:
                    operands.values.add(ReferenceResolver.resolve(store, ((Expr.Reference) arg).position()));
                    break;
                default:
                    operands.values.add(evaluator.evaluate(arg));
                    break;
            }
        }
        return operands;
    }

    private static final class Operands {
        private final List<Value> values = new ArrayList<>();
        private long missing;
    }
}
