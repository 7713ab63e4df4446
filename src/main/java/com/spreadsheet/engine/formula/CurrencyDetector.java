package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.exceptions.FormulaException;
import com.spreadsheet.engine.models.Cell;
import com.spreadsheet.engine.models.CellPosition;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Infers the currency of a numeric formula result from the raw text of the cells
 * referenced anywhere in the parsed formula, including branches that were not evaluated.
 */
public final class CurrencyDetector {

    public static final String SYMBOLS = "$¥€£";

    private CurrencyDetector() {
    }

    /**
     * The single currency symbol prefixed on the cells the formula references, or null
     * when none carries one. Two or more distinct symbols fail with #VALUE!.
     * Ranges are read through the store, so only stored cells are inspected.
     */
    public static String detect(Expr expr, CellStore store) {
        Set<Character> symbols = new LinkedHashSet<>();
        collect(expr, store, symbols);
        if (symbols.size() > 1) {
            throw new FormulaException(ErrorCode.VALUE, "mixed currencies " + symbols);
        }
        return symbols.isEmpty() ? null : String.valueOf(symbols.iterator().next());
    }

    private static void collect(Expr expr, CellStore store, Set<Character> symbols) {
        switch (expr.kind()) {
            case REFERENCE:
                CellPosition position = ((Expr.Reference) expr).position();
                addSymbol(store.findCell(position.getRow(), position.getColumn()), symbols);
                break;
            case RANGE:
                CellRange range = ((Expr.Range) expr).range();
                for (Cell cell : store.findCellsInRange(range.getRowStart(), range.getColumnStart(),
                        range.getRowEnd(), range.getColumnEnd()).values()) {
                    addSymbol(cell, symbols);
                }
                break;
            case UNARY:
                collect(((Expr.Unary) expr).operand(), store, symbols);
                break;
            case BINARY:
                collect(((Expr.Binary) expr).left(), store, symbols);
                collect(((Expr.Binary) expr).right(), store, symbols);
                break;
            case COMPARISON:
                collect(((Expr.Comparison) expr).left(), store, symbols);
                collect(((Expr.Comparison) expr).right(), store, symbols);
                break;
            case CALL:
                for (Expr arg : ((Expr.Call) expr).args()) {
                    collect(arg, store, symbols);
                }
                break;
            default:
                break;
        }
    }

    private static void addSymbol(Cell cell, Set<Character> symbols) {
        Character symbol = cell == null ? null : leadingSymbol(cell.getRawInput());
        if (symbol != null) {
            symbols.add(symbol);
        }
    }

    public static Character leadingSymbol(String rawInput) {
        if (rawInput == null) {
            return null;
        }
        String trimmed = rawInput.trim();
        if (trimmed.isEmpty() || SYMBOLS.indexOf(trimmed.charAt(0)) < 0) {
            return null;
        }
        return trimmed.charAt(0);
    }

    /**
     * Renders 1234.5 with "$" as "$1234.50" and -3 as "-$3.00".
     */
    public static String format(BigDecimal amount, String symbol) {
        BigDecimal cents = amount.setScale(2, RoundingMode.HALF_UP);
        if (cents.signum() < 0) {
            return "-" + symbol + cents.negate().toPlainString();
        }
        return symbol + cents.toPlainString();
    }
}
