package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.exceptions.FormulaException;
import com.spreadsheet.engine.models.Cell;
import com.spreadsheet.engine.models.CellPosition;

/**
 * Reads cell snapshots out of a {@link CellStore} and interprets them as {@link Value}s.
 */
final class ReferenceResolver {

    private ReferenceResolver() {
    }

    /**
     * Value of the cell at the position. A missing row or column object is #REF!;
     * a live position without a stored cell is EMPTY. Error cells come back as
     * error values, not exceptions.
     */
    static Value resolve(CellStore store, CellPosition position) {
        if (!store.rowExists(position.getRow()) || !store.columnExists(position.getColumn())) {
            throw new FormulaException(ErrorCode.REF, "no row/column at " + position);
        }
        return toValue(store.findCell(position.getRow(), position.getColumn()));
    }

    static Value toValue(Cell cell) {
        if (cell == null || cell.isDeleted()) {
            return Value.EMPTY;
        }
        switch (cell.getComputedType()) {
            case NUMBER:
                if (cell.getComputedNumber() != null) {
                    return Value.number(cell.getComputedNumber());
                }
                return cell.getNumberValue() != null ? Value.number(cell.getNumberValue()) : Value.EMPTY;
            case STRING:
                return Value.string(cell.getComputedString() == null ? "" : cell.getComputedString());
            case BOOLEAN:
                if (cell.getBooleanValue() != null) {
                    return Value.bool(cell.getBooleanValue());
                }
                return Value.bool("TRUE".equals(cell.getComputedString()));
            case ERROR:
                return Value.error(cell.getErrorCode() != null ? cell.getErrorCode() : ErrorCode.VALUE);
            case EMPTY:
            default:
                return cell.getNumberValue() != null ? Value.number(cell.getNumberValue()) : Value.EMPTY;
        }
    }
}
