package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.models.Cell;
import com.spreadsheet.engine.models.CellPosition;

import java.util.Map;

/**
 * Read access the formula engine needs from the sparse grid that owns the cells.
 * Positions are zero-based. Soft-deleted cells are never returned.
 */
public interface CellStore {

    /**
     * Point lookup; null when no live cell is stored at the position.
     */
    Cell findCell(int row, int column);

    /**
     * Live cells inside the inclusive rectangle, keyed by position.
     */
    Map<CellPosition, Cell> findCellsInRange(int rowStart, int columnStart, int rowEnd, int columnEnd);

    boolean rowExists(int position);

    boolean columnExists(int position);
}
