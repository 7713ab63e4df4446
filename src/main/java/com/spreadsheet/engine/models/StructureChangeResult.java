package com.spreadsheet.engine.models;

import java.util.List;

/**
 * Outcome of a resize or of a row/column deletion: how many rows and columns were
 * created or deleted, the live totals afterwards, and copies of the formula cells
 * that were recalculated as a consequence.
 */
public class StructureChangeResult {
    private final int rowsChanged;
    private final int columnsChanged;
    private final int totalRows;
    private final int totalColumns;
    private final List<Cell> cells;

    public StructureChangeResult(int rowsChanged, int columnsChanged, int totalRows, int totalColumns,
                                 List<Cell> cells) {
        this.rowsChanged = rowsChanged;
        this.columnsChanged = columnsChanged;
        this.totalRows = totalRows;
        this.totalColumns = totalColumns;
        this.cells = cells;
    }

    public int getRowsChanged() {
        return rowsChanged;
    }

    public int getColumnsChanged() {
        return columnsChanged;
    }

    public int getTotalRows() {
        return totalRows;
    }

    public int getTotalColumns() {
        return totalColumns;
    }

    public List<Cell> getCells() {
        return cells;
    }
}
