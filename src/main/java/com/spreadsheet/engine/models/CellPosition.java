package com.spreadsheet.engine.models;

import com.spreadsheet.engine.formula.CellReferences;

import java.util.Objects;

/**
 * Zero-based (row, column) coordinates of a cell within a sheet.
 * Used as the key of the cell map and of both dependency graphs.
 */
public final class CellPosition implements Comparable<CellPosition> {
    private final int row;
    private final int column;

    public CellPosition(int row, int column) {
        this.row = row;
        this.column = column;
    }

    public static CellPosition of(int row, int column) {
        return new CellPosition(row, column);
    }

    public int getRow() {
        return row;
    }

    public int getColumn() {
        return column;
    }

    /**
     * A1-style address, e.g. (row 11, column 1) -> "B12".
     */
    public String toAddress() {
        return CellReferences.toAddress(row, column);
    }

    // Row-major ordering, matching range expansion order
    @Override
    public int compareTo(CellPosition other) {
        int byRow = Integer.compare(row, other.row);
        return byRow != 0 ? byRow : Integer.compare(column, other.column);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CellPosition)) return false;
        CellPosition that = (CellPosition) o;
        return row == that.row && column == that.column;
    }

    @Override
    public int hashCode() {
        return Objects.hash(row, column);
    }

    @Override
    public String toString() {
        return toAddress();
    }
}
