package com.spreadsheet.engine.formula;

/**
 * Inclusive, normalized rectangle of zero-based positions.
 */
public final class CellRange {
    private final int rowStart;
    private final int columnStart;
    private final int rowEnd;
    private final int columnEnd;

    public CellRange(int rowStart, int columnStart, int rowEnd, int columnEnd) {
        this.rowStart = rowStart;
        this.columnStart = columnStart;
        this.rowEnd = rowEnd;
        this.columnEnd = columnEnd;
    }

    public int getRowStart() {
        return rowStart;
    }

    public int getColumnStart() {
        return columnStart;
    }

    public int getRowEnd() {
        return rowEnd;
    }

    public int getColumnEnd() {
        return columnEnd;
    }

    public int getWidth() {
        return columnEnd - columnStart + 1;
    }

    public int getHeight() {
        return rowEnd - rowStart + 1;
    }

    public long size() {
        return (long) getWidth() * getHeight();
    }

    @Override
    public String toString() {
        return CellReferences.toAddress(rowStart, columnStart) + ":" + CellReferences.toAddress(rowEnd, columnEnd);
    }
}
