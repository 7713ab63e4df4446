package com.spreadsheet.engine.models;

import java.util.List;

/**
 * Summary of an applied batch: how many cells were set or cleared, and every
 * cell touched, directly or through recalculation.
 */
public class BatchUpdateResult {
    private final int updated;
    private final int cleared;
    private final List<Cell> cells;

    public BatchUpdateResult(int updated, int cleared, List<Cell> cells) {
        this.updated = updated;
        this.cleared = cleared;
        this.cells = cells;
    }

    public int getUpdated() {
        return updated;
    }

    public int getCleared() {
        return cleared;
    }

    public List<Cell> getCells() {
        return cells;
    }
}
