package com.spreadsheet.engine.models;

import com.spreadsheet.engine.formula.CellStore;

import java.util.*;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Represents one sheet of a spreadsheet and acts as its in-memory cell store:
 * - Has a unique ID and a display name
 * - Sparse sets of existing row and column positions, plus the positions deleted
 *   from them (deleted positions are only revived explicitly)
 * - A row-major map of position -> Cell (soft-deleted cells included)
 * - Two dependency graphs (forward, reverse) to track formula references
 * - A read/write lock; writers must hold the write lock for a whole batch
 */
public class Sheet implements CellStore {

    // Generates unique IDs for newly created sheets
    private static final AtomicLong ID_GENERATOR = new AtomicLong(1);

    private final long id;
    private final String name;

    private NavigableSet<Integer> rows = new TreeSet<>();
    private NavigableSet<Integer> columns = new TreeSet<>();
    private NavigableSet<Integer> deletedRows = new TreeSet<>();
    private NavigableSet<Integer> deletedColumns = new TreeSet<>();
    private NavigableMap<CellPosition, Cell> cells = new TreeMap<>();

    // Forward adjacency: formula cell -> cells its formula reads
    private Map<CellPosition, Set<CellPosition>> dependencyGraphForward = new HashMap<>();
    // Reverse adjacency: referenced cell -> formula cells that read it
    private Map<CellPosition, Set<CellPosition>> dependencyGraphReverse = new HashMap<>();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public Sheet(String name) {
        this.id = ID_GENERATOR.getAndIncrement();
        this.name = name;
    }

    public long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    // ------------------------
    // Structure
    // ------------------------

    public void addRow(int position) {
        rows.add(position);
        deletedRows.remove(position);
    }

    public void addColumn(int position) {
        columns.add(position);
        deletedColumns.remove(position);
    }

    public void deleteRow(int position) {
        if (rows.remove(position)) {
            deletedRows.add(position);
        }
    }

    public void deleteColumn(int position) {
        if (columns.remove(position)) {
            deletedColumns.add(position);
        }
    }

    public boolean isRowDeleted(int position) {
        return deletedRows.contains(position);
    }

    public boolean isColumnDeleted(int position) {
        return deletedColumns.contains(position);
    }

    /**
     * Highest row position ever created, deleted ones included; -1 for a sheet without rows.
     */
    public int getHighestRowPosition() {
        int live = rows.isEmpty() ? -1 : rows.last();
        int deleted = deletedRows.isEmpty() ? -1 : deletedRows.last();
        return Math.max(live, deleted);
    }

    @Override
    public boolean rowExists(int position) {
        return rows.contains(position);
    }

    @Override
    public boolean columnExists(int position) {
        return columns.contains(position);
    }

    public int getRowCount() {
        return rows.size();
    }

    public int getColumnCount() {
        return columns.size();
    }

    // ------------------------
    // Cells
    // ------------------------

    /**
     * Every stored cell, including soft-deleted ones, in row-major order.
     */
    public Collection<Cell> getCells() {
        return cells.values();
    }

    /**
     * Returns the stored cell at the position whether live or soft-deleted, or null.
     */
    public Cell getStoredCell(CellPosition position) {
        return cells.get(position);
    }

    /**
     * Returns the cell at the position, creating an empty live one if none is stored.
     * A soft-deleted cell is handed back as is; callers decide whether to revive it.
     */
    public Cell getOrCreateCell(CellPosition position) {
        return cells.computeIfAbsent(position, Cell::new);
    }

    @Override
    public Cell findCell(int row, int column) {
        Cell cell = cells.get(CellPosition.of(row, column));
        return cell == null || cell.isDeleted() ? null : cell;
    }

    @Override
    public Map<CellPosition, Cell> findCellsInRange(int rowStart, int columnStart, int rowEnd, int columnEnd) {
        Map<CellPosition, Cell> found = new LinkedHashMap<>();
        SortedMap<CellPosition, Cell> band = cells.subMap(
                CellPosition.of(rowStart, columnStart), true,
                CellPosition.of(rowEnd, columnEnd), true);
        for (Map.Entry<CellPosition, Cell> entry : band.entrySet()) {
            int column = entry.getKey().getColumn();
            Cell cell = entry.getValue();
            if (column >= columnStart && column <= columnEnd && !cell.isDeleted()) {
                found.put(entry.getKey(), cell);
            }
        }
        return found;
    }

    // ------------------------
    // Dependency Management
    // ------------------------

    /**
     * Adds a reference from 'source' -> 'target' in the forward graph,
     * and the reverse graph from 'target' -> 'source'.
     */
    public void addDependency(CellPosition source, CellPosition target) {
        dependencyGraphForward
                .computeIfAbsent(source, k -> new LinkedHashSet<>())
                .add(target);
        dependencyGraphReverse
                .computeIfAbsent(target, k -> new LinkedHashSet<>())
                .add(source);
    }

    /**
     * Removes all forward references from 'source', and
     * also removes 'source' from each target's reverse references.
     */
    public void clearDependencies(CellPosition source) {
        Set<CellPosition> oldTargets = dependencyGraphForward.remove(source);
        if (oldTargets == null) {
            return;
        }
        for (CellPosition target : oldTargets) {
            Set<CellPosition> readers = dependencyGraphReverse.get(target);
            if (readers != null) {
                readers.remove(source);
                if (readers.isEmpty()) {
                    dependencyGraphReverse.remove(target);
                }
            }
        }
    }

    public Set<CellPosition> getDependencies(CellPosition source) {
        return dependencyGraphForward.getOrDefault(source, Collections.emptySet());
    }

    public Set<CellPosition> getDependents(CellPosition target) {
        return dependencyGraphReverse.getOrDefault(target, Collections.emptySet());
    }

    public Map<CellPosition, Set<CellPosition>> getForwardGraph() {
        return dependencyGraphForward;
    }

    public Map<CellPosition, Set<CellPosition>> getReverseGraph() {
        return dependencyGraphReverse;
    }

    public ReentrantReadWriteLock getLock() {
        return lock;
    }

    // ------------------------
    // Snapshots
    // ------------------------

    /**
     * Deep copy of the mutable state, taken before a batch so it can be undone.
     */
    public Snapshot snapshot() {
        NavigableMap<CellPosition, Cell> cellsCopy = new TreeMap<>();
        for (Map.Entry<CellPosition, Cell> entry : cells.entrySet()) {
            cellsCopy.put(entry.getKey(), new Cell(entry.getValue()));
        }
        return new Snapshot(new TreeSet<>(rows), new TreeSet<>(columns),
                new TreeSet<>(deletedRows), new TreeSet<>(deletedColumns), cellsCopy,
                copyGraph(dependencyGraphForward), copyGraph(dependencyGraphReverse));
    }

    public void restore(Snapshot snapshot) {
        this.rows = snapshot.rows;
        this.columns = snapshot.columns;
        this.deletedRows = snapshot.deletedRows;
        this.deletedColumns = snapshot.deletedColumns;
        this.cells = snapshot.cells;
        this.dependencyGraphForward = snapshot.forward;
        this.dependencyGraphReverse = snapshot.reverse;
    }

    private static Map<CellPosition, Set<CellPosition>> copyGraph(Map<CellPosition, Set<CellPosition>> graph) {
        Map<CellPosition, Set<CellPosition>> copy = new HashMap<>();
        graph.forEach((key, edges) -> copy.put(key, new LinkedHashSet<>(edges)));
        return copy;
    }

    /**
     * Opaque saved state of a sheet; only {@link #restore(Snapshot)} reads it.
     */
    public static final class Snapshot {
        private final NavigableSet<Integer> rows;
        private final NavigableSet<Integer> columns;
        private final NavigableSet<Integer> deletedRows;
        private final NavigableSet<Integer> deletedColumns;
        private final NavigableMap<CellPosition, Cell> cells;
        private final Map<CellPosition, Set<CellPosition>> forward;
        private final Map<CellPosition, Set<CellPosition>> reverse;

        private Snapshot(NavigableSet<Integer> rows, NavigableSet<Integer> columns,
                         NavigableSet<Integer> deletedRows, NavigableSet<Integer> deletedColumns,
                         NavigableMap<CellPosition, Cell> cells,
                         Map<CellPosition, Set<CellPosition>> forward,
                         Map<CellPosition, Set<CellPosition>> reverse) {
            this.rows = rows;
            this.columns = columns;
            this.deletedRows = deletedRows;
            this.deletedColumns = deletedColumns;
            this.cells = cells;
            this.forward = forward;
            this.reverse = reverse;
        }
    }
}
