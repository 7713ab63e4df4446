package com.spreadsheet.engine.services;

import com.spreadsheet.engine.exceptions.InvalidCellOperationException;
import com.spreadsheet.engine.exceptions.OperationError;
import com.spreadsheet.engine.exceptions.SheetNotFoundException;
import com.spreadsheet.engine.formula.FormulaEngine;
import com.spreadsheet.engine.models.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Orchestrates sheets around the formula engine: creating sheets, applying
 * batches of cell writes atomically, and reading computed values back.
 */
@Service
public class SheetService {

    private static final Logger log = LoggerFactory.getLogger(SheetService.class);

    // All sheets live here in memory; persistence is left to the embedding application
    private final Map<Long, Sheet> sheets = new ConcurrentHashMap<>();

    private final RecalculationService recalculationService;
    private final FormulaEngine formulaEngine;

    public SheetService(RecalculationService recalculationService) {
        this.recalculationService = recalculationService;
        this.formulaEngine = recalculationService.getFormulaEngine();
    }

    /**
     * Creates a sheet with rows 0..rowCount-1 and columns 0..columnCount-1 and returns its ID.
     */
    public long createSheet(String name, int rowCount, int columnCount) {
        if (rowCount < 0 || columnCount < 0) {
            throw new InvalidCellOperationException("Row and column counts must be non-negative");
        }
        Sheet sheet = new Sheet(name);
        for (int row = 0; row < rowCount; row++) {
            sheet.addRow(row);
        }
        for (int column = 0; column < columnCount; column++) {
            sheet.addColumn(column);
        }
        sheets.put(sheet.getId(), sheet);
        log.info("Created sheet id={} name={} rows={} columns={}", sheet.getId(), name, rowCount, columnCount);
        return sheet.getId();
    }

    /**
     * Retrieves a Sheet by ID. Throws if not found.
     */
    public Sheet getSheet(long sheetId) {
        Sheet sheet = sheets.get(sheetId);
        if (sheet == null) {
            throw new SheetNotFoundException("Sheet not found: " + sheetId);
        }
        return sheet;
    }

    /**
     * Makes the row live, reviving it if it was deleted. Formulas reading it are recalculated.
     */
    public void addRow(long sheetId, int position) {
        if (position < 0) {
            throw new InvalidCellOperationException("row must be a non-negative integer");
        }
        Sheet sheet = getSheet(sheetId);
        sheet.getLock().writeLock().lock();
        try {
            applyReverting(sheet, () -> {
                sheet.addRow(position);
                return recalculateReaders(sheet, p -> p.getRow() == position);
            });
        } finally {
            sheet.getLock().writeLock().unlock();
        }
    }

    /**
     * Makes the column live, reviving it if it was deleted. Formulas reading it are recalculated.
     */
    public void addColumn(long sheetId, int position) {
        if (position < 0) {
            throw new InvalidCellOperationException("column must be a non-negative integer");
        }
        Sheet sheet = getSheet(sheetId);
        sheet.getLock().writeLock().lock();
        try {
            applyReverting(sheet, () -> {
                sheet.addColumn(position);
                return recalculateReaders(sheet, p -> p.getColumn() == position);
            });
        } finally {
            sheet.getLock().writeLock().unlock();
        }
    }

    /**
     * Ensures at least rowCount live rows and live columns 0..columnCount-1.
     * Missing rows below rowCount are created unless their position was deleted; deleted
     * row positions are never reused, the shortfall is appended after the highest row
     * ever created. Missing columns are created at their position.
     */
    public StructureChangeResult resizeSheet(long sheetId, int rowCount, int columnCount) {
        if (rowCount < 0 || columnCount < 0) {
            throw new InvalidCellOperationException("rowCount and columnCount must be non-negative integers");
        }
        Sheet sheet = getSheet(sheetId);

        sheet.getLock().writeLock().lock();
        try {
            return applyReverting(sheet, () -> {
                Set<Integer> newRows = new HashSet<>();
                for (int row = 0; row < rowCount; row++) {
                    if (!sheet.rowExists(row) && !sheet.isRowDeleted(row)) {
                        sheet.addRow(row);
                        newRows.add(row);
                    }
                }
                int next = sheet.getHighestRowPosition() + 1;
                while (sheet.getRowCount() < rowCount) {
                    sheet.addRow(next);
                    newRows.add(next++);
                }

                Set<Integer> newColumns = new HashSet<>();
                for (int column = 0; column < columnCount; column++) {
                    if (!sheet.columnExists(column)) {
                        sheet.addColumn(column);
                        newColumns.add(column);
                    }
                }

                List<Cell> recalculated = recalculateReaders(sheet,
                        p -> newRows.contains(p.getRow()) || newColumns.contains(p.getColumn()));
                log.info("Resized sheet id={} rowsCreated={} columnsCreated={}",
                        sheet.getId(), newRows.size(), newColumns.size());
                return new StructureChangeResult(newRows.size(), newColumns.size(),
                        sheet.getRowCount(), sheet.getColumnCount(), copies(recalculated));
            });
        } finally {
            sheet.getLock().writeLock().unlock();
        }
    }

    /**
     * Deletes the live rows position..position+count-1 together with their cells.
     * Positions are not shifted; formulas reading a deleted row evaluate to #REF!.
     */
    public StructureChangeResult deleteRows(long sheetId, int position, int count) {
        if (count < 1) {
            throw new InvalidCellOperationException("count must be a positive integer");
        }
        if (position < 0) {
            throw new InvalidCellOperationException("position must be a non-negative integer");
        }
        Sheet sheet = getSheet(sheetId);

        sheet.getLock().writeLock().lock();
        try {
            for (int row = position; row < position + count; row++) {
                if (!sheet.rowExists(row)) {
                    throw new InvalidCellOperationException("Row " + row + " does not exist");
                }
            }
            return applyReverting(sheet, () -> {
                Predicate<CellPosition> inRows = p -> p.getRow() >= position && p.getRow() < position + count;
                for (int row = position; row < position + count; row++) {
                    sheet.deleteRow(row);
                }
                removeCells(sheet, inRows);
                List<Cell> recalculated = recalculateReaders(sheet, inRows);
                log.info("Deleted rows sheetId={} position={} count={} recalculated={}",
                        sheet.getId(), position, count, recalculated.size());
                return new StructureChangeResult(count, 0,
                        sheet.getRowCount(), sheet.getColumnCount(), copies(recalculated));
            });
        } finally {
            sheet.getLock().writeLock().unlock();
        }
    }

    /**
     * Deletes the live columns position..position+count-1 together with their cells.
     * Positions are not shifted; formulas reading a deleted column evaluate to #REF!.
     */
    public StructureChangeResult deleteColumns(long sheetId, int position, int count) {
        if (count < 1) {
            throw new InvalidCellOperationException("count must be a positive integer");
        }
        if (position < 0) {
            throw new InvalidCellOperationException("position must be a non-negative integer");
        }
        Sheet sheet = getSheet(sheetId);

        sheet.getLock().writeLock().lock();
        try {
            for (int column = position; column < position + count; column++) {
                if (!sheet.columnExists(column)) {
                    throw new InvalidCellOperationException("Column " + column + " does not exist");
                }
            }
            return applyReverting(sheet, () -> {
                Predicate<CellPosition> inColumns =
                        p -> p.getColumn() >= position && p.getColumn() < position + count;
                for (int column = position; column < position + count; column++) {
                    sheet.deleteColumn(column);
                }
                removeCells(sheet, inColumns);
                List<Cell> recalculated = recalculateReaders(sheet, inColumns);
                log.info("Deleted columns sheetId={} position={} count={} recalculated={}",
                        sheet.getId(), position, count, recalculated.size());
                return new StructureChangeResult(0, count,
                        sheet.getRowCount(), sheet.getColumnCount(), copies(recalculated));
            });
        } finally {
            sheet.getLock().writeLock().unlock();
        }
    }

    /**
     * Applies a batch of SET / CLEAR operations all-or-nothing:
     * 1) Validate every operation; any problem rejects the whole batch untouched.
     * 2) Snapshot the sheet so a failure mid-way can be reverted.
     * 3) Write cells and rebuild each written cell's dependency edges.
     * 4) Recalculate every affected formula once for the whole batch.
     */
    public BatchUpdateResult batchUpdateCells(long sheetId, List<CellOperation> operations) {
        Sheet sheet = getSheet(sheetId);

        // Writers to the same sheet are serialized for the whole batch
        sheet.getLock().writeLock().lock();
        try {
            List<OperationError> errors = validate(sheet, operations);
            if (!errors.isEmpty()) {
                throw new InvalidCellOperationException(
                        "Batch rejected: " + errors.size() + " invalid operation(s)", errors);
            }

            return applyReverting(sheet, () -> apply(sheet, operations));
        } finally {
            sheet.getLock().writeLock().unlock();
        }
    }

    /**
     * Copies of the live, non-empty cells inside the inclusive range, in row-major order.
     */
    public List<Cell> readCellRange(long sheetId, int startRow, int endRow, int startColumn, int endColumn) {
        if (startRow > endRow) {
            throw new InvalidCellOperationException("startRow must be less than or equal to endRow");
        }
        if (startColumn > endColumn) {
            throw new InvalidCellOperationException("startColumn must be less than or equal to endColumn");
        }
        Sheet sheet = getSheet(sheetId);

        sheet.getLock().readLock().lock();
        try {
            List<Cell> found = new ArrayList<>();
            for (Cell cell : sheet.findCellsInRange(startRow, startColumn, endRow, endColumn).values()) {
                if (cell.getValueType() != CellValueType.EMPTY) {
                    found.add(new Cell(cell));
                }
            }
            return found;
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    /**
     * Returns address -> display value for every live, non-empty cell, e.g.
     * { "A1": 10, "B1": "$20.00", "C1": true, "D1": "#DIV/0!" }.
     * Values are read from the computed cache; nothing is evaluated here.
     */
    public Map<String, Object> getSheetData(long sheetId) {
        Sheet sheet = getSheet(sheetId);

        sheet.getLock().readLock().lock();
        try {
            Map<String, Object> data = new LinkedHashMap<>();
            for (Cell cell : sheet.getCells()) {
                if (cell.isDeleted() || cell.getValueType() == CellValueType.EMPTY) {
                    continue;
                }
                Object display = displayValue(cell);
                if (display != null) {
                    data.put(cell.getAddress(), display);
                }
            }
            return data;
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    /**
     * For each formula cell => the addresses its formula reads.
     */
    public Map<String, List<String>> getForwardDependencies(long sheetId) {
        Sheet sheet = getSheet(sheetId);
        sheet.getLock().readLock().lock();
        try {
            return toAddressMap(sheet.getForwardGraph());
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    /**
     * For each referenced cell => the addresses of the formulas reading it.
     */
    public Map<String, List<String>> getReverseDependencies(long sheetId) {
        Sheet sheet = getSheet(sheetId);
        sheet.getLock().readLock().lock();
        try {
            return toAddressMap(sheet.getReverseGraph());
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    // ----------------------------------------------------------------
    // Internal Helpers (used within this service only)
    // ----------------------------------------------------------------

    /**
     * Runs a change against a snapshot of the sheet and restores the snapshot if the
     * change throws, so none of its partial writes stay visible. Caller holds the write lock.
     */
    private <T> T applyReverting(Sheet sheet, Supplier<T> change) {
        Sheet.Snapshot snapshot = sheet.snapshot();
        try {
            return change.get();
        } catch (RuntimeException ex) {
            sheet.restore(snapshot);
            log.warn("Change on sheet {} failed and was reverted", sheet.getId(), ex);
            throw ex;
        }
    }

    /**
     * Recalculates the formulas reading any referenced position the filter accepts.
     */
    private List<Cell> recalculateReaders(Sheet sheet, Predicate<CellPosition> filter) {
        List<CellPosition> seeds = new ArrayList<>();
        for (CellPosition target : sheet.getReverseGraph().keySet()) {
            if (filter.test(target)) {
                seeds.add(target);
            }
        }
        return recalculationService.recalculateReadersOf(sheet, seeds);
    }

    // Soft-deletes the live cells the filter accepts and drops their outgoing edges
    private static void removeCells(Sheet sheet, Predicate<CellPosition> filter) {
        for (Cell cell : sheet.getCells()) {
            if (!cell.isDeleted() && filter.test(cell.getPosition())) {
                cell.wipe();
                cell.setDeleted(true);
                sheet.clearDependencies(cell.getPosition());
            }
        }
    }

    private static List<Cell> copies(Collection<Cell> cells) {
        List<Cell> copied = new ArrayList<>(cells.size());
        for (Cell cell : cells) {
            copied.add(new Cell(cell));
        }
        return copied;
    }

    private List<OperationError> validate(Sheet sheet, List<CellOperation> operations) {
        List<OperationError> errors = new ArrayList<>();
        if (operations == null) {
            errors.add(new OperationError(0, null, null, "operations", "operations are required"));
            return errors;
        }
        for (int index = 0; index < operations.size(); index++) {
            CellOperation op = operations.get(index);
            if (op == null || op.getType() == null) {
                errors.add(new OperationError(index, null, null, "operation", "operation is required"));
                continue;
            }
            int row = op.getRow();
            int column = op.getColumn();
            if (row < 0) {
                errors.add(new OperationError(index, row, column, "row", "row must be a non-negative integer"));
                continue;
            }
            if (column < 0) {
                errors.add(new OperationError(index, row, column, "column", "column must be a non-negative integer"));
                continue;
            }
            if (op.getType() == OperationType.SET && op.getRawInput() == null) {
                errors.add(new OperationError(index, row, column, "raw_input", "raw_input is required when operation is \"set\""));
                continue;
            }
            if (op.isClearing()) {
                continue;
            }
            if (op.getRawInput().startsWith("=")) {
                long referenced = formulaEngine.countReferences(op.getRawInput());
                long limit = formulaEngine.getProperties().getMaxReferencedCells();
                if (referenced > limit) {
                    errors.add(new OperationError(index, row, column, "raw_input",
                            "formula references " + referenced + " cells, more than the limit of " + limit));
                    continue;
                }
            }
            // No auto-expand: writes only land on existing rows and columns
            if (!sheet.rowExists(row)) {
                errors.add(new OperationError(index, row, column, "row", "Row " + row + " does not exist"));
                continue;
            }
            if (!sheet.columnExists(column)) {
                errors.add(new OperationError(index, row, column, "column", "Column " + column + " does not exist"));
            }
        }
        return errors;
    }

    private BatchUpdateResult apply(Sheet sheet, List<CellOperation> operations) {
        int updated = 0;
        int cleared = 0;
        Map<CellPosition, Cell> touched = new LinkedHashMap<>();

        for (CellOperation op : operations) {
            CellPosition position = CellPosition.of(op.getRow(), op.getColumn());
            log.info("Batch write sheetId={} row={} column={}", sheet.getId(), op.getRow(), op.getColumn());

            if (op.isClearing()) {
                // Clearing a missing cell is a no-op that keeps storage sparse
                Cell cell = sheet.getStoredCell(position);
                if (cell == null || cell.isDeleted()) {
                    continue;
                }
                cell.wipe();
                cell.setDeleted(true);
                sheet.clearDependencies(position);
                cleared++;
                touched.put(position, cell);
            } else {
                Cell cell = sheet.getOrCreateCell(position);
                cell.setDeleted(false);
                CellInputParser.apply(cell, op.getRawInput());
                recalculationService.updateDependencies(sheet, cell);
                updated++;
                touched.put(position, cell);
            }
        }

        for (Cell cell : recalculationService.recalculate(sheet, touched.values())) {
            touched.put(cell.getPosition(), cell);
        }
        log.info("Batch applied sheetId={} updated={} cleared={} touched={}",
                sheet.getId(), updated, cleared, touched.size());
        return new BatchUpdateResult(updated, cleared, copies(touched.values()));
    }

    private static Object displayValue(Cell cell) {
        switch (cell.getComputedType()) {
            case NUMBER:
                if (cell.getComputedString() != null) {
                    return cell.getComputedString();
                }
                return cell.getComputedNumber() == null ? null : normalize(cell.getComputedNumber());
            case STRING:
                return cell.getComputedString();
            case BOOLEAN:
                return "TRUE".equals(cell.getComputedString());
            case ERROR:
                return cell.getErrorCode() == null ? null : cell.getErrorCode().getLiteral();
            case EMPTY:
            default:
                return null;
        }
    }

    // 10.0000000000 -> 10, 0.5000000000 -> 0.5
    private static BigDecimal normalize(BigDecimal number) {
        BigDecimal stripped = number.stripTrailingZeros();
        return stripped.scale() < 0 ? stripped.setScale(0) : stripped;
    }

    private static Map<String, List<String>> toAddressMap(Map<CellPosition, Set<CellPosition>> graph) {
        Map<String, List<String>> addresses = new LinkedHashMap<>();
        new TreeMap<>(graph).forEach((position, edges) -> {
            List<String> targets = new ArrayList<>();
            for (CellPosition edge : new TreeSet<>(edges)) {
                targets.add(edge.toAddress());
            }
            addresses.put(position.toAddress(), targets);
        });
        return addresses;
    }
}
