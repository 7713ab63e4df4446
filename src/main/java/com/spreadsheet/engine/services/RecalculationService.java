package com.spreadsheet.engine.services;

import com.spreadsheet.engine.formula.CellReferences;
import com.spreadsheet.engine.formula.ErrorCode;
import com.spreadsheet.engine.formula.FormulaEngine;
import com.spreadsheet.engine.formula.FormulaResult;
import com.spreadsheet.engine.models.Cell;
import com.spreadsheet.engine.models.CellPosition;
import com.spreadsheet.engine.models.ComputedType;
import com.spreadsheet.engine.models.Sheet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Maintains formula dependency edges and brings every formula that depends on a
 * changed cell up to date, in topological order. Cells that cannot be ordered
 * because of a circular reference are all marked #CYCLE!.
 *
 * Callers must hold the sheet's write lock.
 */
@Service
public class RecalculationService {

    private static final Logger log = LoggerFactory.getLogger(RecalculationService.class);

    private final FormulaEngine formulaEngine;

    public RecalculationService(FormulaEngine formulaEngine) {
        this.formulaEngine = formulaEngine;
    }

    public FormulaEngine getFormulaEngine() {
        return formulaEngine;
    }

    /**
     * Replaces the outgoing edges of 'cell' with the references of its current formula.
     * Referenced positions get placeholder rows, columns and empty cells when missing;
     * rows and columns that were deleted stay deleted, so reads of them give #REF!.
     */
    public void updateDependencies(Sheet sheet, Cell cell) {
        CellPosition source = cell.getPosition();
        sheet.clearDependencies(source);
        if (cell.isDeleted() || !cell.isFormula()) {
            return;
        }

        for (String ref : formulaEngine.extractReferences(cell.getRawInput())) {
            if (!CellReferences.isValidReference(ref)) {
                continue;
            }
            CellPosition target = CellReferences.referenceToIndexes(ref);
            sheet.addDependency(source, target);
            if (sheet.isRowDeleted(target.getRow()) || sheet.isColumnDeleted(target.getColumn())) {
                continue;
            }
            sheet.addRow(target.getRow());
            sheet.addColumn(target.getColumn());
            Cell targetCell = sheet.getOrCreateCell(target);
            if (targetCell.isDeleted()) {
                targetCell.setDeleted(false);
            }
        }
    }

    /**
     * Re-evaluates the changed formula cells and all of their transitive dependents.
     * Returns every cell whose computed fields were rewritten.
     */
    public List<Cell> recalculate(Sheet sheet, Collection<Cell> changedCells) {
        return recalculateAffected(sheet, collectAffected(sheet, changedCells, Collections.emptyList()));
    }

    /**
     * Re-evaluates every formula that transitively reads one of the positions, e.g. after
     * the rows or columns holding them were deleted or added.
     */
    public List<Cell> recalculateReadersOf(Sheet sheet, Collection<CellPosition> positions) {
        return recalculateAffected(sheet, collectAffected(sheet, Collections.emptyList(), positions));
    }

    private List<Cell> recalculateAffected(Sheet sheet, Map<CellPosition, Cell> affected) {
        if (affected.isEmpty()) {
            return new ArrayList<>();
        }

        // Kahn's algorithm restricted to edges inside the affected set
        Map<CellPosition, Integer> inDegree = new LinkedHashMap<>();
        Map<CellPosition, List<CellPosition>> readers = new HashMap<>();
        for (CellPosition position : affected.keySet()) {
            inDegree.put(position, 0);
        }
        for (CellPosition position : affected.keySet()) {
            for (CellPosition target : sheet.getDependencies(position)) {
                if (affected.containsKey(target)) {
                    inDegree.merge(position, 1, Integer::sum);
                    readers.computeIfAbsent(target, k -> new ArrayList<>()).add(position);
                }
            }
        }

        Deque<CellPosition> queue = new ArrayDeque<>();
        inDegree.forEach((position, degree) -> {
            if (degree == 0) {
                queue.add(position);
            }
        });

        List<CellPosition> ordered = new ArrayList<>();
        while (!queue.isEmpty()) {
            CellPosition current = queue.poll();
            ordered.add(current);
            for (CellPosition reader : readers.getOrDefault(current, Collections.emptyList())) {
                if (inDegree.merge(reader, -1, Integer::sum) == 0) {
                    queue.add(reader);
                }
            }
        }
        log.debug("Recalculation order for sheet {}: {}", sheet.getId(), ordered);

        List<Cell> updated = new ArrayList<>();
        for (CellPosition position : ordered) {
            Cell cell = affected.get(position);
            if (!cell.isFormula()) {
                continue;
            }
            applyResult(cell, formulaEngine.evaluateFormula(cell.getRawInput(), sheet));
            updated.add(cell);
        }

        Set<CellPosition> unordered = new LinkedHashSet<>(affected.keySet());
        unordered.removeAll(ordered);
        if (!unordered.isEmpty()) {
            log.warn("Circular reference in sheet {} involving {}", sheet.getId(), unordered);
            for (CellPosition position : unordered) {
                Cell cell = affected.get(position);
                cell.resetComputed();
                cell.setComputedType(ComputedType.ERROR);
                cell.setErrorCode(ErrorCode.CYCLE);
                updated.add(cell);
            }
        }
        return updated;
    }

    Map<CellPosition, Cell> collectAffected(Sheet sheet, Collection<Cell> changedCells) {
        return collectAffected(sheet, changedCells, Collections.emptyList());
    }

    /**
     * Changed formula cells plus every live cell reachable over incoming edges from
     * them or from the extra seed positions.
     */
    Map<CellPosition, Cell> collectAffected(Sheet sheet, Collection<Cell> changedCells,
                                            Collection<CellPosition> seeds) {
        Map<CellPosition, Cell> affected = new LinkedHashMap<>();
        Deque<CellPosition> queue = new ArrayDeque<>();

        for (Cell cell : changedCells) {
            if (!cell.isDeleted() && cell.isFormula()) {
                affected.put(cell.getPosition(), cell);
            }
            queue.add(cell.getPosition());
        }
        queue.addAll(seeds);

        Set<CellPosition> visited = new HashSet<>(queue);
        while (!queue.isEmpty()) {
            CellPosition current = queue.poll();
            for (CellPosition dependent : sheet.getDependents(current)) {
                Cell dependentCell = sheet.getStoredCell(dependent);
                if (dependentCell == null || dependentCell.isDeleted()) {
                    continue;
                }
                affected.putIfAbsent(dependent, dependentCell);
                if (visited.add(dependent)) {
                    queue.add(dependent);
                }
            }
        }
        return affected;
    }

    private static void applyResult(Cell cell, FormulaResult result) {
        cell.setComputedType(result.getComputedType());
        cell.setComputedNumber(result.getComputedType() == ComputedType.NUMBER ? result.getComputedNumber() : null);
        cell.setComputedString(result.getComputedString());
        cell.setErrorCode(result.getErrorCode());
    }
}
