package com.spreadsheet.engine.services;

import com.spreadsheet.engine.config.FormulaEngineProperties;
import com.spreadsheet.engine.exceptions.InvalidCellOperationException;
import com.spreadsheet.engine.exceptions.OperationError;
import com.spreadsheet.engine.exceptions.SheetNotFoundException;
import com.spreadsheet.engine.formula.FormulaEngine;
import com.spreadsheet.engine.models.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.*;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SheetService logic, using an in-memory approach
 * (no Spring context).
 */
class SheetServiceTest {

    private FormulaEngine formulaEngine;
    private SheetService sheetService;
    private long sheetId;

    @BeforeEach
    void setUp() {
        formulaEngine = new FormulaEngine(new FormulaEngineProperties());
        sheetService = new SheetService(new RecalculationService(formulaEngine));
        // 10 rows x 5 columns => A1..E10
        sheetId = sheetService.createSheet("test", 10, 5);
    }

    private BatchUpdateResult set(int row, int column, String raw) {
        return sheetService.batchUpdateCells(sheetId, Collections.singletonList(CellOperation.set(row, column, raw)));
    }

    private Object valueAt(String address) {
        return sheetService.getSheetData(sheetId).get(address);
    }

    @Test
    void testSetLiteralValues() {
        set(0, 0, "10");
        set(0, 1, "hello");
        set(0, 2, "true");
        set(0, 3, "$20");

        Map<String, Object> data = sheetService.getSheetData(sheetId);
        assertEquals(new BigDecimal("10"), data.get("A1"));
        assertEquals("hello", data.get("B1"));
        assertEquals(true, data.get("C1"));
        assertEquals(new BigDecimal("20"), data.get("D1"));
    }

    @Test
    void testFormulaResultsInSheetData() {
        BatchUpdateResult result = sheetService.batchUpdateCells(sheetId, Arrays.asList(
                CellOperation.set(0, 0, "$10"),
                CellOperation.set(0, 1, "20"),
                CellOperation.set(0, 2, "=A1+B1"),
                CellOperation.set(1, 0, "=B1/4"),
                CellOperation.set(1, 1, "=1/0"),
                CellOperation.set(1, 2, "=B1>5")
        ));
        assertEquals(6, result.getUpdated());
        assertEquals(0, result.getCleared());

        Map<String, Object> data = sheetService.getSheetData(sheetId);
        assertEquals("$30.00", data.get("C1"));
        assertEquals(new BigDecimal("5"), data.get("A2"));
        assertEquals("#DIV/0!", data.get("B2"));
        assertEquals(true, data.get("C2"));
    }

    /**
     * Writing a formula that reads its own cell => #CYCLE!.
     */
    @Test
    void testSingleCellCycle() {
        set(0, 0, "=A1");
        assertEquals("#CYCLE!", valueAt("A1"));
    }

    /**
     * Multi-cell cycle scenario: C1->A1, A1->B1, B1->C1. Every member fails.
     */
    @Test
    void testThreeCellCycle() {
        set(0, 2, "=A1");
        set(0, 0, "=B1");
        set(0, 1, "=C1");

        Map<String, Object> data = sheetService.getSheetData(sheetId);
        assertEquals("#CYCLE!", data.get("A1"));
        assertEquals("#CYCLE!", data.get("B1"));
        assertEquals("#CYCLE!", data.get("C1"));
    }

    /**
     * Partial re-eval: updating A1 should refresh B1 if B1->A1.
     */
    @Test
    void testPartialReEvaluation() {
        set(0, 0, "3");
        set(0, 1, "=A1*2");
        assertEquals(new BigDecimal("6"), valueAt("B1"));

        BatchUpdateResult result = set(0, 0, "4");
        assertEquals(new BigDecimal("8"), valueAt("B1"));
        assertEquals(2, result.getCells().size());
    }

    @Test
    void testChangeFormulaToLiteral() {
        set(0, 0, "hello");
        set(0, 2, "=A1");
        assertEquals("hello", valueAt("C1"));

        set(0, 2, "newLiteral");
        Map<String, Object> data = sheetService.getSheetData(sheetId);
        assertEquals("newLiteral", data.get("C1"));
        assertEquals("hello", data.get("A1"));
        assertTrue(sheetService.getForwardDependencies(sheetId).isEmpty());
    }

    @Test
    void testWhitespaceInputIsEmpty() {
        set(0, 0, "5");
        BatchUpdateResult result = set(0, 0, "   ");
        assertEquals(1, result.getCleared());
        assertNull(valueAt("A1"));
        assertTrue(sheetService.readCellRange(sheetId, 0, 0, 0, 0).isEmpty());
    }

    @Test
    void testClearRecalculatesDependents() {
        set(0, 0, "5");
        set(0, 1, "=A1+1");
        sheetService.batchUpdateCells(sheetId, Collections.singletonList(CellOperation.clear(0, 0)));

        assertNull(valueAt("A1"));
        assertEquals(new BigDecimal("1"), valueAt("B1"));
    }

    @Test
    void testClearingMissingCellIsNoOp() {
        BatchUpdateResult result =
                sheetService.batchUpdateCells(sheetId, Collections.singletonList(CellOperation.clear(4, 4)));
        assertEquals(0, result.getCleared());
        assertTrue(result.getCells().isEmpty());
    }

    @Test
    void testInvalidBatchIsRejectedWhole() {
        List<CellOperation> ops = Arrays.asList(
                CellOperation.set(0, 0, "1"),
                CellOperation.set(50, 0, "x"),
                CellOperation.set(0, 9, "y"),
                new CellOperation(OperationType.SET, 1, 1, null)
        );
        InvalidCellOperationException ex = assertThrows(InvalidCellOperationException.class,
                () -> sheetService.batchUpdateCells(sheetId, ops));

        List<OperationError> errors = ex.getErrors();
        assertEquals(3, errors.size());
        assertEquals(1, errors.get(0).getIndex());
        assertEquals("row", errors.get(0).getField());
        assertEquals("column", errors.get(1).getField());
        assertEquals("raw_input", errors.get(2).getField());

        // The valid first operation was not applied either
        assertNull(valueAt("A1"));
    }

    @Test
    void testNegativePositionsAreRejected() {
        assertThrows(InvalidCellOperationException.class,
                () -> set(-1, 0, "1"));
        assertThrows(InvalidCellOperationException.class,
                () -> sheetService.addRow(sheetId, -1));
    }

    @Test
    void testAddRowEnablesWrites() {
        Sheet sheet = sheetService.getSheet(sheetId);
        assertEquals("test", sheet.getName());
        assertEquals(10, sheet.getRowCount());
        assertEquals(5, sheet.getColumnCount());

        assertThrows(InvalidCellOperationException.class, () -> set(20, 0, "1"));
        sheetService.addRow(sheetId, 20);
        set(20, 0, "1");
        assertEquals(new BigDecimal("1"), valueAt("A21"));

        sheetService.addColumn(sheetId, 7);
        set(0, 7, "x");
        assertEquals("x", valueAt("H1"));
    }

    /**
     * A failure in the middle of a batch reverts every write of that batch.
     */
    @Test
    void testRevertOnFailure() {
        AtomicBoolean fail = new AtomicBoolean();
        SheetService failing = new SheetService(new RecalculationService(formulaEngine) {
            @Override
            public List<Cell> recalculate(Sheet sheet, Collection<Cell> changedCells) {
                if (fail.get()) {
                    throw new IllegalStateException("boom");
                }
                return super.recalculate(sheet, changedCells);
            }
        });
        long id = failing.createSheet("revert", 5, 5);
        failing.batchUpdateCells(id, Arrays.asList(CellOperation.set(0, 0, "1"), CellOperation.set(0, 1, "=A1+1")));

        fail.set(true);
        assertThrows(IllegalStateException.class, () -> failing.batchUpdateCells(id, Arrays.asList(
                CellOperation.set(0, 0, "100"),
                CellOperation.set(0, 2, "=A1"))));

        Map<String, Object> data = failing.getSheetData(id);
        assertEquals(new BigDecimal("1"), data.get("A1"));
        assertEquals(new BigDecimal("2"), data.get("B1"));
        assertFalse(data.containsKey("C1"));
        assertEquals(Collections.singletonMap("B1", Collections.singletonList("A1")),
                failing.getForwardDependencies(id));
    }

    @Test
    void testReadCellRange() {
        set(0, 0, "1");
        set(1, 1, "2");
        set(2, 2, "3");
        set(3, 3, "4");

        List<Cell> cells = sheetService.readCellRange(sheetId, 0, 2, 0, 2);
        assertEquals(3, cells.size());
        assertEquals("A1", cells.get(0).getAddress());
        assertEquals("B2", cells.get(1).getAddress());
        assertEquals("C3", cells.get(2).getAddress());

        assertThrows(InvalidCellOperationException.class,
                () -> sheetService.readCellRange(sheetId, 2, 0, 0, 2));
    }

    @Test
    void testDependencyMaps() {
        set(0, 2, "=SUM(A1:A2)+B1");

        Map<String, List<String>> forward = sheetService.getForwardDependencies(sheetId);
        assertEquals(Arrays.asList("A1", "B1", "A2"), forward.get("C1"));

        Map<String, List<String>> reverse = sheetService.getReverseDependencies(sheetId);
        assertEquals(Collections.singletonList("C1"), reverse.get("A2"));
        assertEquals(3, reverse.size());
    }

    @Test
    void testUnknownSheet() {
        assertThrows(SheetNotFoundException.class, () -> sheetService.getSheetData(999_999L));
    }

    /**
     * Simple concurrency test: ensures no concurrency errors
     * when two threads write different cells simultaneously.
     */
    @Test
    void testConcurrentCellUpdates() throws InterruptedException {
        set(0, 0, "1");
        set(1, 0, "=A1*10");

        Runnable task1 = () -> {
            for (int i = 0; i < 50; i++) {
                set(0, 0, String.valueOf(i));
            }
        };
        Runnable task2 = () -> {
            for (int i = 0; i < 50; i++) {
                set(0, 1, "foo" + i);
            }
        };

        Thread t1 = new Thread(task1);
        Thread t2 = new Thread(task2);

        t1.start();
        t2.start();
        t1.join();
        t2.join();

        Map<String, Object> data = sheetService.getSheetData(sheetId);
        assertEquals(new BigDecimal("49"), data.get("A1"));
        assertEquals(new BigDecimal("490"), data.get("A2"));
        assertEquals("foo49", data.get("B1"));
    }

    /**
     * Cells handed out by reads and batch results are copies; changing them leaves the sheet alone.
     */
    @Test
    void testReturnedCellsAreCopies() {
        set(0, 0, "5");
        BatchUpdateResult result = set(0, 1, "=A1*2");

        result.getCells().get(0).setComputedNumber(new BigDecimal("-1"));
        Cell read = sheetService.readCellRange(sheetId, 0, 0, 0, 1).get(1);
        assertEquals("B1", read.getAddress());
        read.setComputedNumber(new BigDecimal("999"));
        read.setRawInput("=1");

        assertEquals(new BigDecimal("10"), valueAt("B1"));
        assertEquals("=A1*2", sheetService.readCellRange(sheetId, 0, 0, 1, 1).get(0).getRawInput());
    }

    @Test
    void testDeleteRowsTurnsReadersIntoRefErrors() {
        set(2, 0, "2");
        set(0, 1, "=A3+1");
        set(0, 2, "=SUM(A1:A5)");
        assertEquals(new BigDecimal("3"), valueAt("B1"));

        StructureChangeResult result = sheetService.deleteRows(sheetId, 2, 2);
        assertEquals(2, result.getRowsChanged());
        assertEquals(8, result.getTotalRows());
        assertEquals(2, result.getCells().size());

        Map<String, Object> data = sheetService.getSheetData(sheetId);
        assertEquals("#REF!", data.get("B1"));
        assertEquals(new BigDecimal("0"), data.get("C1"));
        assertFalse(data.containsKey("A3"));

        // deleted rows reject writes and are not revived by formulas pointing at them
        assertThrows(InvalidCellOperationException.class, () -> set(2, 0, "1"));
        set(0, 1, "=A3*2");
        assertEquals("#REF!", valueAt("B1"));
        assertFalse(sheetService.getSheet(sheetId).rowExists(2));

        sheetService.addRow(sheetId, 2);
        assertEquals(new BigDecimal("0"), valueAt("B1"));
    }

    @Test
    void testDeleteColumnsTurnsReadersIntoRefErrors() {
        set(0, 0, "1");
        set(0, 1, "2");
        set(0, 2, "=A1+B1");
        set(1, 2, "=C1*10");

        sheetService.deleteColumns(sheetId, 1, 1);
        Map<String, Object> data = sheetService.getSheetData(sheetId);
        assertEquals("#REF!", data.get("C1"));
        assertEquals("#REF!", data.get("C2"));
        assertEquals(4, sheetService.getSheet(sheetId).getColumnCount());
    }

    @Test
    void testDeleteValidation() {
        assertThrows(InvalidCellOperationException.class, () -> sheetService.deleteRows(sheetId, 0, 0));
        assertThrows(InvalidCellOperationException.class, () -> sheetService.deleteRows(sheetId, 8, 5));
        assertThrows(InvalidCellOperationException.class, () -> sheetService.deleteColumns(sheetId, -1, 1));
        // nothing was deleted by the rejected calls
        assertEquals(10, sheetService.getSheet(sheetId).getRowCount());
    }

    @Test
    void testResizeSheet() {
        StructureChangeResult grown = sheetService.resizeSheet(sheetId, 12, 7);
        assertEquals(2, grown.getRowsChanged());
        assertEquals(2, grown.getColumnsChanged());
        assertEquals(12, grown.getTotalRows());
        assertEquals(7, grown.getTotalColumns());

        StructureChangeResult unchanged = sheetService.resizeSheet(sheetId, 5, 5);
        assertEquals(0, unchanged.getRowsChanged());
        assertEquals(12, unchanged.getTotalRows());
    }

    @Test
    void testResizeDoesNotReuseDeletedRows() {
        sheetService.deleteRows(sheetId, 3, 1);
        StructureChangeResult result = sheetService.resizeSheet(sheetId, 10, 5);

        Sheet sheet = sheetService.getSheet(sheetId);
        assertEquals(1, result.getRowsChanged());
        assertFalse(sheet.rowExists(3));
        assertTrue(sheet.rowExists(10));
        assertEquals(10, sheet.getRowCount());
    }

    @Test
    void testResizeRecalculatesReadersOfNewColumns() {
        sheetService.deleteColumns(sheetId, 4, 1);
        set(0, 0, "=E1+1");
        assertEquals("#REF!", valueAt("A1"));

        StructureChangeResult result = sheetService.resizeSheet(sheetId, 10, 5);
        assertEquals(1, result.getColumnsChanged());
        assertEquals(new BigDecimal("1"), valueAt("A1"));
    }

    @Test
    void testOversizedFormulaIsRejected() {
        FormulaEngineProperties properties = new FormulaEngineProperties();
        properties.setMaxReferencedCells(100);
        SheetService limited = new SheetService(new RecalculationService(new FormulaEngine(properties)));
        long id = limited.createSheet("limited", 20, 10);

        InvalidCellOperationException ex = assertThrows(InvalidCellOperationException.class,
                () -> limited.batchUpdateCells(id, Collections.singletonList(CellOperation.set(0, 0, "=SUM(A2:J21)"))));
        assertEquals("raw_input", ex.getErrors().get(0).getField());

        limited.batchUpdateCells(id, Collections.singletonList(CellOperation.set(0, 0, "=SUM(A2:J11)")));
        assertEquals(new BigDecimal("0"), limited.getSheetData(id).get("A1"));
    }
}
