package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.exceptions.FormulaException;
import com.spreadsheet.engine.models.CellPosition;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

class CellReferencesTest {

    @Test
    void testReferenceToIndexes() {
        assertEquals(CellPosition.of(0, 0), CellReferences.referenceToIndexes("A1"));
        assertEquals(CellPosition.of(11, 1), CellReferences.referenceToIndexes("B12"));
        assertEquals(CellPosition.of(9, 27), CellReferences.referenceToIndexes("ab10"));
    }

    @Test
    void testMalformedReferences() {
        for (String bad : Arrays.asList("A0", "1A", "A", "12", "", "A1B")) {
            FormulaException ex = assertThrows(FormulaException.class,
                    () -> CellReferences.referenceToIndexes(bad), bad);
            assertEquals(ErrorCode.REF, ex.getCode());
        }
    }

    @Test
    void testColumnLabels() {
        assertEquals("A", CellReferences.columnIndexToLabel(0));
        assertEquals("Z", CellReferences.columnIndexToLabel(25));
        assertEquals("AA", CellReferences.columnIndexToLabel(26));
        assertEquals("ZZ", CellReferences.columnIndexToLabel(701));
        assertEquals(701, CellReferences.columnLabelToIndex("ZZ"));
        assertEquals("C7", CellPosition.of(6, 2).toAddress());
    }

    @Test
    void testExtractReferencesExpandsRangesInOrder() {
        assertEquals(Arrays.asList("A1", "A2", "B1"),
                CellReferences.extractReferences("=SUM(A1:A2)+B1"));
    }

    @Test
    void testExtractReferencesRowMajor() {
        assertEquals(Arrays.asList("A1", "B1", "A2", "B2"),
                CellReferences.extractReferences("=SUM(B2:A1)"));
    }

    @Test
    void testExtractReferencesNormalizesCase() {
        assertEquals(Arrays.asList("C3", "D4"),
                CellReferences.extractReferences("=c3*d4"));
    }

    @Test
    void testExtractReferencesFromUntokenizableText() {
        assertEquals(Collections.emptyList(), CellReferences.extractReferences("=A1 # B2"));
    }

    @Test
    void testRangeIsNormalized() {
        CellRange range = CellReferences.range("C5", "A2");
        assertEquals(1, range.getRowStart());
        assertEquals(0, range.getColumnStart());
        assertEquals(4, range.getRowEnd());
        assertEquals(2, range.getColumnEnd());
        assertEquals(3, range.getWidth());
        assertEquals(12, range.size());
        assertEquals("A2:C5", range.toString());
    }

    @Test
    void testCountReferencesWithoutExpanding() {
        assertEquals(3, CellReferences.countReferences("=SUM(A1:A2)+B1"));
        assertEquals(702L * 2_000_000L + 1, CellReferences.countReferences("=COUNT(A1:ZZ2000000)+b1"));
        assertEquals(0, CellReferences.countReferences("=1+2"));
        assertEquals(0, CellReferences.countReferences("=A1 # B2"));
    }
}
