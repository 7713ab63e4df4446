package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.exceptions.FormulaException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class ValueTest {

    private static Value num(String text) {
        return Value.number(new BigDecimal(text));
    }

    @Test
    void testNumberComparisonIgnoresScale() {
        assertEquals(Value.TRUE, Value.compare(num("2.50"), num("2.5"), "="));
        assertEquals(Value.TRUE, Value.compare(num("1"), num("2"), "<"));
        assertEquals(Value.FALSE, Value.compare(num("1"), num("2"), ">="));
        assertEquals(Value.TRUE, Value.compare(num("3"), num("2"), "<>"));
    }

    @Test
    void testStringsOnlySupportEquality() {
        assertEquals(Value.TRUE, Value.compare(Value.string("abc"), Value.string("abc"), "="));
        assertEquals(Value.TRUE, Value.compare(Value.string("abc"), Value.string("ABC"), "<>"));
        FormulaException ex = assertThrows(FormulaException.class,
                () -> Value.compare(Value.string("abc"), Value.string("a"), ">"));
        assertEquals(ErrorCode.VALUE, ex.getCode());
    }

    @Test
    void testEmptyComparedWithEmpty() {
        assertEquals(Value.TRUE, Value.compare(Value.EMPTY, Value.EMPTY, "="));
        assertEquals(Value.FALSE, Value.compare(Value.EMPTY, Value.EMPTY, "<>"));
        assertThrows(FormulaException.class, () -> Value.compare(Value.EMPTY, Value.EMPTY, "<"));
        assertThrows(FormulaException.class, () -> Value.compare(Value.EMPTY, num("0"), "="));
    }

    @Test
    void testMixedKindsAreValueErrors() {
        FormulaException ex = assertThrows(FormulaException.class,
                () -> Value.compare(num("1"), Value.string("1"), "="));
        assertEquals(ErrorCode.VALUE, ex.getCode());
        assertThrows(FormulaException.class, () -> Value.compare(Value.TRUE, num("1"), "="));
    }

    @Test
    void testErrorOperandPropagates() {
        FormulaException ex = assertThrows(FormulaException.class,
                () -> Value.compare(Value.error(ErrorCode.NOT_AVAILABLE), num("1"), "="));
        assertEquals(ErrorCode.NOT_AVAILABLE, ex.getCode());
    }

    @Test
    void testTruthiness() {
        assertTrue(num("-0.5").isTruthy());
        assertFalse(num("0.000").isTruthy());
        assertTrue(Value.string("x").isTruthy());
        assertFalse(Value.string("").isTruthy());
        assertFalse(Value.EMPTY.isTruthy());
        assertTrue(Value.TRUE.isTruthy());
        FormulaException ex = assertThrows(FormulaException.class,
                () -> Value.error(ErrorCode.DIV_ZERO).isTruthy());
        assertEquals(ErrorCode.DIV_ZERO, ex.getCode());
    }

    @Test
    void testNumberCoercion() {
        assertEquals(BigDecimal.ONE, Value.TRUE.toNumber());
        assertEquals(BigDecimal.ZERO, Value.EMPTY.toNumber());
        FormulaException ex = assertThrows(FormulaException.class, () -> Value.string("3").toNumber());
        assertEquals(ErrorCode.VALUE, ex.getCode());
    }

    @Test
    void testKindAwareMatching() {
        assertTrue(num("2").matches(num("2.0")));
        assertFalse(num("2").matches(Value.string("2")));
        assertTrue(Value.EMPTY.matches(Value.EMPTY));
        assertFalse(Value.error(ErrorCode.REF).matches(Value.error(ErrorCode.REF)));
    }
}
