package com.spreadsheet.engine.formula;

import java.util.Locale;

/**
 * Built-in functions with their accepted argument counts and range placement.
 */
public enum FormulaFunction {
    SUM(1, Integer.MAX_VALUE),
    AVERAGE(1, Integer.MAX_VALUE),
    COUNT(1, Integer.MAX_VALUE),
    MIN(1, Integer.MAX_VALUE),
    MAX(1, Integer.MAX_VALUE),
    ABS(1, 1),
    ROUND(1, 2),
    FLOOR(1, 2),
    CEILING(1, 2),
    IF(2, 3),
    AND(1, Integer.MAX_VALUE),
    OR(1, Integer.MAX_VALUE),
    NOT(1, 1),
    VLOOKUP(3, 4);

    private final int minArgs;
    private final int maxArgs;

    FormulaFunction(int minArgs, int maxArgs) {
        this.minArgs = minArgs;
        this.maxArgs = maxArgs;
    }

    public int getMinArgs() {
        return minArgs;
    }

    public int getMaxArgs() {
        return maxArgs;
    }

    public boolean isAggregate() {
        return this == SUM || this == AVERAGE || this == COUNT || this == MIN || this == MAX;
    }

    /**
     * Whether a start:end range may appear as argument number {@code index} (zero-based).
     */
    public boolean acceptsRange(int index) {
        return isAggregate() || (this == VLOOKUP && index == 1);
    }

    public boolean requiresRange(int index) {
        return this == VLOOKUP && index == 1;
    }

    /**
     * Case-insensitive lookup; null when the name is not a known function.
     */
    public static FormulaFunction lookup(String name) {
        try {
            return FormulaFunction.valueOf(name.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
