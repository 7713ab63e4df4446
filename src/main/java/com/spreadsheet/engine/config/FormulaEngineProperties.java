package com.spreadsheet.engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunables for formula evaluation, bound from "formula.engine.*".
 */
@ConfigurationProperties(prefix = "formula.engine")
public class FormulaEngineProperties {

    // Fixed number of fractional digits every numeric result is quantized to
    private int decimalScale = 10;

    // Deepest allowed nesting of parentheses / function calls / unary operators
    private int maxNestingDepth = 64;

    // Upper bound on addresses one formula may register as dependencies, ranges expanded
    private long maxReferencedCells = 1_000_000L;

    public int getDecimalScale() {
        return decimalScale;
    }

    public void setDecimalScale(int decimalScale) {
        if (decimalScale < 0) {
            throw new IllegalArgumentException("decimalScale must be non-negative, got " + decimalScale);
        }
        this.decimalScale = decimalScale;
    }

    public int getMaxNestingDepth() {
        return maxNestingDepth;
    }

    public void setMaxNestingDepth(int maxNestingDepth) {
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got " + maxNestingDepth);
        }
        this.maxNestingDepth = maxNestingDepth;
    }

    public long getMaxReferencedCells() {
        return maxReferencedCells;
    }

    public void setMaxReferencedCells(long maxReferencedCells) {
        if (maxReferencedCells < 1) {
            throw new IllegalArgumentException("maxReferencedCells must be positive, got " + maxReferencedCells);
        }
        this.maxReferencedCells = maxReferencedCells;
    }
}
