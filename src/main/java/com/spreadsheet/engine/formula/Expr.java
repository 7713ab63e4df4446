package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.models.CellPosition;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;

/**
 * Parsed formula tree. A tree that exists has already passed every structural
 * check, so evaluation can skip whole subtrees without consuming tokens.
 */
public abstract class Expr {

    public enum Kind {
        NUMBER,
        STRING,
        BOOLEAN,
        REFERENCE,
        RANGE,
        UNARY,
        BINARY,
        COMPARISON,
        CALL
    }

    public abstract Kind kind();

    // --- Concrete nodes ---

    public static final class NumberLiteral extends Expr {
        private final BigDecimal value;

        public NumberLiteral(BigDecimal value) {
            this.value = value;
        }

        public BigDecimal value() { return value; }

        @Override public Kind kind() { return Kind.NUMBER; }
    }

    public static final class StringLiteral extends Expr {
        private final String value;

        public StringLiteral(String value) {
            this.value = value;
        }

        public String value() { return value; }

        @Override public Kind kind() { return Kind.STRING; }
    }

    public static final class BooleanLiteral extends Expr {
        private final boolean value;

        public BooleanLiteral(boolean value) {
            this.value = value;
        }

        public boolean value() { return value; }

        @Override public Kind kind() { return Kind.BOOLEAN; }
    }

    public static final class Reference extends Expr {
        private final CellPosition position;

        public Reference(CellPosition position) {
            this.position = position;
        }

        public CellPosition position() { return position; }

        @Override public Kind kind() { return Kind.REFERENCE; }
    }

    /**
     * start:end; only ever a direct argument of a function that accepts ranges.
     */
    public static final class Range extends Expr {
        private final CellRange range;

        public Range(CellRange range) {
            this.range = range;
        }

        public CellRange range() { return range; }

        @Override public Kind kind() { return Kind.RANGE; }
    }

    public static final class Unary extends Expr {
        private final char operator;
        private final Expr operand;

        public Unary(char operator, Expr operand) {
            this.operator = operator;
            this.operand = operand;
        }

        public char operator() { return operator; }
        public Expr operand() { return operand; }

        @Override public Kind kind() { return Kind.UNARY; }
    }

    public static final class Binary extends Expr {
        private final char operator;
        private final Expr left;
        private final Expr right;

        public Binary(char operator, Expr left, Expr right) {
            this.operator = operator;
            this.left = left;
            this.right = right;
        }

        public char operator() { return operator; }
        public Expr left() { return left; }
        public Expr right() { return right; }

        @Override public Kind kind() { return Kind.BINARY; }
    }

    public static final class Comparison extends Expr {
        private final String operator;
        private final Expr left;
        private final Expr right;

        public Comparison(String operator, Expr left, Expr right) {
            this.operator = operator;
            this.left = left;
            this.right = right;
        }

        public String operator() { return operator; }
        public Expr left() { return left; }
        public Expr right() { return right; }

        @Override public Kind kind() { return Kind.COMPARISON; }
    }

    public static final class Call extends Expr {
        private final FormulaFunction function;
        private final List<Expr> args;

        public Call(FormulaFunction function, List<Expr> args) {
            this.function = function;
            this.args = Collections.unmodifiableList(args);
        }

        public FormulaFunction function() { return function; }
        public List<Expr> args() { return args; }

        @Override public Kind kind() { return Kind.CALL; }
    }
}
