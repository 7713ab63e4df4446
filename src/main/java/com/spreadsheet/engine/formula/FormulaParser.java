package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.exceptions.FormulaException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser producing an {@link Expr} tree.
 *
 * <pre>
 * formula        := comparison EOF
 * comparison     := additive [COMPARE additive]
 * additive       := multiplicative (("+" | "-") multiplicative)*
 * multiplicative := unary (("*" | "/") unary)*
 * unary          := ("+" | "-") unary | primary
 * primary        := NUMBER | STRING | TRUE | FALSE | REF
 *                 | "(" comparison ")" | IDENT "(" [argument ("," argument)*] ")"
 * argument       := REF ":" REF | comparison
 * </pre>
 *
 * Syntax problems fail with #REF!, malformed argument lists with #VALUE!.
 * Nesting deeper than the configured limit fails with #REF!.
 */
public final class FormulaParser {

    private final List<Token> tokens;
    private final int maxDepth;
    private int index;
    private int depth;

    private FormulaParser(List<Token> tokens, int maxDepth) {
        this.tokens = tokens;
        this.maxDepth = maxDepth;
    }

    /**
     * Parses an expression (without the leading "=") into a tree.
     */
    public static Expr parse(String expression, int maxDepth) {
        FormulaParser parser = new FormulaParser(Tokenizer.tokenize(expression), maxDepth);
        Expr expr = parser.parseComparison();
        if (parser.current() != null) {
            throw new FormulaException(ErrorCode.REF, "unexpected " + parser.current());
        }
        return expr;
    }

    private Token current() {
        return index < tokens.size() ? tokens.get(index) : null;
    }

    private Token peek(int offset) {
        int at = index + offset;
        return at < tokens.size() ? tokens.get(at) : null;
    }

    private Token consume(TokenType expected, ErrorCode onMismatch) {
        Token token = current();
        if (token == null || !token.is(expected)) {
            throw new FormulaException(onMismatch, "expected " + expected + " but found " + token);
        }
        index++;
        return token;
    }

    private void enter() {
        if (++depth > maxDepth) {
            throw new FormulaException(ErrorCode.REF, "nesting deeper than " + maxDepth);
        }
    }

    private void leave() {
        depth--;
    }

    private Expr parseComparison() {
        enter();
        try {
            Expr left = parseAdditive();
            Token token = current();
            if (token != null && token.is(TokenType.COMPARE)) {
                index++;
                Expr right = parseAdditive();
                return new Expr.Comparison(token.getText(), left, right);
            }
            return left;
        } finally {
            leave();
        }
    }

    private Expr parseAdditive() {
        Expr value = parseMultiplicative();
        while (true) {
            Token token = current();
            if (token == null || !(token.is(TokenType.OP, "+") || token.is(TokenType.OP, "-"))) {
                return value;
            }
            index++;
            value = new Expr.Binary(token.getText().charAt(0), value, parseMultiplicative());
        }
    }

    private Expr parseMultiplicative() {
        Expr value = parseUnary();
        while (true) {
            Token token = current();
            if (token == null || !(token.is(TokenType.OP, "*") || token.is(TokenType.OP, "/"))) {
                return value;
            }
            index++;
            value = new Expr.Binary(token.getText().charAt(0), value, parseUnary());
        }
    }

    private Expr parseUnary() {
        Token token = current();
        if (token != null && (token.is(TokenType.OP, "+") || token.is(TokenType.OP, "-"))) {
            index++;
            enter();
            try {
                return new Expr.Unary(token.getText().charAt(0), parseUnary());
            } finally {
                leave();
            }
        }
        return parsePrimary();
    }

    private Expr parsePrimary() {
        Token token = current();
        if (token == null) {
            throw new FormulaException(ErrorCode.REF, "unexpected end of formula");
        }

        switch (token.getType()) {
            case NUMBER:
                index++;
                try {
                    return new Expr.NumberLiteral(new BigDecimal(token.getText()));
                } catch (NumberFormatException e) {
                    throw new FormulaException(ErrorCode.REF, "bad number " + token.getText());
                }
            case STRING:
                index++;
                return new Expr.StringLiteral(token.getText());
            case REF:
                index++;
                return new Expr.Reference(CellReferences.referenceToIndexes(token.getText()));
            case LPAREN:
                index++;
                Expr inner = parseComparison();
                consume(TokenType.RPAREN, ErrorCode.REF);
                return inner;
            case IDENT:
                return parseIdentifier(token);
            default:
                throw new FormulaException(ErrorCode.REF, "unexpected " + token);
        }
    }

    private Expr parseIdentifier(Token token) {
        Token next = peek(1);
        boolean isCall = next != null && next.is(TokenType.LPAREN);
        if (!isCall) {
            if ("TRUE".equalsIgnoreCase(token.getText())) {
                index++;
                return new Expr.BooleanLiteral(true);
            }
            if ("FALSE".equalsIgnoreCase(token.getText())) {
                index++;
                return new Expr.BooleanLiteral(false);
            }
            throw new FormulaException(ErrorCode.REF, "unknown name " + token.getText());
        }

        FormulaFunction function = FormulaFunction.lookup(token.getText());
        if (function == null) {
            throw new FormulaException(ErrorCode.REF, "unknown function " + token.getText());
        }
        index += 2;
        enter();
        try {
            List<Expr> args = parseArguments();
            validateArguments(function, args);
            return new Expr.Call(function, args);
        } finally {
            leave();
        }
    }

    private List<Expr> parseArguments() {
        List<Expr> args = new ArrayList<>();
        Token token = current();
        if (token != null && token.is(TokenType.RPAREN)) {
            index++;
            return args;
        }
        while (true) {
            args.add(parseArgument());
            token = current();
            if (token == null) {
                throw new FormulaException(ErrorCode.VALUE, "unterminated argument list");
            }
            if (token.is(TokenType.COMMA)) {
                index++;
                Token following = current();
                if (following == null || following.is(TokenType.RPAREN)) {
                    throw new FormulaException(ErrorCode.VALUE, "missing argument");
                }
                continue;
            }
            if (token.is(TokenType.RPAREN)) {
                index++;
                return args;
            }
            throw new FormulaException(ErrorCode.VALUE, "unexpected " + token + " in argument list");
        }
    }

    private Expr parseArgument() {
        Token token = current();
        Token next = peek(1);
        if (token != null && token.is(TokenType.REF) && next != null && next.is(TokenType.COLON)) {
            index += 2;
            Token end = consume(TokenType.REF, ErrorCode.VALUE);
            return new Expr.Range(CellReferences.range(token.getText(), end.getText()));
        }
        return parseComparison();
    }

    private static void validateArguments(FormulaFunction function, List<Expr> args) {
        if (args.size() < function.getMinArgs() || args.size() > function.getMaxArgs()) {
            throw new FormulaException(ErrorCode.VALUE,
                    function + " takes " + function.getMinArgs() + ".." + function.getMaxArgs()
                            + " arguments, got " + args.size());
        }
        for (int i = 0; i < args.size(); i++) {
            boolean isRange = args.get(i).kind() == Expr.Kind.RANGE;
            if (isRange && !function.acceptsRange(i)) {
                throw new FormulaException(ErrorCode.VALUE, function + " does not accept a range at argument " + (i + 1));
            }
            if (!isRange && function.requiresRange(i)) {
                throw new FormulaException(ErrorCode.VALUE, function + " needs a range at argument " + (i + 1));
            }
        }
    }
}
