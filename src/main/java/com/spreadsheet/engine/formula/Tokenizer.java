package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.exceptions.FormulaException;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits formula text (leading "=" already removed) into a flat token list.
 * Any character outside the formula alphabet fails with #REF!.
 */
public final class Tokenizer {

    private Tokenizer() {
    }

    public static List<Token> tokenize(String expression) {
        List<Token> tokens = new ArrayList<>();
        int index = 0;
        int length = expression.length();

        while (index < length) {
            char c = expression.charAt(index);

            if (Character.isWhitespace(c)) {
                index++;
                continue;
            }

            switch (c) {
                case '+':
                case '-':
                case '*':
                case '/':
                    tokens.add(new Token(TokenType.OP, String.valueOf(c)));
                    index++;
                    continue;
                case '(':
                    tokens.add(new Token(TokenType.LPAREN, "("));
                    index++;
                    continue;
                case ')':
                    tokens.add(new Token(TokenType.RPAREN, ")"));
                    index++;
                    continue;
                case ',':
                    tokens.add(new Token(TokenType.COMMA, ","));
                    index++;
                    continue;
                case ':':
                    tokens.add(new Token(TokenType.COLON, ":"));
                    index++;
                    continue;
                case '=':
                    tokens.add(new Token(TokenType.COMPARE, "="));
                    index++;
                    continue;
                case '<':
                    if (index + 1 < length && (expression.charAt(index + 1) == '>' || expression.charAt(index + 1) == '=')) {
                        tokens.add(new Token(TokenType.COMPARE, expression.substring(index, index + 2)));
                        index += 2;
                    } else {
                        tokens.add(new Token(TokenType.COMPARE, "<"));
                        index++;
                    }
                    continue;
                case '>':
                    if (index + 1 < length && expression.charAt(index + 1) == '=') {
                        tokens.add(new Token(TokenType.COMPARE, ">="));
                        index += 2;
                    } else {
                        tokens.add(new Token(TokenType.COMPARE, ">"));
                        index++;
                    }
                    continue;
                case '"':
                    int close = expression.indexOf('"', index + 1);
                    if (close < 0) {
                        throw new FormulaException(ErrorCode.REF, "unterminated string");
                    }
                    tokens.add(new Token(TokenType.STRING, expression.substring(index + 1, close)));
                    index = close + 1;
                    continue;
                default:
                    break;
            }

            if (isDigit(c) || c == '.') {
                int start = index++;
                while (index < length && (isDigit(expression.charAt(index)) || expression.charAt(index) == '.')) {
                    index++;
                }
                tokens.add(new Token(TokenType.NUMBER, expression.substring(start, index)));
                continue;
            }

            if (isLetter(c)) {
                int start = index++;
                while (index < length && isLetter(expression.charAt(index))) {
                    index++;
                }
                if (index >= length || !isDigit(expression.charAt(index))) {
                    tokens.add(new Token(TokenType.IDENT, expression.substring(start, index)));
                    continue;
                }
                while (index < length && isDigit(expression.charAt(index))) {
                    index++;
                }
                tokens.add(new Token(TokenType.REF, expression.substring(start, index)));
                continue;
            }

            throw new FormulaException(ErrorCode.REF, "unexpected character '" + c + "'");
        }
        return tokens;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    // Column labels are ASCII only
    private static boolean isLetter(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
    }
}
