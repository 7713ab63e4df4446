package com.spreadsheet.engine.formula;

import java.util.Objects;

/**
 * One lexical unit of a formula. STRING tokens carry their text without quotes.
 */
public final class Token {
    private final TokenType type;
    private final String text;

    public Token(TokenType type, String text) {
        this.type = type;
        this.text = text;
    }

    public TokenType getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    public boolean is(TokenType expected, String expectedText) {
        return type == expected && text.equals(expectedText);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token)) return false;
        Token token = (Token) o;
        return type == token.type && text.equals(token.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, text);
    }

    @Override
    public String toString() {
        return type + "(" + text + ")";
    }
}
