package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.exceptions.FormulaException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TokenizerTest {

    @Test
    void testArithmeticAndReferences() {
        List<Token> tokens = Tokenizer.tokenize("A1 + 2.5*AB12");
        assertEquals(Arrays.asList(
                new Token(TokenType.REF, "A1"),
                new Token(TokenType.OP, "+"),
                new Token(TokenType.NUMBER, "2.5"),
                new Token(TokenType.OP, "*"),
                new Token(TokenType.REF, "AB12")
        ), tokens);
    }

    @Test
    void testFunctionCallWithRange() {
        List<Token> tokens = Tokenizer.tokenize("sum(A1:B2, C3)");
        assertEquals(Arrays.asList(
                new Token(TokenType.IDENT, "sum"),
                new Token(TokenType.LPAREN, "("),
                new Token(TokenType.REF, "A1"),
                new Token(TokenType.COLON, ":"),
                new Token(TokenType.REF, "B2"),
                new Token(TokenType.COMMA, ","),
                new Token(TokenType.REF, "C3"),
                new Token(TokenType.RPAREN, ")")
        ), tokens);
    }

    @Test
    void testComparisonOperators() {
        List<Token> tokens = Tokenizer.tokenize("1<>2<=3>=4<5>6=7");
        long compares = tokens.stream().filter(t -> t.is(TokenType.COMPARE)).count();
        assertEquals(6, compares);
        assertEquals(new Token(TokenType.COMPARE, "<>"), tokens.get(1));
        assertEquals(new Token(TokenType.COMPARE, "<="), tokens.get(3));
        assertEquals(new Token(TokenType.COMPARE, ">="), tokens.get(5));
        assertEquals(new Token(TokenType.COMPARE, "<"), tokens.get(7));
        assertEquals(new Token(TokenType.COMPARE, ">"), tokens.get(9));
        assertEquals(new Token(TokenType.COMPARE, "="), tokens.get(11));
    }

    @Test
    void testStringLiteralKeepsInnerText() {
        List<Token> tokens = Tokenizer.tokenize("\"hello world\" = \"\"");
        assertEquals(new Token(TokenType.STRING, "hello world"), tokens.get(0));
        assertEquals(new Token(TokenType.STRING, ""), tokens.get(2));
    }

    @Test
    void testUnterminatedStringIsRefError() {
        FormulaException ex = assertThrows(FormulaException.class, () -> Tokenizer.tokenize("\"abc"));
        assertEquals(ErrorCode.REF, ex.getCode());
    }

    @Test
    void testUnknownCharacterIsRefError() {
        FormulaException ex = assertThrows(FormulaException.class, () -> Tokenizer.tokenize("1 # 2"));
        assertEquals(ErrorCode.REF, ex.getCode());
    }

    @Test
    void testLettersWithoutDigitsAreIdentifiers() {
        List<Token> tokens = Tokenizer.tokenize("TRUE");
        assertEquals(1, tokens.size());
        assertTrue(tokens.get(0).is(TokenType.IDENT, "TRUE"));
    }
}
