package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.exceptions.FormulaException;
import com.spreadsheet.engine.models.CellPosition;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * A1-style address arithmetic: label/index conversion, range expansion and
 * reference extraction from formula text. Malformed addresses fail with #REF!.
 */
public final class CellReferences {

    // Keeps base-26 accumulation inside int range
    private static final int MAX_COLUMN_LABEL_LENGTH = 6;

    private CellReferences() {
    }

    /**
     * Decodes "B12" into zero-based (row 11, column 1).
     */
    public static CellPosition referenceToIndexes(String ref) {
        if (ref == null || ref.isEmpty()) {
            throw new FormulaException(ErrorCode.REF, "empty reference");
        }
        int split = 0;
        while (split < ref.length() && Character.isLetter(ref.charAt(split))) {
            split++;
        }
        String label = ref.substring(0, split);
        String digits = ref.substring(split);
        if (label.isEmpty() || digits.isEmpty()) {
            throw new FormulaException(ErrorCode.REF, "malformed reference " + ref);
        }
        for (int i = 0; i < digits.length(); i++) {
            char c = digits.charAt(i);
            if (c < '0' || c > '9') {
                throw new FormulaException(ErrorCode.REF, "malformed reference " + ref);
            }
        }

        int rowNumber;
        try {
            rowNumber = Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new FormulaException(ErrorCode.REF, "row out of range in " + ref);
        }
        int row = rowNumber - 1;
        int column = columnLabelToIndex(label);
        if (row < 0 || column < 0) {
            throw new FormulaException(ErrorCode.REF, "reference before A1: " + ref);
        }
        return CellPosition.of(row, column);
    }

    public static boolean isValidReference(String ref) {
        try {
            referenceToIndexes(ref);
            return true;
        } catch (FormulaException e) {
            return false;
        }
    }

    /**
     * "A" -> 0, "Z" -> 25, "AA" -> 26.
     */
    public static int columnLabelToIndex(String label) {
        if (label.isEmpty() || label.length() > MAX_COLUMN_LABEL_LENGTH) {
            throw new FormulaException(ErrorCode.REF, "bad column label " + label);
        }
        int result = 0;
        for (char c : label.toUpperCase(Locale.ROOT).toCharArray()) {
            if (c < 'A' || c > 'Z') {
                throw new FormulaException(ErrorCode.REF, "bad column label " + label);
            }
            result = result * 26 + (c - 'A' + 1);
        }
        return result - 1;
    }

    /**
     * 0 -> "A", 25 -> "Z", 26 -> "AA".
     */
    public static String columnIndexToLabel(int index) {
        if (index < 0) {
            throw new FormulaException(ErrorCode.REF, "negative column " + index);
        }
        StringBuilder label = new StringBuilder();
        int remaining = index;
        while (remaining >= 0) {
            label.insert(0, (char) ('A' + remaining % 26));
            remaining = remaining / 26 - 1;
        }
        return label.toString();
    }

    public static String toAddress(int row, int column) {
        return columnIndexToLabel(column) + (row + 1);
    }

    /**
     * Normalized rectangle spanned by two corner references, in either order.
     */
    public static CellRange range(String startRef, String endRef) {
        CellPosition start = referenceToIndexes(startRef);
        CellPosition end = referenceToIndexes(endRef);
        return new CellRange(
                Math.min(start.getRow(), end.getRow()),
                Math.min(start.getColumn(), end.getColumn()),
                Math.max(start.getRow(), end.getRow()),
                Math.max(start.getColumn(), end.getColumn()));
    }

    /**
     * Every address inside start:end in row-major order.
     */
    public static List<String> expandRange(String startRef, String endRef) {
        CellRange range = range(startRef, endRef);
        List<String> refs = new ArrayList<>();
        for (int row = range.getRowStart(); row <= range.getRowEnd(); row++) {
            for (int column = range.getColumnStart(); column <= range.getColumnEnd(); column++) {
                refs.add(toAddress(row, column));
            }
        }
        return refs;
    }

    /**
     * All references mentioned by a formula, ranges expanded row-major, in textual order.
     * Addresses are upper-cased; corners that cannot be expanded are kept as single
     * addresses. Text that does not tokenize yields an empty list.
     */
    public static List<String> extractReferences(String rawInput) {
        String expression = rawInput.startsWith("=") ? rawInput.substring(1) : rawInput;
        List<Token> tokens;
        try {
            tokens = Tokenizer.tokenize(expression);
        } catch (FormulaException e) {
            return new ArrayList<>();
        }

        List<String> references = new ArrayList<>();
        int index = 0;
        while (index < tokens.size()) {
            Token token = tokens.get(index);
            if (token.is(TokenType.REF)) {
                if (index + 2 < tokens.size()
                        && tokens.get(index + 1).is(TokenType.COLON)
                        && tokens.get(index + 2).is(TokenType.REF)) {
                    String endText = tokens.get(index + 2).getText();
                    if (isValidReference(token.getText()) && isValidReference(endText)) {
                        references.addAll(expandRange(token.getText(), endText));
                    } else {
                        // corners such as A0 cannot be expanded; report them as written
                        references.add(token.getText().toUpperCase(Locale.ROOT));
                        references.add(endText.toUpperCase(Locale.ROOT));
                    }
                    index += 3;
                    continue;
                }
                references.add(token.getText().toUpperCase(Locale.ROOT));
            }
            index++;
        }
        return references;
    }

    /**
     * Size of the list {@link #extractReferences(String)} would build, without building it.
     */
    public static long countReferences(String rawInput) {
        String expression = rawInput.startsWith("=") ? rawInput.substring(1) : rawInput;
        List<Token> tokens;
        try {
            tokens = Tokenizer.tokenize(expression);
        } catch (FormulaException e) {
            return 0;
        }

        long count = 0;
        int index = 0;
        while (index < tokens.size()) {
            Token token = tokens.get(index);
            if (token.is(TokenType.REF)) {
                if (index + 2 < tokens.size()
                        && tokens.get(index + 1).is(TokenType.COLON)
                        && tokens.get(index + 2).is(TokenType.REF)) {
                    String endText = tokens.get(index + 2).getText();
                    if (isValidReference(token.getText()) && isValidReference(endText)) {
                        count += range(token.getText(), endText).size();
                    } else {
                        count += 2;
                    }
                    index += 3;
                    continue;
                }
                count++;
            }
            index++;
        }
        return count;
    }
}
