package com.spreadsheet.engine.services;

import com.spreadsheet.engine.models.Cell;
import com.spreadsheet.engine.models.CellValueType;
import com.spreadsheet.engine.models.ComputedType;

import java.math.BigDecimal;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies raw user input and fills a cell's typed and computed fields.
 * Formulas are only classified here; their computed fields are produced by
 * recalculation.
 */
public final class CellInputParser {

    // Optional currency symbol, then a plain decimal: "$12.50", "-3", ".5"
    private static final Pattern NUMERIC_PATTERN =
            Pattern.compile("^([$¥€£])?([+-]?(\\d+(\\.\\d*)?|\\.\\d+))$");

    private CellInputParser() {
    }

    public static void apply(Cell cell, String rawInput) {
        String raw = rawInput == null ? "" : rawInput;
        String trimmed = raw.trim();

        cell.wipe();
        cell.setRawInput(raw);

        if (trimmed.isEmpty()) {
            return;
        }

        if (raw.startsWith("=")) {
            cell.setValueType(CellValueType.FORMULA);
            return;
        }

        // Leading apostrophe forces literal text, e.g. "'=not a formula"
        if (raw.startsWith("'")) {
            setString(cell, raw.substring(1));
            return;
        }

        Matcher matcher = NUMERIC_PATTERN.matcher(trimmed);
        if (matcher.matches()) {
            BigDecimal number = new BigDecimal(matcher.group(2));
            cell.setValueType(CellValueType.NUMBER);
            cell.setNumberValue(number);
            cell.setComputedType(ComputedType.NUMBER);
            cell.setComputedNumber(number);
            return;
        }

        if ("TRUE".equalsIgnoreCase(trimmed) || "FALSE".equalsIgnoreCase(trimmed)) {
            boolean value = "TRUE".equalsIgnoreCase(trimmed);
            cell.setValueType(CellValueType.BOOLEAN);
            cell.setBooleanValue(value);
            cell.setComputedType(ComputedType.BOOLEAN);
            cell.setComputedString(value ? "TRUE" : "FALSE");
            return;
        }

        setString(cell, raw);
    }

    private static void setString(Cell cell, String text) {
        cell.setValueType(CellValueType.STRING);
        cell.setStringValue(text);
        cell.setComputedType(ComputedType.STRING);
        cell.setComputedString(text);
    }
}
