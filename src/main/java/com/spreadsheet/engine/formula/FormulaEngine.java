package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.config.FormulaEngineProperties;
import com.spreadsheet.engine.exceptions.FormulaException;
import com.spreadsheet.engine.models.CellPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

/**
 * Entry points used by the recalculation service and the sheet orchestrator.
 * Holds configuration only; every call works off the store it is handed.
 */
@Component
public class FormulaEngine {

    private static final Logger log = LoggerFactory.getLogger(FormulaEngine.class);

    private final FormulaEngineProperties properties;

    public FormulaEngine(FormulaEngineProperties properties) {
        this.properties = properties;
    }

    /**
     * Evaluates "=expression" against the sheet. Never throws: every failure is
     * reported through the result's error code.
     */
    public FormulaResult evaluateFormula(String rawInput, CellStore sheet) {
        String expression = rawInput.startsWith("=") ? rawInput.substring(1) : rawInput;
        if (expression.trim().isEmpty()) {
            return FormulaResult.error(ErrorCode.REF);
        }

        try {
            Expr expr = FormulaParser.parse(expression, properties.getMaxNestingDepth());
            FormulaEvaluator evaluator = new FormulaEvaluator(sheet, properties.getDecimalScale());
            Value value = evaluator.evaluate(expr);
            switch (value.getKind()) {
                case NUMBER:
                    BigDecimal number = evaluator.quantize(value.getNumber());
                    String symbol = CurrencyDetector.detect(expr, sheet);
                    return FormulaResult.number(number, symbol == null ? null : CurrencyDetector.format(number, symbol));
                case STRING:
                    return FormulaResult.string(value.getText());
                case BOOLEAN:
                    return FormulaResult.bool(value.getBoolean());
                case ERROR:
                    return FormulaResult.error(value.getError());
                case EMPTY:
                default:
                    return FormulaResult.empty();
            }
        } catch (FormulaException e) {
            log.debug("Formula {} evaluated to {}", rawInput, e.getMessage());
            return FormulaResult.error(e.getCode());
        } catch (RuntimeException e) {
            log.warn("Unexpected failure evaluating {}", rawInput, e);
            return FormulaResult.error(ErrorCode.VALUE);
        }
    }

    /**
     * Addresses read by a formula, ranges expanded row-major. Addresses are returned
     * upper-cased ("=a1+b2" gives A1, B2) so they match the sheet's address keys.
     */
    public List<String> extractReferences(String rawInput) {
        return CellReferences.extractReferences(rawInput);
    }

    public long countReferences(String rawInput) {
        return CellReferences.countReferences(rawInput);
    }

    public CellPosition referenceToIndexes(String ref) {
        return CellReferences.referenceToIndexes(ref);
    }

    public FormulaEngineProperties getProperties() {
        return properties;
    }
}
