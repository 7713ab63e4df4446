package com.spreadsheet.engine.exceptions;

import java.util.Collections;
import java.util.List;

/**
 * Thrown when a batch (or a structural call) contains an invalid request,
 * e.g. a negative position or a write to a row that does not exist.
 * Nothing from the rejected batch is applied.
 */
public class InvalidCellOperationException extends RuntimeException {
    private final List<OperationError> errors;

    public InvalidCellOperationException(String message) {
        this(message, Collections.emptyList());
    }

    public InvalidCellOperationException(String message, List<OperationError> errors) {
        super(message);
        this.errors = Collections.unmodifiableList(errors);
    }

    public List<OperationError> getErrors() {
        return errors;
    }
}
