package com.spreadsheet.formula.exceptions;

/**
 * Base class for every failure raised while lexing, parsing or evaluating a formula.
 * The recalculation pass catches these at a single cell's boundary, except for
 * CircularReferenceException which aborts the whole pass.
 */
public class FormulaException extends RuntimeException {
    public FormulaException(String message) {
        super(message);
    }

    public FormulaException(String message, Throwable cause) {
        super(message, cause);
    }
}
