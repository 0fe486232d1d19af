package com.spreadsheet.formula.exceptions;

/**
 * Thrown when an operator or function receives operands it cannot work with,
 * such as non-numeric text in arithmetic or the wrong number of arguments.
 */
public class EvaluationException extends FormulaException {
    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
