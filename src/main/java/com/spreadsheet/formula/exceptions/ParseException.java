package com.spreadsheet.formula.exceptions;

/**
 * Thrown when a token sequence does not match the formula grammar.
 * Carries the construct the parser expected at the point of failure.
 */
public class ParseException extends FormulaException {
    private final String expected;

    public ParseException(String message, String expected) {
        super(message);
        this.expected = expected;
    }

    public String getExpected() {
        return expected;
    }
}
