package com.spreadsheet.formula.exceptions;

/**
 * Thrown for malformed cell addresses ("A0", "1A") or coordinates
 * outside the sheet bounds.
 */
public class InvalidAddressException extends FormulaException {
    public InvalidAddressException(String message) {
        super(message);
    }
}
