package com.spreadsheet.formula.exceptions;

/**
 * Thrown when the dependency graph of a sheet contains a cycle
 * (e.g., a cell referencing itself, or a multi-cell loop).
 * No recalculation order exists in that case, so the whole pass is aborted.
 */
public class CircularReferenceException extends FormulaException {
    private final String address;

    public CircularReferenceException(String address) {
        super("Circular reference detected at " + address);
        this.address = address;
    }

    public String getAddress() {
        return address;
    }
}
