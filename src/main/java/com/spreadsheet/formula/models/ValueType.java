package com.spreadsheet.formula.models;

/**
 * Kinds of value a cell, or an intermediate formula result, can hold.
 * RANGE only appears while evaluating a formula; it is never stored in a cell.
 */
public enum ValueType {
    EMPTY,
    NUMBER,
    TEXT,
    BOOLEAN,
    ERROR,
    RANGE
}
