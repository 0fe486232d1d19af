package com.spreadsheet.formula.models;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * Type tag stored with each cell, inferred from its current value.
 */
public enum CellType {
    AUTO,
    NUMBER,
    STRING,
    BOOLEAN,
    DATE,
    ERROR;

    /**
     * Allows case-insensitive JSON input, e.g. "number" -> NUMBER.
     */
    @JsonCreator
    public static CellType fromValue(String value) {
        return CellType.valueOf(value.toUpperCase());
    }

    public static CellType infer(CellValue value) {
        switch (value.getType()) {
            case NUMBER:
                return NUMBER;
            case TEXT:
                return STRING;
            case BOOLEAN:
                return BOOLEAN;
            case ERROR:
                return ERROR;
            default:
                return AUTO;
        }
    }
}
