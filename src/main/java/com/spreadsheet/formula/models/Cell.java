package com.spreadsheet.formula.models;

/**
 * Represents a single spreadsheet cell.
 * Stores:
 * - value (literal, or the last computed result of the formula)
 * - formula (original text including the leading "=", null for plain values)
 * - type tag and display format
 * - dirty flag to signal that the value is stale and must be recomputed
 */
public class Cell {
    private CellValue value;
    private String formula;
    private CellType type;
    private String format;
    private boolean dirty = true;

    public Cell(CellValue value) {
        this(value, null, CellType.infer(value), null);
    }

    public Cell(CellValue value, String formula, CellType type, String format) {
        this.value = value == null ? CellValue.empty() : value;
        this.formula = formula;
        this.type = type == null ? CellType.infer(this.value) : type;
        this.format = format;
    }

    public CellValue getValue() {
        return value;
    }

    public void setValue(CellValue value) {
        this.value = value;
    }

    public String getFormula() {
        return formula;
    }

    public void setFormula(String formula) {
        this.formula = formula;
    }

    public boolean hasFormula() {
        return formula != null && !formula.isEmpty();
    }

    public CellType getType() {
        return type;
    }

    public void setType(CellType type) {
        this.type = type;
    }

    public String getFormat() {
        return format;
    }

    public void setFormat(String format) {
        this.format = format;
    }

    public void setDirty(boolean dirty) {
        this.dirty = dirty;
    }

    public boolean isDirty() {
        return dirty;
    }
}
