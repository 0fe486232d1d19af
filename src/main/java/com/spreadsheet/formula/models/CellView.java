package com.spreadsheet.formula.models;

/**
 * Read-only snapshot of one cell as returned by the REST API.
 */
public class CellView {
    private final String address;
    private final CellValue value;
    private final String formula;
    private final CellType type;
    private final String format;

    public CellView(CellAddress address, Cell cell) {
        this.address = address.toText();
        this.value = cell == null ? CellValue.empty() : cell.getValue();
        this.formula = cell == null ? null : cell.getFormula();
        this.type = cell == null ? CellType.AUTO : cell.getType();
        this.format = cell == null ? null : cell.getFormat();
    }

    public String getAddress() {
        return address;
    }

    public CellValue getValue() {
        return value;
    }

    public String getFormula() {
        return formula;
    }

    public CellType getType() {
        return type;
    }

    public String getFormat() {
        return format;
    }
}
