package com.spreadsheet.formula.models;

import com.spreadsheet.formula.exceptions.InvalidAddressException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Represents the cell grid storage of one spreadsheet:
 * - Has a unique ID and a display name
 * - Fixed bounds (rowCount x colCount) used for full-sheet scans
 * - A sparse map of CellAddress -> Cell
 * - A read/write lock the host uses to keep edits and recalculation apart
 */
public class Sheet {

    // Generates unique IDs for newly created sheets
    private static final AtomicLong ID_GENERATOR = new AtomicLong(1);

    private final long id;
    private final String name;
    private final int rowCount;
    private final int colCount;
    private final Map<CellAddress, Cell> cells = new ConcurrentHashMap<>();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public Sheet(int rowCount, int colCount) {
        this("Sheet", rowCount, colCount);
    }

    public Sheet(String name, int rowCount, int colCount) {
        if (rowCount <= 0 || colCount <= 0) {
            throw new IllegalArgumentException("Sheet bounds must be positive: " + rowCount + "x" + colCount);
        }
        this.id = ID_GENERATOR.getAndIncrement();
        this.name = name;
        this.rowCount = rowCount;
        this.colCount = colCount;
    }

    public long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public int getRowCount() {
        return rowCount;
    }

    public int getColCount() {
        return colCount;
    }

    public Map<CellAddress, Cell> getCells() {
        return cells;
    }

    public Cell getCell(int row, int col) {
        return cells.get(new CellAddress(row, col));
    }

    public Cell getCell(CellAddress address) {
        return cells.get(address);
    }

    /**
     * Stored value at (row, col); absent cells read as empty.
     */
    public CellValue getCellValue(int row, int col) {
        Cell cell = getCell(row, col);
        return cell == null ? CellValue.empty() : cell.getValue();
    }

    /**
     * Stores a plain value, dropping any formula the cell had.
     */
    public void setCell(int row, int col, CellValue value) {
        setCell(row, col, value, null, null, null);
    }

    /**
     * Replaces the cell at (row, col). A null type is inferred from the value.
     * The new cell starts dirty so dependents get recomputed on the next pass.
     */
    public void setCell(int row, int col, CellValue value, String formula, CellType type, String format) {
        checkBounds(row, col);
        cells.put(new CellAddress(row, col), new Cell(value, formula, type, format));
    }

    /**
     * Sets or replaces a formula, keeping the current value until the next recalculation.
     */
    public void setFormula(int row, int col, String formula) {
        checkBounds(row, col);
        Cell cell = cells.computeIfAbsent(new CellAddress(row, col), k -> new Cell(CellValue.empty()));
        cell.setFormula(formula);
        cell.setType(CellType.AUTO);
        cell.setDirty(true);
    }

    public void clearCell(int row, int col) {
        cells.remove(new CellAddress(row, col));
    }

    /**
     * Values of the rectangle between two corners (inclusive), one list per row.
     */
    public List<List<CellValue>> getRange(int startRow, int startCol, int endRow, int endCol) {
        CellAddress.checkRangeSize(startRow, startCol, endRow, endCol);
        List<List<CellValue>> rows = new ArrayList<>();
        for (int r = Math.min(startRow, endRow); r <= Math.max(startRow, endRow); r++) {
            List<CellValue> row = new ArrayList<>();
            for (int c = Math.min(startCol, endCol); c <= Math.max(startCol, endCol); c++) {
                row.add(getCellValue(r, c));
            }
            rows.add(row);
        }
        return rows;
    }

    public boolean contains(int row, int col) {
        return row >= 0 && row < rowCount && col >= 0 && col < colCount;
    }

    private void checkBounds(int row, int col) {
        if (!contains(row, col)) {
            throw new InvalidAddressException("Cell " + new CellAddress(row, col)
                    + " is outside the sheet bounds " + rowCount + "x" + colCount);
        }
    }

    public ReentrantReadWriteLock getLock() {
        return lock;
    }
}
