package com.spreadsheet.formula.engine;

/**
 * Outcome of a recalculation request. A rejected request (another pass was
 * still running) processed no cells.
 */
public final class RecalcResult {
    private final int cellsProcessed;
    private final boolean rejected;

    private RecalcResult(int cellsProcessed, boolean rejected) {
        this.cellsProcessed = cellsProcessed;
        this.rejected = rejected;
    }

    public static RecalcResult completed(int cellsProcessed) {
        return new RecalcResult(cellsProcessed, false);
    }

    public static RecalcResult rejected() {
        return new RecalcResult(0, true);
    }

    public int getCellsProcessed() {
        return cellsProcessed;
    }

    public boolean isRejected() {
        return rejected;
    }
}
