package com.spreadsheet.formula.engine;

/**
 * Options of one recalculation request.
 * - force: ignore cached values and evaluate every formula in the working set
 * - async: run the pass on the engine's background thread (see FormulaEngine#recalculateAsync)
 */
public final class RecalcOptions {

    private static final RecalcOptions DEFAULTS = new RecalcOptions(false, false);

    private final boolean force;
    private final boolean async;

    public RecalcOptions(boolean force, boolean async) {
        this.force = force;
        this.async = async;
    }

    public static RecalcOptions defaults() {
        return DEFAULTS;
    }

    public static RecalcOptions forced() {
        return new RecalcOptions(true, false);
    }

    public boolean isForce() {
        return force;
    }

    public boolean isAsync() {
        return async;
    }

    public RecalcOptions withAsync(boolean async) {
        return new RecalcOptions(force, async);
    }
}
