package com.spreadsheet.formula.engine.functions;

import com.spreadsheet.formula.models.CellValue;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Function whose result arrives later, e.g. a rate fetched from a remote service.
 * The evaluator waits for each call before moving on to the next one.
 */
@FunctionalInterface
public interface AsyncFormulaFunction {
    CompletableFuture<CellValue> apply(List<CellValue> args);
}
