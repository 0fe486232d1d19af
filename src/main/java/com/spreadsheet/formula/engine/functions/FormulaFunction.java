package com.spreadsheet.formula.engine.functions;

import com.spreadsheet.formula.models.CellValue;

import java.util.List;

/**
 * Synchronous function implementation. Arguments arrive already evaluated,
 * in call order; ranges arrive as RANGE values.
 */
@FunctionalInterface
public interface FormulaFunction {
    CellValue apply(List<CellValue> args);
}
