package com.spreadsheet.formula.engine;

/**
 * Token kinds produced by {@link FormulaLexer}.
 */
public enum TokenType {
    NUMBER,
    STRING,
    CELL_REF,
    RANGE_REF,
    FUNCTION_NAME,
    OPERATOR,
    LPAREN,
    RPAREN,
    COMMA,
    COLON
}
