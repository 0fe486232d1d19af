package com.spreadsheet.formula.exceptions;

/**
 * Thrown when a formula calls a function that is not in the registry.
 */
public class UnknownFunctionException extends FormulaException {
    private final String functionName;

    public UnknownFunctionException(String functionName) {
        super("Unknown function: " + functionName);
        this.functionName = functionName;
    }

    public String getFunctionName() {
        return functionName;
    }
}
