package com.spreadsheet.formula.engine.functions;

import com.spreadsheet.formula.exceptions.EvaluationException;
import com.spreadsheet.formula.exceptions.FormulaException;
import com.spreadsheet.formula.models.CellValue;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * A registered function: upper-cased name, implementation, arity,
 * async flag and a human readable description.
 */
public final class FunctionSpec {
    private final String name;
    private final FormulaFunction syncImpl;
    private final AsyncFormulaFunction asyncImpl;
    private final Arity arity;
    private final String description;

    private FunctionSpec(String name, FormulaFunction syncImpl, AsyncFormulaFunction asyncImpl,
                         Arity arity, String description) {
        this.name = name.toUpperCase();
        this.syncImpl = syncImpl;
        this.asyncImpl = asyncImpl;
        this.arity = arity == null ? Arity.variadic() : arity;
        this.description = description;
    }

    public static FunctionSpec sync(String name, FormulaFunction impl, Arity arity, String description) {
        return new FunctionSpec(name, impl, null, arity, description);
    }

    public static FunctionSpec async(String name, AsyncFormulaFunction impl, Arity arity, String description) {
        return new FunctionSpec(name, null, impl, arity, description);
    }

    public String getName() {
        return name;
    }

    public Arity getArity() {
        return arity;
    }

    public boolean isAsync() {
        return asyncImpl != null;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Runs the implementation. For async functions this blocks until the
     * future completes; failures inside the future are unwrapped.
     */
    public CellValue invoke(List<CellValue> args) {
        if (asyncImpl == null) {
            return syncImpl.apply(args);
        }
        CompletableFuture<CellValue> future = asyncImpl.apply(args);
        if (future == null) {
            throw new EvaluationException("Function " + name + " returned no result");
        }
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof FormulaException) {
                throw (FormulaException) cause;
            }
            throw new EvaluationException("Function " + name + " failed: " + cause.getMessage(), cause);
        }
    }
}
