package com.spreadsheet.formula.engine.functions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Name -> FunctionSpec table. Keys are upper-cased, so lookups ignore case,
 * and registering an existing name replaces the previous entry.
 */
public class FunctionRegistry {

    private static final Logger log = LoggerFactory.getLogger(FunctionRegistry.class);

    private final Map<String, FunctionSpec> functions = new ConcurrentHashMap<>();

    /**
     * Registry preloaded with the built-in function library.
     */
    public static FunctionRegistry withBuiltins() {
        FunctionRegistry registry = new FunctionRegistry();
        BuiltinFunctions.registerAll(registry);
        return registry;
    }

    public void register(String name, FormulaFunction impl, Arity arity, String description) {
        register(FunctionSpec.sync(name, impl, arity, description));
    }

    public void registerAsync(String name, AsyncFormulaFunction impl, Arity arity, String description) {
        register(FunctionSpec.async(name, impl, arity, description));
    }

    public void register(FunctionSpec spec) {
        FunctionSpec previous = functions.put(spec.getName(), spec);
        if (previous != null) {
            log.debug("Replaced function {}", spec.getName());
        }
    }

    /**
     * Case-insensitive lookup; null when nothing is registered under that name.
     */
    public FunctionSpec get(String name) {
        return name == null ? null : functions.get(name.toUpperCase());
    }

    public List<FunctionSpec> list() {
        List<FunctionSpec> specs = new ArrayList<>(functions.values());
        specs.sort((a, b) -> a.getName().compareTo(b.getName()));
        return specs;
    }
}
