package com.spreadsheet.formula.config;

import com.spreadsheet.formula.engine.FormulaEngine;
import com.spreadsheet.formula.engine.functions.FunctionRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires one function registry and one engine for the whole application.
 * Tests build their own instances instead.
 */
@Configuration
public class EngineConfig {

    @Bean
    public FunctionRegistry functionRegistry() {
        return FunctionRegistry.withBuiltins();
    }

    @Bean(destroyMethod = "shutdown")
    public FormulaEngine formulaEngine(FunctionRegistry functionRegistry) {
        return new FormulaEngine(functionRegistry);
    }
}
