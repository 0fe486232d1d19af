package com.spreadsheet.formula.engine;

import com.spreadsheet.formula.engine.functions.Arity;
import com.spreadsheet.formula.engine.functions.FunctionRegistry;
import com.spreadsheet.formula.exceptions.EvaluationException;
import com.spreadsheet.formula.exceptions.UnknownFunctionException;
import com.spreadsheet.formula.models.CellAddress;
import com.spreadsheet.formula.models.CellValue;
import com.spreadsheet.formula.models.Sheet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Evaluates parsed formulas against a small in-memory sheet.
 */
class FormulaEvaluatorTest {

    private final FormulaLexer lexer = new FormulaLexer();
    private final FormulaParser parser = new FormulaParser();
    private FunctionRegistry registry;
    private FormulaEvaluator evaluator;
    private Sheet sheet;

    @BeforeEach
    void setUp() {
        registry = FunctionRegistry.withBuiltins();
        evaluator = new FormulaEvaluator(registry);
        sheet = new Sheet(10, 5);
        sheet.setCell(0, 0, CellValue.number(2));   // A1
        sheet.setCell(1, 0, CellValue.number(3));   // A2
        sheet.setCell(0, 1, CellValue.text("hi"));  // B1
        sheet.setCell(1, 1, CellValue.text("10"));  // B2
    }

    private CellValue eval(String formula) {
        return evaluator.evaluate(parser.parse(lexer.tokenize(formula)), sheet);
    }

    @Test
    void testArithmeticWithReferences() {
        assertEquals(CellValue.number(8), eval("=A1+A2*2"));
        assertEquals(CellValue.number(18), eval("=2*3^2"));
        assertEquals(CellValue.number(64), eval("=2^3^2"));
        assertEquals(CellValue.number(4), eval("=-2^2"));
        assertEquals(CellValue.number(1), eval("=7%3*1"));
        assertEquals(CellValue.number(-1), eval("=-A1+A2-2"));
    }

    @Test
    void testDivisionByZero() {
        assertEquals(CellValue.divZero(), eval("=1/0"));
        assertEquals(CellValue.divZero(), eval("=A1/C9"));
        assertEquals(CellValue.divZero(), eval("=5%0"));
    }

    @Test
    void testErrorOperandsPropagate() {
        assertEquals(CellValue.divZero(), eval("=1/0+1"));
        assertEquals(CellValue.divZero(), eval("=-(1/0)"));
        sheet.setCell(2, 0, CellValue.notFound());
        assertEquals(CellValue.notFound(), eval("=A3*2"));
    }

    @Test
    void testTextCoercion() {
        assertEquals(CellValue.number(12), eval("=B2+A1"));
        assertThrows(EvaluationException.class, () -> eval("=B1+1"));
    }

    @Test
    void testEmptyCellsReadAsZeroOrBlank() {
        assertEquals(CellValue.number(2), eval("=A1+E9"));
        assertEquals(CellValue.bool(true), eval("=E9=0"));
        assertEquals(CellValue.bool(true), eval("=E9=\"\""));
    }

    @Test
    void testComparisons() {
        assertEquals(CellValue.bool(true), eval("=A1<A2"));
        assertEquals(CellValue.bool(false), eval("=A1>=A2"));
        assertEquals(CellValue.bool(true), eval("=B1=\"hi\""));
        assertEquals(CellValue.bool(true), eval("=\"a\"<\"b\""));
        // Equality across types is simply false; ordering across types is an error
        assertEquals(CellValue.bool(false), eval("=A1=\"2\""));
        assertEquals(CellValue.bool(true), eval("=A1<>\"2\""));
        assertThrows(EvaluationException.class, () -> eval("=A1<\"2\""));
    }

    @Test
    void testRangeAsOperandIsRejected() {
        assertThrows(EvaluationException.class, () -> eval("=A1:A2+1"));
    }

    @Test
    void testFunctionCalls() {
        assertEquals(CellValue.number(5), eval("=SUM(A1:A2)"));
        assertEquals(CellValue.text("HI"), eval("=UPPER(B1)"));
        assertEquals(CellValue.text("big"), eval("=IF(A2>A1, \"big\", \"small\")"));
    }

    @Test
    void testUnknownFunction() {
        UnknownFunctionException ex = assertThrows(UnknownFunctionException.class, () -> eval("=NOPE(1)"));
        assertEquals("NOPE", ex.getFunctionName());
    }

    @Test
    void testArityIsChecked() {
        assertThrows(EvaluationException.class, () -> eval("=ABS(1, 2)"));
        assertThrows(EvaluationException.class, () -> eval("=VLOOKUP(1, A1:A2)"));
    }

    /**
     * Arguments are evaluated left to right before the call.
     */
    @Test
    void testArgumentOrder() {
        List<String> seen = new ArrayList<>();
        registry.register("TRACE", args -> {
            seen.add(args.get(0).asText());
            return args.get(0);
        }, Arity.exactly(1), "Records its argument");
        registry.register("LAST", args -> args.get(args.size() - 1), Arity.atLeast(1), "Last argument");

        assertEquals(CellValue.text("c"), eval("=LAST(TRACE(\"a\"), TRACE(\"b\"), TRACE(\"c\"))"));
        assertEquals(Arrays.asList("a", "b", "c"), seen);
    }

    @Test
    void testNullResultIsAnError() {
        registry.register("BROKEN", args -> null, Arity.variadic(), "Returns nothing");
        assertThrows(EvaluationException.class, () -> eval("=BROKEN()"));
    }

    @Test
    void testReadsAreRecorded() {
        Set<CellAddress> reads = new HashSet<>();
        evaluator.evaluate(parser.parse(lexer.tokenize("=A1+SUM(B1:B2)")), sheet, reads);
        assertEquals(new HashSet<>(Arrays.asList(
                CellAddress.fromText("A1"), CellAddress.fromText("B1"), CellAddress.fromText("B2"))), reads);
    }

    @Test
    void testEvaluationDoesNotWriteToTheSheet() {
        eval("=A1+A2");
        assertEquals(4, sheet.getCells().size());
    }
}
