package com.spreadsheet.formula.engine;

import com.spreadsheet.formula.engine.functions.Arity;
import com.spreadsheet.formula.engine.functions.FunctionRegistry;
import com.spreadsheet.formula.exceptions.CircularReferenceException;
import com.spreadsheet.formula.models.CellAddress;
import com.spreadsheet.formula.models.CellType;
import com.spreadsheet.formula.models.CellValue;
import com.spreadsheet.formula.models.Sheet;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the recalculation engine, working directly on Sheet
 * objects (no Spring context).
 */
class FormulaEngineTest {

    private FunctionRegistry registry;
    private FormulaEngine engine;
    private Sheet sheet;

    @BeforeEach
    void setUp() {
        registry = FunctionRegistry.withBuiltins();
        engine = new FormulaEngine(registry);
        sheet = new Sheet(20, 5);
    }

    @AfterEach
    void tearDown() {
        engine.shutdown();
    }

    private void value(String address, CellValue value) {
        CellAddress at = CellAddress.fromText(address);
        sheet.setCell(at.getRow(), at.getCol(), value);
    }

    private void formula(String address, String formula) {
        CellAddress at = CellAddress.fromText(address);
        sheet.setFormula(at.getRow(), at.getCol(), formula);
    }

    private CellValue valueAt(String address) {
        CellAddress at = CellAddress.fromText(address);
        return sheet.getCellValue(at.getRow(), at.getCol());
    }

    /**
     * A1=2, A2=3, A3=A1+A2*2 => 8, and B1 reading A3 sees the new value.
     */
    @Test
    void testDependentsSeeFreshValues() {
        value("A1", CellValue.number(2));
        value("A2", CellValue.number(3));
        formula("B1", "=A3*10");
        formula("A3", "=A1+A2*2");

        RecalcResult result = engine.recalculate(sheet);

        assertEquals(2, result.getCellsProcessed());
        assertFalse(result.isRejected());
        assertEquals(CellValue.number(8), valueAt("A3"));
        assertEquals(CellValue.number(80), valueAt("B1"));
        assertEquals("=A1+A2*2", sheet.getCell(CellAddress.fromText("A3")).getFormula());
        assertEquals(CellType.NUMBER, sheet.getCell(CellAddress.fromText("A3")).getType());
    }

    /**
     * Each formula runs once per pass; a pass with nothing changed runs none,
     * and editing an input reruns exactly the cells downstream of it.
     */
    @Test
    void testEachFormulaEvaluatedOncePerPass() {
        AtomicInteger calls = new AtomicInteger();
        registry.register("TICK", args -> {
            calls.incrementAndGet();
            return args.get(0);
        }, Arity.exactly(1), "Counts its calls");

        value("A1", CellValue.number(1));
        formula("A2", "=TICK(A1)+1");
        formula("A3", "=TICK(A2)*2");
        formula("C1", "=TICK(5)");

        assertEquals(3, engine.recalculate(sheet).getCellsProcessed());
        assertEquals(3, calls.get());
        assertEquals(CellValue.number(4), valueAt("A3"));

        assertEquals(0, engine.recalculate(sheet).getCellsProcessed());
        assertEquals(3, calls.get());

        value("A1", CellValue.number(10));
        RecalcResult result = engine.recalculate(sheet, CellAddress.fromText("A1"), RecalcOptions.defaults());
        assertEquals(2, result.getCellsProcessed());
        assertEquals(5, calls.get());
        assertEquals(CellValue.number(22), valueAt("A3"));
        assertEquals(CellValue.number(5), valueAt("C1"));
    }

    @Test
    void testEditedFormulaIsRecomputed() {
        value("A1", CellValue.number(1));
        formula("A2", "=A1+1");
        engine.recalculate(sheet);

        formula("A2", "=A1+100");
        engine.recalculate(sheet, CellAddress.fromText("A2"), RecalcOptions.defaults());
        assertEquals(CellValue.number(101), valueAt("A2"));
    }

    /**
     * A1 -> B1 -> C1 -> A1: the pass aborts and every value stays as it was.
     */
    @Test
    void testCycleLeavesValuesUnchanged() {
        sheet.setCell(0, 0, CellValue.number(1), "=B1", null, null);
        sheet.setCell(0, 1, CellValue.number(2), "=C1", null, null);
        sheet.setCell(0, 2, CellValue.number(3), "=A1", null, null);

        assertThrows(CircularReferenceException.class, () -> engine.recalculate(sheet));

        assertEquals(CellValue.number(1), valueAt("A1"));
        assertEquals(CellValue.number(2), valueAt("B1"));
        assertEquals(CellValue.number(3), valueAt("C1"));
        assertEquals(EngineState.IDLE, engine.getState(sheet));
    }

    @Test
    void testSelfReferenceIsACycle() {
        formula("A1", "=A1+1");
        assertThrows(CircularReferenceException.class, () -> engine.recalculate(sheet));
    }

    @Test
    void testDivisionByZeroPropagates() {
        value("A1", CellValue.number(5));
        formula("A2", "=A1/0");
        formula("A3", "=A2+1");

        engine.recalculate(sheet);

        assertEquals(CellValue.divZero(), valueAt("A2"));
        assertEquals(CellValue.divZero(), valueAt("A3"));
        assertEquals(CellType.ERROR, sheet.getCell(CellAddress.fromText("A2")).getType());
    }

    /**
     * A broken formula only affects its own cell.
     */
    @Test
    void testFailuresAreIsolatedPerCell() {
        formula("A1", "=NOPE(1)");
        formula("A2", "=1+");
        formula("A3", "=A1 & 2");
        formula("A4", "=A1:A2");
        formula("B1", "=1+1");

        RecalcResult result = engine.recalculate(sheet);

        assertEquals(5, result.getCellsProcessed());
        assertEquals(CellValue.genericError(), valueAt("A1"));
        assertEquals(CellValue.genericError(), valueAt("A2"));
        assertEquals(CellValue.genericError(), valueAt("A3"));
        assertEquals(CellValue.genericError(), valueAt("A4"));
        assertEquals(CellValue.number(2), valueAt("B1"));
    }

    /**
     * A range far too large to expand fails its own cell; the rest of the sheet
     * is still computed.
     */
    @Test
    void testOversizedRangeOnlyFailsItsCell() {
        value("B1", CellValue.number(5));
        formula("B2", "=B1*2");
        formula("A1", "=SUM(A1:ZZZ100000000)");
        formula("C1", "=COUNT(A1:ZZ1000000)");

        RecalcResult result = engine.recalculate(sheet);

        assertEquals(3, result.getCellsProcessed());
        assertEquals(CellValue.genericError(), valueAt("A1"));
        assertEquals(CellValue.genericError(), valueAt("C1"));
        assertEquals(CellValue.number(10), valueAt("B2"));
    }

    @Test
    void testDeeplyNestedFormulaOnlyFailsItsCell() {
        formula("A1", "=" + "(".repeat(5000) + "1" + ")".repeat(5000));
        formula("A2", "=2+2");

        engine.recalculate(sheet);

        assertEquals(CellValue.genericError(), valueAt("A1"));
        assertEquals(CellValue.number(4), valueAt("A2"));
    }

    /**
     * Registering FOO again changes what the next forced pass computes.
     */
    @Test
    void testReRegisteredFunctionIsUsed() {
        registry.register("FOO", args -> CellValue.number(1), Arity.exactly(0), "first");
        formula("A1", "=FOO()");
        engine.recalculate(sheet);
        assertEquals(CellValue.number(1), valueAt("A1"));

        registry.register("FOO", args -> CellValue.number(2), Arity.exactly(0), "second");
        engine.recalculate(sheet, null, RecalcOptions.forced());
        assertEquals(CellValue.number(2), valueAt("A1"));
    }

    @Test
    void testAsyncFunctionResultIsAwaited() {
        registry.registerAsync("RATE", args -> CompletableFuture.supplyAsync(() -> CellValue.number(1.5)),
                Arity.exactly(0), "Exchange rate");
        formula("A1", "=RATE()*2");

        engine.recalculate(sheet);

        assertEquals(CellValue.number(3), valueAt("A1"));
    }

    /**
     * While a pass is running on a sheet, another request for the same sheet
     * is turned away; other sheets are not affected.
     */
    @Test
    void testConcurrentRequestIsRejected() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CompletableFuture<CellValue> gate = new CompletableFuture<>();
        registry.registerAsync("WAIT", args -> {
            started.countDown();
            return gate;
        }, Arity.exactly(0), "Blocks until released");
        formula("A1", "=WAIT()");

        CompletableFuture<RecalcResult> running =
                engine.recalculateAsync(sheet, null, RecalcOptions.defaults().withAsync(true));
        assertTrue(started.await(5, TimeUnit.SECONDS));
        assertEquals(EngineState.COMPUTING, engine.getState(sheet));

        RecalcResult second = engine.recalculate(sheet);
        assertTrue(second.isRejected());
        assertEquals(0, second.getCellsProcessed());

        Sheet other = new Sheet(5, 5);
        other.setFormula(0, 0, "=1+2");
        assertEquals(1, engine.recalculate(other).getCellsProcessed());

        gate.complete(CellValue.number(42));
        RecalcResult first = running.get(5, TimeUnit.SECONDS);
        assertEquals(1, first.getCellsProcessed());
        assertEquals(CellValue.number(42), valueAt("A1"));
        assertEquals(EngineState.IDLE, engine.getState(sheet));
    }

    @Test
    void testSynchronousRecalculateAsyncIsAlreadyComplete() {
        formula("A1", "=2*2");
        CompletableFuture<RecalcResult> done = engine.recalculateAsync(sheet, null, RecalcOptions.defaults());
        assertTrue(done.isDone());
        assertEquals(1, done.join().getCellsProcessed());

        formula("B1", "=C1");
        formula("C1", "=B1");
        CompletableFuture<RecalcResult> failed = engine.recalculateAsync(sheet, null, RecalcOptions.defaults());
        assertTrue(failed.isCompletedExceptionally());
    }

    @Test
    void testForceEvaluatesEverything() {
        formula("A1", "=1");
        formula("A2", "=A1+1");
        assertEquals(2, engine.recalculate(sheet).getCellsProcessed());
        assertEquals(0, engine.recalculate(sheet).getCellsProcessed());
        assertEquals(2, engine.recalculate(sheet, null, RecalcOptions.forced()).getCellsProcessed());
    }

    /**
     * With a changed address only that cell and what comes after it in the
     * order are considered; an address outside the order means the whole sheet.
     */
    @Test
    void testChangedAddressLimitsTheWorkingSet() {
        formula("A1", "=5");
        formula("A2", "=A1+1");
        formula("A3", "=A2*2");
        engine.recalculate(sheet);

        RecalcResult fromA2 = engine.recalculate(sheet, CellAddress.fromText("A2"), RecalcOptions.forced());
        assertEquals(2, fromA2.getCellsProcessed());

        RecalcResult unknown = engine.recalculate(sheet, CellAddress.fromText("E9"), RecalcOptions.forced());
        assertEquals(3, unknown.getCellsProcessed());
        assertEquals(CellValue.number(12), valueAt("A3"));
    }

    @Test
    void testEvalCellRecomputesOneCell() {
        value("A1", CellValue.number(4));
        formula("A2", "=SQRT(A1)");
        engine.evalCell("A2", sheet);
        assertEquals(CellValue.number(2), valueAt("A2"));
        assertFalse(sheet.getCell(CellAddress.fromText("A2")).isDirty());
        assertTrue(engine.isCached(sheet, CellAddress.fromText("A2")));
    }

    @Test
    void testInvalidateDropsTransitiveReaders() {
        value("A1", CellValue.number(1));
        formula("A2", "=A1+1");
        formula("A3", "=A2+1");
        formula("B1", "=7");
        engine.recalculate(sheet);

        engine.invalidate(sheet, CellAddress.fromText("A1"));

        assertFalse(engine.isCached(sheet, CellAddress.fromText("A2")));
        assertFalse(engine.isCached(sheet, CellAddress.fromText("A3")));
        assertTrue(engine.isCached(sheet, CellAddress.fromText("B1")));
        assertEquals(2, engine.recalculate(sheet).getCellsProcessed());
    }

    @Test
    void testClearCache() {
        formula("A1", "=1");
        engine.recalculate(sheet);
        engine.clearCache();
        assertFalse(engine.isCached(sheet, CellAddress.fromText("A1")));
        assertEquals(1, engine.recalculate(sheet).getCellsProcessed());
    }

    @Test
    void testDependencyGraphOfSheet() {
        formula("A3", "=SUM(A1:A2)");
        formula("B1", "=A3 # 1");
        formula("C1", "=42");

        DependencyGraph graph = engine.buildDependencyGraph(sheet);

        assertEquals(new LinkedHashSet<>(Arrays.asList("A1", "A2")), graph.getEdges().get("A3"));
        assertTrue(graph.contains(CellAddress.fromText("B1")));
        assertTrue(graph.dependenciesOf(CellAddress.fromText("B1")).isEmpty());
        assertTrue(graph.contains(CellAddress.fromText("C1")));
    }

    @Test
    void testExtractReferences() {
        List<String> refs = engine.extractReferences("=SUM(A1:A3)");
        assertEquals(Arrays.asList("A1", "A2", "A3"), refs);
    }

    @Test
    void testAdjustFormulaShiftsRelativeReferences() {
        assertEquals("=B2+C3", engine.adjustFormula("=A1+B2", 2, 0, 3, 1));
        assertEquals("=SUM(B2:B4)", engine.adjustFormula("=SUM(A1:A3)", 0, 0, 1, 1));
    }

    @Test
    void testAdjustFormulaKeepsPinnedParts() {
        assertEquals("=$A$1+B$1+$A2", engine.adjustFormula("=$A$1+A$1+$A1", 0, 0, 1, 1));
    }

    @Test
    void testAdjustFormulaEdgeCases() {
        // Shifted coordinates stop at the first row and column
        assertEquals("=A1", engine.adjustFormula("=A1", 1, 1, 0, 0));
        // Text in quotes and function names stay as they are
        assertEquals("=CONCATENATE(\"A1\", A2)", engine.adjustFormula("=CONCATENATE(\"A1\", A1)", 0, 0, 1, 0));
        assertEquals("=LOG10(B1)", engine.adjustFormula("=LOG10(A1)", 0, 0, 0, 1));
        // Same position: unchanged
        assertEquals("=A1+1", engine.adjustFormula("=A1+1", 3, 3, 3, 3));
        assertEquals("=B1", engine.adjustFormula("A1", 0, 0, 0, 1));
    }
}
