package com.spreadsheet.formula.engine;

import com.spreadsheet.formula.engine.ast.AstNode;
import com.spreadsheet.formula.engine.functions.FunctionRegistry;
import com.spreadsheet.formula.exceptions.CircularReferenceException;
import com.spreadsheet.formula.exceptions.EvaluationException;
import com.spreadsheet.formula.exceptions.FormulaException;
import com.spreadsheet.formula.models.Cell;
import com.spreadsheet.formula.models.CellAddress;
import com.spreadsheet.formula.models.CellType;
import com.spreadsheet.formula.models.CellValue;
import com.spreadsheet.formula.models.Sheet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recalculation orchestrator: rebuilds the dependency graph of a sheet,
 * orders its formula cells and evaluates them one by one.
 *
 * Per pass:
 * 1) Scan the sheet bounds for formula cells and extract their references
 * 2) Topologically order them (a cycle aborts the pass, nothing is written)
 * 3) With a changed address, keep that address and everything after it
 * 4) Evaluate each formula cell that is not already up to date (or all of them when forced)
 *
 * A failing cell gets the value #ERROR! and the pass goes on. Each sheet is
 * either IDLE or COMPUTING; a request for a sheet that is COMPUTING is rejected.
 */
public class FormulaEngine {

    private static final Logger log = LoggerFactory.getLogger(FormulaEngine.class);

    // Relative or absolute reference outside a function name: A1, $A1, A$1, $A$1
    private static final Pattern REFERENCE_PATTERN =
            Pattern.compile("(?<![A-Za-z0-9_$])(\\$?)([A-Za-z]+)(\\$?)([0-9]+)(?![A-Za-z0-9_(])");

    private final FormulaLexer lexer = new FormulaLexer();
    private final FormulaParser parser = new FormulaParser();
    private final ReferenceExtractor extractor = new ReferenceExtractor(lexer);
    private final FunctionRegistry registry;
    private final FormulaEvaluator evaluator;

    // Per sheet: last computed value of each formula cell
    private final Map<Long, Map<CellAddress, CellValue>> valueCache = new ConcurrentHashMap<>();
    // Per sheet: cell -> formula cells that read it, as seen by their last evaluation
    private final Map<Long, Map<CellAddress, Set<CellAddress>>> dependents = new ConcurrentHashMap<>();
    // Per sheet: formula cell -> cells its last evaluation read
    private final Map<Long, Map<CellAddress, Set<CellAddress>>> lastReads = new ConcurrentHashMap<>();
    private final Set<Long> computing = ConcurrentHashMap.newKeySet();

    private final ExecutorService asyncExecutor = Executors.newSingleThreadExecutor(runnable -> {
        Thread thread = new Thread(runnable, "formula-recalc");
        thread.setDaemon(true);
        return thread;
    });

    public FormulaEngine(FunctionRegistry registry) {
        this.registry = registry;
        this.evaluator = new FormulaEvaluator(registry);
    }

    public FunctionRegistry getRegistry() {
        return registry;
    }

    public EngineState getState(Sheet sheet) {
        return computing.contains(sheet.getId()) ? EngineState.COMPUTING : EngineState.IDLE;
    }

    public RecalcResult recalculate(Sheet sheet) {
        return recalculate(sheet, null, RecalcOptions.defaults());
    }

    /**
     * Runs one pass on the calling thread.
     *
     * @param changedAddress the edited cell, or null for the whole sheet
     * @throws CircularReferenceException if the formulas form a cycle; the sheet is left untouched
     */
    public RecalcResult recalculate(Sheet sheet, CellAddress changedAddress, RecalcOptions options) {
        if (!computing.add(sheet.getId())) {
            log.warn("Recalculation of sheet {} rejected: a pass is already running", sheet.getId());
            return RecalcResult.rejected();
        }
        try {
            return runPass(sheet, changedAddress, options);
        } finally {
            computing.remove(sheet.getId());
        }
    }

    /**
     * With options.isAsync() the pass runs on the engine's single background
     * thread; otherwise it runs now and the returned future is already complete.
     * Passes never run in parallel with each other on that thread.
     */
    public CompletableFuture<RecalcResult> recalculateAsync(Sheet sheet, CellAddress changedAddress,
                                                            RecalcOptions options) {
        if (options.isAsync()) {
            return CompletableFuture.supplyAsync(() -> recalculate(sheet, changedAddress, options), asyncExecutor);
        }
        try {
            return CompletableFuture.completedFuture(recalculate(sheet, changedAddress, options));
        } catch (RuntimeException e) {
            CompletableFuture<RecalcResult> failed = new CompletableFuture<>();
            failed.completeExceptionally(e);
            return failed;
        }
    }

    private RecalcResult runPass(Sheet sheet, CellAddress changedAddress, RecalcOptions options) {
        // 1) + 2) Graph and order; a cycle escapes from here before anything is written
        DependencyGraph graph = buildDependencyGraph(sheet);
        List<CellAddress> order;
        try {
            order = graph.topologicalOrder();
        } catch (CircularReferenceException e) {
            log.error("Recalculation of sheet {} aborted: {}", sheet.getId(), e.getMessage());
            throw e;
        }
        log.debug("Recalculation order: {}", order);

        // 3) Everything from the changed cell onwards
        List<CellAddress> working = order;
        if (changedAddress != null) {
            int index = order.indexOf(changedAddress);
            if (index >= 0) {
                working = order.subList(index, order.size());
            }
        }

        Map<CellAddress, CellValue> cache = cacheFor(sheet);
        if (options.isForce()) {
            cache.clear();
        }

        // 4) Cells whose inputs were written (or edited) during this pass
        Set<CellAddress> changed = new HashSet<>();
        if (changedAddress != null) {
            changed.add(changedAddress);
        }

        int processed = 0;
        for (CellAddress address : working) {
            Cell cell = sheet.getCell(address);
            if (cell == null) {
                continue;
            }
            if (!cell.hasFormula()) {
                if (cell.isDirty()) {
                    changed.add(address);
                    cell.setDirty(false);
                }
                continue;
            }
            if (!options.isForce() && isUpToDate(cell, address, cache, graph, changed)) {
                continue;
            }
            evalCell(address, sheet);
            changed.add(address);
            processed++;
        }

        log.debug("Sheet {}: {} cell(s) recalculated", sheet.getId(), processed);
        return RecalcResult.completed(processed);
    }

    private boolean isUpToDate(Cell cell, CellAddress address, Map<CellAddress, CellValue> cache,
                               DependencyGraph graph, Set<CellAddress> changed) {
        if (cell.isDirty() || !cache.containsKey(address) || changed.contains(address)) {
            return false;
        }
        for (CellAddress dependency : graph.dependenciesOf(address)) {
            if (changed.contains(dependency)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Lexes, parses and evaluates the formula at 'address' from scratch and
     * writes the result into the cell. The formula text is left as it was.
     * Any failure turns the value into #ERROR!.
     */
    public void evalCell(CellAddress address, Sheet sheet) {
        Cell cell = sheet.getCell(address);
        if (cell == null || !cell.hasFormula()) {
            return;
        }
        String formula = cell.getFormula();
        Set<CellAddress> reads = new HashSet<>();
        CellValue result;
        try {
            List<Token> tokens = lexer.tokenize(formula);
            AstNode ast = parser.parse(tokens);
            result = evaluator.evaluate(ast, sheet, reads);
            if (result.isRange()) {
                throw new EvaluationException("A range cannot be the value of a single cell");
            }
        } catch (RuntimeException e) {
            // Isolated to this cell; the pass continues with the next one
            log.warn("Error in cell {} ({}): {}", address, formula, e.getMessage());
            result = CellValue.genericError();
        } catch (StackOverflowError e) {
            // Very long operator chains nest the tree deeply enough to exhaust the walker's stack
            log.warn("Cell {} is too deeply nested to evaluate", address);
            result = CellValue.genericError();
        }
        log.debug("Cell {} formula \"{}\" => {}", address, formula, result);

        cell.setValue(result);
        cell.setType(CellType.infer(result));
        cell.setDirty(false);
        cacheFor(sheet).put(address, result);
        recordReads(sheet, address, reads);
    }

    public void evalCell(String address, Sheet sheet) {
        evalCell(CellAddress.fromText(address), sheet);
    }

    /**
     * Graph over every formula cell within the sheet bounds, scanned row by row.
     * A formula that cannot even be lexed still becomes a node, without edges;
     * evaluating it later yields #ERROR!.
     */
    public DependencyGraph buildDependencyGraph(Sheet sheet) {
        DependencyGraph graph = new DependencyGraph();
        for (int r = 0; r < sheet.getRowCount(); r++) {
            for (int c = 0; c < sheet.getColCount(); c++) {
                Cell cell = sheet.getCell(r, c);
                if (cell == null || !cell.hasFormula()) {
                    continue;
                }
                CellAddress address = new CellAddress(r, c);
                graph.addNode(address);
                try {
                    for (CellAddress ref : extractor.extractAddresses(cell.getFormula())) {
                        graph.addEdge(address, ref);
                    }
                } catch (FormulaException e) {
                    log.debug("No references for {}: {}", address, e.getMessage());
                }
            }
        }
        return graph;
    }

    public List<String> extractReferences(String formula) {
        return extractor.extractReferences(formula);
    }

    /**
     * Drops the cached value of 'address' and of every formula that read it,
     * directly or transitively, so the next pass evaluates them again.
     */
    public void invalidate(Sheet sheet, CellAddress address) {
        Map<CellAddress, CellValue> cache = cacheFor(sheet);
        Map<CellAddress, Set<CellAddress>> readers = dependentsFor(sheet);
        Set<CellAddress> seen = new HashSet<>();
        Deque<CellAddress> queue = new ArrayDeque<>();
        queue.add(address);
        seen.add(address);

        while (!queue.isEmpty()) {
            CellAddress current = queue.poll();
            cache.remove(current);
            for (CellAddress reader : readers.getOrDefault(current, Collections.emptySet())) {
                if (seen.add(reader)) {
                    queue.add(reader);
                }
            }
        }
    }

    public boolean isCached(Sheet sheet, CellAddress address) {
        return cacheFor(sheet).containsKey(address);
    }

    public void clearCache() {
        valueCache.clear();
        dependents.clear();
        lastReads.clear();
    }

    /**
     * Rewrites the references of a formula copied from (fromRow, fromCol) to
     * (toRow, toCol). "$" pins a column or row; shifted coordinates stop at 0.
     * String literals are left alone.
     */
    public String adjustFormula(String formula, int fromRow, int fromCol, int toRow, int toCol) {
        int rowOffset = toRow - fromRow;
        int colOffset = toCol - fromCol;
        if (rowOffset == 0 && colOffset == 0) {
            return formula;
        }

        String body = formula.startsWith("=") ? formula.substring(1) : formula;
        StringBuilder adjusted = new StringBuilder("=");
        // Even segments are outside quotes, odd ones are string literals
        String[] segments = body.split("\"", -1);
        for (int i = 0; i < segments.length; i++) {
            if (i > 0) {
                adjusted.append('"');
            }
            adjusted.append(i % 2 == 0 ? shiftReferences(segments[i], rowOffset, colOffset) : segments[i]);
        }
        return adjusted.toString();
    }

    private String shiftReferences(String text, int rowOffset, int colOffset) {
        Matcher matcher = REFERENCE_PATTERN.matcher(text);
        StringBuffer out = new StringBuffer();
        while (matcher.find()) {
            if (matcher.group(4).length() > 9) {
                // Not a row any sheet can have; keep the text as it is
                matcher.appendReplacement(out, Matcher.quoteReplacement(matcher.group()));
                continue;
            }
            String colAbs = matcher.group(1);
            String letters = matcher.group(2).toUpperCase();
            String rowAbs = matcher.group(3);
            int rowNumber = Integer.parseInt(matcher.group(4));

            int col = CellAddress.lettersToColumn(letters);
            int row = rowNumber - 1;
            int newCol = colAbs.isEmpty() ? Math.max(0, col + colOffset) : col;
            int newRow = rowAbs.isEmpty() ? Math.max(0, row + rowOffset) : row;

            String replacement = colAbs + CellAddress.columnToLetters(newCol) + rowAbs + (newRow + 1);
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    public void shutdown() {
        asyncExecutor.shutdown();
    }

    private void recordReads(Sheet sheet, CellAddress reader, Set<CellAddress> reads) {
        Map<CellAddress, Set<CellAddress>> readers = dependentsFor(sheet);
        Set<CellAddress> previous = lastReads.computeIfAbsent(sheet.getId(), k -> new ConcurrentHashMap<>())
                .put(reader, reads);
        if (previous != null) {
            for (CellAddress read : previous) {
                Set<CellAddress> set = readers.get(read);
                if (set != null) {
                    set.remove(reader);
                }
            }
        }
        for (CellAddress read : reads) {
            readers.computeIfAbsent(read, k -> ConcurrentHashMap.newKeySet()).add(reader);
        }
    }

    private Map<CellAddress, CellValue> cacheFor(Sheet sheet) {
        return valueCache.computeIfAbsent(sheet.getId(), k -> new ConcurrentHashMap<>());
    }

    private Map<CellAddress, Set<CellAddress>> dependentsFor(Sheet sheet) {
        return dependents.computeIfAbsent(sheet.getId(), k -> new ConcurrentHashMap<>());
    }
}
