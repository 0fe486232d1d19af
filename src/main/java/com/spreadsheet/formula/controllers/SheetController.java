package com.spreadsheet.formula.controllers;

import com.spreadsheet.formula.engine.RecalcResult;
import com.spreadsheet.formula.engine.functions.FunctionSpec;
import com.spreadsheet.formula.models.CellView;
import com.spreadsheet.formula.models.CreateSheetRequest;
import com.spreadsheet.formula.services.SheetService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * REST endpoints for editing sheets and inspecting their formulas.
 * "/sheet" is the base path.
 */
@RestController
@RequestMapping("/sheet")
public class SheetController {

    @Autowired
    private SheetService sheetService;

    /**
     * POST /sheet
     * Optional JSON body { "name", "rows", "cols" }.
     * Creates a new empty Sheet, returns the sheetId.
     */
    @PostMapping
    public ResponseEntity<Long> createSheet(@RequestBody(required = false) CreateSheetRequest request) {
        CreateSheetRequest body = request == null ? new CreateSheetRequest() : request;
        long sheetId = sheetService.createSheet(body.getName(), body.getRows(), body.getCols());
        return ResponseEntity.ok(sheetId);
    }

    /**
     * PUT /sheet/{sheetId}/cell/{address}
     * Body: raw content, either a literal ("42", "TRUE", "hello") or a formula ("=A1+1").
     * Returns how many formula cells the triggered recalculation evaluated.
     * A circular reference is rejected with 400 and the cell keeps its old content.
     */
    @PutMapping("/{sheetId}/cell/{address}")
    public ResponseEntity<RecalcResult> setCellContent(
            @PathVariable long sheetId,
            @PathVariable String address,
            @RequestBody(required = false) String rawValue
    ) {
        return ResponseEntity.ok(sheetService.setCellContent(sheetId, address, rawValue));
    }

    /**
     * DELETE /sheet/{sheetId}/cell/{address}
     * Clears the cell and recalculates whatever read it.
     */
    @DeleteMapping("/{sheetId}/cell/{address}")
    public ResponseEntity<RecalcResult> clearCell(@PathVariable long sheetId, @PathVariable String address) {
        return ResponseEntity.ok(sheetService.clearCell(sheetId, address));
    }

    /**
     * POST /sheet/{sheetId}/cell/{from}/copy/{to}
     * Copies a cell; relative references of a formula follow the move.
     */
    @PostMapping("/{sheetId}/cell/{from}/copy/{to}")
    public ResponseEntity<RecalcResult> copyCell(
            @PathVariable long sheetId,
            @PathVariable String from,
            @PathVariable String to
    ) {
        return ResponseEntity.ok(sheetService.copyCell(sheetId, from, to));
    }

    /**
     * GET /sheet/{sheetId}
     * Returns the computed value of every stored cell,
     * in the format: { "A1": 2, "A3": 8, "B1": "hello", "C1": "#DIV/0!" }.
     */
    @GetMapping("/{sheetId}")
    public ResponseEntity<Map<String, Object>> getSheet(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getSheetData(sheetId));
    }

    /**
     * GET /sheet/{sheetId}/cell/{address}
     * Value, formula text, type tag and format of one cell.
     */
    @GetMapping("/{sheetId}/cell/{address}")
    public ResponseEntity<CellView> getCell(@PathVariable long sheetId, @PathVariable String address) {
        return ResponseEntity.ok(sheetService.getCell(sheetId, address));
    }

    /**
     * GET /sheet/{sheetId}/forwardDependencies
     * For each formula cell => the set of cells it references.
     */
    @GetMapping("/{sheetId}/forwardDependencies")
    public ResponseEntity<Map<String, Set<String>>> getForwardDependencyGraph(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getForwardGraph(sheetId));
    }

    /**
     * GET /sheet/{sheetId}/reverseDependencies
     * For each referenced cell => the set of formula cells that read it.
     */
    @GetMapping("/{sheetId}/reverseDependencies")
    public ResponseEntity<Map<String, Set<String>>> getReverseDependencyGraph(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getReverseGraph(sheetId));
    }

    /**
     * POST /sheet/{sheetId}/recalculate?force=true
     * Recalculates the whole sheet.
     */
    @PostMapping("/{sheetId}/recalculate")
    public ResponseEntity<RecalcResult> recalculate(
            @PathVariable long sheetId,
            @RequestParam(defaultValue = "false") boolean force
    ) {
        return ResponseEntity.ok(sheetService.recalculate(sheetId, force));
    }

    /**
     * GET /sheet/functions
     * Name, arity, async flag and description of every registered function.
     */
    @GetMapping("/functions")
    public ResponseEntity<List<FunctionSpec>> listFunctions() {
        return ResponseEntity.ok(sheetService.listFunctions());
    }
}
