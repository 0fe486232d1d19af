package com.spreadsheet.formula.services;

import com.spreadsheet.formula.config.FormulaEngineProperties;
import com.spreadsheet.formula.engine.FormulaEngine;
import com.spreadsheet.formula.engine.RecalcOptions;
import com.spreadsheet.formula.engine.RecalcResult;
import com.spreadsheet.formula.engine.functions.FunctionSpec;
import com.spreadsheet.formula.exceptions.CircularReferenceException;
import com.spreadsheet.formula.exceptions.SheetNotFoundException;
import com.spreadsheet.formula.models.Cell;
import com.spreadsheet.formula.models.CellAddress;
import com.spreadsheet.formula.models.CellValue;
import com.spreadsheet.formula.models.CellView;
import com.spreadsheet.formula.models.Sheet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Hosts sheets in memory and drives the formula engine after each edit:
 * parse the raw input, store it, recalculate from the edited cell,
 * and roll the edit back if it closes a reference cycle.
 */
@Service
public class SheetService {

    private static final Logger log = LoggerFactory.getLogger(SheetService.class);

    private static final Pattern NUMBER_PATTERN =
            Pattern.compile("^[+-]?([0-9]+\\.?[0-9]*|\\.[0-9]+)([eE][+-]?[0-9]+)?$");

    // All sheets live here in memory; no persistent storage
    private final Map<Long, Sheet> sheets = new ConcurrentHashMap<>();

    private final FormulaEngine engine;
    private final FormulaEngineProperties properties;

    public SheetService(FormulaEngine engine, FormulaEngineProperties properties) {
        this.engine = engine;
        this.properties = properties;
    }

    /**
     * Creates a new empty Sheet and returns its ID. Null bounds use the configured defaults.
     */
    public long createSheet(String name, Integer rows, Integer cols) {
        int rowCount = rows == null ? properties.getSheet().getDefaultRows() : rows;
        int colCount = cols == null ? properties.getSheet().getDefaultCols() : cols;
        Sheet sheet = new Sheet(name == null ? "Sheet" : name, rowCount, colCount);
        sheets.put(sheet.getId(), sheet);
        log.info("Created sheet {} ({}x{})", sheet.getId(), rowCount, colCount);
        return sheet.getId();
    }

    /**
     * Retrieves a Sheet by ID. Throws if not found.
     */
    public Sheet getSheet(long sheetId) {
        Sheet sheet = sheets.get(sheetId);
        if (sheet == null) {
            throw new SheetNotFoundException("Sheet not found: " + sheetId);
        }
        return sheet;
    }

    /**
     * Sets a cell's content with these steps:
     * 1) Parse the address (InvalidAddressException if malformed or out of bounds)
     * 2) Keep the old cell for revert
     * 3) Store a formula ("=...") or a literal; blank input clears the cell
     * 4) Recalculate starting from the edited cell
     * 5) On a circular reference, restore the old cell and rethrow
     */
    public RecalcResult setCellContent(long sheetId, String addressText, String rawValue) {
        Sheet sheet = getSheet(sheetId);
        CellAddress address = CellAddress.fromText(addressText.trim().toUpperCase());

        // Edits and the pass they trigger must not interleave with other writers
        sheet.getLock().writeLock().lock();
        try {
            Cell oldCell = snapshot(sheet.getCell(address));

            String raw = rawValue == null ? "" : rawValue.trim();
            if (raw.isEmpty()) {
                sheet.clearCell(address.getRow(), address.getCol());
            } else if (raw.startsWith("=")) {
                sheet.setFormula(address.getRow(), address.getCol(), raw);
            } else {
                sheet.setCell(address.getRow(), address.getCol(), parseLiteralValue(raw));
            }

            try {
                return engine.recalculate(sheet, address, RecalcOptions.defaults());
            } catch (CircularReferenceException ex) {
                if (oldCell == null) {
                    sheet.getCells().remove(address);
                } else {
                    sheet.getCells().put(address, oldCell);
                }
                throw ex;
            }
        } finally {
            sheet.getLock().writeLock().unlock();
        }
    }

    public RecalcResult clearCell(long sheetId, String addressText) {
        return setCellContent(sheetId, addressText, "");
    }

    /**
     * Copies 'from' into 'to'. Formulas have their relative references shifted
     * by the distance between the two cells; plain values are copied as they are.
     */
    public RecalcResult copyCell(long sheetId, String fromText, String toText) {
        Sheet sheet = getSheet(sheetId);
        CellAddress from = CellAddress.fromText(fromText.trim().toUpperCase());
        CellAddress to = CellAddress.fromText(toText.trim().toUpperCase());

        String content;
        sheet.getLock().readLock().lock();
        try {
            Cell source = sheet.getCell(from);
            if (source == null) {
                content = "";
            } else if (source.hasFormula()) {
                content = engine.adjustFormula(source.getFormula(), from.getRow(), from.getCol(),
                        to.getRow(), to.getCol());
            } else {
                content = source.getValue().asText();
            }
        } finally {
            sheet.getLock().readLock().unlock();
        }
        return setCellContent(sheetId, to.toText(), content);
    }

    /**
     * Recalculates the whole sheet; 'force' ignores cached values.
     */
    public RecalcResult recalculate(long sheetId, boolean force) {
        Sheet sheet = getSheet(sheetId);
        sheet.getLock().writeLock().lock();
        try {
            return engine.recalculate(sheet, null, new RecalcOptions(force, false));
        } finally {
            sheet.getLock().writeLock().unlock();
        }
    }

    /**
     * Returns address -> value for all stored cells, in row-major order.
     */
    public Map<String, Object> getSheetData(long sheetId) {
        Sheet sheet = getSheet(sheetId);

        sheet.getLock().readLock().lock();
        try {
            Map<String, Object> data = new LinkedHashMap<>();
            for (Map.Entry<CellAddress, Cell> entry : new TreeMap<>(sheet.getCells()).entrySet()) {
                data.put(entry.getKey().toText(), entry.getValue().getValue().toJson());
            }
            return data;
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    public CellView getCell(long sheetId, String addressText) {
        Sheet sheet = getSheet(sheetId);
        CellAddress address = CellAddress.fromText(addressText.trim().toUpperCase());
        sheet.getLock().readLock().lock();
        try {
            return new CellView(address, sheet.getCell(address));
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    /**
     * For each formula cell => the set of cells it references.
     */
    public Map<String, Set<String>> getForwardGraph(long sheetId) {
        Sheet sheet = getSheet(sheetId);
        sheet.getLock().readLock().lock();
        try {
            return engine.buildDependencyGraph(sheet).getEdges();
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    /**
     * For each referenced cell => the set of formula cells that read it.
     */
    public Map<String, Set<String>> getReverseGraph(long sheetId) {
        Sheet sheet = getSheet(sheetId);
        sheet.getLock().readLock().lock();
        try {
            return engine.buildDependencyGraph(sheet).reverse();
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    public List<FunctionSpec> listFunctions() {
        return engine.getRegistry().list();
    }

    // ----------------------------------------------------------------
    // Internal Helpers (used within this service only)
    // ----------------------------------------------------------------

    /**
     * Converts user input to a typed value:
     * TRUE/FALSE -> boolean, error codes -> error value, numbers -> number, anything else -> text.
     */
    static CellValue parseLiteralValue(String raw) {
        if ("true".equalsIgnoreCase(raw) || "false".equalsIgnoreCase(raw)) {
            return CellValue.bool(Boolean.parseBoolean(raw.toLowerCase()));
        }
        if (CellValue.isErrorCode(raw)) {
            return CellValue.error(raw);
        }
        if (NUMBER_PATTERN.matcher(raw).matches()) {
            double number = Double.parseDouble(raw);
            if (!Double.isInfinite(number)) {
                return CellValue.number(number);
            }
        }
        return CellValue.text(raw);
    }

    private static Cell snapshot(Cell cell) {
        if (cell == null) {
            return null;
        }
        Cell copy = new Cell(cell.getValue(), cell.getFormula(), cell.getType(), cell.getFormat());
        copy.setDirty(cell.isDirty());
        return copy;
    }
}
