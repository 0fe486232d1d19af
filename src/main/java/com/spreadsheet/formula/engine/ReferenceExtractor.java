package com.spreadsheet.formula.engine;

import com.spreadsheet.formula.exceptions.InvalidAddressException;
import com.spreadsheet.formula.models.CellAddress;

import java.util.ArrayList;
import java.util.List;

/**
 * Lists the cells a formula reads, for dependency tracking.
 * Works on tokens only (no parse), so it also sees references inside
 * formulas that would fail to parse.
 */
public final class ReferenceExtractor {

    private final FormulaLexer lexer;

    public ReferenceExtractor(FormulaLexer lexer) {
        this.lexer = lexer;
    }

    /**
     * Addresses in formula order, ranges expanded row-major:
     * "=SUM(A1:B2)" -> [A1, B1, A2, B2].
     */
    public List<CellAddress> extractAddresses(String formula) {
        List<CellAddress> refs = new ArrayList<>();
        for (Token token : lexer.tokenize(formula)) {
            if (token.is(TokenType.CELL_REF)) {
                refs.add(CellAddress.fromText(token.getText()));
            } else if (token.is(TokenType.RANGE_REF)) {
                String[] corners = token.getText().split(":", -1);
                if (corners.length != 2) {
                    throw new InvalidAddressException("Malformed range: " + token.getText());
                }
                refs.addAll(expandRange(CellAddress.fromText(corners[0]), CellAddress.fromText(corners[1])));
            }
        }
        return refs;
    }

    public List<String> extractReferences(String formula) {
        List<String> refs = new ArrayList<>();
        for (CellAddress address : extractAddresses(formula)) {
            refs.add(address.toText());
        }
        return refs;
    }

    /**
     * Every address of the rectangle spanned by two corners, top row first,
     * left to right. Corners may be given in any order. Oversized ranges
     * throw InvalidAddressException.
     */
    public static List<CellAddress> expandRange(CellAddress from, CellAddress to) {
        int top = Math.min(from.getRow(), to.getRow());
        int bottom = Math.max(from.getRow(), to.getRow());
        int left = Math.min(from.getCol(), to.getCol());
        int right = Math.max(from.getCol(), to.getCol());

        long size = CellAddress.checkRangeSize(top, left, bottom, right);
        List<CellAddress> cells = new ArrayList<>((int) size);
        for (int r = top; r <= bottom; r++) {
            for (int c = left; c <= right; c++) {
                cells.add(new CellAddress(r, c));
            }
        }
        return cells;
    }
}
