package com.spreadsheet.formula.models;

import com.fasterxml.jackson.annotation.JsonValue;
import com.spreadsheet.formula.exceptions.InvalidAddressException;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Zero-based (row, column) coordinate of a single cell.
 * Text form is column letters followed by a 1-based row, e.g. "B12":
 * - letters are base-26 without a zero digit (A=1 .. Z=26, AA=27 ..)
 * - fromText(toText()) is the identity
 */
public final class CellAddress implements Comparable<CellAddress> {

    private static final Pattern ADDRESS_PATTERN = Pattern.compile("^([A-Z]+)([0-9]+)$");

    // Largest rectangle a single range may cover
    public static final long MAX_RANGE_CELLS = 1_000_000L;

    private final int row;
    private final int col;

    public CellAddress(int row, int col) {
        if (row < 0 || col < 0) {
            throw new InvalidAddressException("Negative coordinates: (" + row + ", " + col + ")");
        }
        this.row = row;
        this.col = col;
    }

    public static CellAddress of(int row, int col) {
        return new CellAddress(row, col);
    }

    /**
     * Parses "A1", "AA10", ... Throws InvalidAddressException for anything else,
     * including row "0" which has no zero-based counterpart.
     */
    public static CellAddress fromText(String text) {
        if (text == null) {
            throw new InvalidAddressException("Address is null");
        }
        Matcher matcher = ADDRESS_PATTERN.matcher(text);
        if (!matcher.matches()) {
            throw new InvalidAddressException("Invalid cell address: " + text);
        }
        int row;
        try {
            row = Integer.parseInt(matcher.group(2)) - 1;
        } catch (NumberFormatException e) {
            throw new InvalidAddressException("Row out of range in address: " + text);
        }
        if (row < 0) {
            throw new InvalidAddressException("Rows start at 1: " + text);
        }
        return new CellAddress(row, lettersToColumn(matcher.group(1)));
    }

    /**
     * Number of cells in the rectangle between two corners (inclusive), in any order.
     * Throws InvalidAddressException when it exceeds {@link #MAX_RANGE_CELLS}.
     */
    public static long checkRangeSize(int startRow, int startCol, int endRow, int endCol) {
        long rows = (long) Math.abs(endRow - startRow) + 1;
        long cols = (long) Math.abs(endCol - startCol) + 1;
        long cells = rows * cols;
        if (cells > MAX_RANGE_CELLS) {
            throw new InvalidAddressException("Range of " + rows + "x" + cols
                    + " cells is larger than the limit of " + MAX_RANGE_CELLS);
        }
        return cells;
    }

    public static boolean isAddress(String text) {
        return text != null && ADDRESS_PATTERN.matcher(text).matches();
    }

    /**
     * "A" -> 0, "Z" -> 25, "AA" -> 26.
     */
    public static int lettersToColumn(String letters) {
        int col = 0;
        for (int i = 0; i < letters.length(); i++) {
            col = col * 26 + (letters.charAt(i) - 'A' + 1);
        }
        return col - 1;
    }

    /**
     * 0 -> "A", 25 -> "Z", 26 -> "AA".
     */
    public static String columnToLetters(int col) {
        StringBuilder letters = new StringBuilder();
        int n = col + 1;
        while (n > 0) {
            int remainder = (n - 1) % 26;
            letters.insert(0, (char) ('A' + remainder));
            n = (n - 1) / 26;
        }
        return letters.toString();
    }

    public int getRow() {
        return row;
    }

    public int getCol() {
        return col;
    }

    @JsonValue
    public String toText() {
        return columnToLetters(col) + (row + 1);
    }

    @Override
    public int compareTo(CellAddress other) {
        if (row != other.row) {
            return Integer.compare(row, other.row);
        }
        return Integer.compare(col, other.col);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellAddress)) {
            return false;
        }
        CellAddress that = (CellAddress) o;
        return row == that.row && col == that.col;
    }

    @Override
    public int hashCode() {
        return Objects.hash(row, col);
    }

    @Override
    public String toString() {
        return toText();
    }
}
