package com.spreadsheet.formula.models;

import com.fasterxml.jackson.annotation.JsonValue;
import com.spreadsheet.formula.exceptions.EvaluationException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable tagged value: empty, number, text, boolean, error marker or a
 * rectangular block of values (only while a range is handed to a function).
 * Coercions used by operators and functions live here so they are spelled
 * out in one place.
 */
public final class CellValue {

    public static final String DIV_ZERO = "#DIV/0!";
    public static final String GENERIC_ERROR = "#ERROR!";
    public static final String NOT_FOUND = "#N/D";

    private static final CellValue EMPTY_VALUE = new CellValue(ValueType.EMPTY, null);
    private static final CellValue TRUE_VALUE = new CellValue(ValueType.BOOLEAN, Boolean.TRUE);
    private static final CellValue FALSE_VALUE = new CellValue(ValueType.BOOLEAN, Boolean.FALSE);

    private final ValueType type;
    // Double, String, Boolean or List<List<CellValue>> depending on type
    private final Object payload;

    private CellValue(ValueType type, Object payload) {
        this.type = type;
        this.payload = payload;
    }

    public static CellValue empty() {
        return EMPTY_VALUE;
    }

    public static CellValue number(double value) {
        return new CellValue(ValueType.NUMBER, value);
    }

    public static CellValue text(String value) {
        return new CellValue(ValueType.TEXT, Objects.requireNonNull(value, "text"));
    }

    public static CellValue bool(boolean value) {
        return value ? TRUE_VALUE : FALSE_VALUE;
    }

    public static CellValue error(String code) {
        return new CellValue(ValueType.ERROR, Objects.requireNonNull(code, "code"));
    }

    public static CellValue divZero() {
        return error(DIV_ZERO);
    }

    public static CellValue genericError() {
        return error(GENERIC_ERROR);
    }

    public static CellValue notFound() {
        return error(NOT_FOUND);
    }

    public static CellValue range(List<List<CellValue>> rows) {
        List<List<CellValue>> copy = new ArrayList<>(rows.size());
        for (List<CellValue> row : rows) {
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        return new CellValue(ValueType.RANGE, Collections.unmodifiableList(copy));
    }

    public static boolean isErrorCode(String text) {
        return DIV_ZERO.equals(text) || GENERIC_ERROR.equals(text) || NOT_FOUND.equals(text);
    }

    public ValueType getType() {
        return type;
    }

    public boolean isEmpty() {
        return type == ValueType.EMPTY;
    }

    public boolean isNumber() {
        return type == ValueType.NUMBER;
    }

    public boolean isText() {
        return type == ValueType.TEXT;
    }

    public boolean isBoolean() {
        return type == ValueType.BOOLEAN;
    }

    public boolean isError() {
        return type == ValueType.ERROR;
    }

    public boolean isRange() {
        return type == ValueType.RANGE;
    }

    /**
     * Empty cells and empty strings both count as blank.
     */
    public boolean isBlank() {
        return isEmpty() || (isText() && ((String) payload).isEmpty());
    }

    public double getNumber() {
        requireType(ValueType.NUMBER);
        return (Double) payload;
    }

    public String getText() {
        requireType(ValueType.TEXT);
        return (String) payload;
    }

    public boolean getBoolean() {
        requireType(ValueType.BOOLEAN);
        return (Boolean) payload;
    }

    public String getErrorCode() {
        requireType(ValueType.ERROR);
        return (String) payload;
    }

    @SuppressWarnings("unchecked")
    public List<List<CellValue>> getRows() {
        requireType(ValueType.RANGE);
        return (List<List<CellValue>>) payload;
    }

    /**
     * Operator coercion: empty is 0, booleans are 1/0, numeric text is parsed.
     * Anything else (non-numeric text, errors, ranges) cannot take part in arithmetic.
     */
    public double toNumber() {
        switch (type) {
            case NUMBER:
                return (Double) payload;
            case EMPTY:
                return 0;
            case BOOLEAN:
                return ((Boolean) payload) ? 1 : 0;
            case TEXT:
                Double parsed = parseNumber((String) payload);
                if (parsed == null) {
                    throw new EvaluationException("Expected a number, got text \"" + payload + "\"");
                }
                return parsed;
            case RANGE:
                throw new EvaluationException("A range cannot be used as a single value");
            default:
                throw new EvaluationException("Expected a number, got " + type);
        }
    }

    /**
     * Value as seen by aggregate functions: numbers, and text that is a number
     * in its entirety. Everything else yields null and is skipped by the caller.
     */
    public Double numericOrNull() {
        if (isNumber()) {
            return (Double) payload;
        }
        if (isText()) {
            return parseNumber((String) payload);
        }
        return null;
    }

    public boolean isTruthy() {
        switch (type) {
            case BOOLEAN:
                return (Boolean) payload;
            case NUMBER:
                return (Double) payload != 0;
            case TEXT:
                return !((String) payload).isEmpty();
            default:
                return false;
        }
    }

    public String asText() {
        switch (type) {
            case EMPTY:
                return "";
            case NUMBER:
                return formatNumber((Double) payload);
            case TEXT:
            case ERROR:
                return (String) payload;
            case BOOLEAN:
                return ((Boolean) payload) ? "TRUE" : "FALSE";
            default:
                throw new EvaluationException("A range cannot be converted to text");
        }
    }

    /**
     * Plain JSON form: number, string, boolean, error code, null or nested arrays.
     */
    @JsonValue
    public Object toJson() {
        if (type == ValueType.EMPTY) {
            return null;
        }
        return payload;
    }

    public static String formatNumber(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private static Double parseNumber(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        try {
            double parsed = Double.parseDouble(trimmed);
            return Double.isNaN(parsed) || Double.isInfinite(parsed) ? null : parsed;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private void requireType(ValueType expected) {
        if (type != expected) {
            throw new EvaluationException("Expected " + expected + " value, got " + type);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellValue)) {
            return false;
        }
        CellValue that = (CellValue) o;
        return type == that.type && Objects.equals(payload, that.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, payload);
    }

    @Override
    public String toString() {
        if (type == ValueType.RANGE) {
            return "RANGE" + payload;
        }
        return type + "(" + asText() + ")";
    }
}
