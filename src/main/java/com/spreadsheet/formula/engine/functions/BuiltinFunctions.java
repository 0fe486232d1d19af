package com.spreadsheet.formula.engine.functions;

import com.spreadsheet.formula.exceptions.EvaluationException;
import com.spreadsheet.formula.models.CellValue;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Built-in function library, grouped by family:
 * - aggregate/math: SUM, AVERAGE, MAX, MIN, ROUND, ABS, SQRT, POWER
 * - text: CONCATENATE, UPPER, LOWER, LEN, TEXT
 * - logical: IF, AND, OR, NOT, TRUE, FALSE
 * - informational: ISNUMBER, ISTEXT, ISBLANK
 * - lookup: VLOOKUP
 * - counting: COUNT, COUNTA
 *
 * Aggregates flatten ranges and nested ranges into one sequence and
 * silently skip anything that is not numeric.
 */
public final class BuiltinFunctions {

    // Beyond this many digits either way a double has nothing left to round
    private static final int MAX_ROUND_SCALE = 400;

    private BuiltinFunctions() {
    }

    public static void registerAll(FunctionRegistry registry) {
        registerMath(registry);
        registerText(registry);
        registerLogical(registry);
        registerInformational(registry);
        registerLookup(registry);
        registerCounting(registry);
    }

    // ----------------------------------------------------------------
    // Aggregate / math
    // ----------------------------------------------------------------

    static void registerMath(FunctionRegistry registry) {
        registry.register("SUM", args -> {
            double sum = 0;
            for (double n : flattenNumbers(args)) {
                sum += n;
            }
            return CellValue.number(sum);
        }, Arity.variadic(), "Adds all numbers");

        registry.register("AVERAGE", args -> {
            List<Double> nums = flattenNumbers(args);
            if (nums.isEmpty()) {
                return CellValue.number(0);
            }
            double sum = 0;
            for (double n : nums) {
                sum += n;
            }
            return CellValue.number(sum / nums.size());
        }, Arity.variadic(), "Arithmetic mean");

        registry.register("MAX", args -> {
            List<Double> nums = flattenNumbers(args);
            double max = nums.isEmpty() ? 0 : Double.NEGATIVE_INFINITY;
            for (double n : nums) {
                max = Math.max(max, n);
            }
            return CellValue.number(max);
        }, Arity.variadic(), "Largest value");

        registry.register("MIN", args -> {
            List<Double> nums = flattenNumbers(args);
            double min = nums.isEmpty() ? 0 : Double.POSITIVE_INFINITY;
            for (double n : nums) {
                min = Math.min(min, n);
            }
            return CellValue.number(min);
        }, Arity.variadic(), "Smallest value");

        // Half away from zero, in decimal so large values and long scales stay exact
        registry.register("ROUND", args -> {
            double value = args.get(0).toNumber();
            double decimals = args.size() > 1 ? args.get(1).toNumber() : 0;
            if (Double.isInfinite(value)) {
                throw new EvaluationException("ROUND of a non-finite number");
            }
            int scale = (int) Math.max(-MAX_ROUND_SCALE, Math.min(MAX_ROUND_SCALE, decimals));
            double rounded = BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
            return CellValue.number(rounded);
        }, Arity.between(1, 2), "Rounds a number to the given decimals");

        registry.register("ABS", args -> CellValue.number(Math.abs(args.get(0).toNumber())),
                Arity.exactly(1), "Absolute value");

        registry.register("SQRT", args -> {
            double value = args.get(0).toNumber();
            if (value < 0) {
                throw new EvaluationException("SQRT of negative number " + CellValue.formatNumber(value));
            }
            return CellValue.number(Math.sqrt(value));
        }, Arity.exactly(1), "Square root");

        registry.register("POWER", args -> CellValue.number(Math.pow(args.get(0).toNumber(), args.get(1).toNumber())),
                Arity.exactly(2), "Raises a number to a power");
    }

    // ----------------------------------------------------------------
    // Text
    // ----------------------------------------------------------------

    static void registerText(FunctionRegistry registry) {
        registry.register("CONCATENATE", args -> {
            StringBuilder sb = new StringBuilder();
            for (CellValue value : flatten(args)) {
                sb.append(value.asText());
            }
            return CellValue.text(sb.toString());
        }, Arity.variadic(), "Joins values as text");

        registry.register("UPPER", args -> CellValue.text(args.get(0).asText().toUpperCase()),
                Arity.exactly(1), "Converts text to upper case");

        registry.register("LOWER", args -> CellValue.text(args.get(0).asText().toLowerCase()),
                Arity.exactly(1), "Converts text to lower case");

        registry.register("LEN", args -> CellValue.number(args.get(0).asText().length()),
                Arity.exactly(1), "Number of characters");

        registry.register("TEXT", args -> {
            CellValue value = args.get(0);
            String pattern = args.size() > 1 ? args.get(1).asText() : "";
            if (value.isNumber() && !pattern.isEmpty()) {
                try {
                    DecimalFormat format = new DecimalFormat(pattern, DecimalFormatSymbols.getInstance(Locale.ROOT));
                    return CellValue.text(format.format(value.getNumber()));
                } catch (IllegalArgumentException e) {
                    throw new EvaluationException("Invalid number pattern: " + pattern, e);
                }
            }
            return CellValue.text(value.asText());
        }, Arity.between(1, 2), "Formats a value as text");
    }

    // ----------------------------------------------------------------
    // Logical
    // ----------------------------------------------------------------

    static void registerLogical(FunctionRegistry registry) {
        // Both branches are already evaluated by the time IF runs
        registry.register("IF", args -> {
            if (args.get(0).isTruthy()) {
                return args.get(1);
            }
            return args.size() > 2 ? args.get(2) : CellValue.bool(false);
        }, Arity.between(2, 3), "Conditional choice");

        registry.register("AND", args -> {
            for (CellValue value : flatten(args)) {
                if (!value.isTruthy()) {
                    return CellValue.bool(false);
                }
            }
            return CellValue.bool(true);
        }, Arity.variadic(), "True when every argument is truthy");

        registry.register("OR", args -> {
            for (CellValue value : flatten(args)) {
                if (value.isTruthy()) {
                    return CellValue.bool(true);
                }
            }
            return CellValue.bool(false);
        }, Arity.variadic(), "True when any argument is truthy");

        registry.register("NOT", args -> CellValue.bool(!args.get(0).isTruthy()),
                Arity.exactly(1), "Logical negation");

        registry.register("TRUE", args -> CellValue.bool(true), Arity.exactly(0), "The boolean TRUE");

        registry.register("FALSE", args -> CellValue.bool(false), Arity.exactly(0), "The boolean FALSE");
    }

    // ----------------------------------------------------------------
    // Informational
    // ----------------------------------------------------------------

    static void registerInformational(FunctionRegistry registry) {
        registry.register("ISNUMBER", args -> CellValue.bool(args.get(0).isNumber()),
                Arity.exactly(1), "Checks whether a value is a number");

        registry.register("ISTEXT", args -> CellValue.bool(args.get(0).isText()),
                Arity.exactly(1), "Checks whether a value is text");

        registry.register("ISBLANK", args -> CellValue.bool(args.get(0).isBlank()),
                Arity.exactly(1), "Checks whether a value is empty");
    }

    // ----------------------------------------------------------------
    // Lookup
    // ----------------------------------------------------------------

    /**
     * VLOOKUP(target, table, columnIndex, exactMatch = TRUE).
     * Exact mode returns the first row whose first column equals the target.
     * Approximate mode is NOT the usual sorted nearest-match search: it returns
     * the first row whose first column, as text, contains the target as text.
     * Misses, out-of-table column indexes and blank results give #N/D.
     */
    static void registerLookup(FunctionRegistry registry) {
        registry.register("VLOOKUP", args -> {
            CellValue target = args.get(0);
            CellValue table = args.get(1);
            if (!table.isRange()) {
                throw new EvaluationException("VLOOKUP expects a range as its table argument");
            }
            int column = (int) args.get(2).toNumber();
            boolean exact = args.size() < 4 || args.get(3).isTruthy();

            for (List<CellValue> row : table.getRows()) {
                CellValue first = row.get(0);
                boolean match = exact
                        ? first.equals(target)
                        : first.asText().contains(target.asText());
                if (match) {
                    if (column < 1 || column > row.size()) {
                        return CellValue.notFound();
                    }
                    CellValue found = row.get(column - 1);
                    return found.isBlank() ? CellValue.notFound() : found;
                }
            }
            return CellValue.notFound();
        }, Arity.between(3, 4), "Vertical lookup");
    }

    // ----------------------------------------------------------------
    // Counting
    // ----------------------------------------------------------------

    static void registerCounting(FunctionRegistry registry) {
        registry.register("COUNT", args -> CellValue.number(flattenNumbers(args).size()),
                Arity.variadic(), "Counts numeric values");

        registry.register("COUNTA", args -> {
            int count = 0;
            for (CellValue value : flatten(args)) {
                if (!value.isBlank()) {
                    count++;
                }
            }
            return CellValue.number(count);
        }, Arity.variadic(), "Counts non-blank values");
    }

    // ----------------------------------------------------------------
    // Helpers
    // ----------------------------------------------------------------

    /**
     * Arguments with every range (at any depth) replaced by its values, row by row.
     */
    public static List<CellValue> flatten(List<CellValue> args) {
        List<CellValue> result = new ArrayList<>();
        for (CellValue arg : args) {
            flattenInto(arg, result);
        }
        return result;
    }

    public static List<Double> flattenNumbers(List<CellValue> args) {
        List<Double> result = new ArrayList<>();
        for (CellValue value : flatten(args)) {
            Double number = value.numericOrNull();
            if (number != null) {
                result.add(number);
            }
        }
        return result;
    }

    private static void flattenInto(CellValue value, List<CellValue> out) {
        if (value.isRange()) {
            for (List<CellValue> row : value.getRows()) {
                for (CellValue item : row) {
                    flattenInto(item, out);
                }
            }
        } else {
            out.add(value);
        }
    }
}
