package com.spreadsheet.formula.engine;

import com.spreadsheet.formula.engine.ast.AstNode;
import com.spreadsheet.formula.engine.ast.AstVisitor;
import com.spreadsheet.formula.engine.ast.BinaryOpNode;
import com.spreadsheet.formula.engine.ast.CellRefNode;
import com.spreadsheet.formula.engine.ast.FunctionCallNode;
import com.spreadsheet.formula.engine.ast.LiteralNode;
import com.spreadsheet.formula.engine.ast.RangeRefNode;
import com.spreadsheet.formula.engine.ast.UnaryOpNode;
import com.spreadsheet.formula.engine.functions.FunctionRegistry;
import com.spreadsheet.formula.engine.functions.FunctionSpec;
import com.spreadsheet.formula.exceptions.EvaluationException;
import com.spreadsheet.formula.exceptions.UnknownFunctionException;
import com.spreadsheet.formula.models.CellAddress;
import com.spreadsheet.formula.models.CellValue;
import com.spreadsheet.formula.models.Sheet;
import com.spreadsheet.formula.models.ValueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Tree-walk evaluator. Reads cell values from the sheet and calls functions
 * from the registry it was built with; never writes to the sheet.
 * Operator coercions:
 * - arithmetic converts both sides with {@link CellValue#toNumber()}
 * - an error operand is passed through unchanged
 * - "/" and "%" by zero give #DIV/0!
 * - ranges are only valid as function arguments
 */
public class FormulaEvaluator {

    private static final Logger log = LoggerFactory.getLogger(FormulaEvaluator.class);

    private final FunctionRegistry registry;

    public FormulaEvaluator(FunctionRegistry registry) {
        this.registry = registry;
    }

    public CellValue evaluate(AstNode node, Sheet sheet) {
        return evaluate(node, sheet, new HashSet<>());
    }

    /**
     * Evaluates 'node', adding every address it actually reads to 'reads'.
     */
    public CellValue evaluate(AstNode node, Sheet sheet, Set<CellAddress> reads) {
        return node.accept(new Walker(sheet, reads));
    }

    private final class Walker implements AstVisitor<CellValue> {
        private final Sheet sheet;
        private final Set<CellAddress> reads;

        Walker(Sheet sheet, Set<CellAddress> reads) {
            this.sheet = sheet;
            this.reads = reads;
        }

        @Override
        public CellValue visitLiteral(LiteralNode node) {
            return node.getValue();
        }

        @Override
        public CellValue visitCellRef(CellRefNode node) {
            CellAddress address = CellAddress.fromText(node.getAddress());
            reads.add(address);
            return sheet.getCellValue(address.getRow(), address.getCol());
        }

        @Override
        public CellValue visitRangeRef(RangeRefNode node) {
            CellAddress start = CellAddress.fromText(node.getStartAddress());
            CellAddress end = CellAddress.fromText(node.getEndAddress());
            reads.addAll(ReferenceExtractor.expandRange(start, end));
            return CellValue.range(sheet.getRange(start.getRow(), start.getCol(), end.getRow(), end.getCol()));
        }

        @Override
        public CellValue visitBinaryOp(BinaryOpNode node) {
            CellValue left = node.getLeft().accept(this);
            CellValue right = node.getRight().accept(this);
            return applyBinary(node.getOperator(), left, right);
        }

        @Override
        public CellValue visitUnaryOp(UnaryOpNode node) {
            CellValue operand = node.getOperand().accept(this);
            return applyUnary(node.getOperator(), operand);
        }

        @Override
        public CellValue visitFunctionCall(FunctionCallNode node) {
            FunctionSpec spec = registry.get(node.getName());
            if (spec == null) {
                throw new UnknownFunctionException(node.getName());
            }
            if (!spec.getArity().accepts(node.getArgs().size())) {
                throw new EvaluationException(spec.getName() + " expects " + spec.getArity()
                        + " argument(s), got " + node.getArgs().size());
            }

            // Strictly left to right, one at a time
            List<CellValue> args = new ArrayList<>(node.getArgs().size());
            for (AstNode arg : node.getArgs()) {
                args.add(arg.accept(this));
            }

            if (spec.isAsync()) {
                log.debug("Waiting for async function {}", spec.getName());
            }
            CellValue result = spec.invoke(args);
            if (result == null) {
                throw new EvaluationException("Function " + spec.getName() + " returned no value");
            }
            return result;
        }
    }

    static CellValue applyBinary(String operator, CellValue left, CellValue right) {
        if (left.isRange() || right.isRange()) {
            throw new EvaluationException("Operator " + operator + " cannot be applied to a range");
        }
        if (left.isError()) {
            return left;
        }
        if (right.isError()) {
            return right;
        }

        switch (operator) {
            case "+":
                return CellValue.number(left.toNumber() + right.toNumber());
            case "-":
                return CellValue.number(left.toNumber() - right.toNumber());
            case "*":
                return CellValue.number(left.toNumber() * right.toNumber());
            case "/": {
                double divisor = right.toNumber();
                double dividend = left.toNumber();
                if (divisor == 0) {
                    return CellValue.divZero();
                }
                return CellValue.number(dividend / divisor);
            }
            case "%": {
                double divisor = right.toNumber();
                double dividend = left.toNumber();
                if (divisor == 0) {
                    return CellValue.divZero();
                }
                return CellValue.number(dividend % divisor);
            }
            case "^":
                return CellValue.number(Math.pow(left.toNumber(), right.toNumber()));
            case "=":
                return CellValue.bool(valuesEqual(left, right));
            case "<>":
                return CellValue.bool(!valuesEqual(left, right));
            case "<":
                return CellValue.bool(compareOrdered(operator, left, right) < 0);
            case ">":
                return CellValue.bool(compareOrdered(operator, left, right) > 0);
            case "<=":
                return CellValue.bool(compareOrdered(operator, left, right) <= 0);
            case ">=":
                return CellValue.bool(compareOrdered(operator, left, right) >= 0);
            default:
                throw new EvaluationException("Unknown operator: " + operator);
        }
    }

    static CellValue applyUnary(String operator, CellValue operand) {
        if (operand.isRange()) {
            throw new EvaluationException("Operator " + operator + " cannot be applied to a range");
        }
        if (operand.isError()) {
            return operand;
        }
        switch (operator) {
            case "-":
                return CellValue.number(-operand.toNumber());
            case "+":
                return CellValue.number(operand.toNumber());
            default:
                throw new EvaluationException("Unknown unary operator: " + operator);
        }
    }

    // Empty takes the kind of the other side: 0 next to a number, "" next to text
    private static CellValue alignEmpty(CellValue value, CellValue other) {
        if (!value.isEmpty()) {
            return value;
        }
        if (other.isNumber()) {
            return CellValue.number(0);
        }
        if (other.isText()) {
            return CellValue.text("");
        }
        if (other.isBoolean()) {
            return CellValue.bool(false);
        }
        return value;
    }

    private static boolean valuesEqual(CellValue left, CellValue right) {
        CellValue a = alignEmpty(left, right);
        CellValue b = alignEmpty(right, left);
        if (a.getType() != b.getType()) {
            return false;
        }
        if (a.isNumber()) {
            return a.getNumber() == b.getNumber();
        }
        return a.equals(b);
    }

    private static int compareOrdered(String operator, CellValue left, CellValue right) {
        CellValue a = alignEmpty(left, right);
        CellValue b = alignEmpty(right, left);
        if (a.getType() != b.getType()) {
            throw new EvaluationException("Cannot compare " + left.getType() + " with " + right.getType()
                    + " using " + operator);
        }
        ValueType type = a.getType();
        switch (type) {
            case NUMBER:
                return Double.compare(a.getNumber(), b.getNumber());
            case TEXT:
                return a.getText().compareTo(b.getText());
            case BOOLEAN:
                return Boolean.compare(a.getBoolean(), b.getBoolean());
            case EMPTY:
                return 0;
            default:
                throw new EvaluationException("Cannot order values of type " + type);
        }
    }
}
