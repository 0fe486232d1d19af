package com.spreadsheet.formula.engine.ast;

import java.util.Objects;

public final class UnaryOpNode extends AstNode {
    private final String operator;
    private final AstNode operand;

    public UnaryOpNode(String operator, AstNode operand) {
        this.operator = operator;
        this.operand = operand;
    }

    public String getOperator() {
        return operator;
    }

    public AstNode getOperand() {
        return operand;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitUnaryOp(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof UnaryOpNode)) {
            return false;
        }
        UnaryOpNode that = (UnaryOpNode) o;
        return operator.equals(that.operator) && operand.equals(that.operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, operand);
    }

    @Override
    public String toString() {
        return "(" + operator + " " + operand + ")";
    }
}
