package com.spreadsheet.formula.engine.ast;

import java.util.Objects;

public final class BinaryOpNode extends AstNode {
    private final String operator;
    private final AstNode left;
    private final AstNode right;

    public BinaryOpNode(String operator, AstNode left, AstNode right) {
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    public String getOperator() {
        return operator;
    }

    public AstNode getLeft() {
        return left;
    }

    public AstNode getRight() {
        return right;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitBinaryOp(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof BinaryOpNode)) {
            return false;
        }
        BinaryOpNode that = (BinaryOpNode) o;
        return operator.equals(that.operator) && left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, left, right);
    }

    @Override
    public String toString() {
        return "(" + operator + " " + left + " " + right + ")";
    }
}
