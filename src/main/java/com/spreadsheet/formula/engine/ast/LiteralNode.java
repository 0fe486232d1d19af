package com.spreadsheet.formula.engine.ast;

import com.spreadsheet.formula.models.CellValue;

import java.util.Objects;

public final class LiteralNode extends AstNode {
    private final CellValue value;

    public LiteralNode(CellValue value) {
        this.value = value;
    }

    public CellValue getValue() {
        return value;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof LiteralNode && value.equals(((LiteralNode) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return value.isText() ? "\"" + value.getText() + "\"" : value.asText();
    }
}
