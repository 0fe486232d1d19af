package com.spreadsheet.formula.engine.ast;

import java.util.Objects;

public final class CellRefNode extends AstNode {
    private final String address;

    public CellRefNode(String address) {
        this.address = address;
    }

    public String getAddress() {
        return address;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitCellRef(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CellRefNode && address.equals(((CellRefNode) o).address);
    }

    @Override
    public int hashCode() {
        return Objects.hash(address);
    }

    @Override
    public String toString() {
        return address;
    }
}
