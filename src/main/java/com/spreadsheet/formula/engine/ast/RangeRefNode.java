package com.spreadsheet.formula.engine.ast;

import java.util.Objects;

public final class RangeRefNode extends AstNode {
    private final String startAddress;
    private final String endAddress;

    public RangeRefNode(String startAddress, String endAddress) {
        this.startAddress = startAddress;
        this.endAddress = endAddress;
    }

    public String getStartAddress() {
        return startAddress;
    }

    public String getEndAddress() {
        return endAddress;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitRangeRef(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof RangeRefNode)) {
            return false;
        }
        RangeRefNode that = (RangeRefNode) o;
        return startAddress.equals(that.startAddress) && endAddress.equals(that.endAddress);
    }

    @Override
    public int hashCode() {
        return Objects.hash(startAddress, endAddress);
    }

    @Override
    public String toString() {
        return startAddress + ":" + endAddress;
    }
}
