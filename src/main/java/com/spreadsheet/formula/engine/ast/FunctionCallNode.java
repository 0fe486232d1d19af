package com.spreadsheet.formula.engine.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public final class FunctionCallNode extends AstNode {
    private final String name;
    private final List<AstNode> args;

    public FunctionCallNode(String name, List<AstNode> args) {
        this.name = name;
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
    }

    public String getName() {
        return name;
    }

    public List<AstNode> getArgs() {
        return args;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFunctionCall(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof FunctionCallNode)) {
            return false;
        }
        FunctionCallNode that = (FunctionCallNode) o;
        return name.equals(that.name) && args.equals(that.args);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, args);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name).append("(");
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(args.get(i));
        }
        return sb.append(")").toString();
    }
}
