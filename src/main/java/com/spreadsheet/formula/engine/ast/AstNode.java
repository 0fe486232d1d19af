package com.spreadsheet.formula.engine.ast;

/**
 * Node of a parsed formula. Trees are built bottom-up by the parser, so they are acyclic.
 * {@link #toString()} renders a prefix form such as "(+ 1 (* 2 3))" that makes
 * operator grouping visible.
 */
public abstract class AstNode {

    public abstract <R> R accept(AstVisitor<R> visitor);
}
