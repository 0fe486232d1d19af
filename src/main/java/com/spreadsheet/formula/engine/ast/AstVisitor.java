package com.spreadsheet.formula.engine.ast;

public interface AstVisitor<R> {
    R visitLiteral(LiteralNode node);

    R visitCellRef(CellRefNode node);

    R visitRangeRef(RangeRefNode node);

    R visitBinaryOp(BinaryOpNode node);

    R visitUnaryOp(UnaryOpNode node);

    R visitFunctionCall(FunctionCallNode node);
}
