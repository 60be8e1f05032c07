package org.simplelang.compiler.frontend.parser.ast;

import org.simplelang.compiler.api.SourcePosition;

import java.util.List;

/**
 * A {@code return} statement.
 *
 * @param value The returned expression, or null for a bare {@code return;}.
 * @param position The position of the keyword.
 */
public record ReturnNode(ExpressionNode value, SourcePosition position) implements StatementNode {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitReturn(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return value == null ? List.of() : List.of(value);
    }
}
