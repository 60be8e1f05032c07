package org.simplelang.compiler.frontend.parser.ast;

import org.simplelang.compiler.api.SourcePosition;

import java.util.List;

/**
 * A {@code do ... jabtak (...);} loop.
 *
 * @param body The loop body.
 * @param condition The condition checked after each iteration.
 * @param position The position of the {@code do} keyword.
 */
public record DoWhileNode(
        StatementNode body,
        ExpressionNode condition,
        SourcePosition position
) implements StatementNode {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitDoWhile(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(body, condition);
    }
}
