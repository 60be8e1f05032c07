package org.simplelang.compiler.frontend.parser.ast;

import org.simplelang.compiler.api.SourcePosition;

import java.util.List;

/**
 * A {@code jabtak} loop.
 *
 * @param condition The loop condition.
 * @param body The loop body.
 * @param position The position of the {@code jabtak} keyword.
 */
public record WhileNode(
        ExpressionNode condition,
        StatementNode body,
        SourcePosition position
) implements StatementNode {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitWhile(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(condition, body);
    }
}
