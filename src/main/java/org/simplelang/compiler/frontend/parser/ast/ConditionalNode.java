package org.simplelang.compiler.frontend.parser.ast;

import org.simplelang.compiler.api.SourcePosition;

import java.util.List;

/**
 * A ternary {@code condition ? thenValue : elseValue} expression.
 *
 * @param condition The condition.
 * @param thenValue The value if the condition holds.
 * @param elseValue The value otherwise.
 * @param position The position of the condition.
 */
public record ConditionalNode(
        ExpressionNode condition,
        ExpressionNode thenValue,
        ExpressionNode elseValue,
        SourcePosition position
) implements ExpressionNode {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitConditional(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(condition, thenValue, elseValue);
    }
}
