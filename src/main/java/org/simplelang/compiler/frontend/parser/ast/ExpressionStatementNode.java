package org.simplelang.compiler.frontend.parser.ast;

import org.simplelang.compiler.api.SourcePosition;

import java.util.List;

/**
 * An expression evaluated for its effect, e.g. {@code i++;} or {@code f(x);}.
 *
 * @param expression The expression.
 * @param position The position of the expression.
 */
public record ExpressionStatementNode(ExpressionNode expression, SourcePosition position) implements StatementNode {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitExpressionStatement(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(expression);
    }
}
