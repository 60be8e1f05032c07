package org.simplelang.compiler.frontend.parser.ast;

import org.simplelang.compiler.api.SourcePosition;

import java.util.List;

/**
 * An array literal {@code [e1, e2, ...]}, possibly empty.
 *
 * @param elements The element expressions.
 * @param position The position of the opening bracket.
 */
public record ArrayLiteralNode(List<ExpressionNode> elements, SourcePosition position) implements ExpressionNode {

    public ArrayLiteralNode {
        elements = List.copyOf(elements);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitArrayLiteral(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(elements);
    }
}
