package org.simplelang.compiler.frontend.parser.ast;

import org.simplelang.compiler.api.SourcePosition;

import java.util.List;

/**
 * A {@code dikhao(...)} statement with one or more arguments.
 *
 * @param arguments The printed expressions, in order.
 * @param position The position of the keyword.
 */
public record PrintNode(List<ExpressionNode> arguments, SourcePosition position) implements StatementNode {

    public PrintNode {
        arguments = List.copyOf(arguments);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitPrint(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(arguments);
    }
}
