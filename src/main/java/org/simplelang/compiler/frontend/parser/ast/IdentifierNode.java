package org.simplelang.compiler.frontend.parser.ast;

import org.simplelang.compiler.api.SourcePosition;

/**
 * An AST node that represents a reference to a variable.
 *
 * @param name The identifier text.
 * @param position The position of the identifier token.
 */
public record IdentifierNode(String name, SourcePosition position) implements ExpressionNode {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitIdentifier(this);
    }
}
