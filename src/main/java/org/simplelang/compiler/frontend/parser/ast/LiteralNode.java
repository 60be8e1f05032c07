package org.simplelang.compiler.frontend.parser.ast;

import org.simplelang.compiler.api.SourcePosition;

/**
 * A literal value.
 *
 * @param kind The literal kind.
 * @param value The decoded value; its Java type is given by {@link LiteralKind}.
 * @param position The position of the literal token.
 */
public record LiteralNode(LiteralKind kind, Object value, SourcePosition position) implements ExpressionNode {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }
}
