package org.simplelang.compiler.frontend.parser.ast;

import org.simplelang.compiler.api.SourcePosition;
import org.simplelang.compiler.frontend.lexer.TokenType;

import java.util.List;

/**
 * A binary operation.
 *
 * @param operator The operator token type, e.g. {@code PLUS} or {@code AND_AND}.
 * @param left The left operand.
 * @param right The right operand.
 * @param position The position of the left operand.
 */
public record BinaryNode(
        TokenType operator,
        ExpressionNode left,
        ExpressionNode right,
        SourcePosition position
) implements ExpressionNode {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitBinary(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(left, right);
    }
}
