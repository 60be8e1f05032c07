package org.simplelang.compiler.frontend.parser.ast;

import org.simplelang.compiler.api.SourcePosition;
import org.simplelang.compiler.frontend.lexer.TokenType;

import java.util.List;

/**
 * A prefix operation: {@code !x}, {@code -x}, {@code +x}, {@code ++x} or {@code --x}.
 * Postfix increments are represented by {@link PostfixNode}.
 *
 * @param operator The operator token type.
 * @param operand The operand.
 * @param prefix Always true for nodes built by the parser.
 * @param position The position of the operator.
 */
public record UnaryNode(
        TokenType operator,
        ExpressionNode operand,
        boolean prefix,
        SourcePosition position
) implements ExpressionNode {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitUnary(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(operand);
    }
}
