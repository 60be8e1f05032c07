package org.simplelang.compiler.frontend.parser.ast;

import org.simplelang.compiler.api.SourcePosition;
import org.simplelang.compiler.frontend.lexer.TokenType;

import java.util.List;

/**
 * A plain or compound assignment to a variable. Compound forms keep their operator
 * rather than being desugared.
 *
 * @param target The assigned variable.
 * @param operator One of {@code ASSIGN, PLUS_ASSIGN, MINUS_ASSIGN, STAR_ASSIGN, SLASH_ASSIGN}.
 * @param value The assigned expression.
 * @param position The position of the target identifier.
 */
public record AssignmentNode(
        IdentifierNode target,
        TokenType operator,
        ExpressionNode value,
        SourcePosition position
) implements StatementNode {

    public AssignmentNode {
        if (!operator.isAssignmentOperator()) {
            throw new IllegalArgumentException("Not an assignment operator: " + operator);
        }
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitAssignment(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(target, value);
    }
}
