package org.simplelang.compiler.frontend.parser.ast;

import org.simplelang.compiler.api.SourcePosition;

import java.util.List;

/**
 * An {@code agr} statement.
 *
 * @param condition The condition.
 * @param thenBranch The statement executed when the condition holds.
 * @param elseBranch The {@code varna} statement, or null if there is none.
 * @param position The position of the {@code agr} keyword.
 */
public record IfNode(
        ExpressionNode condition,
        StatementNode thenBranch,
        StatementNode elseBranch,
        SourcePosition position
) implements StatementNode {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitIf(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return elseBranch == null
                ? List.of(condition, thenBranch)
                : List.of(condition, thenBranch, elseBranch);
    }
}
