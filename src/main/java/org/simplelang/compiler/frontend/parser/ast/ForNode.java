package org.simplelang.compiler.frontend.parser.ast;

import org.simplelang.compiler.api.SourcePosition;

import java.util.ArrayList;
import java.util.List;

/**
 * A {@code tabtak} loop.
 *
 * @param init The init clause: a {@link DeclarationNode}, an {@link AssignmentNode} or an
 *             {@link ExpressionStatementNode} holding an increment or decrement. Null if empty.
 * @param condition The loop condition, or null if empty.
 * @param update The update clauses, each an {@link AssignmentNode} or an
 *               {@link ExpressionStatementNode}. Empty if there are none.
 * @param body The loop body.
 * @param position The position of the {@code tabtak} keyword.
 */
public record ForNode(
        StatementNode init,
        ExpressionNode condition,
        List<StatementNode> update,
        StatementNode body,
        SourcePosition position
) implements StatementNode {

    public ForNode {
        update = List.copyOf(update);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFor(this);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        if (init != null) children.add(init);
        if (condition != null) children.add(condition);
        children.addAll(update);
        children.add(body);
        return children;
    }
}
