package org.simplelang.compiler.frontend.parser.ast;

import org.simplelang.compiler.api.SourcePosition;

import java.util.List;

/**
 * A braced statement list. {@code {}} is a valid block with no statements.
 *
 * @param statements The statements inside the braces.
 * @param position The position of the opening brace.
 */
public record BlockNode(
        List<StatementNode> statements,
        SourcePosition position
) implements StatementNode {

    public BlockNode {
        statements = List.copyOf(statements);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitBlock(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(statements);
    }
}
