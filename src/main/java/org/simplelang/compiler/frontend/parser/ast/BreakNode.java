package org.simplelang.compiler.frontend.parser.ast;

import org.simplelang.compiler.api.SourcePosition;

/**
 * A {@code break;} statement.
 *
 * @param position The position of the keyword.
 */
public record BreakNode(SourcePosition position) implements StatementNode {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitBreak(this);
    }
}
