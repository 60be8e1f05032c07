package org.simplelang.compiler.frontend.parser.ast;

import org.simplelang.compiler.api.SourcePosition;

/**
 * A {@code continue;} statement.
 *
 * @param position The position of the keyword.
 */
public record ContinueNode(SourcePosition position) implements StatementNode {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitContinue(this);
    }
}
