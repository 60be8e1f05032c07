package org.simplelang.compiler.frontend.parser.ast;

import org.simplelang.compiler.api.SourcePosition;

import java.util.List;

/**
 * A {@code likho(x);} statement reading into a variable.
 *
 * @param target The variable that receives the input.
 * @param position The position of the keyword.
 */
public record InputNode(IdentifierNode target, SourcePosition position) implements StatementNode {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitInput(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(target);
    }
}
