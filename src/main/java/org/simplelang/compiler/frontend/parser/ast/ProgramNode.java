package org.simplelang.compiler.frontend.parser.ast;

import org.simplelang.compiler.api.SourcePosition;

import java.util.List;

/**
 * The root of every parse: the top-level statements of one source buffer, in source order.
 *
 * @param statements The top-level statements. Empty for an empty program.
 * @param position The position of the first token (1:1 for an empty program).
 */
public record ProgramNode(
        List<StatementNode> statements,
        SourcePosition position
) implements AstNode {

    public ProgramNode {
        statements = List.copyOf(statements);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitProgram(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(statements);
    }
}
