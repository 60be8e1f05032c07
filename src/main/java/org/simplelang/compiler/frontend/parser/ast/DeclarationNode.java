package org.simplelang.compiler.frontend.parser.ast;

import org.simplelang.compiler.api.SourcePosition;

import java.util.List;

/**
 * A variable declaration such as {@code int[] xs = [1, 2];}.
 *
 * @param type The declared type.
 * @param name The variable name.
 * @param initializer The initial value, or null if the declaration has none.
 * @param position The position of the type keyword.
 */
public record DeclarationNode(
        TypeSpec type,
        String name,
        ExpressionNode initializer,
        SourcePosition position
) implements StatementNode {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitDeclaration(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return initializer == null ? List.of() : List.of(initializer);
    }
}
