package org.simplelang.compiler.frontend.parser.ast;

import org.simplelang.compiler.api.SourcePosition;

import java.util.Collections;
import java.util.List;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST).
 * <p>
 * The set of node types is closed: every consumer that must handle each variant implements
 * {@link AstVisitor}, so adding a production forces every visitor to be updated.
 * Nodes are immutable records, compared by structure and position.
 */
public sealed interface AstNode permits ProgramNode, StatementNode, ExpressionNode {

    /**
     * Returns the position of the leftmost token of this node.
     * @return The source position.
     */
    SourcePosition position();

    /**
     * Dispatches to the visitor method for this node type.
     * @param visitor The visitor.
     * @param <R> The visitor's result type.
     * @return The visitor's result.
     */
    <R> R accept(AstVisitor<R> visitor);

    /**
     * Returns a list of the direct child nodes.
     * Lets generic code traverse the tree without knowing the structure of each node.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    default List<AstNode> getChildren() {
        return Collections.emptyList();
    }
}
