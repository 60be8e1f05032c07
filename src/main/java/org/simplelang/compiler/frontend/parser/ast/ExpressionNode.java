package org.simplelang.compiler.frontend.parser.ast;

/**
 * Marker for all expression nodes.
 */
public sealed interface ExpressionNode extends AstNode
        permits ConditionalNode, BinaryNode, UnaryNode, PostfixNode, LiteralNode, IdentifierNode, ArrayLiteralNode {
}
