package org.simplelang.compiler.frontend.parser.ast;

/**
 * Marker for all statement nodes.
 */
public sealed interface StatementNode extends AstNode
        permits BlockNode, DeclarationNode, AssignmentNode, IfNode, WhileNode, DoWhileNode, ForNode,
        BreakNode, ContinueNode, ReturnNode, PrintNode, InputNode, ExpressionStatementNode {
}
