package org.simplelang.compiler.frontend.parser.ast;

/**
 * A visitor over every AST node type. Implementations must handle each variant, so a new
 * node type is a compile error in every consumer until it is handled there.
 *
 * @param <R> The result type of the visit.
 */
public interface AstVisitor<R> {
    R visitProgram(ProgramNode node);

    R visitBlock(BlockNode node);

    R visitDeclaration(DeclarationNode node);

    R visitAssignment(AssignmentNode node);

    R visitIf(IfNode node);

    R visitWhile(WhileNode node);

    R visitDoWhile(DoWhileNode node);

    R visitFor(ForNode node);

    R visitBreak(BreakNode node);

    R visitContinue(ContinueNode node);

    R visitReturn(ReturnNode node);

    R visitPrint(PrintNode node);

    R visitInput(InputNode node);

    R visitExpressionStatement(ExpressionStatementNode node);

    R visitConditional(ConditionalNode node);

    R visitBinary(BinaryNode node);

    R visitUnary(UnaryNode node);

    R visitPostfix(PostfixNode node);

    R visitLiteral(LiteralNode node);

    R visitIdentifier(IdentifierNode node);

    R visitArrayLiteral(ArrayLiteralNode node);
}
