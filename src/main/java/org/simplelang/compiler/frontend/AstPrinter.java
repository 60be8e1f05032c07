package org.simplelang.compiler.frontend;

import org.simplelang.compiler.frontend.lexer.Lexicon;
import org.simplelang.compiler.frontend.parser.ast.ArrayLiteralNode;
import org.simplelang.compiler.frontend.parser.ast.AssignmentNode;
import org.simplelang.compiler.frontend.parser.ast.AstNode;
import org.simplelang.compiler.frontend.parser.ast.AstVisitor;
import org.simplelang.compiler.frontend.parser.ast.BinaryNode;
import org.simplelang.compiler.frontend.parser.ast.BlockNode;
import org.simplelang.compiler.frontend.parser.ast.BreakNode;
import org.simplelang.compiler.frontend.parser.ast.ConditionalNode;
import org.simplelang.compiler.frontend.parser.ast.ContinueNode;
import org.simplelang.compiler.frontend.parser.ast.DeclarationNode;
import org.simplelang.compiler.frontend.parser.ast.DoWhileNode;
import org.simplelang.compiler.frontend.parser.ast.ExpressionStatementNode;
import org.simplelang.compiler.frontend.parser.ast.ForNode;
import org.simplelang.compiler.frontend.parser.ast.IdentifierNode;
import org.simplelang.compiler.frontend.parser.ast.IfNode;
import org.simplelang.compiler.frontend.parser.ast.InputNode;
import org.simplelang.compiler.frontend.parser.ast.LiteralNode;
import org.simplelang.compiler.frontend.parser.ast.PostfixNode;
import org.simplelang.compiler.frontend.parser.ast.PostfixOperation;
import org.simplelang.compiler.frontend.parser.ast.PrintNode;
import org.simplelang.compiler.frontend.parser.ast.ProgramNode;
import org.simplelang.compiler.frontend.parser.ast.ReturnNode;
import org.simplelang.compiler.frontend.parser.ast.UnaryNode;
import org.simplelang.compiler.frontend.parser.ast.WhileNode;

import java.util.List;

/**
 * Renders an AST as indented text, one node per line, two spaces per level. Used by the
 * {@code ast} command and the interactive mode.
 */
public class AstPrinter implements AstVisitor<Void> {

    private final StringBuilder out = new StringBuilder();
    private int indent = 0;

    /**
     * Renders a tree.
     * @param node The root of the tree to render.
     * @return The rendering, each line terminated by {@code '\n'}.
     */
    public static String print(AstNode node) {
        AstPrinter printer = new AstPrinter();
        node.accept(printer);
        return printer.out.toString();
    }

    /**
     * Counts all nodes of a tree, the root included.
     * @param root The root node.
     * @return The number of nodes.
     */
    public static int countNodes(AstNode root) {
        int count = 1;
        for (AstNode child : root.getChildren()) {
            count += countNodes(child);
        }
        return count;
    }

    @Override
    public Void visitProgram(ProgramNode node) {
        line("Program");
        children(node.statements());
        return null;
    }

    @Override
    public Void visitBlock(BlockNode node) {
        line("Block");
        children(node.statements());
        return null;
    }

    @Override
    public Void visitDeclaration(DeclarationNode node) {
        line("Declaration " + node.type() + " " + node.name());
        if (node.initializer() != null) {
            child(node.initializer());
        }
        return null;
    }

    @Override
    public Void visitAssignment(AssignmentNode node) {
        line("Assignment " + node.target().name() + " " + Lexicon.spelling(node.operator()));
        child(node.value());
        return null;
    }

    @Override
    public Void visitIf(IfNode node) {
        line("If");
        child(node.condition());
        labelled("Then", node.thenBranch());
        if (node.elseBranch() != null) {
            labelled("Else", node.elseBranch());
        }
        return null;
    }

    @Override
    public Void visitWhile(WhileNode node) {
        line("While");
        child(node.condition());
        labelled("Body", node.body());
        return null;
    }

    @Override
    public Void visitDoWhile(DoWhileNode node) {
        line("DoWhile");
        labelled("Body", node.body());
        child(node.condition());
        return null;
    }

    @Override
    public Void visitFor(ForNode node) {
        line("For");
        if (node.init() != null) {
            labelled("Init", node.init());
        }
        if (node.condition() != null) {
            labelled("Condition", node.condition());
        }
        if (!node.update().isEmpty()) {
            indent++;
            line("Update");
            children(node.update());
            indent--;
        }
        labelled("Body", node.body());
        return null;
    }

    @Override
    public Void visitBreak(BreakNode node) {
        line("Break");
        return null;
    }

    @Override
    public Void visitContinue(ContinueNode node) {
        line("Continue");
        return null;
    }

    @Override
    public Void visitReturn(ReturnNode node) {
        line("Return");
        if (node.value() != null) {
            child(node.value());
        }
        return null;
    }

    @Override
    public Void visitPrint(PrintNode node) {
        line("Print");
        children(node.arguments());
        return null;
    }

    @Override
    public Void visitInput(InputNode node) {
        line("Input " + node.target().name());
        return null;
    }

    @Override
    public Void visitExpressionStatement(ExpressionStatementNode node) {
        line("ExpressionStatement");
        child(node.expression());
        return null;
    }

    @Override
    public Void visitConditional(ConditionalNode node) {
        line("Conditional");
        children(List.of(node.condition(), node.thenValue(), node.elseValue()));
        return null;
    }

    @Override
    public Void visitBinary(BinaryNode node) {
        line("Binary " + Lexicon.spelling(node.operator()));
        children(List.of(node.left(), node.right()));
        return null;
    }

    @Override
    public Void visitUnary(UnaryNode node) {
        line("Unary " + Lexicon.spelling(node.operator()));
        child(node.operand());
        return null;
    }

    @Override
    public Void visitPostfix(PostfixNode node) {
        PostfixOperation operation = node.operation();
        if (operation instanceof PostfixOperation.Index index) {
            line("Index");
            children(List.of(node.operand(), index.index()));
        } else if (operation instanceof PostfixOperation.Call call) {
            line("Call");
            child(node.operand());
            if (!call.arguments().isEmpty()) {
                indent++;
                line("Arguments");
                children(call.arguments());
                indent--;
            }
        } else {
            line("Postfix " + operation);
            child(node.operand());
        }
        return null;
    }

    @Override
    public Void visitLiteral(LiteralNode node) {
        String value = switch (node.kind()) {
            case STRING -> "\"" + escape(node.value().toString()) + "\"";
            case CHAR -> "'" + escape(node.value().toString()) + "'";
            default -> String.valueOf(node.value());
        };
        line("Literal " + node.kind() + " " + value);
        return null;
    }

    @Override
    public Void visitIdentifier(IdentifierNode node) {
        line("Identifier " + node.name());
        return null;
    }

    @Override
    public Void visitArrayLiteral(ArrayLiteralNode node) {
        line("ArrayLiteral");
        children(node.elements());
        return null;
    }

    private void line(String text) {
        out.append("  ".repeat(indent)).append(text).append('\n');
    }

    private void child(AstNode node) {
        indent++;
        node.accept(this);
        indent--;
    }

    private void children(List<? extends AstNode> nodes) {
        indent++;
        for (AstNode node : nodes) {
            node.accept(this);
        }
        indent--;
    }

    private void labelled(String label, AstNode node) {
        indent++;
        line(label);
        child(node);
        indent--;
    }

    private static String escape(String text) {
        StringBuilder sb = new StringBuilder();
        for (char c : text.toCharArray()) {
            switch (c) {
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                case '\0' -> sb.append("\\0");
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
