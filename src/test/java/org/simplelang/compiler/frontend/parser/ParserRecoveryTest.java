package org.simplelang.compiler.frontend.parser;

import org.simplelang.compiler.diagnostics.AnalysisMode;
import org.simplelang.compiler.diagnostics.Diagnostic;
import org.simplelang.compiler.diagnostics.DiagnosticsEngine;
import org.simplelang.compiler.diagnostics.ErrorKind;
import org.simplelang.compiler.frontend.lexer.Lexer;
import org.simplelang.compiler.frontend.lexer.Token;
import org.simplelang.compiler.frontend.parser.ast.AssignmentNode;
import org.simplelang.compiler.frontend.parser.ast.BlockNode;
import org.simplelang.compiler.frontend.parser.ast.DeclarationNode;
import org.simplelang.compiler.frontend.parser.ast.IfNode;
import org.simplelang.compiler.frontend.parser.ast.StatementNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.simplelang.compiler.frontend.parser.ParserTest.parse;

/**
 * Contains unit tests for the panic-mode error recovery of the {@link Parser}.
 * Each defect must produce exactly one diagnostic, and the valid statements around it must
 * still be present in the partial program.
 */
public class ParserRecoveryTest {

    private static String name(StatementNode statement) {
        return ((DeclarationNode) statement).name();
    }

    /**
     * Verifies that one malformed statement between two valid ones yields exactly one diagnostic
     * and leaves both valid statements in the program.
     */
    @Test
    @Tag("unit")
    void testMalformedStatementBetweenValidOnes() {
        // Act
        ParseResult result = parse("int a = 1;\nint b = ;\nint c = 3;");

        // Assert
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.diagnostics()).hasSize(1);
        assertThat(result.diagnostics().get(0))
                .extracting(Diagnostic::kind, Diagnostic::line, Diagnostic::column)
                .containsExactly(ErrorKind.UNEXPECTED_TOKEN, 2, 9);
        assertThat(result.diagnostics().get(0).message()).isEqualTo("Unexpected token ';', expected expression");
        assertThat(result.program().statements()).extracting(ParserRecoveryTest::name).containsExactly("a", "c");
    }

    @Test
    @Tag("unit")
    void testGarbageRunIsReportedOnce() {
        // Act
        ParseResult result = parse("int a = 1;\n) ) ) ;\nint b = 2;");

        // Assert
        assertThat(result.diagnostics()).hasSize(1);
        assertThat(result.diagnostics().get(0).line()).isEqualTo(2);
        assertThat(result.program().statements()).extracting(ParserRecoveryTest::name).containsExactly("a", "b");
    }

    /**
     * A missing semicolon in front of a statement keyword is reported right after the previous
     * token, and the statement is kept.
     */
    @Test
    @Tag("unit")
    void testMissingSemicolonBeforeKeyword() {
        // Act
        ParseResult result = parse("int a = 1\nint b = 2;");

        // Assert
        assertThat(result.diagnostics()).hasSize(1);
        assertThat(result.diagnostics().get(0))
                .extracting(Diagnostic::kind, Diagnostic::line, Diagnostic::column)
                .containsExactly(ErrorKind.MISSING_TOKEN, 1, 10);
        assertThat(result.diagnostics().get(0).message()).isEqualTo("Missing ';' after declaration");
        assertThat(result.program().statements()).extracting(ParserRecoveryTest::name).containsExactly("a", "b");
    }

    @Test
    @Tag("unit")
    void testMissingClosingParenthesisBeforeBlock() {
        // Act
        ParseResult result = parse("agr (x > 1 { y = 2; }");

        // Assert
        assertThat(result.diagnostics()).hasSize(1);
        assertThat(result.diagnostics().get(0))
                .extracting(Diagnostic::kind, Diagnostic::column)
                .containsExactly(ErrorKind.MISSING_TOKEN, 11);
        IfNode ifNode = (IfNode) result.program().statements().get(0);
        assertThat(((BlockNode) ifNode.thenBranch()).statements().get(0)).isInstanceOf(AssignmentNode.class);
    }

    @Test
    @Tag("unit")
    void testEveryIndependentFaultIsReported() {
        // Act
        ParseResult result = parse("int a = ;\nint b = ;\nint c = 1;");

        // Assert
        assertThat(result.diagnostics()).extracting(Diagnostic::line).containsExactly(1, 2);
        assertThat(result.program().statements()).extracting(ParserRecoveryTest::name).containsExactly("c");
    }

    @Test
    @Tag("unit")
    void testUnexpectedEndOfInput() {
        // Act
        ParseResult result = parse("int x = ");

        // Assert
        assertThat(result.diagnostics()).hasSize(1);
        assertThat(result.diagnostics().get(0).kind()).isEqualTo(ErrorKind.UNEXPECTED_EOF);
        assertThat(result.program().statements()).isEmpty();
    }

    @Test
    @Tag("unit")
    void testUnclosedBlockReportsItsOpeningBrace() {
        // Act
        ParseResult result = parse("{ int a = 1;");

        // Assert
        assertThat(result.diagnostics()).hasSize(1);
        Diagnostic diagnostic = result.diagnostics().get(0);
        assertThat(diagnostic.kind()).isEqualTo(ErrorKind.UNEXPECTED_EOF);
        assertThat(diagnostic.message()).contains("'}'").contains("1:1");
    }

    @Test
    @Tag("unit")
    void testElseWithoutIf() {
        // Act
        ParseResult result = parse("varna x = 1;\ny = 2;");

        // Assert
        assertThat(result.diagnostics()).hasSize(1);
        assertThat(result.diagnostics().get(0).kind()).isEqualTo(ErrorKind.UNEXPECTED_TOKEN);
        assertThat(result.program().statements()).hasSize(1);
        assertThat(((AssignmentNode) result.program().statements().get(0)).target().name()).isEqualTo("y");
    }

    /**
     * A broken then-branch still consumes its {@code varna} clause, so the else keyword is not
     * reported a second time as a stray token.
     */
    @Test
    @Tag("unit")
    void testBrokenThenBranchConsumesElse() {
        // Act
        ParseResult result = parse("agr (x) int = 5; varna y = 1;\nz = 2;");

        // Assert
        assertThat(result.diagnostics()).hasSize(1);
        assertThat(result.program().statements()).hasSize(1);
        assertThat(((AssignmentNode) result.program().statements().get(0)).target().name()).isEqualTo("z");
    }

    @Test
    @Tag("unit")
    void testBrokenForHeaderIsSkipped() {
        // Act
        ParseResult result = parse("tabtak (i = ; i < 3; i++) { break; }\nint z = 1;");

        // Assert
        assertThat(result.diagnostics()).hasSize(1);
        List<StatementNode> statements = result.program().statements();
        assertThat(statements.get(statements.size() - 1)).isInstanceOf(DeclarationNode.class);
    }

    /**
     * Verifies that the body of a loop with a broken header is still checked, so a separate fault
     * in a body that is not a block is reported as well.
     */
    @Test
    @Tag("unit")
    void testFaultInBodyOfBrokenForHeaderIsReported() {
        // Act
        ParseResult result = parse("tabtak (i = ; i < 3; i++) x = ) ;\nint z = 1;");

        // Assert
        assertThat(result.diagnostics()).extracting(Diagnostic::line, Diagnostic::column)
                .containsExactly(tuple(1, 13), tuple(1, 31));
        assertThat(result.program().statements()).extracting(ParserRecoveryTest::name).containsExactly("z");
    }

    /**
     * Verifies that a token already reported by the lexer does not produce a second, syntactic
     * diagnostic.
     */
    @Test
    @Tag("unit")
    void testLexicalFaultIsNotReportedAgain() {
        // Act
        ParseResult result = parse("int a = @;\nint b = 2;");

        // Assert
        assertThat(result.diagnostics()).extracting(Diagnostic::kind).containsExactly(ErrorKind.UNKNOWN_CHARACTER);
        assertThat(result.program().statements()).extracting(ParserRecoveryTest::name).containsExactly("b");
    }

    /**
     * The unterminated string in {@code dikhao("abc);} is reported once, at the opening quote,
     * with no follow-up syntax errors.
     */
    @Test
    @Tag("unit")
    void testUnterminatedStringInPrint() {
        // Act
        ParseResult result = parse("dikhao(\"abc);");

        // Assert
        assertThat(result.diagnostics()).hasSize(1);
        assertThat(result.diagnostics().get(0))
                .extracting(Diagnostic::kind, Diagnostic::line, Diagnostic::column)
                .containsExactly(ErrorKind.UNTERMINATED_STRING, 1, 8);
    }

    @Test
    @Tag("unit")
    void testFirstErrorModeStopsTheParse() {
        // Arrange
        String source = "int a = ;\nint b = ;\nint c = 1;";
        DiagnosticsEngine diagnostics = new DiagnosticsEngine("test.sl", source, AnalysisMode.FIRST_ERROR);
        List<Token> tokens = new Lexer(source, diagnostics).scanTokens();

        // Act
        ParseResult result = new Parser(tokens, diagnostics).parse();

        // Assert
        assertThat(result.diagnostics()).hasSize(1);
        assertThat(result.program().statements()).isEmpty();
    }

    /**
     * Verifies that nesting beyond the configured limit is reported once instead of exhausting
     * the call stack.
     */
    @Test
    @Tag("unit")
    void testNestingTooDeep() {
        // Arrange
        String source = "x = " + "(".repeat(100) + "1" + ")".repeat(100) + ";\ny = 2;";
        DiagnosticsEngine diagnostics = new DiagnosticsEngine("test.sl", source, AnalysisMode.BATCH);
        List<Token> tokens = new Lexer(source, diagnostics).scanTokens();

        // Act
        ParseResult result = new Parser(tokens, diagnostics, 16).parse();

        // Assert
        assertThat(result.diagnostics()).extracting(Diagnostic::kind).containsExactly(ErrorKind.NESTING_TOO_DEEP);
        assertThat(result.program().statements()).isEmpty();
    }

    @Test
    @Tag("unit")
    void testAdversarialBlockNestingWithDefaultLimit() {
        // Arrange
        String source = "{".repeat(20_000) + "}".repeat(20_000);

        // Act
        ParseResult result = parse(source);

        // Assert
        assertThat(result.diagnostics()).extracting(Diagnostic::kind).containsExactly(ErrorKind.NESTING_TOO_DEEP);
    }
}
