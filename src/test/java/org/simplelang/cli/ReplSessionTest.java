package org.simplelang.cli;

import org.simplelang.compiler.Compiler;
import org.simplelang.compiler.api.FrontendConfig;
import org.simplelang.compiler.diagnostics.AnalysisMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the line handling of the interactive mode.
 */
public class ReplSessionTest {

    private StringWriter out;
    private ReplSession session;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        Compiler compiler = new Compiler(FrontendConfig.DEFAULT.withMode(AnalysisMode.FIRST_ERROR));
        session = new ReplSession(compiler, new PrintWriter(out, true));
    }

    @Test
    @Tag("unit")
    void testCommandsBeforeAnyInput() {
        // Act
        boolean afterHelp = session.accept("help");
        session.accept("tokens");
        session.accept("ast");

        // Assert
        assertThat(afterHelp).isTrue();
        assertThat(out.toString())
                .contains("exit/quit - Exit interactive mode")
                .contains("No previous input.")
                .contains("No AST available. Parse some code first.");
    }

    @Test
    @Tag("unit")
    void testExitAndQuitEndTheSession() {
        assertThat(session.accept("exit")).isFalse();
        assertThat(session.accept("  QUIT ")).isFalse();
        assertThat(session.accept("")).isTrue();
    }

    @Test
    @Tag("unit")
    void testSingleLineStatement() {
        // Act
        session.accept("int x = 1;");

        // Assert
        assertThat(out.toString()).contains("✓ Code is syntactically correct!");
        assertThat(session.lastResult().isWellFormed()).isTrue();
        assertThat(session.isContinuing()).isFalse();
    }

    /**
     * Verifies that an open block keeps collecting lines until its closing brace.
     */
    @Test
    @Tag("unit")
    void testMultiLineBlock() {
        // Act
        session.accept("agr (x > 1) {");
        boolean continuingAfterFirst = session.isContinuing();
        session.accept("dikhao(x);");
        boolean continuingInsideBlock = session.isContinuing();
        session.accept("}");

        // Assert
        assertThat(continuingAfterFirst).isTrue();
        assertThat(continuingInsideBlock).isTrue();
        assertThat(session.isContinuing()).isFalse();
        assertThat(session.lastResult().isWellFormed()).isTrue();
        assertThat(session.lastResult().program().statements()).hasSize(1);
    }

    @Test
    @Tag("unit")
    void testEmptyLineEndsUnterminatedInput() {
        // Act
        session.accept("int x = 1");
        session.accept("");

        // Assert
        assertThat(session.lastResult().isWellFormed()).isFalse();
        assertThat(out.toString()).contains("UNEXPECTED_EOF");
    }

    /**
     * The interactive mode stops at the first error.
     */
    @Test
    @Tag("unit")
    void testReportsOnlyFirstError() {
        // Act
        session.accept("int a = ; int b = ;");

        // Assert
        assertThat(session.lastResult().diagnostics()).hasSize(1);
        assertThat(out.toString()).contains("   1 | int a = ; int b = ;");
    }

    @Test
    @Tag("unit")
    void testTokensAndAstOfLastInput() {
        // Arrange
        session.accept("y = 2;");

        // Act
        session.accept("tokens");
        session.accept("ast");

        // Assert
        assertThat(out.toString())
                .contains("  0: IDENTIFIER 'y' 1:1")
                .contains("Program")
                .contains("  Assignment y =");
    }

    @Test
    @Tag("unit")
    void testCommandWordsInsideContinuationAreSource() {
        // Act
        session.accept("dikhao(");
        session.accept("help");
        session.accept(");");

        // Assert
        assertThat(out.toString()).doesNotContain("Commands:");
        assertThat(session.lastResult().isWellFormed()).isTrue();
    }

    @Test
    @Tag("unit")
    void testDiscardPending() {
        // Act
        session.accept("int x =");
        session.discardPending();

        // Assert
        assertThat(session.isContinuing()).isFalse();
        assertThat(session.lastResult()).isNull();
    }

    @Test
    @Tag("unit")
    void testIsCompleteIgnoresBracesInLiterals() {
        assertThat(ReplSession.isComplete("dikhao(\"{\");")).isTrue();
        assertThat(ReplSession.isComplete("jabtak (x) { x--;")).isFalse();
        assertThat(ReplSession.isComplete("jabtak (x) { x--; }")).isTrue();
        assertThat(ReplSession.isComplete("x = 1")).isFalse();
    }
}
