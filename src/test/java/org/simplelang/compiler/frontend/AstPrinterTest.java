package org.simplelang.compiler.frontend;

import org.simplelang.compiler.Compiler;
import org.simplelang.compiler.api.AnalysisResult;
import org.simplelang.compiler.frontend.parser.ast.ProgramNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class AstPrinterTest {

    private static String print(String source) {
        AnalysisResult result = new Compiler().analyze(source, "test.sl");
        assertThat(result.diagnostics()).isEmpty();
        return AstPrinter.print(result.program());
    }

    @Test
    @Tag("unit")
    void testPrintsIfWithElse() {
        // Act
        String text = print("agr (x > 1) dikhao(\"hi\\n\"); varna likho(x);");

        // Assert
        assertThat(text).isEqualTo(String.join("\n",
                "Program",
                "  If",
                "    Binary >",
                "      Identifier x",
                "      Literal INTEGER 1",
                "    Then",
                "      Print",
                "        Literal STRING \"hi\\n\"",
                "    Else",
                "      Input x",
                ""));
    }

    @Test
    @Tag("unit")
    void testPrintsForLoop() {
        // Act
        String text = print("tabtak (int i = 0; i < 2; i++) break;");

        // Assert
        assertThat(text).isEqualTo(String.join("\n",
                "Program",
                "  For",
                "    Init",
                "      Declaration int i",
                "        Literal INTEGER 0",
                "    Condition",
                "      Binary <",
                "        Identifier i",
                "        Literal INTEGER 2",
                "    Update",
                "      ExpressionStatement",
                "        Postfix ++",
                "          Identifier i",
                "    Body",
                "      Break",
                ""));
    }

    @Test
    @Tag("unit")
    void testPrintsPostfixChainAndArrays() {
        // Act
        String text = print("char[] c = ['a']; f(c)[0]++;");

        // Assert
        assertThat(text).isEqualTo(String.join("\n",
                "Program",
                "  Declaration char[] c",
                "    ArrayLiteral",
                "      Literal CHAR 'a'",
                "  ExpressionStatement",
                "    Postfix ++",
                "      Index",
                "        Call",
                "          Identifier f",
                "          Arguments",
                "            Identifier c",
                "        Literal INTEGER 0",
                ""));
    }

    @Test
    @Tag("unit")
    void testCountNodes() throws Exception {
        // Arrange
        ProgramNode program = new Compiler().compile("int x = 1 + 2;", "test.sl");

        // Act
        int count = AstPrinter.countNodes(program);

        // Assert
        // Program, Declaration, Binary and two literals
        assertThat(count).isEqualTo(5);
    }
}
