package org.simplelang.cli;

import org.simplelang.cli.config.LoggingConfigurator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains integration tests for the {@link CommandLineInterface} and its subcommands,
 * running them on source files in a temporary directory.
 */
public class CommandLineInterfaceTest {

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;
    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        commandLine = CommandLineInterface.commandLine();
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
    }

    private String write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file.toString();
    }

    @Test
    @Tag("integration")
    void testCheckWellFormedFile() throws IOException {
        // Arrange
        String file = write("ok.sl", "int x = 1;\ndikhao(x);\n");

        // Act
        int exitCode = commandLine.execute("check", file);

        // Assert
        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(out.toString()).contains(file + ": OK (2 statement(s))");
        assertThat(err.toString()).isEmpty();
    }

    @Test
    @Tag("integration")
    void testCheckReportsAllDiagnostics() throws IOException {
        // Arrange
        String file = write("bad.sl", "int a = ;\nint b = ;\nint c = 1;\n");

        // Act
        int exitCode = commandLine.execute("check", file);

        // Assert
        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_DIAGNOSTICS);
        assertThat(out.toString())
                .contains(file + ":1:9: UNEXPECTED_TOKEN")
                .contains(file + ":2:9: UNEXPECTED_TOKEN")
                .contains("   2 | int b = ;")
                .contains(file + ": 2 error(s)");
    }

    @Test
    @Tag("integration")
    void testCheckFirstErrorReportsOnlyOne() throws IOException {
        // Arrange
        String file = write("bad.sl", "int a = ;\nint b = ;\n");

        // Act
        int exitCode = commandLine.execute("check", "--first-error", file);

        // Assert
        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_DIAGNOSTICS);
        assertThat(out.toString()).contains(file + ": 1 error(s)");
    }

    /**
     * The exit code of a multi-file check is the worst outcome over all files.
     */
    @Test
    @Tag("integration")
    void testCheckMissingFileFails() throws IOException {
        // Arrange
        String good = write("ok.sl", "int x;");
        String missing = tempDir.resolve("missing.sl").toString();

        // Act
        int exitCode = commandLine.execute("check", good, missing);

        // Assert
        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_FAILURE);
        assertThat(out.toString()).contains(good + ": OK");
        assertThat(err.toString()).contains("Error reading file '" + missing + "'");
    }

    @Test
    @Tag("integration")
    void testTokensCommand() throws IOException {
        // Arrange
        String file = write("t.sl", "int x = 42;");

        // Act
        int exitCode = commandLine.execute("tokens", file);

        // Assert
        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(out.toString())
                .contains("  0: INT 'int' 1:1")
                .contains("  3: INTEGER_LITERAL '42' 1:9")
                .contains("  5: END_OF_FILE '' 1:12");
    }

    @Test
    @Tag("integration")
    void testTokensCommandReportsLexicalErrors() throws IOException {
        // Arrange
        String file = write("t.sl", "x = @;");

        // Act
        int exitCode = commandLine.execute("tokens", file);

        // Assert
        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_DIAGNOSTICS);
        assertThat(out.toString()).contains("INVALID '@'");
        assertThat(err.toString()).contains("UNKNOWN_CHARACTER");
    }

    @Test
    @Tag("integration")
    void testAstCommand() throws IOException {
        // Arrange
        String file = write("a.sl", "x = 1 + 2;");

        // Act
        int exitCode = commandLine.execute("ast", file);

        // Assert
        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(out.toString()).startsWith("Program").contains("  Assignment x =").contains("    Binary +");
    }

    @Test
    @Tag("integration")
    void testAstCommandWithErrors() throws IOException {
        // Arrange
        String file = write("a.sl", "int a = 1;\nint b = ;");

        // Act
        int plain = commandLine.execute("ast", file);
        String plainOut = out.toString();
        int partial = commandLine.execute("ast", "--partial", file);

        // Assert
        assertThat(plain).isEqualTo(CommandLineInterface.EXIT_DIAGNOSTICS);
        assertThat(plainOut).isEmpty();
        assertThat(partial).isEqualTo(CommandLineInterface.EXIT_DIAGNOSTICS);
        assertThat(out.toString()).contains("Declaration int a").doesNotContain("Declaration int b");
        assertThat(err.toString()).contains("UNEXPECTED_TOKEN");
    }

    /**
     * A configuration file given with {@code --config} that does not exist is a failure of the
     * command, not of the analyzed source.
     */
    @Test
    @Tag("integration")
    void testMissingConfigFileFails() throws IOException {
        // Arrange
        String file = write("ok.sl", "int x;");
        String config = tempDir.resolve("nope.conf").toString();

        // Act
        int exitCode = commandLine.execute("--config", config, "check", file);

        // Assert
        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_FAILURE);
        assertThat(err.toString()).startsWith("Error: ");
    }

    @Test
    @Tag("integration")
    void testConfigFileSetsMode() throws IOException {
        // Arrange
        String file = write("bad.sl", "int a = ;\nint b = ;\n");
        String config = write("custom.conf", "simplelang.frontend.mode = FIRST_ERROR\n");

        // Act
        int exitCode = commandLine.execute("-c", config, "check", file);

        // Assert
        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_DIAGNOSTICS);
        assertThat(out.toString()).contains(file + ": 1 error(s)");
    }

    @Test
    @Tag("unit")
    void testMissingFileParameterIsUsageError() {
        // Act
        int exitCode = commandLine.execute("check");

        // Assert
        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("FILE");
    }
}
