package org.simplelang.cli;

import org.simplelang.cli.commands.TokensCommand;
import org.simplelang.compiler.Compiler;
import org.simplelang.compiler.api.AnalysisResult;
import org.simplelang.compiler.diagnostics.AnalysisMode;
import org.simplelang.compiler.diagnostics.DiagnosticsEngine;
import org.simplelang.compiler.frontend.AstPrinter;
import org.simplelang.compiler.frontend.lexer.Lexer;
import org.simplelang.compiler.frontend.lexer.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.util.List;
import java.util.Locale;

/**
 * The line handling of the interactive mode, independent of the terminal.
 * <p>
 * A line that does not end with a semicolon or a closing brace, or that leaves a brace open, starts a
 * multi-line input that is collected until such a line or an empty line arrives. The collected
 * text is then analyzed as one buffer. Commands are only recognized at the start of an input.
 */
public class ReplSession {

    private static final Logger log = LoggerFactory.getLogger(ReplSession.class);

    private static final String SOURCE_NAME = "<interactive>";

    /** The words recognized as commands at the start of an input. */
    public static final List<String> COMMANDS = List.of("help", "tokens", "ast", "exit", "quit");

    private final Compiler compiler;
    private final PrintWriter out;
    private final StringBuilder pending = new StringBuilder();
    private AnalysisResult last;

    public ReplSession(Compiler compiler, PrintWriter out) {
        this.compiler = compiler;
        this.out = out;
    }

    public void printBanner() {
        out.println("SimpleLang Interactive Mode");
        out.println("Enter SimpleLang code (type 'exit' to quit, 'help' for commands)");
        out.println("-".repeat(50));
        out.flush();
    }

    /**
     * @return {@code true} while a multi-line input is being collected.
     */
    public boolean isContinuing() {
        return pending.length() > 0;
    }

    /**
     * Handles one line read from the user.
     *
     * @param rawLine The line, without its terminator.
     * @return {@code false} if the session should end.
     */
    public boolean accept(String rawLine) {
        String line = rawLine == null ? "" : rawLine.strip();
        if (!isContinuing()) {
            switch (line.toLowerCase(Locale.ROOT)) {
                case "" -> {
                    return true;
                }
                case "exit", "quit" -> {
                    return false;
                }
                case "help" -> {
                    printHelp();
                    return true;
                }
                case "tokens" -> {
                    printTokens();
                    return true;
                }
                case "ast" -> {
                    printAst();
                    return true;
                }
                default -> {
                    // source text
                }
            }
        }

        if (line.isEmpty()) {
            analyzePending();
            return true;
        }
        if (isContinuing()) {
            pending.append('\n');
        }
        pending.append(line);
        if (isComplete(pending.toString())) {
            analyzePending();
        }
        return true;
    }

    /**
     * Drops a partially collected input, e.g. after Ctrl-C.
     */
    public void discardPending() {
        pending.setLength(0);
    }

    /**
     * @return The analysis of the most recent input, or null if nothing was analyzed yet.
     */
    public AnalysisResult lastResult() {
        return last;
    }

    private void analyzePending() {
        String source = pending.toString();
        pending.setLength(0);
        if (source.isBlank()) {
            return;
        }
        last = compiler.analyze(source, SOURCE_NAME);
        log.debug("Analyzed interactive input: {} diagnostic(s)", last.diagnostics().size());
        if (last.isWellFormed()) {
            out.println("✓ Code is syntactically correct!");
        } else {
            out.println(last.formatDiagnostics());
        }
        out.flush();
    }

    private void printHelp() {
        out.println("Commands:");
        out.println("  exit/quit - Exit interactive mode");
        out.println("  help      - Show this help");
        out.println("  tokens    - Show tokens for last input");
        out.println("  ast       - Show AST for last input");
        out.flush();
    }

    private void printTokens() {
        if (last == null) {
            out.println("No previous input.");
        } else {
            out.println("Tokens:");
            out.println("-".repeat(50));
            TokensCommand.printTokens(last.tokens(), out);
        }
        out.flush();
    }

    private void printAst() {
        if (last == null) {
            out.println("No AST available. Parse some code first.");
        } else {
            out.println("Abstract Syntax Tree:");
            out.println("-".repeat(50));
            out.print(AstPrinter.print(last.program()));
        }
        out.flush();
    }

    /**
     * An input is complete once it ends with a semicolon or a closing brace and every brace is closed.
     * Braces inside literals and comments do not count.
     */
    static boolean isComplete(String text) {
        String trimmed = text.strip();
        if (!trimmed.endsWith(";") && !trimmed.endsWith("}")) {
            return false;
        }
        DiagnosticsEngine scratch = new DiagnosticsEngine(SOURCE_NAME, null, AnalysisMode.BATCH);
        int depth = 0;
        for (Token token : new Lexer(text, scratch).scanTokens()) {
            switch (token.type()) {
                case LEFT_BRACE -> depth++;
                case RIGHT_BRACE -> depth--;
                default -> {
                    // other tokens do not affect nesting
                }
            }
        }
        return depth <= 0;
    }
}
