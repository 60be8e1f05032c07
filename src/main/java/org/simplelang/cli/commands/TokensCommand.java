package org.simplelang.cli.commands;

import org.simplelang.cli.CommandLineInterface;
import org.simplelang.compiler.diagnostics.Diagnostic;
import org.simplelang.compiler.diagnostics.DiagnosticsEngine;
import org.simplelang.compiler.frontend.lexer.Lexer;
import org.simplelang.compiler.frontend.lexer.Token;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "tokens", description = "Prints the token stream of a SimpleLang source file.")
public class TokensCommand extends SourceFileCommand implements Callable<Integer> {

    @Parameters(index = "0", paramLabel = "FILE", description = "The source file to tokenize.")
    private File file;

    @Override
    public Integer call() throws Exception {
        final String source = readSource(file);
        final DiagnosticsEngine diagnostics = new DiagnosticsEngine(file.getPath(), source, frontendConfig().mode());
        final List<Token> tokens = new Lexer(source, diagnostics).scanTokens();

        printTokens(tokens, out());
        for (final Diagnostic diagnostic : diagnostics.getDiagnostics()) {
            err().println(diagnostic.format());
        }
        return diagnostics.hasErrors() ? CommandLineInterface.EXIT_DIAGNOSTICS : CommandLineInterface.EXIT_OK;
    }

    /**
     * Prints one numbered line per token.
     */
    public static void printTokens(final List<Token> tokens, final PrintWriter out) {
        for (int i = 0; i < tokens.size(); i++) {
            out.printf("%3d: %s%n", i, tokens.get(i));
        }
    }
}
