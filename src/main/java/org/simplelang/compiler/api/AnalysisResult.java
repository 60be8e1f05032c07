package org.simplelang.compiler.api;

import org.simplelang.compiler.diagnostics.Diagnostic;
import org.simplelang.compiler.frontend.lexer.Token;
import org.simplelang.compiler.frontend.parser.ast.ProgramNode;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Everything the frontend produced for one source buffer.
 *
 * @param fileName The logical file name used in diagnostics.
 * @param source The analyzed source text.
 * @param tokens The token stream, terminated by an end-of-file token.
 * @param program The (possibly partial) program. Only complete if {@link #isWellFormed()}.
 * @param diagnostics All diagnostics in report order.
 */
public record AnalysisResult(
        String fileName,
        String source,
        List<Token> tokens,
        ProgramNode program,
        List<Diagnostic> diagnostics
) {

    public AnalysisResult {
        tokens = List.copyOf(tokens);
        diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return {@code true} if no error-severity diagnostic was reported.
     */
    public boolean isWellFormed() {
        return errors().isEmpty();
    }

    /**
     * @return The error-severity diagnostics, in report order.
     */
    public List<Diagnostic> errors() {
        return diagnostics.stream()
                .filter(d -> d.severity() == Diagnostic.Severity.ERROR)
                .collect(Collectors.toList());
    }

    /**
     * @return One line per diagnostic.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }

    /**
     * @return Every diagnostic rendered with its source line and a caret under the column.
     */
    public String formatDiagnostics() {
        return diagnostics.stream()
                .map(Diagnostic::format)
                .collect(Collectors.joining(System.lineSeparator()));
    }
}
