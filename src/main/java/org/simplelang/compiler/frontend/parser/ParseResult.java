package org.simplelang.compiler.frontend.parser;

import org.simplelang.compiler.diagnostics.Diagnostic;
import org.simplelang.compiler.frontend.parser.ast.ProgramNode;

import java.util.List;

/**
 * The outcome of a parse: the (possibly partial) program plus every diagnostic reported
 * while producing it.
 *
 * @param program The program root. Statements that could not be parsed are omitted.
 * @param diagnostics All diagnostics in report order, lexical ones included.
 */
public record ParseResult(ProgramNode program, List<Diagnostic> diagnostics) {

    public ParseResult {
        diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return {@code true} if no error-severity diagnostic was reported.
     */
    public boolean isSuccess() {
        return diagnostics.stream().noneMatch(d -> d.severity() == Diagnostic.Severity.ERROR);
    }
}
