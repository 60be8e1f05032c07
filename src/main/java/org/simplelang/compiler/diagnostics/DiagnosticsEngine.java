package org.simplelang.compiler.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting and managing diagnostic messages (errors, warnings)
 * that occur while one source buffer is lexed and parsed.
 * <p>
 * This decouples error reporting from the actual analysis logic (lexer, parser). One engine
 * belongs to exactly one analysis; it is not thread-safe and must not be shared.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final String fileName;
    private final String[] sourceLines;
    private final AnalysisMode mode;

    /**
     * Creates an engine without source text, reporting every fault.
     */
    public DiagnosticsEngine() {
        this("<memory>", null, AnalysisMode.BATCH);
    }

    /**
     * Creates an engine for one source buffer.
     *
     * @param fileName The logical file name used in every diagnostic.
     * @param source   The full source text, used to attach the offending line to diagnostics.
     *                 May be null, in which case no source context is rendered.
     * @param mode     The reporting policy.
     */
    public DiagnosticsEngine(String fileName, String source, AnalysisMode mode) {
        this.fileName = fileName;
        this.sourceLines = source == null ? null : source.split("\\r?\\n", -1);
        this.mode = mode;
    }

    /**
     * Reports an error.
     *
     * @param kind    The kind of the error.
     * @param message The error message.
     * @param line    The line number of the error.
     * @param column  The column number of the error.
     */
    public void reportError(ErrorKind kind, String message, int line, int column) {
        diagnostics.add(new Diagnostic(Diagnostic.Severity.ERROR, kind, message, fileName, line, column, sourceLine(line)));
    }

    /**
     * Reports a warning. Warnings never affect {@link #isWellFormed()}.
     *
     * @param message The warning message.
     * @param line    The line number of the warning.
     * @param column  The column number of the warning.
     */
    public void reportWarning(String message, int line, int column) {
        diagnostics.add(new Diagnostic(Diagnostic.Severity.WARNING, null, message, fileName, line, column, sourceLine(line)));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.severity() == Diagnostic.Severity.ERROR);
    }

    /**
     * @return {@code true} if no error-severity diagnostic has been reported.
     */
    public boolean isWellFormed() {
        return !hasErrors();
    }

    /**
     * Tells the lexer and the parser whether to stop. This is only ever the case in
     * {@link AnalysisMode#FIRST_ERROR} once an error has been reported.
     *
     * @return {@code true} if analysis should stop now.
     */
    public boolean shouldHalt() {
        return mode == AnalysisMode.FIRST_ERROR && hasErrors();
    }

    public long errorCount() {
        return diagnostics.stream().filter(d -> d.severity() == Diagnostic.Severity.ERROR).count();
    }

    public AnalysisMode getMode() {
        return mode;
    }

    public String getFileName() {
        return fileName;
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics, in report order.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }

    private String sourceLine(int line) {
        if (sourceLines == null || line < 1 || line > sourceLines.length) {
            return null;
        }
        return sourceLines[line - 1];
    }
}
