package org.simplelang.compiler.diagnostics;

/**
 * Represents a single diagnostic message (error, warning, info)
 * that occurs while analyzing a source buffer.
 *
 * @param severity The severity of the diagnostic (e.g., ERROR, WARNING).
 * @param kind The error kind, or null for warnings and infos raised outside the core.
 * @param message The diagnostic message.
 * @param fileName The name of the file where the issue occurred.
 * @param line The line number of the issue (1-based).
 * @param column The column number of the issue (1-based).
 * @param sourceLine The text of the offending source line, or null if the source is unknown.
 */
public record Diagnostic(
        Severity severity,
        ErrorKind kind,
        String message,
        String fileName,
        int line,
        int column,
        String sourceLine
) {
    /**
     * The severity of a diagnostic message.
     */
    public enum Severity {
        /** An error that makes the input ill-formed. */
        ERROR,
        /** A warning that does not affect well-formedness. */
        WARNING,
        /** An informational message. */
        INFO
    }

    /**
     * Renders this diagnostic with its source line and a caret under the offending column:
     * <pre>
     * [ERROR] demo.sl:1:8: UNTERMINATED_STRING: Unterminated string literal
     *    1 | dikhao("abc);
     *      |        ^
     * </pre>
     * @return The multi-line rendering, or just {@link #toString()} if no source line is known.
     */
    public String format() {
        if (sourceLine == null) {
            return toString();
        }
        String gutter = String.format("%4d | ", line);
        StringBuilder caret = new StringBuilder(" ".repeat(gutter.length() - 2)).append("| ");
        int limit = Math.min(column - 1, sourceLine.length());
        for (int i = 0; i < limit; i++) {
            // Keep tabs so the caret lines up in terminals that expand them.
            caret.append(sourceLine.charAt(i) == '\t' ? '\t' : ' ');
        }
        caret.append('^');
        return toString() + System.lineSeparator()
                + gutter + sourceLine + System.lineSeparator()
                + caret;
    }

    @Override
    public String toString() {
        String prefix = kind == null ? "" : kind + ": ";
        return String.format("[%s] %s:%d:%d: %s%s", severity, fileName, line, column, prefix, message);
    }
}
