package org.simplelang.compiler.api;

/**
 * Thrown when a caller asks for a well-formed program and the source is not well-formed.
 * Its message is the summary of all diagnostics; recoverable faults are otherwise reported as
 * diagnostics, never as exceptions.
 */
public class CompilationException extends Exception {

    /**
     * @param message The diagnostics summary.
     */
    public CompilationException(String message) {
        super(message);
    }
}
