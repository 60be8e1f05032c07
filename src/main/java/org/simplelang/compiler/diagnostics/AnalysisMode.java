package org.simplelang.compiler.diagnostics;

/**
 * Controls how many faults a single analysis reports.
 */
public enum AnalysisMode {
    /** Report every fault of the input, continuing past each one. Used for files. */
    BATCH,
    /** Stop lexing and parsing after the first error. Used by the interactive mode. */
    FIRST_ERROR
}
