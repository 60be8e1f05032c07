package org.simplelang.compiler;

import org.simplelang.compiler.api.AnalysisResult;
import org.simplelang.compiler.api.CompilationException;
import org.simplelang.compiler.api.FrontendConfig;
import org.simplelang.compiler.diagnostics.AnalysisMode;
import org.simplelang.compiler.diagnostics.DiagnosticsEngine;
import org.simplelang.compiler.frontend.AstPrinter;
import org.simplelang.compiler.frontend.lexer.Lexer;
import org.simplelang.compiler.frontend.lexer.Token;
import org.simplelang.compiler.frontend.parser.ParseResult;
import org.simplelang.compiler.frontend.parser.Parser;
import org.simplelang.compiler.frontend.parser.ast.ProgramNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The frontend facade. This class runs the pipeline from source text to an AST for one
 * in-memory source buffer: lexing, then parsing, with one fresh {@link DiagnosticsEngine} per
 * call. It never touches files.
 * <p>
 * A Compiler holds only immutable settings, so one instance may analyze several buffers
 * concurrently.
 */
public class Compiler {

    private static final Logger log = LoggerFactory.getLogger(Compiler.class);

    private final FrontendConfig config;

    public Compiler() {
        this(FrontendConfig.DEFAULT);
    }

    public Compiler(FrontendConfig config) {
        this.config = config;
    }

    /**
     * Analyzes a source buffer with the configured reporting mode.
     *
     * @param source   The full source text.
     * @param fileName The logical file name used in diagnostics.
     * @return The tokens, the (possibly partial) program and all diagnostics.
     */
    public AnalysisResult analyze(String source, String fileName) {
        return analyze(source, fileName, config.mode());
    }

    /**
     * Analyzes a source buffer.
     *
     * @param source   The full source text.
     * @param fileName The logical file name used in diagnostics.
     * @param mode     The reporting policy for this call.
     * @return The tokens, the (possibly partial) program and all diagnostics.
     */
    public AnalysisResult analyze(String source, String fileName, AnalysisMode mode) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine(fileName, source, mode);

        // Phase 1: Lexical Analysis
        List<Token> tokens = new Lexer(source, diagnostics).scanTokens();

        // Phase 2: Parsing (builds AST)
        ParseResult parsed = new Parser(tokens, diagnostics, config.maxNestingDepth()).parse();

        if (log.isDebugEnabled()) {
            log.debug("Analyzed {}: {} tokens, {} AST nodes, {} errors",
                    fileName, tokens.size(), AstPrinter.countNodes(parsed.program()), diagnostics.errorCount());
        }
        return new AnalysisResult(fileName, source, tokens, parsed.program(), parsed.diagnostics());
    }

    /**
     * Analyzes a source buffer and returns its program only if it is well-formed.
     *
     * @param source   The full source text.
     * @param fileName The logical file name used in diagnostics.
     * @return The complete program.
     * @throws CompilationException if any error was reported; the message lists all diagnostics.
     */
    public ProgramNode compile(String source, String fileName) throws CompilationException {
        AnalysisResult result = analyze(source, fileName);
        if (!result.isWellFormed()) {
            throw new CompilationException(result.summary());
        }
        return result.program();
    }

    public FrontendConfig getConfig() {
        return config;
    }
}
