package org.simplelang.cli.commands;

import org.simplelang.cli.CommandLineInterface;
import org.simplelang.compiler.Compiler;
import org.simplelang.compiler.api.AnalysisResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "check", description = "Checks SimpleLang source files for lexical and syntax errors.")
public class CheckCommand extends SourceFileCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CheckCommand.class);

    @Parameters(arity = "1..*", paramLabel = "FILE", description = "The source files to analyze.")
    private List<File> files;

    @Override
    public Integer call() {
        final Compiler compiler = compiler();
        int exitCode = CommandLineInterface.EXIT_OK;
        for (final File file : files) {
            exitCode = Math.max(exitCode, check(compiler, file));
        }
        return exitCode;
    }

    private int check(final Compiler compiler, final File file) {
        final String source;
        try {
            source = readSource(file);
        } catch (IOException e) {
            log.debug("Failed to read {}", file, e);
            err().println("Error reading file '" + file.getPath() + "': " + e.getMessage());
            return CommandLineInterface.EXIT_FAILURE;
        }

        final AnalysisResult result = compiler.analyze(source, file.getPath());
        if (result.isWellFormed()) {
            out().printf("%s: OK (%d statement(s))%n", file.getPath(), result.program().statements().size());
            return CommandLineInterface.EXIT_OK;
        }
        out().println(result.formatDiagnostics());
        out().printf("%s: %d error(s)%n", file.getPath(), result.errors().size());
        return CommandLineInterface.EXIT_DIAGNOSTICS;
    }
}
