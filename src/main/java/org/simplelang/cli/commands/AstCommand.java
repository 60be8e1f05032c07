package org.simplelang.cli.commands;

import org.simplelang.cli.CommandLineInterface;
import org.simplelang.compiler.api.AnalysisResult;
import org.simplelang.compiler.frontend.AstPrinter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.util.concurrent.Callable;

@Command(name = "ast", description = "Parses a SimpleLang source file and prints its syntax tree.")
public class AstCommand extends SourceFileCommand implements Callable<Integer> {

    @Parameters(index = "0", paramLabel = "FILE", description = "The source file to parse.")
    private File file;

    @Option(names = {"--partial"}, description = "Print the recovered tree even if errors were reported")
    private boolean partial;

    @Override
    public Integer call() throws Exception {
        final AnalysisResult result = compiler().analyze(readSource(file), file.getPath());
        if (result.isWellFormed()) {
            out().print(AstPrinter.print(result.program()));
            return CommandLineInterface.EXIT_OK;
        }
        err().println(result.formatDiagnostics());
        if (partial) {
            out().print(AstPrinter.print(result.program()));
        }
        return CommandLineInterface.EXIT_DIAGNOSTICS;
    }
}
