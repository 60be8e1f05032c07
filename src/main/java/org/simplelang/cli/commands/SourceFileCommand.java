package org.simplelang.cli.commands;

import org.simplelang.cli.CommandLineInterface;
import org.simplelang.compiler.Compiler;
import org.simplelang.compiler.api.FrontendConfig;
import org.simplelang.compiler.diagnostics.AnalysisMode;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

/**
 * Common plumbing of the subcommands that analyze source files.
 */
abstract class SourceFileCommand {

    @Option(
        names = {"--first-error"},
        description = "Stop at the first error instead of reporting all of them"
    )
    private boolean firstError;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    protected FrontendConfig frontendConfig() {
        return parent.frontendConfig(firstError ? AnalysisMode.FIRST_ERROR : null);
    }

    protected Compiler compiler() {
        return new Compiler(frontendConfig());
    }

    protected PrintWriter out() {
        return spec.commandLine().getOut();
    }

    protected PrintWriter err() {
        return spec.commandLine().getErr();
    }

    /**
     * Reads a whole source file as UTF-8.
     *
     * @throws IOException if the file does not exist or cannot be read.
     */
    protected static String readSource(final File file) throws IOException {
        return Files.readString(file.toPath(), StandardCharsets.UTF_8);
    }
}
