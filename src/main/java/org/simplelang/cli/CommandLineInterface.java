package org.simplelang.cli;

import com.typesafe.config.Config;
import org.simplelang.cli.commands.AstCommand;
import org.simplelang.cli.commands.CheckCommand;
import org.simplelang.cli.commands.ReplCommand;
import org.simplelang.cli.commands.TokensCommand;
import org.simplelang.cli.config.ConfigLoader;
import org.simplelang.cli.config.LoggingConfigurator;
import org.simplelang.compiler.Compiler;
import org.simplelang.compiler.api.FrontendConfig;
import org.simplelang.compiler.diagnostics.AnalysisMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "simplelang",
    mixinStandardHelpOptions = true,
    version = "SimpleLang 1.0",
    description = "SimpleLang syntax analyzer",
    subcommands = {
        CheckCommand.class,
        TokensCommand.class,
        AstCommand.class,
        ReplCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    /** The source was analyzed and is well-formed. */
    public static final int EXIT_OK = 0;
    /** The source was analyzed and at least one error was reported. */
    public static final int EXIT_DIAGNOSTICS = 1;
    /** The source could not be analyzed at all (unreadable file, broken configuration). */
    public static final int EXIT_FAILURE = 2;

    private static final Logger log = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    @Option(
        names = {"-v", "--verbose"},
        description = "Log the analysis phases at DEBUG level"
    )
    private boolean verbose;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return EXIT_OK;
    }

    public static void main(final String[] args) {
        final int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates the configured picocli command line. Exceptions escaping a subcommand are printed
     * to the error stream and mapped to {@link #EXIT_FAILURE}.
     *
     * @return A command line ready to {@code execute}.
     */
    public static CommandLine commandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("simplelang");
        commandLine.setExecutionExceptionHandler((ex, cl, parseResult) -> {
            log.debug("Command failed", ex);
            cl.getErr().println("Error: " + ex.getMessage());
            return EXIT_FAILURE;
        });
        return commandLine;
    }

    private void initialize() {
        if (initialized) {
            return;
        }
        this.config = ConfigLoader.load(configFile);
        LoggingConfigurator.configure(config);
        if (verbose) {
            LoggingConfigurator.setLevel("org.simplelang", "DEBUG");
        }
        initialized = true;
    }

    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }

    /**
     * Builds the frontend settings from the {@code simplelang.frontend} block.
     *
     * @param modeOverride A reporting mode that replaces the configured one, or null.
     * @return The settings.
     */
    public FrontendConfig frontendConfig(final AnalysisMode modeOverride) {
        final FrontendConfig frontend = FrontendConfig.fromConfig(getConfig().getConfig("simplelang.frontend"));
        return modeOverride == null ? frontend : frontend.withMode(modeOverride);
    }

    public Compiler createCompiler(final AnalysisMode modeOverride) {
        return new Compiler(frontendConfig(modeOverride));
    }
}
