package org.simplelang.cli.commands;

import com.typesafe.config.Config;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.completer.StringsCompleter;
import org.jline.reader.impl.history.DefaultHistory;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.simplelang.cli.CommandLineInterface;
import org.simplelang.cli.ReplSession;
import org.simplelang.compiler.Compiler;
import org.simplelang.compiler.diagnostics.AnalysisMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "repl", description = "Starts the interactive mode.")
public class ReplCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ReplCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Override
    public Integer call() throws Exception {
        final Config replConfig = parent.getConfig().getConfig("simplelang.repl");
        final String prompt = replConfig.getString("prompt");
        final String continuationPrompt = replConfig.getString("continuation-prompt");
        final AnalysisMode mode = replConfig.getEnum(AnalysisMode.class, "mode");
        final Compiler compiler = parent.createCompiler(mode);

        try (Terminal terminal = TerminalBuilder.builder().system(true).build()) {
            final LineReader reader = LineReaderBuilder.builder()
                    .terminal(terminal)
                    .history(new DefaultHistory())
                    .completer(new StringsCompleter(ReplSession.COMMANDS))
                    .build();
            final PrintWriter out = terminal.writer();
            final ReplSession session = new ReplSession(compiler, out);
            session.printBanner();

            while (true) {
                final String line;
                try {
                    line = reader.readLine(session.isContinuing() ? continuationPrompt : prompt);
                } catch (UserInterruptException e) {
                    // Ctrl-C drops the current input but keeps the session.
                    session.discardPending();
                    continue;
                } catch (EndOfFileException e) {
                    break;
                }
                if (!session.accept(line)) {
                    break;
                }
            }
            out.println("Goodbye!");
            out.flush();
        }
        log.debug("Interactive session ended");
        return CommandLineInterface.EXIT_OK;
    }
}
